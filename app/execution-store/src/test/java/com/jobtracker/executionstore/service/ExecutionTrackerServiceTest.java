/*
 * どこで: ExecutionTrackerService のユニットテスト
 * 何を: ストアへの委譲・重複時の例外伝播・メトリクス記録を検証する
 * なぜ: 重複送信を握りつぶさず、呼び出し側へ区別可能な形で返すことを保証するため
 */
package com.jobtracker.executionstore.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.jobtracker.executionstore.model.ExecutionRecord;
import com.jobtracker.executionstore.repository.DuplicateExecutionException;
import com.jobtracker.executionstore.repository.ExecutionLogStore;
import com.jobtracker.executionstore.repository.JobPauseStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExecutionTrackerServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T01:02:03Z");
  private static final LocalDateTime START = LocalDateTime.parse("2026-01-17T00:00:00");
  private static final ExecutionRecord SUCCESS =
      new ExecutionRecord(
          "e1", "job-a", START, START.plusMinutes(1), JsonNodeFactory.instance.objectNode(), true);
  private static final ExecutionRecord FAILURE =
      new ExecutionRecord(
          "e2", "job-a", START, START.plusMinutes(2), JsonNodeFactory.instance.objectNode(), false);

  @Mock private ExecutionLogStore executionLogStore;

  @Mock private JobPauseStore jobPauseStore;

  private SimpleMeterRegistry registry;

  private ExecutionTrackerService service;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    service =
        new ExecutionTrackerService(
            executionLogStore,
            jobPauseStore,
            new ExecutionTrackerMetrics(registry),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void logExecutionStoresRecordAndCountsOutcome() {
    service.logExecution(SUCCESS);
    service.logExecution(FAILURE);

    verify(executionLogStore).logExecution(SUCCESS);
    verify(executionLogStore).logExecution(FAILURE);
    assertThat(loggedCount("success")).isEqualTo(1.0d);
    assertThat(loggedCount("failure")).isEqualTo(1.0d);
  }

  @Test
  void logExecutionPropagatesDuplicateAndCountsIt() {
    final DuplicateExecutionException duplicate = new DuplicateExecutionException("e1", null);
    doThrow(duplicate).when(executionLogStore).logExecution(SUCCESS);

    assertThatThrownBy(() -> service.logExecution(SUCCESS)).isSameAs(duplicate);

    assertThat(registry.get("tracker.execution.duplicate").counter().count()).isEqualTo(1.0d);
    assertThat(loggedCount("success")).isZero();
  }

  @Test
  void getRecentExecutionsQueriesLastThirtyDays() {
    when(executionLogStore.getJobExecutions("job-a", LocalDateTime.parse("2025-12-18T01:02:03")))
        .thenReturn(List.of(SUCCESS));

    assertThat(service.getRecentExecutions("job-a")).containsExactly(SUCCESS);
  }

  @Test
  void pauseAndUnpauseDelegateAndCount() {
    when(jobPauseStore.getPausedJobIds()).thenReturn(Set.of("job-b"));

    service.pauseJob("job-a");
    service.unpauseJob("job-a");

    verify(jobPauseStore).pauseJob("job-a");
    verify(jobPauseStore).unpauseJob("job-a");
    assertThat(service.getPausedJobIds()).containsExactly("job-b");
    assertThat(registry.get("tracker.job.pause").tag("action", "pause").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("tracker.job.pause").tag("action", "unpause").counter().count())
        .isEqualTo(1.0d);
  }

  private double loggedCount(String result) {
    return registry.get("tracker.execution.logged").tag("result", result).counter().count();
  }
}
