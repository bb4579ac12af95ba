/*
 * どこで: Execution store サービス層
 * 何を: 実行記録と一時停止操作のメトリクス記録を集約する
 * なぜ: 重複送信や停止操作の発生状況を運用で監視できるようにするため
 */
package com.jobtracker.executionstore.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ExecutionTrackerMetrics {

  private static final String METRIC_EXECUTION_LOGGED = "tracker.execution.logged";
  private static final String METRIC_EXECUTION_DUPLICATE = "tracker.execution.duplicate";
  private static final String METRIC_JOB_PAUSE = "tracker.job.pause";

  private final Counter successLogged;
  private final Counter failureLogged;
  private final Counter duplicate;
  private final Counter paused;
  private final Counter unpaused;

  public ExecutionTrackerMetrics(MeterRegistry meterRegistry) {
    this.successLogged = loggedCounter(meterRegistry, "success");
    this.failureLogged = loggedCounter(meterRegistry, "failure");
    this.duplicate =
        Counter.builder(METRIC_EXECUTION_DUPLICATE)
            .description("Execution records rejected because the id was already logged")
            .register(meterRegistry);
    this.paused = pauseCounter(meterRegistry, "pause");
    this.unpaused = pauseCounter(meterRegistry, "unpause");
  }

  public void recordExecutionLogged(boolean success) {
    (success ? successLogged : failureLogged).increment();
  }

  public void recordDuplicateExecution() {
    duplicate.increment();
  }

  public void recordPause() {
    paused.increment();
  }

  public void recordUnpause() {
    unpaused.increment();
  }

  private static Counter loggedCounter(MeterRegistry meterRegistry, String result) {
    return Counter.builder(METRIC_EXECUTION_LOGGED)
        .description("Execution records stored")
        .tag("result", result)
        .register(meterRegistry);
  }

  private static Counter pauseCounter(MeterRegistry meterRegistry, String action) {
    return Counter.builder(METRIC_JOB_PAUSE)
        .description("Job pause state changes")
        .tag("action", action)
        .register(meterRegistry);
  }
}
