/*
 * どこで: Execution store サービス層
 * 何を: スケジューラ/API 向けに実行履歴と一時停止状態の操作をまとめて提供する
 * なぜ: 呼び出し側にストレージの詳細を見せず、メトリクス記録を一箇所に集めるため
 */
package com.jobtracker.executionstore.service;

import com.jobtracker.executionstore.model.ExecutionRecord;
import com.jobtracker.executionstore.repository.DuplicateExecutionException;
import com.jobtracker.executionstore.repository.ExecutionLogStore;
import com.jobtracker.executionstore.repository.JobPauseStore;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ExecutionTrackerService {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionTrackerService.class);

    // ダッシュボードのジョブ詳細は直近 30 日を集計する
    static final Duration RECENT_WINDOW = Duration.ofDays(30);

    private final ExecutionLogStore executionLogStore;
    private final JobPauseStore jobPauseStore;
    private final ExecutionTrackerMetrics metrics;
    private final Clock clock;

    public void logExecution(ExecutionRecord record) {
        try {
            executionLogStore.logExecution(record);
        } catch (DuplicateExecutionException ex) {
            metrics.recordDuplicateExecution();
            logger.debug("duplicate execution rejected id={} job={}", record.id(), record.job());
            throw ex;
        }
        metrics.recordExecutionLogged(record.success());
    }

    public List<ExecutionRecord> getExecutionLog(boolean success) {
        return executionLogStore.getExecutionLog(success);
    }

    public List<ExecutionRecord> getRecentExecutions(String job) {
        LocalDateTime since = LocalDateTime.ofInstant(clock.instant().minus(RECENT_WINDOW), ZoneOffset.UTC);
        return executionLogStore.getJobExecutions(job, since);
    }

    public void pauseJob(String jobId) {
        jobPauseStore.pauseJob(jobId);
        metrics.recordPause();
        logger.info("job paused job={}", jobId);
    }

    public void unpauseJob(String jobId) {
        jobPauseStore.unpauseJob(jobId);
        metrics.recordUnpause();
        logger.info("job unpaused job={}", jobId);
    }

    public Set<String> getPausedJobIds() {
        return jobPauseStore.getPausedJobIds();
    }

    public boolean isPaused(String jobId) {
        return jobPauseStore.isPaused(jobId);
    }
}
