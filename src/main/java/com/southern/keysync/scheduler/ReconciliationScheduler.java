package com.southern.keysync.scheduler;

import com.southern.keysync.config.KeySyncProperties;
import com.southern.keysync.service.ReconciliationOrchestrator;
import com.southern.keysync.service.ReconciliationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.concurrent.ScheduledFuture;

/**
 * 按 keysync.schedule.cron 定时触发对账，keysync.schedule.enabled=false 时不注册任务
 */
@Slf4j
@Component
public class ReconciliationScheduler {

    private final ThreadPoolTaskScheduler threadPoolTaskScheduler;
    private final ReconciliationOrchestrator orchestrator;
    private final KeySyncProperties.Schedule schedule;

    private volatile ScheduledFuture<?> scheduledTask;

    public ReconciliationScheduler(ThreadPoolTaskScheduler threadPoolTaskScheduler,
                                   ReconciliationOrchestrator orchestrator,
                                   KeySyncProperties properties) {
        this.threadPoolTaskScheduler = threadPoolTaskScheduler;
        this.orchestrator = orchestrator;
        this.schedule = properties.getSchedule();
    }

    @PostConstruct
    public void init() {
        if (schedule.isEnabled()) {
            scheduleReconciliation();
        } else {
            log.info("Scheduled reconciliation is disabled");
        }
    }

    public synchronized void scheduleReconciliation() {
        cancel();
        CronTrigger cronTrigger = new CronTrigger(schedule.getCron());
        scheduledTask = threadPoolTaskScheduler.schedule(this::runScheduled, cronTrigger);
        log.info("Scheduled reconciliation with cron '{}' ({}, {})",
                schedule.getCron(), schedule.getMode().getValue(), schedule.getExecutionMode().getValue());
    }

    @PreDestroy
    public synchronized void cancel() {
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
    }

    /**
     * @return 任务已注册且未被取消
     */
    public boolean isScheduled() {
        ScheduledFuture<?> future = scheduledTask;
        return future != null && !future.isCancelled() && !future.isDone();
    }

    /**
     * 定时任务入口，失败只记录日志，不影响下一次触发
     */
    void runScheduled() {
        try {
            ReconciliationOutcome outcome = orchestrator.reconcile(schedule.getMode(), schedule.getExecutionMode());
            log.info("Scheduled reconciliation run {} completed", outcome.getRunId());
        } catch (RuntimeException e) {
            log.error("Scheduled reconciliation failed: {}", e.getMessage(), e);
        }
    }
}
