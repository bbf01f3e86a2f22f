package com.expertrelay.trigger.job;

import com.expertrelay.trigger.application.command.EscalationScheduleApplicationService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 进程内升级调度守护进程。外部定时器通过 HTTP 回调驱动时可关闭。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "relay.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EscalationSchedulerDaemon {

    private final EscalationScheduleApplicationService escalationScheduleApplicationService;
    private final Clock clock;
    private final Counter failureCounter;

    public EscalationSchedulerDaemon(EscalationScheduleApplicationService escalationScheduleApplicationService,
                                     Clock clock) {
        this.escalationScheduleApplicationService = escalationScheduleApplicationService;
        this.clock = clock;
        this.failureCounter = Counter.builder("relay.scheduler.daemon.failure.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${relay.scheduler.poll-interval-ms:30000}", scheduler = "daemonScheduler")
    public void tick() {
        try {
            escalationScheduleApplicationService.tick(LocalDateTime.now(clock));
        } catch (Exception ex) {
            failureCounter.increment();
            log.error("Escalation scheduler tick failed. error={}", ex.getMessage(), ex);
        }
    }
}
