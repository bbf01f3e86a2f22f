package com.expertrelay.trigger.application.command;

import com.expertrelay.domain.conversation.adapter.repository.IQueryRepository;
import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.domain.review.adapter.gateway.IReminderSink;
import com.expertrelay.domain.review.model.entity.ReviewTaskEntity;
import com.expertrelay.domain.review.model.valobj.ReviewNotice;
import com.expertrelay.domain.review.service.EscalationPolicyDomainService;
import com.expertrelay.trigger.application.common.QueryLockRegistry;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.enums.ReviewNoticeTypeEnum;
import com.expertrelay.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 升级调度写用例：一次 tick 依次处理到期升级与过期、检索滞留清理、专家提醒、重新投递、
 * 空闲用户提醒与会话过期。
 * <p>
 * 专家提醒按 next_reminder_at 取批，同一专家在一次 tick 内只收到一条合并提醒。
 * </p>
 * <p>
 * 单个任务失败只记录并跳过；存储不可用时中止本轮 tick 并向上抛出。
 * </p>
 */
@Slf4j
@Service
public class EscalationScheduleApplicationService {

    private final QueryVerificationApplicationService queryVerificationApplicationService;
    private final ReviewDeadlineApplicationService reviewDeadlineApplicationService;
    private final ConversationEngagementApplicationService conversationEngagementApplicationService;
    private final IQueryRepository queryRepository;
    private final IReminderSink reminderSink;
    private final EscalationPolicyDomainService escalationPolicyDomainService;
    private final QueryLockRegistry queryLockRegistry;
    private final int batchSize;
    private final long lockWaitMs;

    private final Counter tickCounter;
    private final Counter reminderCounter;
    private final Counter taskErrorCounter;
    private final Counter tickAbortCounter;

    public EscalationScheduleApplicationService(QueryVerificationApplicationService queryVerificationApplicationService,
                                                ReviewDeadlineApplicationService reviewDeadlineApplicationService,
                                                ConversationEngagementApplicationService conversationEngagementApplicationService,
                                                IQueryRepository queryRepository,
                                                IReminderSink reminderSink,
                                                EscalationPolicyDomainService escalationPolicyDomainService,
                                                QueryLockRegistry queryLockRegistry,
                                                @Value("${relay.scheduler.batch-size:200}") int batchSize,
                                                @Value("${relay.scheduler.lock-wait-ms:200}") long lockWaitMs) {
        this.queryVerificationApplicationService = queryVerificationApplicationService;
        this.reviewDeadlineApplicationService = reviewDeadlineApplicationService;
        this.conversationEngagementApplicationService = conversationEngagementApplicationService;
        this.queryRepository = queryRepository;
        this.reminderSink = reminderSink;
        this.escalationPolicyDomainService = escalationPolicyDomainService;
        this.queryLockRegistry = queryLockRegistry;
        this.batchSize = batchSize > 0 ? batchSize : 200;
        this.lockWaitMs = Math.max(lockWaitMs, 0L);
        this.tickCounter = Counter.builder("relay.scheduler.tick.total").register(Metrics.globalRegistry);
        this.reminderCounter = Counter.builder("relay.review.reminder.total").register(Metrics.globalRegistry);
        this.taskErrorCounter = Counter.builder("relay.scheduler.task.error.total").register(Metrics.globalRegistry);
        this.tickAbortCounter = Counter.builder("relay.scheduler.tick.abort.total").register(Metrics.globalRegistry);
    }

    public TickReport tick(LocalDateTime now) {
        tickCounter.increment();
        TickStats stats = new TickStats();
        try {
            processDueTasks(now, stats);
            processStalledQueries(now, stats);
            processReminders(now, stats);
            processPendingDeliveries(stats);

            ConversationEngagementApplicationService.EngagementResult reminded =
                    conversationEngagementApplicationService.remindIdle(now);
            stats.userReminded += reminded.count();
            stats.errors += reminded.errorCount();

            ConversationEngagementApplicationService.EngagementResult expired =
                    conversationEngagementApplicationService.expireStale(now);
            stats.conversationsExpired += expired.count();
            stats.errors += expired.errorCount();
        } catch (AppException ex) {
            if (ex.is(ResponseCode.STORE_UNAVAILABLE)) {
                tickAbortCounter.increment();
                log.error("SCHEDULER_EVENT action=tick_aborted code={} now={} error={}", ex.getCode(), now, ex.getInfo());
            }
            throw ex;
        }

        TickReport report = stats.toReport();
        if (report.hasActivity()) {
            log.info("SCHEDULER_EVENT action=tick now={} escalated={} expired={} recovered={} reminded={} redelivered={} userReminded={} conversationsExpired={} skipped={} errors={}",
                    now,
                    report.escalatedCount(),
                    report.expiredCount(),
                    report.recoveredCount(),
                    report.remindedCount(),
                    report.redeliveredCount(),
                    report.userRemindedCount(),
                    report.conversationExpiredCount(),
                    report.skippedCount(),
                    report.errorCount());
        }
        return report;
    }

    private void processDueTasks(LocalDateTime now, TickStats stats) {
        List<ReviewTaskEntity> dueTasks = reviewDeadlineApplicationService.dueTasks(now, batchSize);
        for (ReviewTaskEntity task : dueTasks) {
            boolean escalate = escalationPolicyDomainService.canEscalate(task);
            TransitionResult result = isolate(stats, task.getQueryId(), escalate ? "escalate" : "expire",
                    () -> escalate
                            ? queryVerificationApplicationService.escalate(task.getQueryId())
                            : queryVerificationApplicationService.expire(task.getQueryId()));
            if (result == null) {
                continue;
            }
            if (result.outcome() == TransitionResult.Outcome.SKIPPED_LOCKED) {
                stats.skipped++;
            } else if (result.isApplied()) {
                if (escalate) {
                    stats.escalated++;
                } else {
                    stats.expired++;
                }
            }
        }
    }

    private void processStalledQueries(LocalDateTime now, TickStats stats) {
        LocalDateTime cutoff = queryVerificationApplicationService.stalledCutoff(now);
        List<QueryEntity> stalled = queryRepository.findStalledBefore(cutoff, batchSize);
        for (QueryEntity query : stalled) {
            TransitionResult result = isolate(stats, query.getId(), "recover_stalled",
                    () -> queryVerificationApplicationService.recoverStalled(query.getId()));
            if (result == null) {
                continue;
            }
            if (result.outcome() == TransitionResult.Outcome.SKIPPED_LOCKED) {
                stats.skipped++;
            } else if (result.isApplied()) {
                stats.recovered++;
            }
        }
    }

    private void processReminders(LocalDateTime now, TickStats stats) {
        List<ReviewTaskEntity> dueTasks = reviewDeadlineApplicationService.reminderDueTasks(now, batchSize);
        Map<String, List<ReviewNotice>> noticesByExpert = new LinkedHashMap<>();
        for (ReviewTaskEntity snapshot : dueTasks) {
            DueReminder due = isolate(stats, snapshot.getQueryId(), "remind",
                    () -> queryLockRegistry.tryWithLock(QueryLockRegistry.queryKey(snapshot.getQueryId()), lockWaitMs,
                            () -> markDueReminders(snapshot.getQueryId(), now),
                            () -> DueReminder.LOCKED));
            if (due == null || due == DueReminder.NONE) {
                continue;
            }
            if (due == DueReminder.LOCKED) {
                stats.skipped++;
                continue;
            }
            stats.reminded += due.tierCount();
            noticesByExpert.computeIfAbsent(due.expertId(), key -> new ArrayList<>()).add(due.notice());
        }
        noticesByExpert.forEach(this::sendReminderDigest);
    }

    /**
     * 锁内标记到点档位并生成该问题的提醒项；发送在锁外按专家合并进行。
     */
    private DueReminder markDueReminders(Long queryId, LocalDateTime now) {
        ReviewTaskEntity task = reviewDeadlineApplicationService.find(queryId);
        if (task == null) {
            return DueReminder.NONE;
        }
        List<Integer> dueTiers = escalationPolicyDomainService.dueReminderTiers(task, now);
        if (dueTiers.isEmpty()) {
            return DueReminder.NONE;
        }
        QueryEntity query = queryRepository.findById(queryId);
        if (query == null || !query.isPendingReview()) {
            return DueReminder.NONE;
        }
        task = reviewDeadlineApplicationService.markReminderSent(task, dueTiers, now);
        int tier = dueTiers.get(dueTiers.size() - 1);
        reminderCounter.increment(dueTiers.size());
        log.info("REVIEW_EVENT action=reminded queryId={} expertId={} level={} tiers={} deadline={} nextReminderAt={}",
                queryId, task.getAssignedExpertId(), task.getEscalationLevel(), dueTiers, task.getDeadline(),
                task.getNextReminderAt());
        return new DueReminder(task.getAssignedExpertId(),
                QueryVerificationApplicationService.notice(ReviewNoticeTypeEnum.REMINDER, query, task, tier),
                dueTiers.size());
    }

    private void sendReminderDigest(String expertId, List<ReviewNotice> items) {
        List<ReviewNotice> ordered = items.stream()
                .sorted(Comparator.comparing(ReviewNotice::getDeadline, Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
        ReviewNotice first = ordered.get(0);
        ReviewNotice digest = ReviewNotice.builder()
                .type(ReviewNoticeTypeEnum.REMINDER)
                .queryId(first.getQueryId())
                .conversationId(first.getConversationId())
                .escalationLevel(first.getEscalationLevel())
                .reminderTierPercent(first.getReminderTierPercent())
                .deadline(first.getDeadline())
                .reviewPacket(first.getReviewPacket())
                .pendingReviews(ordered)
                .build();
        try {
            reminderSink.notify(expertId, digest);
        } catch (RuntimeException ex) {
            taskErrorCounter.increment();
            log.warn("REVIEW_EVENT action=reminder_notify_failed expertId={} items={} error={}",
                    expertId, ordered.size(), ex.getMessage());
            return;
        }
        log.info("REVIEW_EVENT action=reminder_digest expertId={} items={} queryIds={}",
                expertId, ordered.size(), ordered.stream().map(ReviewNotice::getQueryId).collect(Collectors.toList()));
    }

    private void processPendingDeliveries(TickStats stats) {
        List<QueryEntity> pending = queryRepository.findPendingDelivery(batchSize);
        for (QueryEntity query : pending) {
            TransitionResult result = isolate(stats, query.getId(), "redeliver",
                    () -> queryVerificationApplicationService.redeliver(query.getId()));
            if (result == null) {
                continue;
            }
            if (result.outcome() == TransitionResult.Outcome.SKIPPED_LOCKED) {
                stats.skipped++;
            } else if (result.isApplied() && result.isDelivered()) {
                stats.redelivered++;
            }
        }
    }

    /**
     * 隔离单个任务的失败：STORE_UNAVAILABLE 继续上抛，其余错误计数后返回 null。
     */
    private <T> T isolate(TickStats stats, Long queryId, String action, Supplier<T> work) {
        try {
            return work.get();
        } catch (AppException ex) {
            if (ex.is(ResponseCode.STORE_UNAVAILABLE)) {
                throw ex;
            }
            stats.errors++;
            taskErrorCounter.increment();
            log.warn("SCHEDULER_EVENT action={}_failed queryId={} code={} error={}", action, queryId, ex.getCode(), ex.getInfo());
        } catch (RuntimeException ex) {
            stats.errors++;
            taskErrorCounter.increment();
            log.warn("SCHEDULER_EVENT action={}_failed queryId={} error={}", action, queryId, ex.getMessage());
        }
        return null;
    }

    private record DueReminder(String expertId, ReviewNotice notice, int tierCount) {
        private static final DueReminder NONE = new DueReminder(null, null, 0);
        private static final DueReminder LOCKED = new DueReminder(null, null, -1);
    }

    private static final class TickStats {
        private int escalated;
        private int expired;
        private int recovered;
        private int reminded;
        private int redelivered;
        private int userReminded;
        private int conversationsExpired;
        private int skipped;
        private int errors;

        private TickReport toReport() {
            return new TickReport(escalated, expired, recovered, reminded, redelivered, userReminded, conversationsExpired,
                    skipped, errors);
        }
    }

    public record TickReport(int escalatedCount,
                             int expiredCount,
                             int recoveredCount,
                             int remindedCount,
                             int redeliveredCount,
                             int userRemindedCount,
                             int conversationExpiredCount,
                             int skippedCount,
                             int errorCount) {

        public boolean hasActivity() {
            return escalatedCount + expiredCount + recoveredCount + remindedCount + redeliveredCount + userRemindedCount
                    + conversationExpiredCount + skippedCount + errorCount > 0;
        }
    }
}
