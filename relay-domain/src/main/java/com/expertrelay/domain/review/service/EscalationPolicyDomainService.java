package com.expertrelay.domain.review.service;

import com.expertrelay.domain.review.model.entity.ReviewTaskEntity;
import com.expertrelay.domain.review.model.valobj.EscalationPolicy;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 升级策略领域服务：计算审核窗口、截止时间、专家分配与待发送提醒档位。
 * <p>
 * 第 level 级窗口长度 = reviewSla × backoffFactor^level。
 * </p>
 */
public class EscalationPolicyDomainService {

    private final EscalationPolicy policy;

    public EscalationPolicyDomainService(EscalationPolicy policy) {
        this.policy = policy;
    }

    public EscalationPolicy policy() {
        return policy;
    }

    public int maxLevel() {
        return policy.maxLevel();
    }

    public Duration window(int level) {
        double factor = Math.pow(policy.backoffFactor(), Math.max(0, level));
        long millis = Math.round(policy.reviewSla().toMillis() * factor);
        return Duration.ofMillis(millis);
    }

    public LocalDateTime deadline(LocalDateTime windowStart, int level) {
        return windowStart.plus(window(level));
    }

    /**
     * 选择某级别的专家；同一级别内按 Query ID 取模，保证同一问题稳定落到同一专家。
     */
    public String expertFor(int level, Long queryId) {
        List<List<String>> tiers = policy.tierExperts();
        List<String> tier = tiers.get(Math.min(Math.max(0, level), tiers.size() - 1));
        long seed = queryId == null ? 0L : Math.abs(queryId);
        return tier.get((int) (seed % tier.size()));
    }

    public boolean canEscalate(ReviewTaskEntity task) {
        return task.normalizedEscalationLevel() < policy.maxLevel();
    }

    public boolean resetRemindersOnEscalation() {
        return policy.resetRemindersOnEscalation();
    }

    /**
     * 当前窗口内最早一个未发送档位的触发时间；没有待发档位时返回 null。
     */
    public LocalDateTime nextReminderAt(ReviewTaskEntity task) {
        if (task.getWindowStartedAt() == null || task.getDeadline() == null) {
            return null;
        }
        long windowMillis = Duration.between(task.getWindowStartedAt(), task.getDeadline()).toMillis();
        if (windowMillis <= 0) {
            return null;
        }
        return policy.reminderTierPercents().stream()
                .sorted()
                .filter(percent -> !task.isReminderSent(percent))
                .findFirst()
                .map(percent -> task.getWindowStartedAt().plus(Duration.ofMillis(ceilDiv(windowMillis * percent, 100L))))
                .orElse(null);
    }

    /**
     * 当前窗口内已到期且未发送的提醒档位，按档位升序。
     */
    public List<Integer> dueReminderTiers(ReviewTaskEntity task, LocalDateTime now) {
        List<Integer> due = new ArrayList<>();
        if (task.getWindowStartedAt() == null || task.getDeadline() == null || task.isDue(now)) {
            return due;
        }
        long windowMillis = Duration.between(task.getWindowStartedAt(), task.getDeadline()).toMillis();
        long elapsedMillis = Duration.between(task.getWindowStartedAt(), now).toMillis();
        if (windowMillis <= 0 || elapsedMillis < 0) {
            return due;
        }
        policy.reminderTierPercents().stream()
                .sorted()
                .filter(percent -> !task.isReminderSent(percent))
                .filter(percent -> elapsedMillis * 100 >= windowMillis * percent)
                .forEach(due::add);
        return due;
    }

    private static long ceilDiv(long dividend, long divisor) {
        return -Math.floorDiv(-dividend, divisor);
    }
}
