package com.expertrelay.domain.review.model.valobj;

import java.time.Duration;
import java.util.List;

/**
 * 升级策略配置。
 *
 * @param reviewSla                 初始审核时限
 * @param backoffFactor             每升一级的时限倍数
 * @param maxLevel                  最高升级级别
 * @param reminderTierPercents      提醒档位（当前窗口的百分比）
 * @param tierExperts               每个级别的专家池，超出部分复用最后一级
 * @param acceptSupersededDecisions 是否接受已被升级替换的专家的审核动作
 * @param resetRemindersOnEscalation 升级后是否在新窗口内重新发送提醒档位；默认每个档位在整个审核期只发送一次
 */
public record EscalationPolicy(Duration reviewSla,
                               double backoffFactor,
                               int maxLevel,
                               List<Integer> reminderTierPercents,
                               List<List<String>> tierExperts,
                               boolean acceptSupersededDecisions,
                               boolean resetRemindersOnEscalation) {

    public EscalationPolicy(Duration reviewSla,
                            double backoffFactor,
                            int maxLevel,
                            List<Integer> reminderTierPercents,
                            List<List<String>> tierExperts,
                            boolean acceptSupersededDecisions) {
        this(reviewSla, backoffFactor, maxLevel, reminderTierPercents, tierExperts, acceptSupersededDecisions, false);
    }

    public EscalationPolicy {
        if (reviewSla == null || reviewSla.isZero() || reviewSla.isNegative()) {
            throw new IllegalArgumentException("reviewSla must be positive");
        }
        if (backoffFactor < 1D) {
            throw new IllegalArgumentException("backoffFactor must be >= 1");
        }
        if (maxLevel < 0) {
            throw new IllegalArgumentException("maxLevel must be >= 0");
        }
        reminderTierPercents = reminderTierPercents == null ? List.of() : List.copyOf(reminderTierPercents);
        for (Integer percent : reminderTierPercents) {
            if (percent == null || percent <= 0 || percent >= 100) {
                throw new IllegalArgumentException("reminder tier must be in (0, 100): " + percent);
            }
        }
        if (tierExperts == null || tierExperts.isEmpty()) {
            throw new IllegalArgumentException("at least one expert tier is required");
        }
        tierExperts = tierExperts.stream().map(List::copyOf).toList();
        for (List<String> tier : tierExperts) {
            if (tier.isEmpty()) {
                throw new IllegalArgumentException("expert tier cannot be empty");
            }
        }
    }
}
