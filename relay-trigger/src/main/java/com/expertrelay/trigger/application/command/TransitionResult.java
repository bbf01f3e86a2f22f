package com.expertrelay.trigger.application.command;

import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.types.enums.DeliveryStateEnum;
import com.expertrelay.types.enums.QueryStatusEnum;
import com.expertrelay.types.enums.ReviewOutcomeEnum;

/**
 * 单次状态迁移尝试的结果。
 *
 * @param queryId       Query ID
 * @param outcome       迁移结果
 * @param status        迁移后（或当前）状态
 * @param reviewOutcome 审核结果
 * @param deliveryState 投递状态
 */
public record TransitionResult(Long queryId,
                               Outcome outcome,
                               QueryStatusEnum status,
                               ReviewOutcomeEnum reviewOutcome,
                               DeliveryStateEnum deliveryState) {

    public static TransitionResult applied(QueryEntity query) {
        return of(query.getId(), Outcome.APPLIED, query);
    }

    public static TransitionResult stale(Long queryId, QueryEntity current) {
        return of(queryId, Outcome.STALE, current);
    }

    public static TransitionResult skippedLocked(Long queryId) {
        return new TransitionResult(queryId, Outcome.SKIPPED_LOCKED, null, null, null);
    }

    public boolean isApplied() {
        return outcome == Outcome.APPLIED;
    }

    public boolean isDelivered() {
        return deliveryState == DeliveryStateEnum.SENT;
    }

    private static TransitionResult of(Long queryId, Outcome outcome, QueryEntity query) {
        if (query == null) {
            return new TransitionResult(queryId, outcome, null, null, null);
        }
        return new TransitionResult(queryId, outcome, query.getStatus(), query.getReviewOutcome(), query.getDeliveryState());
    }

    public enum Outcome {
        /** 迁移已执行 */
        APPLIED,
        /** 当前状态不允许该动作，未做任何修改 */
        STALE,
        /** 限时加锁失败，下轮重试 */
        SKIPPED_LOCKED
    }
}
