package com.expertrelay.domain.conversation.service;

import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.types.enums.ExpertDecisionEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Query 状态迁移领域服务：判定提交/审核/升级/过期动作在当前状态下是否有效，并执行审核迁移。
 */
@Service
public class QueryTransitionDomainService {

    public String normalizeText(String rawText) {
        return StringUtils.normalizeSpace(rawText);
    }

    /**
     * 会话当前 Query 未到终态时拒绝新的提交。
     */
    public boolean blocksNewSubmission(QueryEntity current) {
        return current != null && current.isOpen();
    }

    public DecisionCheck checkDecision(QueryEntity query, String expertId, boolean acceptSupersededDecisions) {
        if (query == null || !query.isPendingReview()) {
            return DecisionCheck.STALE_STATUS;
        }
        if (acceptSupersededDecisions) {
            return DecisionCheck.ACCEPT;
        }
        String assigned = query.getAssignedExpertId();
        if (StringUtils.isNotBlank(assigned) && !StringUtils.equals(assigned, expertId)) {
            return DecisionCheck.STALE_SUPERSEDED;
        }
        return DecisionCheck.ACCEPT;
    }

    public void applyDecision(QueryEntity query, String expertId, ExpertDecisionEnum decision,
                              String text, LocalDateTime now) {
        switch (decision) {
            case APPROVE -> query.approve(expertId, now);
            case EDIT -> query.edit(expertId, text, now);
            case REJECT -> query.reject(expertId, text, now);
        }
    }

    public boolean canEscalate(QueryEntity query, int maxLevel) {
        return query != null && query.isPendingReview() && query.normalizedEscalationLevel() < maxLevel;
    }

    public boolean canExpire(QueryEntity query, int maxLevel) {
        return query != null && query.isPendingReview() && query.normalizedEscalationLevel() >= maxLevel;
    }

    public enum DecisionCheck {
        ACCEPT,
        STALE_STATUS,
        STALE_SUPERSEDED
    }
}
