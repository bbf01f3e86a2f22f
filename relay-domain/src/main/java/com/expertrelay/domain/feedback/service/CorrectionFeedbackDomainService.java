package com.expertrelay.domain.feedback.service;

import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.domain.feedback.model.valobj.CorrectionRecord;
import com.expertrelay.domain.knowledge.model.valobj.RetrievedCandidate;
import com.expertrelay.types.enums.QueryCloseReasonEnum;
import com.expertrelay.types.enums.ReviewOutcomeEnum;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * 纠错反馈领域服务：仅专家修改或拒绝的结果产生纠错记录。
 */
@Service
public class CorrectionFeedbackDomainService {

    public boolean requiresCorrection(QueryEntity query) {
        if (query == null || query.getReviewOutcome() == null) {
            return false;
        }
        if (query.getReviewOutcome() == ReviewOutcomeEnum.EDITED) {
            return true;
        }
        return query.getReviewOutcome() == ReviewOutcomeEnum.REJECTED
                && query.getCloseReason() == QueryCloseReasonEnum.EXPERT_REJECTED;
    }

    public CorrectionRecord buildRecord(QueryEntity query, LocalDateTime now) {
        if (!requiresCorrection(query)) {
            return null;
        }
        RetrievedCandidate chosen = query.getChosenCandidate();
        String expertFinalText = query.getReviewOutcome() == ReviewOutcomeEnum.EDITED
                ? query.getFinalAnswer()
                : query.getExpertNote();
        return CorrectionRecord.builder()
                .queryId(query.getId())
                .originalQueryText(query.getRawText())
                .originalCandidate(chosen == null ? query.getDraftAnswer() : chosen.getContent())
                .originalSourceId(chosen == null ? null : chosen.getSourceId())
                .expertFinalText(expertFinalText)
                .expertId(query.getActedByExpertId())
                .outcome(query.getReviewOutcome())
                .recordedAt(now)
                .build();
    }
}
