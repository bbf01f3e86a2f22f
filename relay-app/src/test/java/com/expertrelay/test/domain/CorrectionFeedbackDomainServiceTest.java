package com.expertrelay.test.domain;

import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.domain.feedback.model.valobj.CorrectionRecord;
import com.expertrelay.domain.feedback.service.CorrectionFeedbackDomainService;
import com.expertrelay.domain.knowledge.model.valobj.DraftAnswer;
import com.expertrelay.domain.knowledge.model.valobj.RetrievedCandidate;
import com.expertrelay.types.enums.ReviewOutcomeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

public class CorrectionFeedbackDomainServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 9, 0, 0);

    private final CorrectionFeedbackDomainService service = new CorrectionFeedbackDomainService();

    @Test
    public void shouldSkipApprovedAndNoAnswerQueries() {
        QueryEntity approved = pendingQuery();
        approved.approve("expert-a", NOW);
        Assertions.assertNull(service.buildRecord(approved, NOW));

        QueryEntity noAnswer = QueryEntity.receive("sms:u1", "hi", "hi", "en", NOW);
        noAnswer.startRetrieval(NOW);
        noAnswer.rejectNoAnswer(NOW);
        Assertions.assertFalse(service.requiresCorrection(noAnswer));
    }

    @Test
    public void shouldRecordEditedAnswer() {
        QueryEntity query = pendingQuery();
        query.edit("expert-a", "Use the reset link.", NOW);

        CorrectionRecord record = service.buildRecord(query, NOW);

        Assertions.assertEquals(11L, record.getQueryId());
        Assertions.assertEquals("  reset   pwd ", record.getOriginalQueryText());
        Assertions.assertEquals("Reset it from settings.", record.getOriginalCandidate());
        Assertions.assertEquals("kb:42", record.getOriginalSourceId());
        Assertions.assertEquals("Use the reset link.", record.getExpertFinalText());
        Assertions.assertEquals(ReviewOutcomeEnum.EDITED, record.getOutcome());
        Assertions.assertEquals(NOW, record.getRecordedAt());
    }

    @Test
    public void shouldRecordRejectionNote() {
        QueryEntity query = pendingQuery();
        query.reject("expert-a", "Outdated", NOW);

        CorrectionRecord record = service.buildRecord(query, NOW);

        Assertions.assertEquals("Outdated", record.getExpertFinalText());
        Assertions.assertEquals(ReviewOutcomeEnum.REJECTED, record.getOutcome());
        Assertions.assertEquals("expert-a", record.getExpertId());
    }

    private QueryEntity pendingQuery() {
        QueryEntity query = QueryEntity.receive("sms:u1", "  reset   pwd ", "reset pwd", "en", NOW);
        query.setId(11L);
        query.startRetrieval(NOW);
        RetrievedCandidate top = RetrievedCandidate.builder().content("Reset it from settings.").sourceId("kb:42").score(0.8D).build();
        query.awaitReview(List.of(top), new DraftAnswer(top, top.getContent(), "packet"), "expert-a", NOW);
        return query;
    }
}
