package com.expertrelay.test;

import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.domain.conversation.model.valobj.QueryHandle;
import com.expertrelay.domain.delivery.model.valobj.RenderedPayload;
import com.expertrelay.domain.feedback.model.valobj.CorrectionRecord;
import com.expertrelay.domain.review.model.entity.ReviewTaskEntity;
import com.expertrelay.test.support.RecordingReminderSink;
import com.expertrelay.test.support.RelayTestFixture;
import com.expertrelay.trigger.application.command.TransitionResult;
import com.expertrelay.types.enums.ContentCategoryEnum;
import com.expertrelay.types.enums.DeliveryModeEnum;
import com.expertrelay.types.enums.DeliveryStateEnum;
import com.expertrelay.types.enums.ExpertDecisionEnum;
import com.expertrelay.types.enums.QueryCloseReasonEnum;
import com.expertrelay.types.enums.QueryStatusEnum;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.enums.ReviewNoticeTypeEnum;
import com.expertrelay.types.enums.ReviewOutcomeEnum;
import com.expertrelay.types.exception.AppException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

public class QueryVerificationApplicationServiceTest {

    private RelayTestFixture fixture;

    @BeforeEach
    public void setUp() {
        fixture = new RelayTestFixture();
    }

    @AfterEach
    public void tearDown() {
        fixture.close();
    }

    @Test
    public void shouldRequestReviewAfterSuccessfulRetrieval() {
        QueryHandle handle = fixture.verificationService.submit("WhatsApp", "user-1", "  How do I   reset my password? ", "en");

        Assertions.assertEquals("whatsapp:user-1", handle.conversationId());
        Assertions.assertEquals(QueryStatusEnum.PENDING_REVIEW, handle.status());

        QueryEntity query = fixture.queryRepository.findById(handle.queryId());
        Assertions.assertEquals("How do I reset my password?", query.getNormalizedText());
        Assertions.assertEquals("Reset it from settings.", query.getDraftAnswer());
        Assertions.assertEquals("expert-l0", query.getAssignedExpertId());
        Assertions.assertEquals(0, query.getEscalationLevel());

        ReviewTaskEntity task = fixture.reviewTaskRepository.findByQueryId(handle.queryId());
        Assertions.assertEquals(fixture.at(Duration.ofMinutes(10)), task.getDeadline());

        List<RecordingReminderSink.Delivered> requests = fixture.reminderSink.ofType(ReviewNoticeTypeEnum.REVIEW_REQUEST);
        Assertions.assertEquals(1, requests.size());
        Assertions.assertEquals("expert-l0", requests.get(0).expertId());
        Assertions.assertTrue(requests.get(0).notice().getReviewPacket().startsWith("Q: How do I reset my password?"));
        Assertions.assertTrue(fixture.channelAdapter.sent().isEmpty());
        Assertions.assertEquals(handle.queryId(), fixture.conversationRepository.findById("whatsapp:user-1").getPendingQueryId());
    }

    @Test
    public void shouldDeliverVerifiedAnswerWhenExpertApproves() {
        QueryHandle handle = fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");
        fixture.clock.advance(Duration.ofMinutes(3));

        TransitionResult result = fixture.verificationService.recordExpertDecision(handle.queryId(), "expert-l0",
                ExpertDecisionEnum.APPROVE, null);

        Assertions.assertTrue(result.isApplied());
        Assertions.assertEquals(QueryStatusEnum.DELIVERED, result.status());
        Assertions.assertEquals(ReviewOutcomeEnum.APPROVED, result.reviewOutcome());

        RenderedPayload payload = fixture.channelAdapter.last();
        Assertions.assertEquals(DeliveryModeEnum.FREE_FORM, payload.getMode());
        Assertions.assertEquals(ContentCategoryEnum.VERIFIED_ANSWER, payload.getCategory());
        Assertions.assertEquals("Reset it from settings.", payload.getText());

        Assertions.assertNull(fixture.reviewTaskRepository.findByQueryId(handle.queryId()));
        Assertions.assertTrue(fixture.correctionLedger.all().isEmpty());
        Assertions.assertEquals(fixture.at(Duration.ofMinutes(3)),
                fixture.conversationRepository.findById(handle.conversationId()).getLastOutboundAt());
    }

    @Test
    public void shouldDeliverCorrectionAndRecordFeedbackWhenExpertEdits() {
        QueryHandle handle = fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");

        TransitionResult result = fixture.verificationService.recordExpertDecision(handle.queryId(), "expert-l0",
                ExpertDecisionEnum.EDIT, "Use the reset link on the login page.");

        Assertions.assertEquals(QueryStatusEnum.DELIVERED, result.status());
        Assertions.assertEquals(ReviewOutcomeEnum.EDITED, result.reviewOutcome());
        Assertions.assertEquals("Use the reset link on the login page.", fixture.channelAdapter.last().getText());
        Assertions.assertEquals(ContentCategoryEnum.CORRECTED_ANSWER, fixture.channelAdapter.last().getCategory());

        List<CorrectionRecord> records = fixture.correctionLedger.all();
        Assertions.assertEquals(1, records.size());
        CorrectionRecord record = records.get(0);
        Assertions.assertEquals(handle.queryId(), record.getQueryId());
        Assertions.assertEquals("How do I reset my password?", record.getOriginalQueryText());
        Assertions.assertEquals("Reset it from settings.", record.getOriginalCandidate());
        Assertions.assertEquals("faq:1", record.getOriginalSourceId());
        Assertions.assertEquals("Use the reset link on the login page.", record.getExpertFinalText());
        Assertions.assertEquals("expert-l0", record.getExpertId());
        Assertions.assertEquals(ReviewOutcomeEnum.EDITED, record.getOutcome());
    }

    @Test
    public void shouldNotifyUserAndRecordFeedbackWhenExpertRejects() {
        QueryHandle handle = fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");

        TransitionResult result = fixture.verificationService.recordExpertDecision(handle.queryId(), "expert-l0",
                ExpertDecisionEnum.REJECT, "Answer is outdated");

        Assertions.assertEquals(QueryStatusEnum.DELIVERED, result.status());
        Assertions.assertEquals(ReviewOutcomeEnum.REJECTED, result.reviewOutcome());
        Assertions.assertEquals(ContentCategoryEnum.REJECTED_ANSWER, fixture.channelAdapter.last().getCategory());
        Assertions.assertEquals(QueryCloseReasonEnum.EXPERT_REJECTED,
                fixture.queryRepository.findById(handle.queryId()).getCloseReason());
        Assertions.assertEquals("Answer is outdated", fixture.correctionLedger.all().get(0).getExpertFinalText());
    }

    @Test
    public void shouldSendApologyWhenRetrievalUnavailable() {
        fixture.setRetriever((text, options) -> {
            throw new AppException(ResponseCode.RETRIEVAL_UNAVAILABLE, "all sources down");
        });

        QueryHandle handle = fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");

        Assertions.assertEquals(QueryStatusEnum.REJECTED, handle.status());
        QueryEntity query = fixture.queryRepository.findById(handle.queryId());
        Assertions.assertEquals(QueryCloseReasonEnum.NO_ANSWER_AVAILABLE, query.getCloseReason());
        Assertions.assertEquals(DeliveryStateEnum.SENT, query.getDeliveryState());
        Assertions.assertEquals(ContentCategoryEnum.NO_ANSWER_APOLOGY, fixture.channelAdapter.last().getCategory());
        Assertions.assertTrue(fixture.channelAdapter.last().getText().contains("How do I reset my password?"));
        Assertions.assertNull(fixture.reviewTaskRepository.findByQueryId(handle.queryId()));
        Assertions.assertTrue(fixture.reminderSink.all().isEmpty());
    }

    @Test
    public void shouldSendApologyWhenNoCandidateFound() {
        fixture.setRetriever((text, options) -> List.of());

        QueryHandle handle = fixture.verificationService.submit("whatsapp", "user-1", "Unknown topic", "en");

        Assertions.assertEquals(QueryStatusEnum.REJECTED, handle.status());
        Assertions.assertEquals(1, fixture.channelAdapter.sent().size());
        Assertions.assertTrue(fixture.correctionLedger.all().isEmpty());
    }

    @Test
    public void shouldRejectSecondSubmissionWhileQueryIsPending() {
        fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.verificationService.submit("whatsapp", "user-1", "Another question", null));

        Assertions.assertEquals(ResponseCode.DUPLICATE_PENDING.getCode(), ex.getCode());
        Assertions.assertTrue(ex.getInfo().startsWith("We are still working on your previous question"));
        Assertions.assertEquals(1, fixture.queryRepository.size());
    }

    @Test
    public void shouldLocalizeWaitingTextForDuplicateSubmission() {
        fixture.verificationService.submit("whatsapp", "user-1", "Como redefinir a senha?", "pt-BR");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.verificationService.submit("whatsapp", "user-1", "Outra pergunta", "pt-BR"));

        Assertions.assertEquals("Aguarde a resposta anterior.", ex.getInfo());
    }

    @Test
    public void shouldAcceptNewSubmissionAfterDelivery() {
        QueryHandle first = fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");
        fixture.verificationService.recordExpertDecision(first.queryId(), "expert-l0", ExpertDecisionEnum.APPROVE, null);

        QueryHandle second = fixture.verificationService.submit("whatsapp", "user-1", "How do I change my email?", "en");

        Assertions.assertNotEquals(first.queryId(), second.queryId());
        Assertions.assertEquals(QueryStatusEnum.PENDING_REVIEW, second.status());
        Assertions.assertEquals(second.queryId(), fixture.conversationRepository.findById("whatsapp:user-1").getPendingQueryId());
    }

    @Test
    public void shouldTreatDecisionFromSupersededExpertAsStale() {
        QueryHandle handle = fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");

        TransitionResult result = fixture.verificationService.recordExpertDecision(handle.queryId(), "expert-l1",
                ExpertDecisionEnum.APPROVE, null);

        Assertions.assertEquals(TransitionResult.Outcome.STALE, result.outcome());
        Assertions.assertEquals(QueryStatusEnum.PENDING_REVIEW, result.status());
        Assertions.assertTrue(fixture.channelAdapter.sent().isEmpty());
        Assertions.assertNotNull(fixture.reviewTaskRepository.findByQueryId(handle.queryId()));
    }

    @Test
    public void shouldAcceptSupersededDecisionWhenConfigured() {
        try (RelayTestFixture lenient = new RelayTestFixture(true)) {
            QueryHandle handle = lenient.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");

            TransitionResult result = lenient.verificationService.recordExpertDecision(handle.queryId(), "expert-l1",
                    ExpertDecisionEnum.APPROVE, null);

            Assertions.assertTrue(result.isApplied());
            Assertions.assertEquals("expert-l1", lenient.queryRepository.findById(handle.queryId()).getActedByExpertId());
        }
    }

    @Test
    public void shouldTreatSecondDecisionAsStale() {
        QueryHandle handle = fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");
        fixture.verificationService.recordExpertDecision(handle.queryId(), "expert-l0", ExpertDecisionEnum.APPROVE, null);

        TransitionResult second = fixture.verificationService.recordExpertDecision(handle.queryId(), "expert-l0",
                ExpertDecisionEnum.REJECT, "changed my mind");

        Assertions.assertEquals(TransitionResult.Outcome.STALE, second.outcome());
        Assertions.assertEquals(QueryStatusEnum.DELIVERED, second.status());
        Assertions.assertEquals(1, fixture.channelAdapter.sent().size());
    }

    @Test
    public void shouldRejectInvalidDecisionInput() {
        QueryHandle handle = fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");

        AppException blankEdit = Assertions.assertThrows(AppException.class,
                () -> fixture.verificationService.recordExpertDecision(handle.queryId(), "expert-l0", ExpertDecisionEnum.EDIT, " "));
        AppException missing = Assertions.assertThrows(AppException.class,
                () -> fixture.verificationService.recordExpertDecision(999L, "expert-l0", ExpertDecisionEnum.APPROVE, null));

        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), blankEdit.getCode());
        Assertions.assertEquals(ResponseCode.QUERY_NOT_FOUND.getCode(), missing.getCode());
    }

    @Test
    public void shouldRejectBlankQueryText() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.verificationService.submit("whatsapp", "user-1", "   ", "en"));

        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
        Assertions.assertEquals(0, fixture.queryRepository.size());
    }

    @Test
    public void shouldKeepDeliveryPendingWhenChannelFails() {
        QueryHandle handle = fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");
        fixture.channelAdapter.failNext(1);

        TransitionResult result = fixture.verificationService.recordExpertDecision(handle.queryId(), "expert-l0",
                ExpertDecisionEnum.APPROVE, null);

        Assertions.assertTrue(result.isApplied());
        Assertions.assertEquals(QueryStatusEnum.APPROVED, result.status());
        Assertions.assertEquals(DeliveryStateEnum.PENDING, result.deliveryState());
        QueryEntity query = fixture.queryRepository.findById(handle.queryId());
        Assertions.assertEquals(1, query.getDeliveryAttempts());
        Assertions.assertTrue(query.getLastDeliveryError().startsWith(ResponseCode.DELIVERY_FAILED.getCode()));

        AppException blocked = Assertions.assertThrows(AppException.class,
                () -> fixture.verificationService.submit("whatsapp", "user-1", "Are you there?", "en"));
        Assertions.assertEquals(ResponseCode.DUPLICATE_PENDING.getCode(), blocked.getCode());

        TransitionResult redelivered = fixture.verificationService.redeliver(handle.queryId());

        Assertions.assertEquals(QueryStatusEnum.DELIVERED, redelivered.status());
        Assertions.assertEquals(2, fixture.queryRepository.findById(handle.queryId()).getDeliveryAttempts());
        Assertions.assertEquals(1, fixture.channelAdapter.sent().size());
    }

    @Test
    public void shouldUseTemplateWhenFreeFormWindowClosed() {
        fixture.channelAdapter.setWindowOpen(false);
        QueryHandle handle = fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");

        fixture.verificationService.recordExpertDecision(handle.queryId(), "expert-l0", ExpertDecisionEnum.APPROVE, null);

        RenderedPayload payload = fixture.channelAdapter.last();
        Assertions.assertEquals(DeliveryModeEnum.TEMPLATE, payload.getMode());
        Assertions.assertEquals("verified_answer_en", payload.getTemplateName());
        Assertions.assertEquals("How do I reset my password?", payload.getVariables().get("question"));
        Assertions.assertEquals("Reset it from settings.", payload.getVariables().get("answer"));
        Assertions.assertEquals(DeliveryModeEnum.TEMPLATE, fixture.queryRepository.findById(handle.queryId()).getDeliveryMode());
    }

    @Test
    public void shouldTreatWindowLookupFailureAsClosed() {
        fixture.channelAdapter.setWindowCheckFails(true);
        QueryHandle handle = fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");

        fixture.verificationService.recordExpertDecision(handle.queryId(), "expert-l0", ExpertDecisionEnum.APPROVE, null);

        Assertions.assertEquals(DeliveryModeEnum.TEMPLATE, fixture.channelAdapter.last().getMode());
    }

    @Test
    public void shouldLeaveReviewUntouchedWhenCorrectionCannotBeRecorded() {
        QueryHandle handle = fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");
        fixture.correctionLedger.setUnavailable(true);

        AppException ex = Assertions.assertThrows(AppException.class, () -> fixture.verificationService.recordExpertDecision(
                handle.queryId(), "expert-l0", ExpertDecisionEnum.EDIT, "Open Settings > Security > Reset."));

        Assertions.assertEquals(ResponseCode.STORE_UNAVAILABLE.getCode(), ex.getCode());
        QueryEntity pending = fixture.queryRepository.findById(handle.queryId());
        Assertions.assertEquals(QueryStatusEnum.PENDING_REVIEW, pending.getStatus());
        Assertions.assertEquals(ReviewOutcomeEnum.PENDING, pending.getReviewOutcome());
        Assertions.assertNotNull(fixture.reviewTaskRepository.findByQueryId(handle.queryId()));
        Assertions.assertTrue(fixture.correctionLedger.all().isEmpty());
        Assertions.assertTrue(fixture.channelAdapter.sent().isEmpty());

        fixture.correctionLedger.setUnavailable(false);
        TransitionResult retried = fixture.verificationService.recordExpertDecision(handle.queryId(), "expert-l0",
                ExpertDecisionEnum.EDIT, "Open Settings > Security > Reset.");

        Assertions.assertTrue(retried.isApplied());
        Assertions.assertEquals(QueryStatusEnum.DELIVERED, retried.status());
        Assertions.assertEquals(1, fixture.correctionLedger.all().size());
        Assertions.assertEquals(ReviewOutcomeEnum.EDITED, fixture.correctionLedger.all().get(0).getOutcome());
        Assertions.assertNull(fixture.reviewTaskRepository.findByQueryId(handle.queryId()));
    }

    @Test
    public void shouldCloseWithApologyWhenSettlingRetrievalFails() {
        fixture.setRetriever((text, options) -> Collections.singletonList(null));

        QueryHandle handle = fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en");

        Assertions.assertEquals(QueryStatusEnum.REJECTED, handle.status());
        QueryEntity query = fixture.queryRepository.findById(handle.queryId());
        Assertions.assertEquals(QueryCloseReasonEnum.NO_ANSWER_AVAILABLE, query.getCloseReason());
        Assertions.assertEquals(DeliveryStateEnum.SENT, query.getDeliveryState());
        Assertions.assertEquals(ContentCategoryEnum.NO_ANSWER_APOLOGY, fixture.channelAdapter.last().getCategory());
        Assertions.assertNull(fixture.reviewTaskRepository.findByQueryId(handle.queryId()));
        Assertions.assertTrue(fixture.reminderSink.all().isEmpty());

        fixture.setRetriever((text, options) -> List.of(RelayTestFixture.candidate("Reset it from settings.", "faq:1", 0.92D)));
        Assertions.assertEquals(QueryStatusEnum.PENDING_REVIEW,
                fixture.verificationService.submit("whatsapp", "user-1", "How do I reset my password?", "en").status());
    }
}
