package com.expertrelay.test;

import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.domain.conversation.model.valobj.QueryHandle;
import com.expertrelay.domain.review.model.entity.ReviewTaskEntity;
import com.expertrelay.domain.review.model.valobj.ReviewNotice;
import com.expertrelay.test.support.RecordingReminderSink;
import com.expertrelay.test.support.RelayTestFixture;
import com.expertrelay.trigger.application.command.EscalationScheduleApplicationService.TickReport;
import com.expertrelay.trigger.application.command.TransitionResult;
import com.expertrelay.trigger.application.common.QueryLockRegistry;
import com.expertrelay.types.enums.ContentCategoryEnum;
import com.expertrelay.types.enums.DeliveryStateEnum;
import com.expertrelay.types.enums.ExpertDecisionEnum;
import com.expertrelay.types.enums.QueryCloseReasonEnum;
import com.expertrelay.types.enums.QueryStatusEnum;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.enums.ReviewNoticeTypeEnum;
import com.expertrelay.types.exception.AppException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class EscalationScheduleApplicationServiceTest {

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
    public void shouldEscalateThroughAllLevelsThenExpire() {
        QueryHandle handle = submit("user-1");

        Assertions.assertFalse(tickAt(Duration.ofMinutes(9).plusSeconds(59)).escalatedCount() > 0);

        TickReport first = tickAt(Duration.ofMinutes(10));
        Assertions.assertEquals(1, first.escalatedCount());
        QueryEntity query = fixture.queryRepository.findById(handle.queryId());
        Assertions.assertEquals(1, query.getEscalationLevel());
        Assertions.assertEquals("expert-l1", query.getAssignedExpertId());
        ReviewTaskEntity task = fixture.reviewTaskRepository.findByQueryId(handle.queryId());
        Assertions.assertEquals(fixture.at(Duration.ofMinutes(30)), task.getDeadline());
        Assertions.assertEquals("expert-l1",
                fixture.conversationRepository.findById(handle.conversationId()).getAssignedExpertId());

        Assertions.assertEquals(0, tickAt(Duration.ofMinutes(29)).escalatedCount());

        TickReport second = tickAt(Duration.ofMinutes(30));
        Assertions.assertEquals(1, second.escalatedCount());
        Assertions.assertEquals(fixture.at(Duration.ofMinutes(70)),
                fixture.reviewTaskRepository.findByQueryId(handle.queryId()).getDeadline());

        List<RecordingReminderSink.Delivered> escalations = fixture.reminderSink.ofType(ReviewNoticeTypeEnum.ESCALATED);
        Assertions.assertEquals(List.of("expert-l1", "expert-l2"),
                escalations.stream().map(RecordingReminderSink.Delivered::expertId).toList());
        Assertions.assertEquals(2, escalations.get(1).notice().getEscalationLevel());
        Assertions.assertTrue(fixture.channelAdapter.sent().isEmpty());

        TickReport third = tickAt(Duration.ofMinutes(70));
        Assertions.assertEquals(0, third.escalatedCount());
        Assertions.assertEquals(1, third.expiredCount());

        QueryEntity expired = fixture.queryRepository.findById(handle.queryId());
        Assertions.assertEquals(QueryStatusEnum.EXPIRED, expired.getStatus());
        Assertions.assertEquals(QueryCloseReasonEnum.REVIEW_EXPIRED, expired.getCloseReason());
        Assertions.assertEquals(DeliveryStateEnum.SENT, expired.getDeliveryState());
        Assertions.assertEquals(ContentCategoryEnum.STILL_WORKING, fixture.channelAdapter.last().getCategory());
        Assertions.assertTrue(fixture.channelAdapter.last().getText().contains("How do I reset my password?"));
        Assertions.assertNull(fixture.reviewTaskRepository.findByQueryId(handle.queryId()));

        Assertions.assertFalse(tickAt(Duration.ofMinutes(200)).hasActivity());
        Assertions.assertEquals(1, fixture.channelAdapter.sent().size());
    }

    @Test
    public void shouldIgnoreDecisionAfterExpiry() {
        QueryHandle handle = submit("user-1");
        tickAt(Duration.ofMinutes(10));
        tickAt(Duration.ofMinutes(30));
        tickAt(Duration.ofMinutes(70));

        TransitionResult late = fixture.verificationService.recordExpertDecision(handle.queryId(), "expert-l2",
                ExpertDecisionEnum.APPROVE, null);

        Assertions.assertEquals(TransitionResult.Outcome.STALE, late.outcome());
        Assertions.assertEquals(QueryStatusEnum.EXPIRED, late.status());
        Assertions.assertEquals(1, fixture.channelAdapter.sent().size());
        Assertions.assertEquals(QueryStatusEnum.PENDING_REVIEW, submit("user-1").status());
    }

    @Test
    public void shouldSendEachReminderTierOnceAcrossEscalations() {
        QueryHandle handle = submit("user-1");

        Assertions.assertEquals(0, tickAt(Duration.ofMinutes(4)).remindedCount());
        Assertions.assertEquals(1, tickAt(Duration.ofMinutes(5)).remindedCount());
        Assertions.assertEquals(0, tickAt(Duration.ofMinutes(6)).remindedCount());
        Assertions.assertEquals(1, tickAt(Duration.ofMinutes(9)).remindedCount());
        Assertions.assertEquals(0, tickAt(Duration.ofMinutes(9).plusSeconds(30)).remindedCount());

        List<RecordingReminderSink.Delivered> reminders = fixture.reminderSink.ofType(ReviewNoticeTypeEnum.REMINDER);
        Assertions.assertEquals(2, reminders.size());
        Assertions.assertEquals(50, reminders.get(0).notice().getReminderTierPercent());
        Assertions.assertEquals(90, reminders.get(1).notice().getReminderTierPercent());
        Assertions.assertEquals("expert-l0", reminders.get(1).expertId());
        Assertions.assertEquals(handle.queryId(), reminders.get(1).notice().getQueryId());

        Assertions.assertEquals(1, tickAt(Duration.ofMinutes(10)).escalatedCount());
        Assertions.assertEquals(0, tickAt(Duration.ofMinutes(20)).remindedCount());
        Assertions.assertEquals(0, tickAt(Duration.ofMinutes(28)).remindedCount());
        Assertions.assertEquals(2, fixture.reminderSink.ofType(ReviewNoticeTypeEnum.REMINDER).size());
        Assertions.assertNull(fixture.reviewTaskRepository.findByQueryId(handle.queryId()).getNextReminderAt());
    }

    @Test
    public void shouldFireConfiguredTiersExactlyOnceOverWholeReview() {
        submit("user-1");

        for (int minute = 1; minute < 70; minute++) {
            tickAt(Duration.ofMinutes(minute));
        }

        Assertions.assertEquals(List.of(50, 90), fixture.reminderSink.ofType(ReviewNoticeTypeEnum.REMINDER).stream()
                .map(delivered -> delivered.notice().getReminderTierPercent())
                .toList());
        Assertions.assertEquals(2, fixture.reminderSink.ofType(ReviewNoticeTypeEnum.ESCALATED).size());
    }

    @Test
    public void shouldResendTiersInEachWindowWhenResetEnabled() {
        fixture.close();
        fixture = new RelayTestFixture(false, true, 200);
        submit("user-1");

        Assertions.assertEquals(2, tickAt(Duration.ofMinutes(9)).remindedCount());
        tickAt(Duration.ofMinutes(10));
        Assertions.assertEquals(0, tickAt(Duration.ofMinutes(19)).remindedCount());
        Assertions.assertEquals(1, tickAt(Duration.ofMinutes(20)).remindedCount());

        List<RecordingReminderSink.Delivered> reminders = fixture.reminderSink.ofType(ReviewNoticeTypeEnum.REMINDER);
        Assertions.assertEquals("expert-l1", reminders.get(reminders.size() - 1).expertId());
        Assertions.assertEquals(50, reminders.get(reminders.size() - 1).notice().getReminderTierPercent());
    }

    @Test
    public void shouldSendAllOverdueTiersInOneNotice() {
        QueryHandle handle = submit("user-1");

        TickReport report = tickAt(Duration.ofMinutes(9));

        Assertions.assertEquals(2, report.remindedCount());
        List<RecordingReminderSink.Delivered> reminders = fixture.reminderSink.ofType(ReviewNoticeTypeEnum.REMINDER);
        Assertions.assertEquals(1, reminders.size());
        Assertions.assertEquals(90, reminders.get(0).notice().getReminderTierPercent());
        Assertions.assertEquals(List.of(handle.queryId()), reminders.get(0).notice().getPendingReviews().stream()
                .map(ReviewNotice::getQueryId)
                .toList());
        Assertions.assertEquals(0, tickAt(Duration.ofMinutes(9).plusSeconds(30)).remindedCount());
    }

    @Test
    public void shouldConsolidateRemindersForSameExpert() {
        QueryHandle first = submit("user-1");
        fixture.clock.setTo(fixture.at(Duration.ofMinutes(1)));
        QueryHandle second = submit("user-2");

        TickReport report = tickAt(Duration.ofMinutes(6));

        Assertions.assertEquals(2, report.remindedCount());
        List<RecordingReminderSink.Delivered> reminders = fixture.reminderSink.ofType(ReviewNoticeTypeEnum.REMINDER);
        Assertions.assertEquals(1, reminders.size());
        Assertions.assertEquals("expert-l0", reminders.get(0).expertId());
        ReviewNotice digest = reminders.get(0).notice();
        Assertions.assertEquals(first.queryId(), digest.getQueryId());
        Assertions.assertEquals(List.of(first.queryId(), second.queryId()), digest.getPendingReviews().stream()
                .map(ReviewNotice::getQueryId)
                .toList());
    }

    @Test
    public void shouldReachEveryDueReminderWhenBatchIsSmall() {
        fixture.close();
        fixture = new RelayTestFixture(false, false, 1);
        QueryHandle first = submit("user-1");
        fixture.clock.setTo(fixture.at(Duration.ofMinutes(1)));
        QueryHandle second = submit("user-2");
        fixture.clock.setTo(fixture.at(Duration.ofMinutes(2)));
        QueryHandle third = submit("user-3");

        Assertions.assertEquals(1, tickAt(Duration.ofMinutes(8)).remindedCount());
        Assertions.assertEquals(1, tickAt(Duration.ofMinutes(8).plusSeconds(10)).remindedCount());
        Assertions.assertEquals(1, tickAt(Duration.ofMinutes(8).plusSeconds(20)).remindedCount());

        Assertions.assertEquals(List.of(first.queryId(), second.queryId(), third.queryId()),
                fixture.reminderSink.ofType(ReviewNoticeTypeEnum.REMINDER).stream()
                        .map(delivered -> delivered.notice().getQueryId())
                        .toList());
        Assertions.assertEquals(fixture.at(Duration.ofMinutes(9)),
                fixture.reviewTaskRepository.findByQueryId(first.queryId()).getNextReminderAt());
    }

    @Test
    public void shouldCloseQueryStalledInRetrieval() {
        fixture.setRetriever((text, options) -> {
            fixture.queryRepository.setUnavailable(true);
            return List.of(RelayTestFixture.candidate("Reset it from settings.", "faq:1", 0.92D));
        });
        AppException failed = Assertions.assertThrows(AppException.class, () -> submit("user-1"));
        Assertions.assertEquals(ResponseCode.STORE_UNAVAILABLE.getCode(), failed.getCode());
        fixture.queryRepository.setUnavailable(false);
        QueryEntity stalled = fixture.queryRepository.findAll().get(0);
        Assertions.assertEquals(QueryStatusEnum.RETRIEVING, stalled.getStatus());

        fixture.setRetriever((text, options) -> List.of(RelayTestFixture.candidate("Reset it from settings.", "faq:1", 0.92D)));
        AppException blocked = Assertions.assertThrows(AppException.class, () -> submit("user-1"));
        Assertions.assertEquals(ResponseCode.DUPLICATE_PENDING.getCode(), blocked.getCode());

        TickReport report = tickAt(Duration.ofMinutes(1));

        Assertions.assertEquals(1, report.recoveredCount());
        QueryEntity closed = fixture.queryRepository.findById(stalled.getId());
        Assertions.assertEquals(QueryStatusEnum.REJECTED, closed.getStatus());
        Assertions.assertEquals(QueryCloseReasonEnum.NO_ANSWER_AVAILABLE, closed.getCloseReason());
        Assertions.assertEquals(ContentCategoryEnum.NO_ANSWER_APOLOGY, fixture.channelAdapter.last().getCategory());
        Assertions.assertEquals(QueryStatusEnum.PENDING_REVIEW, submit("user-1").status());
        Assertions.assertEquals(0, tickAt(Duration.ofMinutes(2)).recoveredCount());
    }

    @Test
    public void shouldNotRemindAfterDecision() {
        QueryHandle handle = submit("user-1");
        fixture.verificationService.recordExpertDecision(handle.queryId(), "expert-l0", ExpertDecisionEnum.APPROVE, null);

        TickReport report = tickAt(Duration.ofMinutes(15));

        Assertions.assertFalse(report.hasActivity());
        Assertions.assertTrue(fixture.reminderSink.ofType(ReviewNoticeTypeEnum.REMINDER).isEmpty());
    }

    @Test
    public void shouldRedeliverPendingMessages() {
        QueryHandle handle = submit("user-1");
        fixture.channelAdapter.failNext(2);
        fixture.verificationService.recordExpertDecision(handle.queryId(), "expert-l0", ExpertDecisionEnum.APPROVE, null);

        TickReport failed = tickAt(Duration.ofMinutes(1));
        Assertions.assertEquals(0, failed.redeliveredCount());
        Assertions.assertEquals(2, fixture.queryRepository.findById(handle.queryId()).getDeliveryAttempts());

        TickReport succeeded = tickAt(Duration.ofMinutes(2));
        Assertions.assertEquals(1, succeeded.redeliveredCount());
        Assertions.assertEquals(QueryStatusEnum.DELIVERED, fixture.queryRepository.findById(handle.queryId()).getStatus());
        Assertions.assertEquals(1, fixture.channelAdapter.sent().size());

        Assertions.assertEquals(0, tickAt(Duration.ofMinutes(3)).redeliveredCount());
    }

    @Test
    public void shouldIsolateFailureOfSingleQuery() {
        QueryHandle broken = submit("user-1");
        QueryHandle healthy = submit("user-2");
        fixture.queryRepository.conflictOnUpdate(broken.queryId());

        TickReport report = tickAt(Duration.ofMinutes(10));

        Assertions.assertEquals(1, report.escalatedCount());
        Assertions.assertEquals(1, report.errorCount());
        Assertions.assertEquals(1, fixture.queryRepository.findById(healthy.queryId()).getEscalationLevel());
        Assertions.assertEquals(0, fixture.reviewTaskRepository.findByQueryId(broken.queryId()).getEscalationLevel());
        List<RecordingReminderSink.Delivered> escalations = fixture.reminderSink.ofType(ReviewNoticeTypeEnum.ESCALATED);
        Assertions.assertEquals(1, escalations.size());
        Assertions.assertEquals(healthy.queryId(), escalations.get(0).notice().getQueryId());
    }

    @Test
    public void shouldAbortTickWhenStoreUnavailable() {
        QueryHandle handle = submit("user-1");
        fixture.queryRepository.setUnavailable(true);

        AppException ex = Assertions.assertThrows(AppException.class, () -> tickAt(Duration.ofMinutes(10)));
        Assertions.assertEquals(ResponseCode.STORE_UNAVAILABLE.getCode(), ex.getCode());

        fixture.queryRepository.setUnavailable(false);
        Assertions.assertEquals(1, tickAt(Duration.ofMinutes(11)).escalatedCount());
        Assertions.assertEquals(fixture.at(Duration.ofMinutes(31)),
                fixture.reviewTaskRepository.findByQueryId(handle.queryId()).getDeadline());
    }

    @Test
    public void shouldSkipQueryLockedByAnotherAction() throws Exception {
        QueryHandle handle = submit("user-1");
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> fixture.lockRegistry.withLock(QueryLockRegistry.queryKey(handle.queryId()), () -> {
            locked.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        holder.start();
        Assertions.assertTrue(locked.await(5, TimeUnit.SECONDS));

        TickReport report;
        try {
            report = tickAt(Duration.ofMinutes(10));
        } finally {
            release.countDown();
            holder.join(5000);
        }

        Assertions.assertEquals(0, report.escalatedCount());
        Assertions.assertEquals(1, report.skippedCount());
        Assertions.assertEquals(0, fixture.queryRepository.findById(handle.queryId()).getEscalationLevel());
        Assertions.assertEquals(1, tickAt(Duration.ofMinutes(10).plusSeconds(5)).escalatedCount());
    }

    private QueryHandle submit(String userId) {
        return fixture.verificationService.submit("whatsapp", userId, "How do I reset my password?", "en");
    }

    private TickReport tickAt(Duration offset) {
        fixture.clock.setTo(fixture.at(offset));
        return fixture.scheduleService.tick(fixture.at(offset));
    }
}
