package com.expertrelay.infrastructure.channel;

import com.expertrelay.domain.review.adapter.gateway.IReminderSink;
import com.expertrelay.domain.review.model.valobj.ReviewNotice;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * 专家通知出口：异步 POST 到专家通知桥，失败只记录。
 */
@Slf4j
@Component
public class HttpReminderSink implements IReminderSink {

    private final RestTemplate restTemplate;
    private final Executor notifyWorker;
    private final String notifyUrl;
    private final Counter failureCounter;

    public HttpReminderSink(@Qualifier("channelBridgeRestTemplate") RestTemplate restTemplate,
                            @Qualifier("notifyWorker") Executor notifyWorker,
                            @Value("${relay.review.notify-url:}") String notifyUrl) {
        this.restTemplate = restTemplate;
        this.notifyWorker = notifyWorker;
        this.notifyUrl = notifyUrl;
        this.failureCounter = Counter.builder("relay.review.notice.failure.total")
                .register(Metrics.globalRegistry);
    }

    @Override
    public void notify(String expertId, ReviewNotice notice) {
        if (StringUtils.isBlank(notifyUrl)) {
            log.info("REVIEW_NOTICE_SKIPPED reason=notify_url_missing expertId={} type={} queryId={}",
                    expertId, notice.getType(), notice.getQueryId());
            return;
        }
        Map<String, Object> body = toBody(expertId, notice);
        try {
            notifyWorker.execute(() -> post(expertId, notice, body));
        } catch (RejectedExecutionException ex) {
            failureCounter.increment();
            log.warn("REVIEW_NOTICE_REJECTED expertId={} type={} queryId={} error={}",
                    expertId, notice.getType(), notice.getQueryId(), ex.getMessage());
        }
    }

    private void post(String expertId, ReviewNotice notice, Map<String, Object> body) {
        try {
            restTemplate.postForObject(notifyUrl, body, Map.class);
            log.debug("REVIEW_NOTICE_SENT expertId={} type={} queryId={} items={}", expertId, notice.getType(), notice.getQueryId(),
                    notice.getPendingReviews() == null ? 1 : notice.getPendingReviews().size());
        } catch (RestClientException ex) {
            failureCounter.increment();
            log.warn("REVIEW_NOTICE_FAILED expertId={} type={} queryId={} error={}",
                    expertId, notice.getType(), notice.getQueryId(), ex.getMessage());
        }
    }

    private Map<String, Object> toBody(String expertId, ReviewNotice notice) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("expertId", expertId);
        body.put("type", notice.getType() == null ? null : notice.getType().name());
        body.putAll(toItem(notice));
        if (notice.getPendingReviews() != null) {
            body.put("pendingReviews", notice.getPendingReviews().stream()
                    .map(this::toItem)
                    .collect(Collectors.toList()));
        }
        return body;
    }

    private Map<String, Object> toItem(ReviewNotice notice) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("queryId", notice.getQueryId());
        body.put("conversationId", notice.getConversationId());
        body.put("escalationLevel", notice.getEscalationLevel());
        body.put("reminderTierPercent", notice.getReminderTierPercent());
        body.put("deadline", notice.getDeadline() == null ? null : notice.getDeadline().toString());
        body.put("reviewPacket", notice.getReviewPacket());
        return body;
    }
}
