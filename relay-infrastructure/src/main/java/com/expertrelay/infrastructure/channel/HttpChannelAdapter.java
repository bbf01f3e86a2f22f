package com.expertrelay.infrastructure.channel;

import com.expertrelay.domain.conversation.model.entity.ConversationEntity;
import com.expertrelay.domain.delivery.adapter.gateway.IChannelAdapter;
import com.expertrelay.domain.delivery.model.valobj.DeliveryReceipt;
import com.expertrelay.domain.delivery.model.valobj.RenderedPayload;
import com.expertrelay.types.enums.DeliveryModeEnum;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 通过 HTTP 渠道桥下发消息。
 * <p>
 * 规范化载荷以 JSON 发给渠道桥，由其转换为具体渠道协议；
 * 服务端错误与网络错误在重试预算内重试，客户端错误（4xx）不重试。
 * </p>
 */
@Slf4j
@Component
public class HttpChannelAdapter implements IChannelAdapter {

    private final RestTemplate restTemplate;
    private final Clock clock;
    private final String bridgeUrl;
    private final int maxAttempts;
    private final long retryBackoffMs;
    private final Duration freeFormWindow;

    public HttpChannelAdapter(@Qualifier("channelBridgeRestTemplate") RestTemplate restTemplate,
                              Clock clock,
                              @Value("${relay.channel.bridge-url:}") String bridgeUrl,
                              @Value("${relay.channel.max-attempts:3}") int maxAttempts,
                              @Value("${relay.channel.retry-backoff-ms:200}") long retryBackoffMs,
                              @Value("${relay.delivery.free-form-window:24h}") Duration freeFormWindow) {
        this.restTemplate = restTemplate;
        this.clock = clock;
        this.bridgeUrl = bridgeUrl;
        this.maxAttempts = Math.max(maxAttempts, 1);
        this.retryBackoffMs = Math.max(retryBackoffMs, 0L);
        this.freeFormWindow = freeFormWindow;
    }

    @Override
    public boolean isFreeFormWindowOpen(ConversationEntity conversation) {
        if (conversation == null || conversation.getLastInboundAt() == null) {
            return false;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        return conversation.getLastInboundAt().plus(freeFormWindow).isAfter(now);
    }

    @Override
    public DeliveryReceipt send(ConversationEntity conversation, RenderedPayload payload) {
        if (StringUtils.isBlank(bridgeUrl)) {
            throw new AppException(ResponseCode.DELIVERY_FAILED, "Channel bridge url is not configured");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(toBody(conversation, payload), headers);

        RestClientException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Map<?, ?> response = restTemplate.postForObject(bridgeUrl, request, Map.class);
                Object messageId = response == null ? null : response.get("messageId");
                log.info("CHANNEL_SEND_OK conversationId={} mode={} template={} attempt={}",
                        conversation.getId(), payload.getMode(), payload.getTemplateName(), attempt);
                return new DeliveryReceipt(messageId == null ? null : String.valueOf(messageId), LocalDateTime.now(clock));
            } catch (HttpClientErrorException ex) {
                throw new AppException(ResponseCode.DELIVERY_FAILED,
                        "Channel bridge rejected message: " + ex.getStatusCode(), ex);
            } catch (RestClientException ex) {
                lastError = ex;
                log.warn("CHANNEL_SEND_RETRY conversationId={} attempt={} maxAttempts={} error={}",
                        conversation.getId(), attempt, maxAttempts, ex.getMessage());
                if (attempt < maxAttempts) {
                    pause();
                }
            }
        }
        throw new AppException(ResponseCode.DELIVERY_FAILED,
                "Channel bridge send failed after " + maxAttempts + " attempts", lastError);
    }

    private Map<String, Object> toBody(ConversationEntity conversation, RenderedPayload payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("conversationId", conversation.getId());
        body.put("channel", conversation.getChannel());
        body.put("userId", conversation.getUserExternalId());
        body.put("mode", payload.getMode().getCode());
        body.put("category", payload.getCategory() == null ? null : payload.getCategory().getCode());
        if (payload.getMode() == DeliveryModeEnum.FREE_FORM) {
            body.put("text", payload.getText());
        } else {
            Map<String, Object> template = new LinkedHashMap<>();
            template.put("name", payload.getTemplateName());
            template.put("language", payload.getTemplateLanguage());
            template.put("variables", payload.getVariables());
            body.put("template", template);
        }
        return body;
    }

    private void pause() {
        if (retryBackoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(retryBackoffMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AppException(ResponseCode.DELIVERY_FAILED, "Channel send interrupted", ex);
        }
    }
}
