package com.expertrelay.domain.delivery.service;

import com.expertrelay.domain.conversation.model.entity.ConversationEntity;
import com.expertrelay.domain.delivery.model.valobj.DeliveryContent;
import com.expertrelay.domain.delivery.model.valobj.DeliveryDecision;
import com.expertrelay.domain.delivery.model.valobj.MessageTemplate;
import com.expertrelay.domain.delivery.model.valobj.RenderedPayload;
import com.expertrelay.domain.delivery.model.valobj.TemplateCatalog;
import com.expertrelay.types.enums.DeliveryModeEnum;
import com.expertrelay.types.enums.ResponseCode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 下发方式选择领域服务。
 * <p>
 * 纯函数：结果只取决于会话、消息内容与窗口状态，不做任何 I/O。
 * </p>
 */
@Slf4j
public class DeliverySelectorDomainService {

    private static final String ELLIPSIS = "...";

    private final TemplateCatalog templateCatalog;
    private final int maxSlotLength;

    public DeliverySelectorDomainService(TemplateCatalog templateCatalog, int maxSlotLength) {
        if (templateCatalog == null) {
            throw new IllegalArgumentException("templateCatalog cannot be null");
        }
        if (maxSlotLength <= 0) {
            throw new IllegalArgumentException("maxSlotLength must be positive");
        }
        this.templateCatalog = templateCatalog;
        this.maxSlotLength = maxSlotLength;
    }

    public DeliveryDecision select(ConversationEntity conversation, DeliveryContent content, boolean windowOpen) {
        if (windowOpen) {
            RenderedPayload payload = RenderedPayload.builder()
                    .mode(DeliveryModeEnum.FREE_FORM)
                    .category(content.category())
                    .recipient(conversation.getId())
                    .text(content.text())
                    .variables(Map.of())
                    .build();
            return new DeliveryDecision(DeliveryModeEnum.FREE_FORM, payload);
        }

        String locale = StringUtils.defaultIfBlank(content.locale(), conversation.resolvedLocale());
        Optional<MessageTemplate> nearest = templateCatalog.findNearest(content.category(), locale);
        MessageTemplate template = nearest.orElseGet(() -> {
            log.warn("DELIVERY_CONFIG_GAP code={} category={} locale={} conversationId={} fallback={}",
                    ResponseCode.NO_TEMPLATE_AVAILABLE.getCode(),
                    content.category(),
                    locale,
                    conversation.getId(),
                    templateCatalog.genericTemplate().name());
            return templateCatalog.genericTemplate();
        });

        RenderedPayload payload = RenderedPayload.builder()
                .mode(DeliveryModeEnum.TEMPLATE)
                .category(content.category())
                .recipient(conversation.getId())
                .templateName(template.name())
                .templateLanguage(template.language())
                .variables(fillSlots(template, content.variables()))
                .genericFallback(nearest.isEmpty())
                .build();
        return new DeliveryDecision(DeliveryModeEnum.TEMPLATE, payload);
    }

    private Map<String, String> fillSlots(MessageTemplate template, Map<String, String> variables) {
        Map<String, String> filled = new LinkedHashMap<>();
        for (String slot : template.slots()) {
            filled.put(slot, truncate(StringUtils.defaultString(variables.get(slot))));
        }
        return filled;
    }

    private String truncate(String value) {
        if (value.length() <= maxSlotLength) {
            return value;
        }
        if (maxSlotLength <= ELLIPSIS.length()) {
            return value.substring(0, maxSlotLength);
        }
        return StringUtils.abbreviate(value, ELLIPSIS, maxSlotLength);
    }
}
