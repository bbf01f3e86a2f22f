package com.expertrelay.domain.delivery.model.valobj;

import com.expertrelay.types.enums.ContentCategoryEnum;

import java.util.List;

/**
 * 渠道侧预审通过的消息模板。
 *
 * @param name     模板名
 * @param category 适用类别，通用模板为 null
 * @param language 模板语言
 * @param slots    允许填充的变量白名单（按模板参数顺序）
 */
public record MessageTemplate(String name, ContentCategoryEnum category, String language, List<String> slots) {

    public MessageTemplate {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("template name cannot be blank");
        }
        slots = slots == null ? List.of() : List.copyOf(slots);
    }
}
