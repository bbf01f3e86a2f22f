package com.expertrelay.domain.delivery.model.valobj;

import com.expertrelay.types.enums.ContentCategoryEnum;

import java.util.Map;

/**
 * 待下发的用户消息内容。
 *
 * @param category  消息类别
 * @param locale    语言
 * @param text      完整自由文本
 * @param variables 模板变量（question / answer / message）
 */
public record DeliveryContent(ContentCategoryEnum category, String locale, String text,
                              Map<String, String> variables) {

    public DeliveryContent {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }
}
