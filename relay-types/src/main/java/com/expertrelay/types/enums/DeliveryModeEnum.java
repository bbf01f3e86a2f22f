package com.expertrelay.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 投递形态：窗口期内自由文本，窗口期外使用预审模板。
 *
 * @author expertrelay
 * @since 2026-03-02
 */
public enum DeliveryModeEnum {

    TEMPLATE("template"),

    FREE_FORM("free_form");

    private final String code;

    DeliveryModeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
