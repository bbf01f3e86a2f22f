package com.expertrelay.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 专家审核结果枚举。PENDING 只能单向迁移到其余三个结果之一。
 *
 * @author expertrelay
 * @since 2026-03-02
 */
public enum ReviewOutcomeEnum {

    PENDING("pending"),

    APPROVED("approved"),

    EDITED("edited"),

    REJECTED("rejected");

    private final String code;

    ReviewOutcomeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
