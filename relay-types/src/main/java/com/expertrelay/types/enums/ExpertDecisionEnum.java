package com.expertrelay.types.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 专家对草稿答案的操作。
 *
 * @author expertrelay
 * @since 2026-03-02
 */
public enum ExpertDecisionEnum {

    /** 认可草稿答案 */
    APPROVE("approve"),

    /** 修改草稿答案 */
    EDIT("edit"),

    /** 拒绝草稿答案 */
    REJECT("reject");

    private final String code;

    ExpertDecisionEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ExpertDecisionEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ExpertDecisionEnum decision : ExpertDecisionEnum.values()) {
            if (decision.code.equalsIgnoreCase(code.trim())) {
                return decision;
            }
        }
        throw new IllegalArgumentException("Unknown expert decision: " + code);
    }
}
