package com.expertrelay.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 面向用户的消息类别，决定模板匹配与文案选择。
 *
 * @author expertrelay
 * @since 2026-03-02
 */
public enum ContentCategoryEnum {

    /** 专家认可的答案 */
    VERIFIED_ANSWER("verified_answer"),

    /** 专家修正后的答案 */
    CORRECTED_ANSWER("corrected_answer"),

    /** 专家拒绝了草稿答案 */
    REJECTED_ANSWER("rejected_answer"),

    /** 知识库无可用答案 */
    NO_ANSWER_APOLOGY("no_answer_apology"),

    /** 审核超时，告知用户仍在处理 */
    STILL_WORKING("still_working"),

    /** 长时间未互动的用户提醒 */
    USER_REMINDER("user_reminder");

    private final String code;

    ContentCategoryEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
