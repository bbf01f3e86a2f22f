package com.expertrelay.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 用户问题（Query）生命周期状态枚举
 *
 * @author expertrelay
 * @since 2026-03-02
 */
public enum QueryStatusEnum {

    /**
     * 已接收 - Query 刚创建
     */
    RECEIVED("received", false),

    /**
     * 检索中 - 正在调用知识库检索
     */
    RETRIEVING("retrieving", false),

    /**
     * 待审核 - 草稿答案等待专家确认
     */
    PENDING_REVIEW("pending_review", false),

    /**
     * 已批准 - 专家确认草稿答案，等待投递
     */
    APPROVED("approved", false),

    /**
     * 已修改 - 专家给出修正后的答案，等待投递
     */
    EDITED("edited", false),

    /**
     * 已拒绝 - 专家拒绝或无可用答案
     */
    REJECTED("rejected", true),

    /**
     * 已投递 - 最终答案已送达用户
     */
    DELIVERED("delivered", true),

    /**
     * 已过期 - 最高级别专家仍未处理
     */
    EXPIRED("expired", true);

    private final String code;
    private final boolean terminal;

    QueryStatusEnum(String code, boolean terminal) {
        this.code = code;
        this.terminal = terminal;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public static QueryStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (QueryStatusEnum status : QueryStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown query status code: " + code);
    }
}
