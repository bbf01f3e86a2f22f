package com.expertrelay.types.enums;

/**
 * Query 非正常结束原因。
 *
 * @author expertrelay
 * @since 2026-03-02
 */
public enum QueryCloseReasonEnum {

    /** 知识库检索失败、超时或结果为空 */
    NO_ANSWER_AVAILABLE,

    /** 专家拒绝 */
    EXPERT_REJECTED,

    /** 最高级别审核超时 */
    REVIEW_EXPIRED
}
