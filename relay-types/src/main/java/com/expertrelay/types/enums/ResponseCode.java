package com.expertrelay.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 0xxx 为通用码，1xxx 为编排引擎的业务错误码。
 * </p>
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 会话已有未完成的问题 */
    DUPLICATE_PENDING("1001", "已有问题正在处理"),

    /** Query 不存在 */
    QUERY_NOT_FOUND("1002", "问题不存在"),

    /** 知识库不可用 */
    RETRIEVAL_UNAVAILABLE("1003", "知识库检索不可用"),

    /** 知识库检索超时 */
    RETRIEVAL_TIMEOUT("1004", "知识库检索超时"),

    /** 审核动作已失效（已被升级、过期或他人处理） */
    STALE_REVIEW_ACTION("1005", "审核已失效"),

    /** 无匹配模板 */
    NO_TEMPLATE_AVAILABLE("1006", "无可用模板"),

    /** 投递失败 */
    DELIVERY_FAILED("1007", "消息投递失败"),

    /** 投递超时 */
    DELIVERY_TIMEOUT("1008", "消息投递超时"),

    /** 会话存储不可用 */
    STORE_UNAVAILABLE("1009", "会话存储不可用"),

    /** 并发更新冲突 */
    STORE_CONFLICT("1010", "并发更新冲突");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
