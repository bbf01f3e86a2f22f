package com.expertrelay.types.common;

/**
 * 全局常量定义类。
 *
 * @author expertrelay
 * @since 2026-03-02
 */
public class Constants {

    /** 会话标识分隔符：channel + SEPARATOR + userExternalId */
    public final static String CONVERSATION_ID_SEPARATOR = ":";

    /** 默认语言标签 */
    public final static String DEFAULT_LOCALE = "en";

    /** 模板变量：用户问题 */
    public final static String SLOT_QUESTION = "question";

    /** 模板变量：答案正文 */
    public final static String SLOT_ANSWER = "answer";

    /** 模板变量：渲染后的完整消息，通用模板使用 */
    public final static String SLOT_MESSAGE = "message";

}
