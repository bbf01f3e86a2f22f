package com.expertrelay.domain.conversation.model.valobj;

import com.expertrelay.types.enums.QueryStatusEnum;

/**
 * 提交问题后返回给调用方的句柄。
 */
public record QueryHandle(Long queryId, String conversationId, QueryStatusEnum status) {
}
