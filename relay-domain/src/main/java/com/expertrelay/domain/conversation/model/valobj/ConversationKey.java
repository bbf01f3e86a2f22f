package com.expertrelay.domain.conversation.model.valobj;

import com.expertrelay.types.common.Constants;
import org.apache.commons.lang3.StringUtils;

/**
 * 会话标识：渠道 + 用户外部标识。
 */
public record ConversationKey(String channel, String userExternalId) {

    public ConversationKey {
        if (StringUtils.isBlank(channel)) {
            throw new IllegalArgumentException("channel cannot be blank");
        }
        if (StringUtils.isBlank(userExternalId)) {
            throw new IllegalArgumentException("userExternalId cannot be blank");
        }
        channel = channel.trim().toLowerCase();
        userExternalId = userExternalId.trim();
    }

    public String conversationId() {
        return channel + Constants.CONVERSATION_ID_SEPARATOR + userExternalId;
    }
}
