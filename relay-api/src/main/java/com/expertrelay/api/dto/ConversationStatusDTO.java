package com.expertrelay.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 会话状态只读视图（诊断用）。
 */
@Data
public class ConversationStatusDTO {

    private String conversationId;
    private String channel;
    private String userId;
    private String status;
    private String locale;
    private LocalDateTime lastInboundAt;
    private LocalDateTime lastOutboundAt;
    private String assignedExpertId;
    private Integer escalationLevel;
    private QueryStatusDTO currentQuery;
}
