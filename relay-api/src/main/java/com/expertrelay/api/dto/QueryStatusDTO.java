package com.expertrelay.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * Query 状态只读视图。
 */
@Data
public class QueryStatusDTO {

    private Long queryId;
    private String status;
    private String reviewOutcome;
    private Integer escalationLevel;
    private String assignedExpertId;
    private LocalDateTime reviewDeadline;
    private String deliveryState;
    private String deliveryMode;
    private String closeReason;
    private LocalDateTime createdAt;
}
