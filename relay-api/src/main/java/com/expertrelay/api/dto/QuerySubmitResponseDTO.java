package com.expertrelay.api.dto;

import lombok.Data;

/**
 * 用户提问响应 DTO。
 */
@Data
public class QuerySubmitResponseDTO {

    private Long queryId;
    private String conversationId;
    private String status;
}
