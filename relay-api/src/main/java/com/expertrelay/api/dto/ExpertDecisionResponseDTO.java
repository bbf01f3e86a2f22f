package com.expertrelay.api.dto;

import lombok.Data;

/**
 * 专家审核响应 DTO。outcome 为 APPLIED 或 STALE，STALE 不视为错误。
 */
@Data
public class ExpertDecisionResponseDTO {

    private Long queryId;
    private String outcome;
    private String status;
}
