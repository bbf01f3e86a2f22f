package com.expertrelay.api.dto;

import lombok.Data;

/**
 * 专家审核请求 DTO。decision 取值 approve / edit / reject。
 */
@Data
public class ExpertDecisionRequestDTO {

    private String expertId;
    private String decision;
    private String editedText;
}
