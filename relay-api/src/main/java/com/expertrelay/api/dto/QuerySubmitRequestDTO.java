package com.expertrelay.api.dto;

import lombok.Data;

/**
 * 用户提问请求 DTO，由 webhook 前置服务转换渠道消息后提交。
 */
@Data
public class QuerySubmitRequestDTO {

    private String channel;
    private String userId;
    private String text;
    private String locale;
}
