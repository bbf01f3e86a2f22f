package com.expertrelay.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 专家纠错记录 DTO，供知识库入库流程按游标拉取。
 */
@Data
public class CorrectionRecordDTO {

    private Long id;
    private Long queryId;
    private String originalQueryText;
    private String originalCandidate;
    private String originalSourceId;
    private String expertFinalText;
    private String expertId;
    private String outcome;
    private LocalDateTime recordedAt;
}
