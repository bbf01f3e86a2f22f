package com.expertrelay.domain.feedback.model.valobj;

import com.expertrelay.types.enums.ReviewOutcomeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 纠错记录，追加后不可修改。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrectionRecord {

    /** 账本游标 ID */
    private Long id;

    private Long queryId;

    private String originalQueryText;

    /** 原始候选内容 */
    private String originalCandidate;

    private String originalSourceId;

    /** 专家最终文本（修改后的答案或拒绝备注） */
    private String expertFinalText;

    private String expertId;

    private ReviewOutcomeEnum outcome;

    private LocalDateTime recordedAt;
}
