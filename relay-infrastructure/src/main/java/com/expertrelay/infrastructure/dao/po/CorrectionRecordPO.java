package com.expertrelay.infrastructure.dao.po;

import com.expertrelay.types.enums.ReviewOutcomeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 纠错记录 PO
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrectionRecordPO {

    private Long id;

    private Long queryId;

    private String originalQueryText;

    private String originalCandidate;

    private String originalSourceId;

    private String expertFinalText;

    private String expertId;

    private ReviewOutcomeEnum outcome;

    private LocalDateTime recordedAt;
}
