package com.expertrelay.trigger.http;

import com.expertrelay.api.dto.CorrectionRecordDTO;
import com.expertrelay.api.response.Response;
import com.expertrelay.domain.feedback.adapter.repository.ICorrectionLedger;
import com.expertrelay.domain.feedback.model.valobj.CorrectionRecord;
import com.expertrelay.types.enums.ResponseCode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 纠错账本游标读取 API，供知识库入库流程拉取专家修正。
 */
@RestController
@RequestMapping("/api/corrections")
public class CorrectionLedgerController {

    private final ICorrectionLedger correctionLedger;

    @Value("${relay.feedback.max-page-size:500}")
    private int maxPageSize = 500;

    public CorrectionLedgerController(ICorrectionLedger correctionLedger) {
        this.correctionLedger = correctionLedger;
    }

    @GetMapping
    public Response<List<CorrectionRecordDTO>> list(@RequestParam(value = "afterId", defaultValue = "0") long afterId,
                                                    @RequestParam(value = "limit", defaultValue = "100") int limit) {
        if (afterId < 0 || limit <= 0) {
            return Response.<List<CorrectionRecordDTO>>builder()
                    .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                    .info("afterId 不能为负数且 limit 必须大于 0")
                    .build();
        }
        List<CorrectionRecordDTO> data = correctionLedger.findAfter(afterId, Math.min(limit, maxPageSize)).stream()
                .map(this::toDTO)
                .collect(Collectors.toList());
        return Response.<List<CorrectionRecordDTO>>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

    private CorrectionRecordDTO toDTO(CorrectionRecord record) {
        CorrectionRecordDTO dto = new CorrectionRecordDTO();
        dto.setId(record.getId());
        dto.setQueryId(record.getQueryId());
        dto.setOriginalQueryText(record.getOriginalQueryText());
        dto.setOriginalCandidate(record.getOriginalCandidate());
        dto.setOriginalSourceId(record.getOriginalSourceId());
        dto.setExpertFinalText(record.getExpertFinalText());
        dto.setExpertId(record.getExpertId());
        dto.setOutcome(record.getOutcome() == null ? null : record.getOutcome().getCode());
        dto.setRecordedAt(record.getRecordedAt());
        return dto;
    }
}
