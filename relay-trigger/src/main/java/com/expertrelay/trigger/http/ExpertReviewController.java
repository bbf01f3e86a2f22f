package com.expertrelay.trigger.http;

import com.expertrelay.api.dto.ExpertDecisionRequestDTO;
import com.expertrelay.api.dto.ExpertDecisionResponseDTO;
import com.expertrelay.api.response.Response;
import com.expertrelay.trigger.application.command.QueryVerificationApplicationService;
import com.expertrelay.trigger.application.command.TransitionResult;
import com.expertrelay.types.enums.ExpertDecisionEnum;
import com.expertrelay.types.enums.ResponseCode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 专家审核回调 API。
 * <p>
 * 已失效的审核动作（已被升级、过期或他人处理）以 outcome=STALE 正常返回。
 * </p>
 */
@RestController
@RequestMapping("/api/reviews")
public class ExpertReviewController {

    private final QueryVerificationApplicationService queryVerificationApplicationService;

    public ExpertReviewController(QueryVerificationApplicationService queryVerificationApplicationService) {
        this.queryVerificationApplicationService = queryVerificationApplicationService;
    }

    @PostMapping("/{queryId}/decision")
    public Response<ExpertDecisionResponseDTO> decide(@PathVariable("queryId") Long queryId,
                                                      @RequestBody ExpertDecisionRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getDecision())) {
            return Response.<ExpertDecisionResponseDTO>builder()
                    .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                    .info("decision 不能为空")
                    .build();
        }
        ExpertDecisionEnum decision = ExpertDecisionEnum.fromCode(request.getDecision());
        TransitionResult result = queryVerificationApplicationService.recordExpertDecision(queryId,
                request.getExpertId(),
                decision,
                request.getEditedText());

        ExpertDecisionResponseDTO data = new ExpertDecisionResponseDTO();
        data.setQueryId(result.queryId());
        data.setOutcome(result.outcome().name());
        data.setStatus(result.status() == null ? null : result.status().getCode());
        return Response.<ExpertDecisionResponseDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(result.isApplied() ? ResponseCode.SUCCESS.getInfo() : ResponseCode.STALE_REVIEW_ACTION.getInfo())
                .data(data)
                .build();
    }
}
