package com.expertrelay.trigger.http;

import com.expertrelay.api.dto.QuerySubmitRequestDTO;
import com.expertrelay.api.dto.QuerySubmitResponseDTO;
import com.expertrelay.api.response.Response;
import com.expertrelay.domain.conversation.model.valobj.QueryHandle;
import com.expertrelay.trigger.application.command.QueryVerificationApplicationService;
import com.expertrelay.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 用户提问入口，由 webhook 前置服务调用。
 */
@RestController
@RequestMapping("/api/queries")
public class QueryController {

    private final QueryVerificationApplicationService queryVerificationApplicationService;

    public QueryController(QueryVerificationApplicationService queryVerificationApplicationService) {
        this.queryVerificationApplicationService = queryVerificationApplicationService;
    }

    @PostMapping
    public Response<QuerySubmitResponseDTO> submit(@RequestBody QuerySubmitRequestDTO request) {
        if (request == null) {
            return Response.<QuerySubmitResponseDTO>builder()
                    .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                    .info("请求体不能为空")
                    .build();
        }
        QueryHandle handle = queryVerificationApplicationService.submit(request.getChannel(),
                request.getUserId(),
                request.getText(),
                request.getLocale());

        QuerySubmitResponseDTO data = new QuerySubmitResponseDTO();
        data.setQueryId(handle.queryId());
        data.setConversationId(handle.conversationId());
        data.setStatus(handle.status() == null ? null : handle.status().getCode());
        return Response.<QuerySubmitResponseDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
