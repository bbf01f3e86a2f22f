package com.expertrelay.trigger.http;

import com.expertrelay.api.dto.ConversationStatusDTO;
import com.expertrelay.api.response.Response;
import com.expertrelay.trigger.application.query.ConversationStatusQueryService;
import com.expertrelay.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 会话状态查询 API（诊断用）。
 */
@RestController
@RequestMapping("/api/conversations")
public class ConversationStatusController {

    private final ConversationStatusQueryService conversationStatusQueryService;

    public ConversationStatusController(ConversationStatusQueryService conversationStatusQueryService) {
        this.conversationStatusQueryService = conversationStatusQueryService;
    }

    @GetMapping("/{channel}/{userId}/status")
    public Response<ConversationStatusDTO> status(@PathVariable("channel") String channel,
                                                  @PathVariable("userId") String userId) {
        ConversationStatusDTO data = conversationStatusQueryService.getConversationStatus(channel, userId);
        return Response.<ConversationStatusDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
