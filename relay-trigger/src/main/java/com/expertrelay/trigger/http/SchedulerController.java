package com.expertrelay.trigger.http;

import com.expertrelay.api.dto.SchedulerTickResponseDTO;
import com.expertrelay.api.response.Response;
import com.expertrelay.trigger.application.command.EscalationScheduleApplicationService;
import com.expertrelay.trigger.application.command.EscalationScheduleApplicationService.TickReport;
import com.expertrelay.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 外部定时器回调：执行一次升级调度 tick。
 */
@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {

    private final EscalationScheduleApplicationService escalationScheduleApplicationService;
    private final Clock clock;

    public SchedulerController(EscalationScheduleApplicationService escalationScheduleApplicationService, Clock clock) {
        this.escalationScheduleApplicationService = escalationScheduleApplicationService;
        this.clock = clock;
    }

    @PostMapping("/tick")
    public Response<SchedulerTickResponseDTO> tick() {
        TickReport report = escalationScheduleApplicationService.tick(LocalDateTime.now(clock));
        SchedulerTickResponseDTO data = new SchedulerTickResponseDTO();
        data.setEscalatedCount(report.escalatedCount());
        data.setExpiredCount(report.expiredCount());
        data.setRecoveredCount(report.recoveredCount());
        data.setRemindedCount(report.remindedCount());
        data.setRedeliveredCount(report.redeliveredCount());
        data.setUserRemindedCount(report.userRemindedCount());
        data.setConversationExpiredCount(report.conversationExpiredCount());
        data.setSkippedCount(report.skippedCount());
        data.setErrorCount(report.errorCount());
        return Response.<SchedulerTickResponseDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
