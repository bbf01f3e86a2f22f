package com.expertrelay.api.dto;

import lombok.Data;

/**
 * 调度回调执行结果 DTO。
 */
@Data
public class SchedulerTickResponseDTO {

    private int escalatedCount;
    private int expiredCount;
    /** 检索阶段滞留后被关闭的问题数 */
    private int recoveredCount;
    private int remindedCount;
    private int redeliveredCount;
    private int userRemindedCount;
    private int conversationExpiredCount;
    private int skippedCount;
    private int errorCount;
}
