package com.expertrelay.trigger.application.command;

import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.domain.review.adapter.repository.IReviewTaskRepository;
import com.expertrelay.domain.review.model.entity.ReviewTaskEntity;
import com.expertrelay.domain.review.service.EscalationPolicyDomainService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 审核截止时间簿记：登记、取消、推进审核任务，并按截止时间顺序提供到期任务。
 * <p>
 * 调用方须持有对应 Query 的迁移锁。
 * </p>
 */
@Slf4j
@Service
public class ReviewDeadlineApplicationService {

    private final IReviewTaskRepository reviewTaskRepository;
    private final EscalationPolicyDomainService escalationPolicyDomainService;

    public ReviewDeadlineApplicationService(IReviewTaskRepository reviewTaskRepository,
                                            EscalationPolicyDomainService escalationPolicyDomainService) {
        this.reviewTaskRepository = reviewTaskRepository;
        this.escalationPolicyDomainService = escalationPolicyDomainService;
    }

    public ReviewTaskEntity register(QueryEntity query, String expertId, LocalDateTime now) {
        LocalDateTime deadline = escalationPolicyDomainService.deadline(now, 0);
        ReviewTaskEntity task = ReviewTaskEntity.register(query.getId(), query.getConversationId(), expertId, now, deadline);
        task.setNextReminderAt(escalationPolicyDomainService.nextReminderAt(task));
        return reviewTaskRepository.save(task);
    }

    public boolean cancel(Long queryId) {
        boolean removed = reviewTaskRepository.deleteByQueryId(queryId);
        if (!removed) {
            log.debug("Review task already removed. queryId={}", queryId);
        }
        return removed;
    }

    public ReviewTaskEntity find(Long queryId) {
        return reviewTaskRepository.findByQueryId(queryId);
    }

    /**
     * 推进到下一级：新截止时间 = now + 该级窗口。已发送档位默认保留。
     */
    public ReviewTaskEntity advance(ReviewTaskEntity task, int level, String expertId, LocalDateTime now) {
        task.advance(level, expertId, now, escalationPolicyDomainService.deadline(now, level),
                escalationPolicyDomainService.resetRemindersOnEscalation());
        task.setNextReminderAt(escalationPolicyDomainService.nextReminderAt(task));
        return reviewTaskRepository.update(task);
    }

    public ReviewTaskEntity markReminderSent(ReviewTaskEntity task, List<Integer> tierPercents, LocalDateTime now) {
        tierPercents.forEach(percent -> task.markReminderSent(percent, now));
        task.setNextReminderAt(escalationPolicyDomainService.nextReminderAt(task));
        return reviewTaskRepository.update(task);
    }

    public List<ReviewTaskEntity> dueTasks(LocalDateTime now, int limit) {
        return reviewTaskRepository.findDueBefore(now, limit);
    }

    public List<ReviewTaskEntity> reminderDueTasks(LocalDateTime now, int limit) {
        return reviewTaskRepository.findReminderDueBefore(now, limit);
    }
}
