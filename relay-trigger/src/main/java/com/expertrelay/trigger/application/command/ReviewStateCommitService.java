package com.expertrelay.trigger.application.command;

import com.expertrelay.domain.conversation.adapter.repository.IConversationRepository;
import com.expertrelay.domain.conversation.adapter.repository.IQueryRepository;
import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.domain.feedback.adapter.repository.ICorrectionLedger;
import com.expertrelay.domain.feedback.model.valobj.CorrectionRecord;
import com.expertrelay.domain.review.model.entity.ReviewTaskEntity;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 审核状态落库：一次迁移涉及的多张表在同一事务内提交。
 * <p>
 * 每个方法只做写入，不做投递或通知；调用方在提交返回后再对外发消息。
 * 纠错记录最先写入；Query 的乐观锁更新先于审核任务与会话的写入，版本冲突时后续写入不会发生。
 * </p>
 */
@Service
public class ReviewStateCommitService {

    private final IConversationRepository conversationRepository;
    private final IQueryRepository queryRepository;
    private final ICorrectionLedger correctionLedger;
    private final ReviewDeadlineApplicationService reviewDeadlineApplicationService;

    public ReviewStateCommitService(IConversationRepository conversationRepository,
                                    IQueryRepository queryRepository,
                                    ICorrectionLedger correctionLedger,
                                    ReviewDeadlineApplicationService reviewDeadlineApplicationService) {
        this.conversationRepository = conversationRepository;
        this.queryRepository = queryRepository;
        this.correctionLedger = correctionLedger;
        this.reviewDeadlineApplicationService = reviewDeadlineApplicationService;
    }

    /**
     * 新建 Query、绑定为会话待处理问题并进入检索。
     */
    @Transactional(rollbackFor = Exception.class)
    public QueryEntity commitOpened(QueryEntity query, LocalDateTime now) {
        queryRepository.save(query);
        conversationRepository.bindPendingQuery(query.getConversationId(), query.getId(), null, 0, now);
        query.startRetrieval(now);
        return queryRepository.update(query);
    }

    /**
     * Query 落为 PENDING_REVIEW，同时登记审核任务与会话负责专家。
     */
    @Transactional(rollbackFor = Exception.class)
    public ReviewTaskEntity commitReviewRequest(QueryEntity query, String expertId, LocalDateTime now) {
        queryRepository.update(query);
        ReviewTaskEntity task = reviewDeadlineApplicationService.register(query, expertId, now);
        conversationRepository.updateReviewAssignment(query.getConversationId(), expertId, 0, now);
        return task;
    }

    /**
     * 检索阶段直接关闭：Query 落库并清理可能残留的审核任务。
     */
    @Transactional(rollbackFor = Exception.class)
    public QueryEntity commitClosedBeforeReview(QueryEntity query) {
        queryRepository.update(query);
        reviewDeadlineApplicationService.cancel(query.getId());
        return query;
    }

    /**
     * 专家审核结果：纠错记录、Query 终态与任务删除同时生效。
     */
    @Transactional(rollbackFor = Exception.class)
    public QueryEntity commitDecision(QueryEntity query, CorrectionRecord record) {
        if (record != null) {
            correctionLedger.append(record);
        }
        queryRepository.update(query);
        reviewDeadlineApplicationService.cancel(query.getId());
        return query;
    }

    @Transactional(rollbackFor = Exception.class)
    public ReviewTaskEntity commitEscalation(QueryEntity query, ReviewTaskEntity task, LocalDateTime now) {
        int level = query.normalizedEscalationLevel();
        queryRepository.update(query);
        ReviewTaskEntity advanced = reviewDeadlineApplicationService.advance(task, level, query.getAssignedExpertId(), now);
        conversationRepository.updateReviewAssignment(query.getConversationId(), query.getAssignedExpertId(), level, now);
        return advanced;
    }

    @Transactional(rollbackFor = Exception.class)
    public QueryEntity commitExpiry(QueryEntity query) {
        queryRepository.update(query);
        reviewDeadlineApplicationService.cancel(query.getId());
        return query;
    }
}
