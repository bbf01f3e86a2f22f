package com.expertrelay.trigger.application.query;

import com.expertrelay.api.dto.ConversationStatusDTO;
import com.expertrelay.api.dto.QueryStatusDTO;
import com.expertrelay.domain.conversation.adapter.repository.IConversationRepository;
import com.expertrelay.domain.conversation.adapter.repository.IQueryRepository;
import com.expertrelay.domain.conversation.model.entity.ConversationEntity;
import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.domain.conversation.model.valobj.ConversationKey;
import com.expertrelay.domain.review.adapter.repository.IReviewTaskRepository;
import com.expertrelay.domain.review.model.entity.ReviewTaskEntity;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.exception.AppException;
import org.springframework.stereotype.Service;

/**
 * 会话状态只读查询。
 */
@Service
public class ConversationStatusQueryService {

    private final IConversationRepository conversationRepository;
    private final IQueryRepository queryRepository;
    private final IReviewTaskRepository reviewTaskRepository;

    public ConversationStatusQueryService(IConversationRepository conversationRepository,
                                          IQueryRepository queryRepository,
                                          IReviewTaskRepository reviewTaskRepository) {
        this.conversationRepository = conversationRepository;
        this.queryRepository = queryRepository;
        this.reviewTaskRepository = reviewTaskRepository;
    }

    public ConversationStatusDTO getConversationStatus(String channel, String userExternalId) {
        ConversationKey key;
        try {
            key = new ConversationKey(channel, userExternalId);
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, ex.getMessage());
        }
        ConversationEntity conversation = conversationRepository.findById(key.conversationId());
        if (conversation == null) {
            throw new AppException(ResponseCode.QUERY_NOT_FOUND, "Conversation not found: " + key.conversationId());
        }

        ConversationStatusDTO dto = new ConversationStatusDTO();
        dto.setConversationId(conversation.getId());
        dto.setChannel(conversation.getChannel());
        dto.setUserId(conversation.getUserExternalId());
        dto.setStatus(conversation.getStatus() == null ? null : conversation.getStatus().name());
        dto.setLocale(conversation.resolvedLocale());
        dto.setLastInboundAt(conversation.getLastInboundAt());
        dto.setLastOutboundAt(conversation.getLastOutboundAt());
        dto.setAssignedExpertId(conversation.getAssignedExpertId());
        dto.setEscalationLevel(conversation.getEscalationLevel());
        if (conversation.getPendingQueryId() != null) {
            QueryEntity query = queryRepository.findById(conversation.getPendingQueryId());
            if (query != null) {
                dto.setCurrentQuery(toQueryStatus(query));
            }
        }
        return dto;
    }

    private QueryStatusDTO toQueryStatus(QueryEntity query) {
        QueryStatusDTO dto = new QueryStatusDTO();
        dto.setQueryId(query.getId());
        dto.setStatus(query.getStatus() == null ? null : query.getStatus().getCode());
        dto.setReviewOutcome(query.getReviewOutcome() == null ? null : query.getReviewOutcome().getCode());
        dto.setEscalationLevel(query.getEscalationLevel());
        dto.setAssignedExpertId(query.getAssignedExpertId());
        dto.setDeliveryState(query.getDeliveryState() == null ? null : query.getDeliveryState().name());
        dto.setDeliveryMode(query.getDeliveryMode() == null ? null : query.getDeliveryMode().getCode());
        dto.setCloseReason(query.getCloseReason() == null ? null : query.getCloseReason().name());
        dto.setCreatedAt(query.getCreatedAt());
        if (query.isPendingReview()) {
            ReviewTaskEntity task = reviewTaskRepository.findByQueryId(query.getId());
            dto.setReviewDeadline(task == null ? null : task.getDeadline());
        }
        return dto;
    }
}
