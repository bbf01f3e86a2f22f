package com.expertrelay.domain.knowledge.service;

import com.expertrelay.domain.conversation.model.entity.ConversationEntity;
import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.domain.delivery.model.valobj.DeliveryContent;
import com.expertrelay.domain.delivery.model.valobj.MessageCatalog;
import com.expertrelay.domain.knowledge.model.valobj.DraftAnswer;
import com.expertrelay.domain.knowledge.model.valobj.RetrievedCandidate;
import com.expertrelay.types.common.Constants;
import com.expertrelay.types.enums.ContentCategoryEnum;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 答案组装领域服务：生成草稿答案、专家审核包与面向用户的下发内容。
 */
public class AnswerComposerDomainService {

    private final MessageCatalog messageCatalog;
    private final int maxAnswerLength;

    public AnswerComposerDomainService(MessageCatalog messageCatalog, int maxAnswerLength) {
        if (maxAnswerLength <= 0) {
            throw new IllegalArgumentException("maxAnswerLength must be positive");
        }
        this.messageCatalog = messageCatalog;
        this.maxAnswerLength = maxAnswerLength;
    }

    /**
     * 取相关度最高的候选作为草稿。候选列表须已排序且非空。
     */
    public DraftAnswer composeDraft(String question, List<RetrievedCandidate> ranked) {
        if (ranked == null || ranked.isEmpty()) {
            throw new IllegalArgumentException("ranked candidates cannot be empty");
        }
        RetrievedCandidate top = ranked.get(0);
        String text = StringUtils.abbreviate(StringUtils.trimToEmpty(top.getContent()), maxAnswerLength);
        return new DraftAnswer(top, text, buildReviewPacket(question, text, ranked));
    }

    public DeliveryContent composeDelivery(ConversationEntity conversation, QueryEntity query, ContentCategoryEnum category) {
        String locale = StringUtils.defaultIfBlank(query == null ? null : query.getLocale(), conversation.resolvedLocale());
        Map<String, String> variables = new LinkedHashMap<>();
        if (query != null) {
            variables.put(Constants.SLOT_QUESTION, StringUtils.defaultString(query.getNormalizedText()));
            variables.put(Constants.SLOT_ANSWER, StringUtils.defaultString(query.getFinalAnswer()));
        }
        String text = messageCatalog.render(messageCatalog.text(category, locale), variables);
        variables.put(Constants.SLOT_MESSAGE, text);
        return new DeliveryContent(category, locale, text, variables);
    }

    public String waitingText(String locale) {
        return messageCatalog.waitingText(locale);
    }

    private String buildReviewPacket(String question, String draft, List<RetrievedCandidate> ranked) {
        StringBuilder packet = new StringBuilder();
        packet.append("Q: ").append(StringUtils.defaultString(question)).append('\n');
        packet.append("A: ").append(draft).append('\n');
        packet.append("Sources:");
        for (RetrievedCandidate candidate : ranked) {
            packet.append("\n- ")
                    .append(StringUtils.defaultIfBlank(candidate.getSourceId(), "unknown"))
                    .append(" (")
                    .append(String.format(Locale.ROOT, "%.3f", candidate.scoreOrZero()))
                    .append(')');
        }
        return packet.toString();
    }
}
