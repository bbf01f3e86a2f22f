package com.expertrelay.config;

import com.expertrelay.domain.delivery.model.valobj.MessageCatalog;
import com.expertrelay.domain.delivery.model.valobj.MessageTemplate;
import com.expertrelay.domain.delivery.model.valobj.TemplateCatalog;
import com.expertrelay.domain.delivery.service.DeliverySelectorDomainService;
import com.expertrelay.domain.knowledge.model.valobj.RetrievalOptions;
import com.expertrelay.domain.knowledge.service.AnswerComposerDomainService;
import com.expertrelay.domain.review.model.valobj.EscalationPolicy;
import com.expertrelay.domain.review.service.EscalationPolicyDomainService;
import com.expertrelay.infrastructure.knowledge.FanOutKnowledgeRetriever;
import com.expertrelay.infrastructure.knowledge.KnowledgeSource;
import com.expertrelay.infrastructure.knowledge.VectorStoreKnowledgeSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.BeanNotOfRequiredTypeException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * 编排核心装配：把 relay.* 配置组装为领域服务与网关。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(OrchestrationProperties.class)
public class OrchestrationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public EscalationPolicyDomainService escalationPolicyDomainService(OrchestrationProperties properties) {
        OrchestrationProperties.Review review = properties.getReview();
        EscalationPolicy policy = new EscalationPolicy(review.getSla(),
                review.getBackoffFactor(),
                review.getMaxLevel(),
                review.getReminderTiers(),
                review.getTierExperts(),
                review.isAcceptSupersededDecisions(),
                review.isResetRemindersOnEscalation());
        log.info("Escalation policy loaded. sla={}, backoffFactor={}, maxLevel={}, reminderTiers={}, tiers={}, resetRemindersOnEscalation={}",
                policy.reviewSla(), policy.backoffFactor(), policy.maxLevel(),
                policy.reminderTierPercents(), policy.tierExperts().size(), policy.resetRemindersOnEscalation());
        return new EscalationPolicyDomainService(policy);
    }

    @Bean
    public TemplateCatalog templateCatalog(OrchestrationProperties properties) {
        OrchestrationProperties.Delivery delivery = properties.getDelivery();
        List<MessageTemplate> templates = delivery.getTemplates().stream()
                .map(this::toTemplate)
                .collect(Collectors.toList());
        return new TemplateCatalog(templates, toTemplate(delivery.getGenericTemplate()), delivery.getDefaultLocale());
    }

    @Bean
    public MessageCatalog messageCatalog(OrchestrationProperties properties) {
        return new MessageCatalog(properties.getMessages(),
                properties.getWaitingTexts(),
                properties.getDelivery().getDefaultLocale());
    }

    @Bean
    public DeliverySelectorDomainService deliverySelectorDomainService(TemplateCatalog templateCatalog,
                                                                       OrchestrationProperties properties) {
        return new DeliverySelectorDomainService(templateCatalog, properties.getDelivery().getMaxSlotLength());
    }

    @Bean
    public AnswerComposerDomainService answerComposerDomainService(MessageCatalog messageCatalog,
                                                                   OrchestrationProperties properties) {
        return new AnswerComposerDomainService(messageCatalog, properties.getComposer().getMaxAnswerLength());
    }

    @Bean
    public RetrievalOptions retrievalOptions(OrchestrationProperties properties) {
        OrchestrationProperties.Retrieval retrieval = properties.getRetrieval();
        return new RetrievalOptions(retrieval.getTopK(),
                retrieval.getMinScore(),
                properties.getDelivery().getDefaultLocale());
    }

    /**
     * 按配置从容器中解析 VectorStore；找不到的知识源只告警跳过，全部缺失时检索统一走无答案兜底。
     */
    @Bean
    public FanOutKnowledgeRetriever fanOutKnowledgeRetriever(OrchestrationProperties properties,
                                                             ListableBeanFactory beanFactory,
                                                             @Qualifier("knowledgeSourceWorker") ExecutorService knowledgeSourceWorker) {
        OrchestrationProperties.Retrieval retrieval = properties.getRetrieval();
        List<KnowledgeSource> sources = new ArrayList<>();
        for (OrchestrationProperties.Source source : retrieval.getSources()) {
            VectorStore vectorStore = resolveVectorStore(beanFactory, source.getVectorStoreBean());
            if (vectorStore == null) {
                continue;
            }
            String name = StringUtils.defaultIfBlank(source.getName(), source.getVectorStoreBean());
            sources.add(new VectorStoreKnowledgeSource(name, vectorStore, source.getWeight()));
        }
        FanOutKnowledgeRetriever retriever =
                new FanOutKnowledgeRetriever(sources, knowledgeSourceWorker, retrieval.getSourceTimeoutMs());
        log.info("Knowledge retriever ready. sources={}", retriever.sourceNames());
        return retriever;
    }

    @Bean(name = "channelBridgeRestTemplate")
    public RestTemplate channelBridgeRestTemplate(RestTemplateBuilder builder,
                                                  @Value("${relay.channel.connect-timeout:2s}") Duration connectTimeout,
                                                  @Value("${relay.channel.read-timeout:5s}") Duration readTimeout) {
        return builder
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .build();
    }

    private VectorStore resolveVectorStore(ListableBeanFactory beanFactory, String beanName) {
        if (StringUtils.isBlank(beanName)) {
            return null;
        }
        try {
            return beanFactory.getBean(beanName, VectorStore.class);
        } catch (NoSuchBeanDefinitionException | BeanNotOfRequiredTypeException ex) {
            log.warn("VectorStore bean '{}' not found; knowledge source skipped", beanName);
            return null;
        }
    }

    private MessageTemplate toTemplate(OrchestrationProperties.Template template) {
        return new MessageTemplate(template.getName(), template.getCategory(), template.getLanguage(), template.getSlots());
    }
}
