package com.expertrelay.config;

import com.expertrelay.types.common.Constants;
import com.expertrelay.types.enums.ContentCategoryEnum;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 编排核心配置，前缀 relay。
 * <p>
 * 线程池、超时与调度节奏等运行参数通过 {@code @Value} 直接注入各组件，这里只保存需要组装成领域对象的结构化配置。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "relay")
public class OrchestrationProperties {

    private Review review = new Review();

    private Delivery delivery = new Delivery();

    private Composer composer = new Composer();

    private Retrieval retrieval = new Retrieval();

    /** 类别 → 语言 → 用户可见文本，可使用 {question} / {answer}。 */
    private Map<ContentCategoryEnum, Map<String, String>> messages = new EnumMap<>(ContentCategoryEnum.class);

    /** 会话已有未完成问题时的等待提示，语言 → 文本。 */
    private Map<String, String> waitingTexts = new HashMap<>();

    @Data
    public static class Review {

        /** 初始审核时限。 */
        private Duration sla = Duration.ofMinutes(10);

        /** 每升一级时限倍数。 */
        private double backoffFactor = 2.0D;

        /** 最高升级级别，超过后过期。 */
        private int maxLevel = 2;

        /** 提醒档位（当前窗口百分比）。 */
        private List<Integer> reminderTiers = new ArrayList<>(Arrays.asList(50, 90));

        /** 各级专家池，级别 0 起。 */
        private List<List<String>> tierExperts = new ArrayList<>();

        /** 是否接受已被升级替换的专家提交的审核动作。 */
        private boolean acceptSupersededDecisions = false;

        /** 升级后是否在新窗口内重新发送提醒档位。 */
        private boolean resetRemindersOnEscalation = false;
    }

    @Data
    public static class Delivery {

        private String defaultLocale = Constants.DEFAULT_LOCALE;

        /** 模板单个变量的最大长度，超出截断。 */
        private int maxSlotLength = 1024;

        private List<Template> templates = new ArrayList<>();

        private Template genericTemplate = new Template();
    }

    @Data
    public static class Template {

        private String name;

        private ContentCategoryEnum category;

        private String language = Constants.DEFAULT_LOCALE;

        private List<String> slots = new ArrayList<>();
    }

    @Data
    public static class Composer {

        /** 草稿答案最大长度。 */
        private int maxAnswerLength = 1000;
    }

    @Data
    public static class Retrieval {

        private int topK = 3;

        private double minScore = 0.0D;

        private long sourceTimeoutMs = 3000L;

        private List<Source> sources = new ArrayList<>();
    }

    @Data
    public static class Source {

        /** 知识源名，作为候选 sourceId 前缀。 */
        private String name;

        /** VectorStore bean 名。 */
        private String vectorStoreBean = "vectorStore";

        private double weight = 1.0D;
    }
}
