package com.expertrelay.domain.delivery.model.valobj;

import com.expertrelay.types.common.Constants;
import com.expertrelay.types.enums.ContentCategoryEnum;
import org.apache.commons.lang3.StringUtils;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 用户可见文案目录：类别 → 语言 → 文本，文本中可使用 {question} / {answer} 占位符。
 */
public class MessageCatalog {

    private static final Map<ContentCategoryEnum, String> BUILTIN = new EnumMap<>(ContentCategoryEnum.class);

    private static final String BUILTIN_WAITING =
            "We are still working on your previous question. Please wait for the answer before asking a new one.";

    static {
        BUILTIN.put(ContentCategoryEnum.VERIFIED_ANSWER, "{answer}");
        BUILTIN.put(ContentCategoryEnum.CORRECTED_ANSWER, "{answer}");
        BUILTIN.put(ContentCategoryEnum.REJECTED_ANSWER,
                "Our experts could not confirm an answer to your question \"{question}\". Please rephrase it or ask another question.");
        BUILTIN.put(ContentCategoryEnum.NO_ANSWER_APOLOGY,
                "Sorry, we could not find an answer to your question \"{question}\".");
        BUILTIN.put(ContentCategoryEnum.STILL_WORKING,
                "Our experts are still working on your question \"{question}\". We will get back to you soon.");
        BUILTIN.put(ContentCategoryEnum.USER_REMINDER,
                "Do you have any other questions? Just send us a message.");
    }

    private final Map<ContentCategoryEnum, Map<String, String>> messages;
    private final Map<String, String> waitingTexts;
    private final String defaultLocale;

    public MessageCatalog(Map<ContentCategoryEnum, Map<String, String>> messages,
                          Map<String, String> waitingTexts,
                          String defaultLocale) {
        this.messages = new EnumMap<>(ContentCategoryEnum.class);
        if (messages != null) {
            messages.forEach((category, texts) -> this.messages.put(category, normalizeKeys(texts)));
        }
        this.waitingTexts = normalizeKeys(waitingTexts);
        this.defaultLocale = normalize(StringUtils.defaultIfBlank(defaultLocale, Constants.DEFAULT_LOCALE));
    }

    public String text(ContentCategoryEnum category, String locale) {
        String text = lookup(messages.get(category), locale);
        return text != null ? text : BUILTIN.get(category);
    }

    /**
     * 会话已有未完成问题时回复给用户的文本。
     */
    public String waitingText(String locale) {
        String text = lookup(waitingTexts, locale);
        return text != null ? text : BUILTIN_WAITING;
    }

    public String render(String text, Map<String, String> variables) {
        String rendered = StringUtils.defaultString(text);
        if (variables == null) {
            return rendered;
        }
        for (Map.Entry<String, String> entry : variables.entrySet()) {
            rendered = rendered.replace("{" + entry.getKey() + "}", StringUtils.defaultString(entry.getValue()));
        }
        return rendered;
    }

    private String lookup(Map<String, String> texts, String locale) {
        if (texts == null || texts.isEmpty()) {
            return null;
        }
        String requested = normalize(locale);
        String text = texts.get(requested);
        if (text == null && requested.contains("-")) {
            text = texts.get(requested.substring(0, requested.indexOf('-')));
        }
        if (text == null) {
            text = texts.get(defaultLocale);
        }
        return text;
    }

    private static Map<String, String> normalizeKeys(Map<String, String> texts) {
        Map<String, String> normalized = new HashMap<>();
        if (texts != null) {
            texts.forEach((locale, text) -> {
                if (StringUtils.isNotBlank(text)) {
                    normalized.put(normalize(locale), text);
                }
            });
        }
        return normalized;
    }

    private static String normalize(String locale) {
        return StringUtils.defaultString(locale).trim().replace('_', '-').toLowerCase(Locale.ROOT);
    }
}
