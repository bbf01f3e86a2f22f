package com.expertrelay.domain.delivery.model.valobj;

import com.expertrelay.types.common.Constants;
import com.expertrelay.types.enums.ContentCategoryEnum;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 模板目录：按类别与语言查找最接近的模板。
 */
public class TemplateCatalog {

    private final List<MessageTemplate> templates;
    private final MessageTemplate genericTemplate;
    private final String defaultLocale;

    public TemplateCatalog(List<MessageTemplate> templates, MessageTemplate genericTemplate, String defaultLocale) {
        if (genericTemplate == null) {
            throw new IllegalArgumentException("generic template is required");
        }
        this.templates = templates == null ? List.of() : List.copyOf(templates);
        this.genericTemplate = genericTemplate;
        this.defaultLocale = StringUtils.defaultIfBlank(defaultLocale, Constants.DEFAULT_LOCALE);
    }

    /**
     * 查找顺序：同类别精确语言 → 同类别主语言（pt-BR → pt）→ 同类别默认语言。
     */
    public Optional<MessageTemplate> findNearest(ContentCategoryEnum category, String locale) {
        if (category == null) {
            return Optional.empty();
        }
        String requested = normalize(locale);
        Optional<MessageTemplate> exact = find(category, requested);
        if (exact.isPresent()) {
            return exact;
        }
        String primary = primaryLanguage(requested);
        if (!primary.equals(requested)) {
            Optional<MessageTemplate> primaryMatch = find(category, primary);
            if (primaryMatch.isPresent()) {
                return primaryMatch;
            }
        }
        return find(category, normalize(defaultLocale));
    }

    public MessageTemplate genericTemplate() {
        return genericTemplate;
    }

    public List<MessageTemplate> templates() {
        return templates;
    }

    private Optional<MessageTemplate> find(ContentCategoryEnum category, String language) {
        return templates.stream()
                .filter(template -> template.category() == category)
                .filter(template -> normalize(template.language()).equals(language))
                .findFirst();
    }

    private static String normalize(String locale) {
        return StringUtils.defaultString(locale).trim().replace('_', '-').toLowerCase(Locale.ROOT);
    }

    private static String primaryLanguage(String locale) {
        int index = locale.indexOf('-');
        return index > 0 ? locale.substring(0, index) : locale;
    }
}
