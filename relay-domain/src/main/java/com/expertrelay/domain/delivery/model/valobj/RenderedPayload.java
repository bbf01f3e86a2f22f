package com.expertrelay.domain.delivery.model.valobj;

import com.expertrelay.types.enums.ContentCategoryEnum;
import com.expertrelay.types.enums.DeliveryModeEnum;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 渠道无关的规范化下发载荷，由渠道适配器转换为具体协议格式。
 */
@Data
@Builder
public class RenderedPayload {

    private DeliveryModeEnum mode;

    private ContentCategoryEnum category;

    /** 接收方（会话 ID） */
    private String recipient;

    /** 自由文本，仅 FREE_FORM 有值 */
    private String text;

    private String templateName;

    private String templateLanguage;

    /** 模板变量，按模板参数顺序 */
    private Map<String, String> variables;

    /** 是否因缺少类别模板而退化为通用模板 */
    private boolean genericFallback;
}
