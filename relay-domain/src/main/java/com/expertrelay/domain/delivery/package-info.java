/**
 * Delivery 领域 - 下发方式选择
 *
 * <p>职责：在渠道自由消息窗口规则下，为一次下发选择自由文本或最接近的预审模板，
 * 并渲染成渠道适配器可直接发送的载荷。</p>
 *
 * <h3>规则</h3>
 * <ul>
 *   <li>窗口开启：自由文本</li>
 *   <li>窗口关闭：同类别同语言模板，其次同类别默认语言模板，最后通用模板</li>
 *   <li>只填充模板白名单中的变量，且逐个截断到最大长度</li>
 * </ul>
 */
package com.expertrelay.domain.delivery;
