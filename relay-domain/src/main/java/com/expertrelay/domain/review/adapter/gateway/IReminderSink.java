package com.expertrelay.domain.review.adapter.gateway;

import com.expertrelay.domain.review.model.valobj.ReviewNotice;

/**
 * 专家通知出口。实现必须是非阻塞的，失败只记录不抛出。
 */
public interface IReminderSink {

    void notify(String expertId, ReviewNotice notice);
}
