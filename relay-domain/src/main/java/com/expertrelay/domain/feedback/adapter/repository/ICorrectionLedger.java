package com.expertrelay.domain.feedback.adapter.repository;

import com.expertrelay.domain.feedback.model.valobj.CorrectionRecord;

import java.util.List;

/**
 * 纠错账本：只追加，按 ID 游标读取。
 */
public interface ICorrectionLedger {

    /**
     * 追加记录，回填 ID
     */
    CorrectionRecord append(CorrectionRecord record);

    /**
     * 读取 ID 大于 afterId 的记录，按 ID 升序
     */
    List<CorrectionRecord> findAfter(long afterId, int limit);
}
