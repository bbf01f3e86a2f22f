package com.expertrelay.infrastructure.repository.feedback;

import com.expertrelay.domain.feedback.adapter.repository.ICorrectionLedger;
import com.expertrelay.domain.feedback.model.valobj.CorrectionRecord;
import com.expertrelay.infrastructure.dao.CorrectionRecordDao;
import com.expertrelay.infrastructure.dao.po.CorrectionRecordPO;
import com.expertrelay.infrastructure.repository.support.StoreAccess;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 纠错账本实现类：只追加，不提供更新与删除。
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Repository
public class CorrectionLedgerRepositoryImpl implements ICorrectionLedger {

    private final CorrectionRecordDao correctionRecordDao;

    public CorrectionLedgerRepositoryImpl(CorrectionRecordDao correctionRecordDao) {
        this.correctionRecordDao = correctionRecordDao;
    }

    @Override
    public CorrectionRecord append(CorrectionRecord record) {
        CorrectionRecordPO po = CorrectionRecordPO.builder()
                .queryId(record.getQueryId())
                .originalQueryText(record.getOriginalQueryText())
                .originalCandidate(record.getOriginalCandidate())
                .originalSourceId(record.getOriginalSourceId())
                .expertFinalText(record.getExpertFinalText())
                .expertId(record.getExpertId())
                .outcome(record.getOutcome())
                .recordedAt(record.getRecordedAt())
                .build();
        StoreAccess.call("correction.insert", () -> correctionRecordDao.insert(po));
        record.setId(po.getId());
        return record;
    }

    @Override
    public List<CorrectionRecord> findAfter(long afterId, int limit) {
        return StoreAccess.call("correction.selectAfter", () -> correctionRecordDao.selectAfter(afterId, limit))
                .stream()
                .map(po -> CorrectionRecord.builder()
                        .id(po.getId())
                        .queryId(po.getQueryId())
                        .originalQueryText(po.getOriginalQueryText())
                        .originalCandidate(po.getOriginalCandidate())
                        .originalSourceId(po.getOriginalSourceId())
                        .expertFinalText(po.getExpertFinalText())
                        .expertId(po.getExpertId())
                        .outcome(po.getOutcome())
                        .recordedAt(po.getRecordedAt())
                        .build())
                .collect(Collectors.toList());
    }
}
