package com.expertrelay.infrastructure.dao;

import com.expertrelay.infrastructure.dao.po.CorrectionRecordPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 纠错记录 DAO
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Mapper
public interface CorrectionRecordDao {

    /**
     * 追加记录，回填主键
     */
    int insert(CorrectionRecordPO po);

    /**
     * 按 ID 游标读取
     */
    List<CorrectionRecordPO> selectAfter(@Param("afterId") Long afterId,
                                         @Param("limit") Integer limit);
}
