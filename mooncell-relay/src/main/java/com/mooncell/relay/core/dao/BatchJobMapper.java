package com.mooncell.relay.core.dao;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

@Mapper
public interface BatchJobMapper {

    @Insert("""
        INSERT INTO relay_batch_job (id, owner, references_json, next_index, succeeded, failed, state, created_at, updated_at)
        VALUES (#{id}, #{owner}, #{referencesJson}, #{nextIndex}, #{succeeded}, #{failed}, #{state}, #{createdAt}, #{updatedAt})
    """)
    void insert(BatchJobRecord record);

    // 条件更新：游标只进不退，过期的 checkpoint 不会覆盖新的
    @Update("""
        UPDATE relay_batch_job
        SET next_index = #{nextIndex}, succeeded = #{succeeded}, failed = #{failed}, state = #{state}, updated_at = #{updatedAt}
        WHERE id = #{id} AND next_index <= #{nextIndex}
    """)
    int updateCheckpoint(BatchJobRecord record);

    @Select("SELECT * FROM relay_batch_job WHERE id = #{id}")
    BatchJobRecord findById(String id);

    @Select("SELECT * FROM relay_batch_job WHERE state IN ('ACTIVE', 'CANCELLING') ORDER BY created_at")
    List<BatchJobRecord> findUnfinished();
}
