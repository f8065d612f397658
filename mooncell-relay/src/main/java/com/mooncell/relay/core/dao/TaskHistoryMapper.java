package com.mooncell.relay.core.dao;

import com.mooncell.relay.core.model.TaskRecord;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface TaskHistoryMapper {

    @Insert("""
        INSERT INTO relay_task_history (task_id, job_id, ref_index, requester, link, state, failure_reason, detail, byte_size, finished_at)
        VALUES (#{taskId}, #{jobId}, #{refIndex}, #{requester}, #{link}, #{state}, #{failureReason}, #{detail}, #{byteSize}, #{finishedAt})
    """)
    void insert(TaskRecord record);

    @Select("SELECT * FROM relay_task_history WHERE job_id = #{jobId} ORDER BY ref_index, finished_at")
    List<TaskRecord> findByJobId(String jobId);

    @Select("SELECT * FROM relay_task_history WHERE requester = #{requester} ORDER BY finished_at DESC LIMIT #{limit}")
    List<TaskRecord> findRecent(@Param("requester") String requester, @Param("limit") int limit);
}
