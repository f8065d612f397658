package com.mooncell.relay.core.dao;

import com.mooncell.relay.core.traffic.TrafficLimits;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;

@Mapper
public interface TrafficMapper {

    @Insert("INSERT INTO relay_traffic_usage (user_id, byte_size, recorded_at) VALUES (#{userId}, #{byteSize}, #{recordedAt})")
    void insert(@Param("userId") String userId, @Param("byteSize") long byteSize, @Param("recordedAt") Instant recordedAt);

    @Select("SELECT COALESCE(SUM(byte_size), 0) FROM relay_traffic_usage WHERE user_id = #{userId} AND recorded_at >= #{since}")
    long sumSince(@Param("userId") String userId, @Param("since") Instant since);

    @Select("SELECT COALESCE(SUM(byte_size), 0) FROM relay_traffic_usage WHERE user_id = #{userId}")
    long sumTotal(@Param("userId") String userId);

    // 所有用户合计
    @Select("SELECT COALESCE(SUM(byte_size), 0) FROM relay_traffic_usage WHERE recorded_at >= #{since}")
    long sumAllSince(@Param("since") Instant since);

    @Select("SELECT COALESCE(SUM(byte_size), 0) FROM relay_traffic_usage")
    long sumAll();

    @Delete("DELETE FROM relay_traffic_usage WHERE recorded_at >= #{since}")
    int deleteSince(@Param("since") Instant since);

    @Delete("DELETE FROM relay_traffic_usage")
    int deleteAll();

    @Select("SELECT enabled, per_file_limit, daily_limit, monthly_limit FROM relay_traffic_limits WHERE id = 1")
    TrafficLimits findLimits();

    @Insert("""
        MERGE INTO relay_traffic_limits (id, enabled, per_file_limit, daily_limit, monthly_limit, updated_at) KEY (id)
        VALUES (1, #{limits.enabled}, #{limits.perFileLimit}, #{limits.dailyLimit}, #{limits.monthlyLimit}, #{updatedAt})
    """)
    void saveLimits(@Param("limits") TrafficLimits limits, @Param("updatedAt") Instant updatedAt);
}
