package com.mooncell.relay.core.dao;

import com.mooncell.relay.core.session.StoredSession;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;
import java.util.List;

@Mapper
public interface SessionMapper {

    @Select("SELECT * FROM relay_session")
    List<StoredSession> findAll();

    @Insert("""
        MERGE INTO relay_session (requester, credential, updated_at) KEY (requester)
        VALUES (#{requester}, #{credential}, #{updatedAt})
    """)
    void upsert(@Param("requester") String requester, @Param("credential") String credential, @Param("updatedAt") Instant updatedAt);

    @Delete("DELETE FROM relay_session WHERE requester = #{requester}")
    int delete(String requester);
}
