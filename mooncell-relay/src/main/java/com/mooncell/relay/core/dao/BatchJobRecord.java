package com.mooncell.relay.core.dao;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 对应 relay_batch_job 表，引用列表以 JSON 保存
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchJobRecord {
    private String id;
    private String owner;
    private String referencesJson;
    private Integer nextIndex;
    private Integer succeeded;
    private Integer failed;
    private String state;
    private Instant createdAt;
    private Instant updatedAt;
}
