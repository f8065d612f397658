package com.mooncell.relay.core.model;

/**
 * 任务失败的终态原因，历史记录与进度汇总都以它为准
 */
public enum FailureReason {
    INVALID_REFERENCE,
    ACCESS_DENIED,
    NOT_FOUND,
    QUOTA_EXCEEDED,
    DELIVERY_FAILED,
    RETRIES_EXHAUSTED,
    UPSTREAM_ERROR,
    CANCELLED
}
