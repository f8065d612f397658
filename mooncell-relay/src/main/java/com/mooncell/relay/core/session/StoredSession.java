package com.mooncell.relay.core.session;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 对应 relay_session 表
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StoredSession {
    private String requester;
    private String credential;
    private Instant updatedAt;
}
