package com.mooncell.relay.core.heartbeat;

import com.mooncell.relay.config.RelayProperties;
import com.mooncell.relay.core.session.ClientHandle;
import com.mooncell.relay.core.session.ClientPool;
import com.mooncell.relay.core.session.ConnectivityState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReconnectManager {

    private final ClientPool clientPool;
    private final RelayProperties properties;

    // 定期探测：降级或断开的会话尝试重连
    @Scheduled(fixedDelayString = "${relay.session.reconnect-interval:PT30S}")
    public void checkSessions() {
        for (ClientHandle handle : clientPool.snapshot()) {
            ConnectivityState state = handle.getState();
            if (state != ConnectivityState.DEGRADED && state != ConnectivityState.DISCONNECTED) {
                continue;
            }
            int failures = handle.getFailureCount().get();
            if (failures >= properties.getSession().getMaxReconnectFailures()) {
                log.warn("Session {} failed {} times (last: {}), still retrying", handle, failures, handle.getLastFailureReason());
            }
            log.info("Reconnecting session {}", handle);
            clientPool.reconnect(handle);
        }
    }
}
