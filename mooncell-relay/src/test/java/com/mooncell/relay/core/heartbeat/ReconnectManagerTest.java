package com.mooncell.relay.core.heartbeat;

import com.mooncell.relay.config.RelayProperties;
import com.mooncell.relay.core.session.ClientHandle;
import com.mooncell.relay.core.session.ClientPool;
import com.mooncell.relay.core.session.HandleKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReconnectManagerTest {

    @Test
    void disconnectedHandlesAreReconnected() {
        ClientPool pool = mock(ClientPool.class);
        ClientHandle handle = new ClientHandle(HandleKind.PRIVILEGED, "alice", "credential");
        when(pool.snapshot()).thenReturn(List.of(handle));

        new ReconnectManager(pool, new RelayProperties()).checkSessions();

        verify(pool).reconnect(handle);
    }
}
