package com.mooncell.relay.core.session;

import com.mooncell.relay.config.RelayProperties;
import com.mooncell.relay.core.model.Capability;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 管理上游会话：一个通用会话 + 按用户划分的特权会话。
 * acquire 只做查询不做等待，要么立即返回可用 handle，要么抛出带类型的 {@link CapabilityException}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientPool {

    private final SessionConnector connector;
    private final SessionStore sessionStore;
    private final RelayProperties properties;

    // requester -> 特权会话
    private final Map<String, ClientHandle> privileged = new ConcurrentHashMap<>();
    private final Sinks.Many<ConnectivityEvent> events = Sinks.many().multicast().directBestEffort();

    private volatile ClientHandle general;

    @PostConstruct
    public void init() {
        general = new ClientHandle(HandleKind.GENERAL, properties.getSession().getGeneralIdentity(), null);
        connect(general);

        List<StoredSession> sessions = sessionStore.findAll();
        log.info("Loading {} stored privileged sessions", sessions.size());
        for (StoredSession session : sessions) {
            install(session.getRequester(), session.getCredential());
        }
    }

    public ClientHandle acquire(Capability capability, String requester) {
        ClientHandle handle;
        if (capability == Capability.PRIVILEGED) {
            handle = privileged.get(requester);
            if (handle == null) {
                throw CapabilityException.noPrivilegedSession(requester);
            }
        } else {
            handle = general;
            if (handle == null) {
                throw new CapabilityException(CapabilityException.Reason.UNAVAILABLE, capability, "General session not initialized");
            }
        }
        if (!handle.isReady()) {
            throw CapabilityException.unavailable(handle);
        }
        handle.lease();
        return handle;
    }

    public void release(ClientHandle handle) {
        if (handle != null) {
            handle.unlease();
        }
    }

    /**
     * 协议层致命错误：标记降级，acquire 不再返回它，等待 ReconnectManager 重连
     */
    public void markDegraded(ClientHandle handle, String reason) {
        handle.recordFailure(reason);
        ConnectivityState previous = handle.transition(ConnectivityState.DEGRADED);
        if (previous != ConnectivityState.DEGRADED) {
            log.warn("Session {} degraded: {}", handle, reason);
            publish(handle, previous, ConnectivityState.DEGRADED, reason);
        }
    }

    public boolean hasPrivilegedSession(String requester) {
        return privileged.containsKey(requester);
    }

    /**
     * 用户提交新的会话凭证：持久化并替换旧会话
     */
    public ClientHandle register(String requester, String credential) {
        sessionStore.save(requester, credential);
        return install(requester, credential);
    }

    public void unregister(String requester) {
        sessionStore.delete(requester);
        ClientHandle removed = privileged.remove(requester);
        if (removed != null) {
            disconnect(removed, "unregistered");
        }
    }

    public void reconnect(ClientHandle handle) {
        if (handle.getKind() == HandleKind.PRIVILEGED && privileged.get(handle.getIdentity()) != handle) {
            // 已被替换或移除
            return;
        }
        connect(handle);
    }

    public List<ClientHandle> snapshot() {
        List<ClientHandle> all = new ArrayList<>();
        if (general != null) {
            all.add(general);
        }
        all.addAll(privileged.values());
        return all;
    }

    public Flux<ConnectivityEvent> events() {
        return events.asFlux();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Disconnecting {} sessions", snapshot().size());
        for (ClientHandle handle : snapshot()) {
            disconnect(handle, "shutdown");
        }
        synchronized (events) {
            events.tryEmitComplete();
        }
    }

    private ClientHandle install(String requester, String credential) {
        ClientHandle handle = new ClientHandle(HandleKind.PRIVILEGED, requester, credential);
        ClientHandle previous = privileged.put(requester, handle);
        if (previous != null) {
            disconnect(previous, "replaced");
        }
        log.info("Installed privileged session for {} (credential {})", requester, handle.maskedCredential());
        connect(handle);
        return handle;
    }

    private void connect(ClientHandle handle) {
        ConnectivityState before = handle.getState();
        if (!handle.beginConnecting()) {
            return;
        }
        publish(handle, before, ConnectivityState.CONNECTING, null);

        connector.connect(handle)
                .timeout(properties.getSession().getConnectTimeout())
                .subscribe(
                        ignored -> { },
                        error -> onConnectFailed(handle, error),
                        () -> {
                            handle.recordSuccess();
                            ConnectivityState previous = handle.transition(ConnectivityState.READY);
                            log.info("Session {} ready", handle);
                            publish(handle, previous, ConnectivityState.READY, null);
                        });
    }

    private void onConnectFailed(ClientHandle handle, Throwable error) {
        if (error instanceof SessionInvalidException && handle.getKind() == HandleKind.PRIVILEGED) {
            // 凭证失效：清理存储，后续请求直接得到 NO_PRIVILEGED_SESSION
            log.warn("Session for {} is invalid, removing it: {}", handle.getIdentity(), error.getMessage());
            if (privileged.remove(handle.getIdentity(), handle)) {
                sessionStore.delete(handle.getIdentity());
            }
            ConnectivityState previous = handle.transition(ConnectivityState.DISCONNECTED);
            publish(handle, previous, ConnectivityState.DISCONNECTED, error.getMessage());
            return;
        }
        handle.recordFailure(error.getMessage());
        ConnectivityState previous = handle.transition(ConnectivityState.DEGRADED);
        log.error("Session {} connect failed: {}", handle, error.getMessage());
        publish(handle, previous, ConnectivityState.DEGRADED, error.getMessage());
    }

    private void disconnect(ClientHandle handle, String reason) {
        ConnectivityState previous = handle.transition(ConnectivityState.DISCONNECTED);
        publish(handle, previous, ConnectivityState.DISCONNECTED, reason);
        connector.disconnect(handle)
                .subscribe(
                        ignored -> { },
                        error -> log.warn("Session {} disconnect error: {}", handle, error.getMessage()));
    }

    private void publish(ClientHandle handle, ConnectivityState from, ConnectivityState to, String reason) {
        ConnectivityEvent event = new ConnectivityEvent(handle.getId(), handle.getKind(), handle.getIdentity(),
                from, to, reason, Instant.now());
        // Sinks 不允许并发 emit
        synchronized (events) {
            events.tryEmitNext(event);
        }
    }
}
