package com.mooncell.relay.api;

import com.mooncell.relay.core.session.ClientHandle;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SessionView {
    private String id;
    private String kind;
    private String identity;
    private String state;
    private String credential; // 脱敏
    private int failureCount;
    private int leases;
    private String lastFailureReason;

    public static SessionView from(ClientHandle handle) {
        return SessionView.builder()
                .id(handle.getId())
                .kind(handle.getKind().name())
                .identity(handle.getIdentity())
                .state(handle.getState().name())
                .credential(handle.getCredential() == null ? null : handle.maskedCredential())
                .failureCount(handle.getFailureCount().get())
                .leases(handle.getLeases().get())
                .lastFailureReason(handle.getLastFailureReason())
                .build();
    }
}
