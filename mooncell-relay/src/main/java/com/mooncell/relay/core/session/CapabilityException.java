package com.mooncell.relay.core.session;

import com.mooncell.relay.core.model.Capability;
import lombok.Getter;

@Getter
public class CapabilityException extends RuntimeException {

    public enum Reason {
        NO_PRIVILEGED_SESSION,
        UNAVAILABLE
    }

    private final Reason reason;
    private final Capability capability;

    public CapabilityException(Reason reason, Capability capability, String message) {
        super(message);
        this.reason = reason;
        this.capability = capability;
    }

    public static CapabilityException noPrivilegedSession(String requester) {
        return new CapabilityException(Reason.NO_PRIVILEGED_SESSION, Capability.PRIVILEGED,
                "No privileged session registered for " + requester);
    }

    public static CapabilityException unavailable(ClientHandle handle) {
        return new CapabilityException(Reason.UNAVAILABLE,
                handle.getKind() == HandleKind.PRIVILEGED ? Capability.PRIVILEGED : Capability.GENERAL,
                "Session " + handle + " is not ready");
    }
}
