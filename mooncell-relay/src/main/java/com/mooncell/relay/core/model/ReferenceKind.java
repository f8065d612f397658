package com.mooncell.relay.core.model;

public enum ReferenceKind {
    // t.me/<username>/<id>
    PUBLIC_CHANNEL(Capability.GENERAL),
    // t.me/c/<internalId>/<id>
    PRIVATE_CHANNEL(Capability.PRIVILEGED),
    // t.me/b/<name>/<id>
    PRIVATE_BY_NAME(Capability.PRIVILEGED);

    private final Capability requiredCapability;

    ReferenceKind(Capability requiredCapability) {
        this.requiredCapability = requiredCapability;
    }

    public Capability requiredCapability() {
        return requiredCapability;
    }
}
