package com.devicepush.orchestrator.domain.model;

import com.devicepush.orchestrator.push.PushPriority;

public enum JobPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL;

    public PushPriority toPushPriority() {
        return PushPriority.valueOf(name());
    }
}
