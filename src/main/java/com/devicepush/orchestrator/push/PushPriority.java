package com.devicepush.orchestrator.push;

public enum PushPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL;

    public boolean isUrgent() {
        return this == HIGH || this == CRITICAL;
    }
}
