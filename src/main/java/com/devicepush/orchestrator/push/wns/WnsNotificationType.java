package com.devicepush.orchestrator.push.wns;

import org.springframework.http.MediaType;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

public enum WnsNotificationType {
    TOAST("wns/toast", new MediaType("text", "xml", StandardCharsets.UTF_8)),
    TILE("wns/tile", new MediaType("text", "xml", StandardCharsets.UTF_8)),
    BADGE("wns/badge", new MediaType("text", "xml", StandardCharsets.UTF_8)),
    RAW("wns/raw", MediaType.APPLICATION_OCTET_STREAM);

    private final String header;
    private final MediaType contentType;

    WnsNotificationType(String header, MediaType contentType) {
        this.header = header;
        this.contentType = contentType;
    }

    public String header() {
        return header;
    }

    public MediaType contentType() {
        return contentType;
    }

    public static WnsNotificationType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return TOAST;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
