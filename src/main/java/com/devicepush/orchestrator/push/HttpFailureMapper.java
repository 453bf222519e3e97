package com.devicepush.orchestrator.push;

import org.springframework.http.HttpHeaders;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Translates HTTP client failures of the HTTP-based providers into result codes.
 */
public final class HttpFailureMapper {

    private HttpFailureMapper() {
    }

    public static String errorCodeForStatus(int status) {
        return switch (status) {
            case 400 -> PushErrorCodes.BAD_REQUEST;
            case 401 -> PushErrorCodes.UNAUTHORIZED;
            case 403 -> PushErrorCodes.FORBIDDEN;
            case 404 -> PushErrorCodes.NOT_FOUND;
            case 410 -> PushErrorCodes.UNREGISTERED;
            case 413 -> PushErrorCodes.PAYLOAD_TOO_LARGE;
            case 429 -> PushErrorCodes.TOO_MANY_REQUESTS;
            case 503 -> PushErrorCodes.SERVICE_UNAVAILABLE;
            default -> status >= 500 ? PushErrorCodes.SERVER_ERROR : "HTTP_" + status;
        };
    }

    public static ProviderResult fromStatus(PushPlatform platform, HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        return ProviderResult.failed(platform, errorCodeForStatus(status),
                platform.displayName() + " rejected the request with HTTP " + status,
                retryAfterSeconds(e.getResponseHeaders()));
    }

    public static ProviderResult fromTransport(PushPlatform platform, ResourceAccessException e) {
        Throwable cause = e.getCause();
        boolean timeout = cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException;
        return ProviderResult.failed(platform, timeout ? PushErrorCodes.TIMEOUT : PushErrorCodes.NETWORK_ERROR,
                "Could not reach " + platform.displayName() + ": " + e.getMessage());
    }

    public static Integer retryAfterSeconds(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            // HTTP-date form is not interpreted
            return null;
        }
    }
}
