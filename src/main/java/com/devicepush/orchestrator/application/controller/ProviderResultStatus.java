package com.devicepush.orchestrator.application.controller;

import com.devicepush.orchestrator.push.ProviderResult;
import com.devicepush.orchestrator.push.PushErrorCodes;
import org.springframework.http.HttpStatus;

/**
 * HTTP status for a direct-send result.
 */
final class ProviderResultStatus {

    private ProviderResultStatus() {
    }

    static HttpStatus of(ProviderResult result) {
        if (result.success()) {
            return HttpStatus.OK;
        }
        String code = result.errorCode() == null ? "" : result.errorCode();
        return switch (code) {
            case PushErrorCodes.TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case PushErrorCodes.NETWORK_ERROR, PushErrorCodes.SERVER_ERROR -> HttpStatus.BAD_GATEWAY;
            case PushErrorCodes.UNAUTHORIZED, PushErrorCodes.AUTH_FAILED -> HttpStatus.UNAUTHORIZED;
            case PushErrorCodes.FORBIDDEN -> HttpStatus.FORBIDDEN;
            case PushErrorCodes.NOT_FOUND, PushErrorCodes.UNREGISTERED, PushErrorCodes.CHANNEL_EXPIRED,
                    PushErrorCodes.CHANNEL_GONE, PushErrorCodes.SUBSCRIPTION_EXPIRED,
                    PushErrorCodes.SUBSCRIPTION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PushErrorCodes.PAYLOAD_TOO_LARGE -> HttpStatus.PAYLOAD_TOO_LARGE;
            case PushErrorCodes.TOO_MANY_REQUESTS, PushErrorCodes.THROTTLED, PushErrorCodes.QUOTA_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            case PushErrorCodes.NOT_INITIALIZED, PushErrorCodes.NOT_CONNECTED, PushErrorCodes.LIBRARY_NOT_AVAILABLE,
                    PushErrorCodes.SERVICE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case PushErrorCodes.TOPICS_NOT_SUPPORTED -> HttpStatus.NOT_IMPLEMENTED;
            default -> HttpStatus.BAD_REQUEST;
        };
    }
}
