package com.devicepush.orchestrator.push;

/**
 * Error codes carried by {@link ProviderResult#errorCode()}.
 */
public final class PushErrorCodes {

    // token / target validation
    public static final String INVALID_TOKEN = "INVALID_TOKEN";
    public static final String INVALID_SUBSCRIPTION = "INVALID_SUBSCRIPTION";
    public static final String INVALID_CHANNEL_URI = "INVALID_CHANNEL_URI";
    public static final String INVALID_TOPIC = "INVALID_TOPIC";
    public static final String PAYLOAD_TOO_LARGE = "PAYLOAD_TOO_LARGE";
    public static final String TOPICS_NOT_SUPPORTED = "TOPICS_NOT_SUPPORTED";
    public static final String NOTIFICATION_EXPIRED = "NOTIFICATION_EXPIRED";

    // provider state
    public static final String NOT_INITIALIZED = "NOT_INITIALIZED";
    public static final String NOT_CONNECTED = "NOT_CONNECTED";
    public static final String LIBRARY_NOT_AVAILABLE = "LIBRARY_NOT_AVAILABLE";
    public static final String PLATFORM_NOT_CONFIGURED = "PLATFORM_NOT_CONFIGURED";
    public static final String AUTH_FAILED = "AUTH_FAILED";

    // transport
    public static final String NETWORK_ERROR = "NETWORK_ERROR";
    public static final String TIMEOUT = "TIMEOUT";

    // upstream rejections
    public static final String BAD_REQUEST = "BAD_REQUEST";
    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String FORBIDDEN = "FORBIDDEN";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String UNREGISTERED = "UNREGISTERED";
    public static final String TOO_MANY_REQUESTS = "TOO_MANY_REQUESTS";
    public static final String QUOTA_EXCEEDED = "QUOTA_EXCEEDED";
    public static final String SERVER_ERROR = "SERVER_ERROR";
    public static final String SERVICE_UNAVAILABLE = "SERVICE_UNAVAILABLE";
    public static final String CHANNEL_EXPIRED = "CHANNEL_EXPIRED";
    public static final String CHANNEL_GONE = "CHANNEL_GONE";
    public static final String THROTTLED = "THROTTLED";
    public static final String SUBSCRIPTION_EXPIRED = "SUBSCRIPTION_EXPIRED";
    public static final String SUBSCRIPTION_NOT_FOUND = "SUBSCRIPTION_NOT_FOUND";

    // platform catch-alls
    public static final String FCM_ERROR = "FCM_ERROR";
    public static final String APNS_ERROR = "APNS_ERROR";
    public static final String WNS_ERROR = "WNS_ERROR";
    public static final String WEBPUSH_ERROR = "WEBPUSH_ERROR";
    public static final String MQTT_ERROR_PREFIX = "MQTT_ERROR_";
    public static final String SEND_FAILED = "SEND_FAILED";

    private PushErrorCodes() {
    }
}
