package com.devicepush.orchestrator.push.auth;

public enum AuthenticationType {
    API_KEY,
    OAUTH2_CLIENT_CREDENTIALS,
    SIGNED_TOKEN,
    SERVICE_ACCOUNT
}
