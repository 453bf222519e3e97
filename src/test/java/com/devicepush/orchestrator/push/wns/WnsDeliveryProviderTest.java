package com.devicepush.orchestrator.push.wns;

import com.devicepush.orchestrator.push.NotificationPayload;
import com.devicepush.orchestrator.push.ProviderResult;
import com.devicepush.orchestrator.push.PushErrorCodes;
import com.devicepush.orchestrator.push.auth.AuthenticationType;
import com.devicepush.orchestrator.push.auth.Authenticator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.w3c.dom.Document;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WnsDeliveryProviderTest {

    private static final String CHANNEL = "https://db5p.notify.windows.com/w/channel-abc";

    private MockRestServiceServer server;
    private Authenticator authenticator;
    private WnsDeliveryProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        authenticator = mock(Authenticator.class);
        when(authenticator.type()).thenReturn(AuthenticationType.OAUTH2_CLIENT_CREDENTIALS);
        when(authenticator.refreshToken()).thenReturn(true);
        when(authenticator.getAuthHeader()).thenReturn(Map.of("Authorization", "Bearer wns-token"));
        provider = new WnsDeliveryProvider(builder.build(), authenticator, new ObjectMapper(), 100, Clock.systemUTC());
    }

    private NotificationPayload payload() {
        return NotificationPayload.builder()
                .title("Configuration Update v2")
                .body("New configuration available for pos-1")
                .putData("config_version", "v2")
                .collapseKey("config-site-1-terminals")
                .createdAt(Clock.systemUTC().instant())
                .build();
    }

    @Test
    void invalidChannelUriIsRejectedWithoutNetwork() {
        ProviderResult result = provider.sendNotification("http://example.com/not-a-channel", payload());

        assertFalse(result.success());
        assertEquals(PushErrorCodes.INVALID_CHANNEL_URI, result.errorCode());
        verify(authenticator, never()).refreshToken();
        server.verify();
    }

    @Test
    void channelUriValidation() {
        assertTrue(provider.validateDeviceToken(CHANNEL));
        assertFalse(provider.validateDeviceToken("https://evil.example.com/notify.windows.com"));
        assertFalse(provider.validateDeviceToken("http://db5p.notify.windows.com/w/x"));
        assertFalse(provider.validateDeviceToken(""));
        assertFalse(provider.validateDeviceToken(null));
    }

    @Test
    void toastIsPostedWithWnsHeaders() {
        server.expect(requestTo(CHANNEL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer wns-token"))
                .andExpect(header("X-WNS-Type", "wns/toast"))
                .andExpect(header("X-WNS-TTL", "300"))
                .andExpect(header("X-WNS-Tag", "config-site-1-te"))
                .andRespond(withSuccess().header("X-WNS-Msg-ID", "msg-42").header("X-WNS-Status", "received"));

        ProviderResult result = provider.sendNotification(CHANNEL, payload());

        assertTrue(result.success());
        assertEquals("msg-42", result.messageId());
        server.verify();
    }

    @Test
    void expiredChannelIsReported() {
        server.expect(requestTo(CHANNEL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        ProviderResult result = provider.sendNotification(CHANNEL, payload());

        assertFalse(result.success());
        assertEquals(PushErrorCodes.CHANNEL_EXPIRED, result.errorCode());
    }

    @Test
    void throttlingCarriesRetryAfter() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "60");
        server.expect(requestTo(CHANNEL)).andRespond(withStatus(HttpStatus.NOT_ACCEPTABLE).headers(headers));

        ProviderResult result = provider.sendNotification(CHANNEL, payload());

        assertEquals(PushErrorCodes.THROTTLED, result.errorCode());
        assertEquals(60, result.retryAfterSeconds());
    }

    @Test
    void oversizedPayloadIsRejectedBeforeSending() {
        NotificationPayload large = payload().toBuilder().body("x".repeat(6000)).build();

        ProviderResult result = provider.sendNotification(CHANNEL, large);

        assertEquals(PushErrorCodes.PAYLOAD_TOO_LARGE, result.errorCode());
        server.verify();
    }

    @Test
    void topicsAreNotSupported() {
        ProviderResult result = provider.sendTopicNotification("all-terminals", payload());

        assertEquals(PushErrorCodes.TOPICS_NOT_SUPPORTED, result.errorCode());
    }

    @Test
    void toastTextIsEscaped() {
        String xml = provider.buildBody(WnsNotificationType.TOAST,
                payload().toBuilder().title("A & B <c>").build());

        assertTrue(xml.contains("A &amp; B &lt;c&gt;"));
    }

    @Test
    void toastWithNonAsciiTextIsWellFormedXml() throws Exception {
        NotificationPayload localized = payload().toBuilder().title("Configuración v2").body("配置 für Kasse").build();

        String xml = provider.buildBody(WnsNotificationType.TOAST, localized);
        Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder()
                .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));

        NodeList texts = document.getElementsByTagName("text");
        assertEquals(2, texts.getLength());
        assertEquals("Configuración v2", texts.item(0).getTextContent());
        assertEquals("配置 für Kasse", texts.item(1).getTextContent());
    }

    @Test
    void toastIsSentAsUtf8Xml() {
        NotificationPayload localized = payload().toBuilder().title("Configuración v2").body("配置 für Kasse").build();
        byte[] expected = provider.buildBody(WnsNotificationType.TOAST, localized).getBytes(StandardCharsets.UTF_8);
        server.expect(requestTo(CHANNEL))
                .andExpect(content().contentType(new MediaType("text", "xml", StandardCharsets.UTF_8)))
                .andExpect(content().bytes(expected))
                .andRespond(withSuccess());

        assertTrue(provider.sendNotification(CHANNEL, localized).success());
        server.verify();
    }
}
