package me.golemcore.monitor.adapter.outbound.http;

import me.golemcore.monitor.domain.model.Credential;
import me.golemcore.monitor.domain.model.ErrorKind;
import me.golemcore.monitor.domain.model.FetchResult;
import me.golemcore.monitor.domain.model.Provenance;
import me.golemcore.monitor.domain.service.TokenResolver;
import me.golemcore.monitor.domain.service.UsageFetchPipeline;
import me.golemcore.monitor.domain.service.UsageResponseMapper;
import me.golemcore.monitor.infrastructure.config.MonitorConfiguration;
import me.golemcore.monitor.infrastructure.config.MonitorProperties;
import me.golemcore.monitor.infrastructure.http.OkHttpConfig;
import me.golemcore.monitor.port.outbound.UsageTransportPort.TransportResponse;
import me.golemcore.monitor.testsupport.http.OkHttpMockEngine;
import okhttp3.Call;
import okhttp3.EventListener;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.ServerSocket;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnthropicUsageTransportAdapterTest {

    private static final String TOKEN = "sk-ant-oat01-test";

    private OkHttpMockEngine httpEngine;
    private MonitorProperties properties;
    private AnthropicUsageTransportAdapter adapter;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        properties = new MonitorProperties();
        properties.getApi().setBaseUrl("https://usage.test/");
        adapter = new AnthropicUsageTransportAdapter(httpEngine.client(), properties);
    }

    @Test
    void shouldSendBearerTokenAndProtocolHeaders() throws IOException {
        httpEngine.enqueueJson(200, "{\"five_hour\":{\"utilization\":12.0}}");

        TransportResponse response = adapter.request(TOKEN);

        assertEquals(200, response.status());
        assertTrue(response.isSuccessful());
        assertEquals("{\"five_hour\":{\"utilization\":12.0}}", response.body());

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertNotNull(request);
        assertEquals("GET", request.method());
        assertEquals("https://usage.test/api/oauth/usage", request.url());
        assertEquals("Bearer " + TOKEN, request.headers().get("Authorization"));
        assertEquals("oauth-2025-04-20", request.headers().get("anthropic-beta"));
        assertEquals("claude-code/2.0.32", request.headers().get("User-Agent"));
        assertEquals("application/json", request.headers().get("Accept"));
    }

    @Test
    void shouldReturnNonSuccessStatusWithBody() throws IOException {
        httpEngine.enqueueJson(429, "{\"error\":\"rate_limited\"}");

        TransportResponse response = adapter.request(TOKEN);

        assertEquals(429, response.status());
        assertFalse(response.isSuccessful());
        assertEquals("{\"error\":\"rate_limited\"}", response.body());
    }

    @Test
    void shouldReturnEmptyBodyWhenServerSendsNothing() throws IOException {
        httpEngine.enqueueText(401, null, null);

        TransportResponse response = adapter.request(TOKEN);

        assertEquals(401, response.status());
        assertEquals("", response.body());
    }

    @Test
    void shouldPropagateTransportFailure() {
        httpEngine.enqueueFailure(new ConnectException("connection refused"));

        IOException exception = assertThrows(IOException.class, () -> adapter.request(TOKEN));

        assertEquals("connection refused", exception.getMessage());
        assertEquals(1, httpEngine.getRequestCount());
    }

    @Test
    void shouldUseConfiguredUsagePath() throws IOException {
        properties.getApi().setUsagePath("/custom/usage");
        httpEngine.enqueueJson(200, "{}");

        adapter.request(TOKEN);

        assertEquals("/custom/usage", httpEngine.takeRequest().target());
    }

    @Test
    void shouldMakeSingleConnectionAttemptWhenServerIsUnreachable() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        properties.getApi().setBaseUrl("http://127.0.0.1:" + closedPort);
        properties.getHttp().setConnectTimeout(2000);
        AtomicInteger connectAttempts = new AtomicInteger();
        OkHttpClient client = new OkHttpConfig(properties).usageHttpClient().newBuilder()
                .eventListener(new EventListener() {
                    @Override
                    public void connectStart(Call call, InetSocketAddress inetSocketAddress, Proxy proxy) {
                        connectAttempts.incrementAndGet();
                    }
                })
                .build();
        AnthropicUsageTransportAdapter liveAdapter = new AnthropicUsageTransportAdapter(client, properties);
        TokenResolver tokenResolver = mock(TokenResolver.class);
        when(tokenResolver.resolve(Provenance.PRIMARY))
                .thenReturn(Optional.of(new Credential(TOKEN, Provenance.PRIMARY)));
        UsageFetchPipeline pipeline = new UsageFetchPipeline(tokenResolver, liveAdapter, new UsageResponseMapper(),
                MonitorConfiguration.objectMapper(), Clock.systemUTC());

        FetchResult result = pipeline.fetch(Provenance.PRIMARY);

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.NETWORK, result.getError().getKind());
        assertEquals(1, connectAttempts.get());
    }
}
