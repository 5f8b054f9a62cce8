package me.golemcore.monitor.adapter.inbound.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.monitor.domain.model.Provenance;
import me.golemcore.monitor.domain.model.ServiceState;
import me.golemcore.monitor.domain.model.UsageBucket;
import me.golemcore.monitor.domain.model.UsageSnapshot;
import me.golemcore.monitor.domain.service.UsageMonitorService;
import me.golemcore.monitor.infrastructure.config.MonitorConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WebSocketUsageStateHandlerTest {

    private UsageMonitorService usageMonitorService;
    private ObjectMapper objectMapper;
    private WebSocketUsageStateHandler handler;

    @BeforeEach
    void setUp() {
        usageMonitorService = mock(UsageMonitorService.class);
        objectMapper = MonitorConfiguration.objectMapper();
        handler = new WebSocketUsageStateHandler(usageMonitorService, objectMapper);
    }

    @Test
    void shouldStreamStatesInOrderWithExpectedPayload() throws Exception {
        ServiceState initial = ServiceState.initial(Provenance.PRIMARY);
        ServiceState loaded = initial.toBuilder()
                .initializing(false)
                .credentialAvailable(true)
                .activeProvenance(Provenance.PRIMARY)
                .snapshot(UsageSnapshot.builder()
                        .bucket(UsageBucket.builder()
                                .id("seven_day")
                                .title("All models")
                                .utilizationRatio(0.6)
                                .resetAt(Instant.parse("2026-02-05T00:00:00Z"))
                                .build())
                        .fetchedAt(Instant.parse("2026-02-01T10:00:00Z"))
                        .build())
                .lastUpdated(Instant.parse("2026-02-01T10:00:00Z"))
                .build();
        when(usageMonitorService.states()).thenReturn(Flux.just(initial, loaded));
        List<String> sentPayloads = new ArrayList<>();
        WebSocketSession session = mockStreamingSession(sentPayloads);

        StepVerifier.create(handler.handle(session))
                .verifyComplete();

        assertEquals(2, sentPayloads.size());

        @SuppressWarnings("unchecked")
        Map<String, Object> first = objectMapper.readValue(sentPayloads.get(0), Map.class);
        assertEquals(WebSocketUsageStateHandler.MESSAGE_TYPE, first.get("type"));
        Map<?, ?> firstState = (Map<?, ?>) first.get("state");
        assertEquals(Boolean.TRUE, firstState.get("initializing"));
        assertEquals(Boolean.FALSE, firstState.get("hasCredential"));

        @SuppressWarnings("unchecked")
        Map<String, Object> second = objectMapper.readValue(sentPayloads.get(1), Map.class);
        Map<?, ?> secondState = (Map<?, ?>) second.get("state");
        assertEquals(Boolean.TRUE, secondState.get("hasCredential"));
        assertEquals("primary", secondState.get("activeSource"));
        assertEquals("2026-02-01T10:00:00Z", secondState.get("lastUpdated"));
        Object rawBuckets = secondState.get("buckets");
        assertTrue(rawBuckets instanceof List<?>);
        Map<?, ?> bucket = (Map<?, ?>) ((List<?>) rawBuckets).get(0);
        assertEquals("seven_day", bucket.get("id"));
        assertEquals("All models", bucket.get("title"));
        assertEquals(0.6, ((Number) bucket.get("utilizationRatio")).doubleValue(), 1e-9);
    }

    @Test
    void shouldCompleteWhenNoStatesArrive() {
        when(usageMonitorService.states()).thenReturn(Flux.empty());
        WebSocketSession session = mockStreamingSession(new ArrayList<>());

        StepVerifier.create(handler.handle(session))
                .verifyComplete();
    }

    private WebSocketSession mockStreamingSession(List<String> sentPayloads) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("session-1");
        when(session.receive()).thenReturn(Flux.empty());
        when(session.textMessage(anyString())).thenAnswer(invocation -> {
            String payload = invocation.getArgument(0, String.class);
            WebSocketMessage message = mock(WebSocketMessage.class);
            when(message.getPayloadAsText()).thenReturn(payload);
            return message;
        });
        when(session.send(any(Publisher.class))).thenAnswer(invocation -> {
            @SuppressWarnings("unchecked")
            Publisher<WebSocketMessage> publisher = invocation.getArgument(0, Publisher.class);
            return Flux.from(publisher)
                    .doOnNext(msg -> sentPayloads.add(msg.getPayloadAsText()))
                    .then();
        });
        return session;
    }
}
