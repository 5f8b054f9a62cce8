package me.golemcore.monitor.adapter.inbound.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.monitor.adapter.inbound.web.dto.ServiceStateResponse;
import me.golemcore.monitor.domain.model.ServiceState;
import me.golemcore.monitor.domain.service.UsageMonitorService;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Streams every published state to the connected client, starting with the
 * current one. Closing the socket ends the subscription.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketUsageStateHandler implements WebSocketHandler {

    static final String MESSAGE_TYPE = "usage_state";

    private final UsageMonitorService usageMonitorService;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String sessionId = session.getId();
        log.info("[UsageWS] Connection established: session={}", sessionId);

        Flux<WebSocketMessage> outbound = usageMonitorService.states()
                .onBackpressureLatest()
                .map(this::toPayloadJson)
                .map(session::textMessage);

        return session.send(outbound)
                .and(session.receive().then())
                .doFinally(signal -> log.info("[UsageWS] Connection closed: session={}, signal={}", sessionId, signal));
    }

    private String toPayloadJson(ServiceState state) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", MESSAGE_TYPE);
        payload.put("state", ServiceStateResponse.from(state));
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
