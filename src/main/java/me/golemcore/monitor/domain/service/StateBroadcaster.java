package me.golemcore.monitor.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.monitor.domain.model.ServiceState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.function.Consumer;

/**
 * Holds the current {@link ServiceState} and fans it out to subscribers.
 *
 * <p>
 * Backed by a replay-latest sink: a new subscriber first receives the state
 * current at subscribe time, then every later publication in order. Emission
 * never waits for subscribers.
 */
@Component
@Slf4j
public class StateBroadcaster {

    private final Object lock = new Object();
    private final Sinks.Many<ServiceState> stream = Sinks.many().replay().latest();

    private volatile ServiceState current;

    public void publish(ServiceState state) {
        synchronized (lock) {
            current = state;
            Sinks.EmitResult result = stream.tryEmitNext(state);
            if (result.isFailure()) {
                log.warn("[State] Failed to publish state: {}", result);
            }
        }
    }

    /**
     * @return the latest published state, or {@code null} before the first
     *         publication
     */
    public ServiceState current() {
        return current;
    }

    public Flux<ServiceState> states() {
        return stream.asFlux();
    }

    /**
     * Attach a callback. Delivery happens on a separate worker with its own
     * buffer, so a slow callback does not hold up publishers.
     *
     * @return handle to pass to {@link #unsubscribe(Disposable)}
     */
    public Disposable subscribe(Consumer<ServiceState> subscriber) {
        return stream.asFlux()
                .onBackpressureBuffer()
                .publishOn(Schedulers.boundedElastic())
                .subscribe(subscriber,
                        error -> log.warn("[State] Subscriber terminated: {}", error.getMessage()));
    }

    public void unsubscribe(Disposable handle) {
        if (handle != null) {
            handle.dispose();
        }
    }

    int subscriberCount() {
        return stream.currentSubscriberCount();
    }
}
