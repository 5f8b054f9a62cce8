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

import me.golemcore.monitor.infrastructure.config.MonitorProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives usage refreshes: once at start-up, then periodically, plus on demand.
 *
 * <p>
 * At most one fetch is in flight at any time. A refresh requested while another
 * is running is skipped, whatever its trigger (timer, manual request or
 * preference change); the running one picks up a changed credential context
 * before it returns. The gate is released on every exit path.
 *
 * <p>
 * Start-up and periodic ticks share a single daemon thread, so the first tick
 * never overlaps the start-up sequence. After {@link #shutdown()} no further
 * tick or refresh starts; a fetch already running is allowed to finish.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class RefreshScheduler {

    private final UsageStateService stateService;
    private final Duration interval;
    private final Duration startupDelay;
    private final Duration shutdownTimeout;
    private final AtomicBoolean refreshing = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile boolean cancelled;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public RefreshScheduler(UsageStateService stateService, MonitorProperties properties) {
        this.stateService = stateService;
        MonitorProperties.RefreshProperties refresh = properties.getRefresh();
        this.interval = refresh.getInterval();
        this.startupDelay = refresh.getStartupDelay();
        this.shutdownTimeout = refresh.getShutdownTimeout();
    }

    /**
     * Run the start-up sequence and enter periodic mode. Only the first call
     * has an effect.
     */
    public synchronized void start() {
        if (cancelled || !started.compareAndSet(false, true)) {
            log.debug("[Refresh] Start ignored: already started or shut down");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "usage-refresh-scheduler");
            t.setDaemon(true);
            return t;
        });

        long startupDelayMillis = startupDelay.toMillis();
        long intervalMillis = interval.toMillis();
        scheduler.schedule(this::startup, startupDelayMillis, TimeUnit.MILLISECONDS);
        tickTask = scheduler.scheduleWithFixedDelay(
                this::tick,
                startupDelayMillis + intervalMillis,
                intervalMillis,
                TimeUnit.MILLISECONDS);

        log.info("[Refresh] Started with interval: {}s", interval.toSeconds());
    }

    /**
     * Refresh now unless a refresh is already running or the scheduler was shut
     * down. If the credential context changes while the gate is still held, the
     * caller whose follow-up refresh was skipped is covered by one more pass
     * here.
     *
     * @return {@code true} if this call published a fetch outcome
     */
    public boolean refresh() {
        boolean published = false;
        boolean again;
        do {
            if (cancelled) {
                log.debug("[Refresh] Skipped: scheduler shut down");
                return published;
            }
            if (!refreshing.compareAndSet(false, true)) {
                log.debug("[Refresh] Skipped: previous refresh still in progress");
                return published;
            }
            boolean outcome;
            try {
                outcome = stateService.refreshNow();
            } finally {
                refreshing.set(false);
            }
            published |= outcome;
            again = outcome && stateService.isCredentialContextStale();
        } while (again);
        return published;
    }

    boolean isRefreshing() {
        return refreshing.get();
    }

    boolean isStarted() {
        return started.get();
    }

    @PreDestroy
    public synchronized void shutdown() {
        cancelled = true;
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Refresh] Shut down");
    }

    void startup() {
        if (cancelled) {
            return;
        }
        try {
            stateService.initialize();
            refresh();
        } catch (Exception e) {
            log.error("[Refresh] Start-up sequence failed: {}", e.getMessage(), e);
        }
    }

    void tick() {
        if (cancelled) {
            return;
        }
        try {
            refresh();
        } catch (Exception e) {
            log.error("[Refresh] Tick failed: {}", e.getMessage(), e);
        }
    }
}
