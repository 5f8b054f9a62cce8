package me.golemcore.monitor.infrastructure.http;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client for the usage endpoint.
 *
 * <p>
 * All traffic goes to one host, one request at a time, so the pool keeps a
 * single idle connection between polls. Connection-level retries are off by
 * default: a failed attempt surfaces as a network error and the next poll is
 * the retry. {@code call-timeout} bounds a whole fetch so a stalled server
 * cannot hold the refresh gate past the polling interval.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    private final MonitorProperties properties;

    @Bean
    public OkHttpClient usageHttpClient() {
        return buildClient(properties.getHttp());
    }

    static OkHttpClient buildClient(MonitorProperties.HttpProperties http) {
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(http.getConnectTimeout()))
                .readTimeout(Duration.ofMillis(http.getReadTimeout()))
                .writeTimeout(Duration.ofMillis(http.getWriteTimeout()))
                .callTimeout(Duration.ofMillis(http.getCallTimeout()))
                .connectionPool(new ConnectionPool(http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(), TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(http.isRetryOnConnectionFailure())
                .build();
        log.debug("[UsageApi] HTTP client: call timeout {}ms, connection retry {}",
                http.getCallTimeout(), http.isRetryOnConnectionFailure());
        return client;
    }
}
