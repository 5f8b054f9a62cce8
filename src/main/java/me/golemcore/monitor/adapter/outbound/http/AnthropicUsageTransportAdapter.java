package me.golemcore.monitor.adapter.outbound.http;

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
import me.golemcore.monitor.port.outbound.UsageTransportPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * OkHttp implementation of {@link UsageTransportPort} for the OAuth usage
 * endpoint.
 *
 * <p>
 * Sends {@code GET {base-url}{usage-path}} with the bearer token and the fixed
 * protocol headers, and hands back the status and body of any response.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnthropicUsageTransportAdapter implements UsageTransportPort {

    private final OkHttpClient okHttpClient;
    private final MonitorProperties properties;

    @Override
    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    public TransportResponse request(String accessToken) throws IOException {
        MonitorProperties.ApiProperties api = properties.getApi();
        Request request = new Request.Builder()
                .url(getUsageUrl(api))
                .get()
                .header("Authorization", "Bearer " + accessToken)
                .header("anthropic-beta", api.getBetaHeader())
                .header("User-Agent", api.getUserAgent())
                .header("Accept", "application/json")
                .build();

        try (Response response = okHttpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            log.debug("[UsageApi] GET {} -> HTTP {}", api.getUsagePath(), response.code());
            return new TransportResponse(response.code(), text);
        }
    }

    private String getUsageUrl(MonitorProperties.ApiProperties api) {
        String baseUrl = api.getBaseUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + api.getUsagePath();
    }
}
