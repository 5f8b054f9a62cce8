package me.golemcore.monitor.port.outbound;

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

import java.io.IOException;

/**
 * Port for the usage endpoint: one authenticated request, raw status and body
 * back.
 */
public interface UsageTransportPort {

    /**
     * Perform a single usage request.
     *
     * @param accessToken
     *            bearer token sent in the Authorization header
     * @return status code and body, for any HTTP status
     * @throws IOException
     *             if the request could not be completed at transport level
     */
    TransportResponse request(String accessToken) throws IOException;

    /**
     * HTTP status with the response body as text (empty when absent).
     */
    record TransportResponse(int status, String body) {

        public boolean isSuccessful() {
            return status >= 200 && status < 300;
        }
    }
}
