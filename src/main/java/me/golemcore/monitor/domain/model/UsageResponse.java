package me.golemcore.monitor.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw payload of the usage endpoint. Every bucket is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UsageResponse {

    @JsonProperty("five_hour")
    private Bucket fiveHour;

    @JsonProperty("seven_day")
    private Bucket sevenDay;

    @JsonProperty("seven_day_oauth_apps")
    private Bucket sevenDayOauthApps;

    @JsonProperty("seven_day_opus")
    private Bucket sevenDayOpus;

    @JsonProperty("seven_day_sonnet")
    private Bucket sevenDaySonnet;

    public Bucket bucketFor(UsageBucketType type) {
        return switch (type) {
        case FIVE_HOUR -> fiveHour;
        case SEVEN_DAY -> sevenDay;
        case SEVEN_DAY_SONNET -> sevenDaySonnet;
        case SEVEN_DAY_OPUS -> sevenDayOpus;
        case SEVEN_DAY_OAUTH_APPS -> sevenDayOauthApps;
        };
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Bucket {

        /** Percentage between 0 and 100. */
        private Double utilization;

        @JsonProperty("resets_at")
        private String resetsAt;
    }
}
