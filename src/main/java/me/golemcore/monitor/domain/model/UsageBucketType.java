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

/**
 * Known usage buckets reported by the usage endpoint, declared in display
 * order.
 *
 * <p>
 * Session and aggregate buckets are always shown when the API returns them.
 * Model-specific buckets are shown only when they carry information
 * (utilization above zero or a known reset time).
 */
public enum UsageBucketType {

    FIVE_HOUR("five_hour", "Current session", true),
    SEVEN_DAY("seven_day", "All models", true),
    SEVEN_DAY_SONNET("seven_day_sonnet", "Sonnet only", false),
    SEVEN_DAY_OPUS("seven_day_opus", "Opus only", false),
    SEVEN_DAY_OAUTH_APPS("seven_day_oauth_apps", "OAuth apps", false);

    private final String id;
    private final String title;
    private final boolean alwaysShown;

    UsageBucketType(String id, String title, boolean alwaysShown) {
        this.id = id;
        this.title = title;
        this.alwaysShown = alwaysShown;
    }

    /** API field name, used as the stable bucket identifier. */
    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public boolean isAlwaysShown() {
        return alwaysShown;
    }
}
