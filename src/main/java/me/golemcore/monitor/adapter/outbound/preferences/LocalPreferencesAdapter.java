package me.golemcore.monitor.adapter.outbound.preferences;

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

import me.golemcore.monitor.port.outbound.PreferencesPort;
import me.golemcore.monitor.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stores preferences as a JSON object in {@code preferences/settings.json}.
 *
 * <p>
 * The file is read once and kept in memory. Writes are atomic; if a write
 * fails, the in-memory value is rolled back so memory and disk stay in sync.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalPreferencesAdapter implements PreferencesPort {

    private static final String PREFERENCES_DIR = "preferences";
    private static final String SETTINGS_FILE = "settings.json";
    private static final TypeReference<LinkedHashMap<String, String>> SETTINGS_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private Map<String, String> cachedSettings;

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(getSettings().get(key));
    }

    @Override
    public synchronized void put(String key, String value) {
        Map<String, String> settings = getSettings();
        boolean existed = settings.containsKey(key);
        String previous = settings.put(key, value);
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(settings);
            storagePort.putTextAtomic(PREFERENCES_DIR, SETTINGS_FILE, json, true).join();
            log.debug("[Preferences] Saved {}", key);
        } catch (JsonProcessingException | RuntimeException e) {
            if (existed) {
                settings.put(key, previous);
            } else {
                settings.remove(key);
            }
            log.error("[Preferences] Failed to save preferences", e);
            throw new IllegalStateException("Failed to persist preferences", e);
        }
    }

    private Map<String, String> getSettings() {
        if (cachedSettings == null) {
            cachedSettings = loadSettings();
        }
        return cachedSettings;
    }

    private Map<String, String> loadSettings() {
        try {
            String json = storagePort.getText(PREFERENCES_DIR, SETTINGS_FILE).join();
            if (json != null && !json.isBlank()) {
                Map<String, String> loaded = objectMapper.readValue(json, SETTINGS_TYPE);
                if (loaded != null) {
                    log.debug("[Preferences] Loaded {} settings", loaded.size());
                    return new LinkedHashMap<>(loaded);
                }
            }
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Preferences] Failed to load preferences, using defaults: {}", e.getMessage());
        }
        return new LinkedHashMap<>();
    }
}
