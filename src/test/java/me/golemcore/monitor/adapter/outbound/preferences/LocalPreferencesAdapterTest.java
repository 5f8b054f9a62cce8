package me.golemcore.monitor.adapter.outbound.preferences;

import me.golemcore.monitor.infrastructure.config.MonitorConfiguration;
import me.golemcore.monitor.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LocalPreferencesAdapterTest {

    private static final String PREFERENCES_DIR = "preferences";
    private static final String SETTINGS_FILE = "settings.json";

    private StoragePort storagePort;
    private LocalPreferencesAdapter adapter;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        adapter = new LocalPreferencesAdapter(storagePort, MonitorConfiguration.objectMapper());
    }

    @Test
    void shouldReadPersistedValue() {
        when(storagePort.getText(PREFERENCES_DIR, SETTINGS_FILE))
                .thenReturn(CompletableFuture.completedFuture("{\"preferredSource\":\"manual\"}"));

        assertEquals(Optional.of("manual"), adapter.get("preferredSource"));
        assertEquals(Optional.empty(), adapter.get("other"));
    }

    @Test
    void shouldLoadSettingsOnlyOnce() {
        when(storagePort.getText(PREFERENCES_DIR, SETTINGS_FILE))
                .thenReturn(CompletableFuture.completedFuture("{\"preferredSource\":\"manual\"}"));

        adapter.get("preferredSource");
        adapter.get("preferredSource");

        verify(storagePort, times(1)).getText(PREFERENCES_DIR, SETTINGS_FILE);
    }

    @Test
    void shouldReturnEmptyWhenFileMissing() {
        when(storagePort.getText(PREFERENCES_DIR, SETTINGS_FILE))
                .thenReturn(CompletableFuture.completedFuture(null));

        assertTrue(adapter.get("preferredSource").isEmpty());
    }

    @Test
    void shouldUseDefaultsWhenFileCorrupted() {
        when(storagePort.getText(PREFERENCES_DIR, SETTINGS_FILE))
                .thenReturn(CompletableFuture.completedFuture("{not json"));

        assertTrue(adapter.get("preferredSource").isEmpty());
    }

    @Test
    void shouldPersistValueAtomically() {
        when(storagePort.getText(PREFERENCES_DIR, SETTINGS_FILE))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));

        adapter.put("preferredSource", "manual");

        verify(storagePort).putTextAtomic(eq(PREFERENCES_DIR), eq(SETTINGS_FILE),
                contains("\"preferredSource\" : \"manual\""), eq(true));
        assertEquals(Optional.of("manual"), adapter.get("preferredSource"));
    }

    @Test
    void shouldRollBackWhenPersistFails() {
        when(storagePort.getText(PREFERENCES_DIR, SETTINGS_FILE))
                .thenReturn(CompletableFuture.completedFuture("{\"preferredSource\":\"primary\"}"));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        assertThrows(IllegalStateException.class, () -> adapter.put("preferredSource", "manual"));

        assertEquals(Optional.of("primary"), adapter.get("preferredSource"));
    }

    @Test
    void shouldRemoveNewKeyWhenPersistFails() {
        when(storagePort.getText(PREFERENCES_DIR, SETTINGS_FILE))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        assertThrows(IllegalStateException.class, () -> adapter.put("preferredSource", "manual"));

        assertTrue(adapter.get("preferredSource").isEmpty());
    }
}
