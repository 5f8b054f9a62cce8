package me.golemcore.monitor.adapter.outbound.credentials;

import me.golemcore.monitor.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.monitor.domain.exception.CredentialStoreException;
import me.golemcore.monitor.domain.model.ErrorKind;
import me.golemcore.monitor.infrastructure.config.MonitorProperties;
import me.golemcore.monitor.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LocalCredentialStoreAdapterTest {

    @TempDir
    Path tempDir;

    private Path primaryFile;
    private MonitorProperties properties;
    private LocalCredentialStoreAdapter adapter;

    @BeforeEach
    void setUp() {
        primaryFile = tempDir.resolve("cli").resolve(".credentials.json");
        properties = new MonitorProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.resolve("workspace").toString());
        properties.getCredentials().setPrimaryPath(primaryFile.toString());

        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        adapter = new LocalCredentialStoreAdapter(storage, properties);
    }

    @Test
    void shouldReadPrimaryCredentialsFile() throws IOException {
        Files.createDirectories(primaryFile.getParent());
        Files.writeString(primaryFile, "{\"accessToken\":\"sk-ant-1\"}");

        Optional<byte[]> secret = adapter.read("primary");

        assertTrue(secret.isPresent());
        assertEquals("{\"accessToken\":\"sk-ant-1\"}", new String(secret.get(), StandardCharsets.UTF_8));
    }

    @Test
    void shouldReturnEmptyWhenPrimaryFileMissing() {
        assertTrue(adapter.read("primary").isEmpty());
    }

    @Test
    void shouldReportUnreadablePrimaryAsUnexpectedStatus() throws IOException {
        Files.createDirectories(primaryFile);

        CredentialStoreException exception = assertThrows(CredentialStoreException.class,
                () -> adapter.read("primary"));

        assertEquals(ErrorKind.UNEXPECTED_STATUS, exception.getKind());
    }

    @Test
    void shouldNeverWritePrimary() {
        assertThrows(IllegalArgumentException.class,
                () -> adapter.write("primary", "x".getBytes(StandardCharsets.UTF_8)));
        assertThrows(IllegalArgumentException.class, () -> adapter.delete("primary"));
        assertFalse(Files.exists(primaryFile));
    }

    @Test
    void shouldRejectUnknownSecretName() {
        assertThrows(IllegalArgumentException.class, () -> adapter.read("keychain"));
    }

    @Test
    void shouldWriteReplaceAndDeleteManualToken() {
        adapter.write("manual", "sk-ant-first".getBytes(StandardCharsets.UTF_8));
        adapter.write("manual", "sk-ant-second".getBytes(StandardCharsets.UTF_8));

        assertEquals("sk-ant-second", new String(adapter.read("manual").orElseThrow(), StandardCharsets.UTF_8));

        adapter.delete("manual");

        assertTrue(adapter.read("manual").isEmpty());
    }

    @Test
    void shouldTreatDeletingAbsentManualTokenAsSuccess() {
        assertDoesNotThrow(() -> adapter.delete("manual"));
        assertDoesNotThrow(() -> adapter.delete("manual"));
    }

    @Test
    void shouldStoreManualTokenUnderWorkspace() {
        adapter.write("manual", "sk-ant-x".getBytes(StandardCharsets.UTF_8));

        assertTrue(Files.exists(tempDir.resolve("workspace").resolve("credentials")
                .resolve(LocalCredentialStoreAdapter.MANUAL_TOKEN_FILE)));
    }

    @Test
    void shouldReportDuplicateWhenExistingTokenSurvivesDelete() {
        StoragePort storage = mock(StoragePort.class);
        when(storage.deleteObject(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(storage.exists(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(true));
        LocalCredentialStoreAdapter duplicateAdapter = new LocalCredentialStoreAdapter(storage, properties);

        CredentialStoreException exception = assertThrows(CredentialStoreException.class,
                () -> duplicateAdapter.write("manual", "sk-ant-x".getBytes(StandardCharsets.UTF_8)));

        assertEquals(ErrorKind.DUPLICATE_ITEM, exception.getKind());
    }

    @Test
    void shouldWrapStorageFailures() {
        StoragePort storage = mock(StoragePort.class);
        when(storage.getObject(anyString(), anyString())).thenReturn(
                CompletableFuture.failedFuture(new UncheckedIOException(new IOException("disk error"))));
        LocalCredentialStoreAdapter failingAdapter = new LocalCredentialStoreAdapter(storage, properties);

        CredentialStoreException exception = assertThrows(CredentialStoreException.class,
                () -> failingAdapter.read("manual"));

        assertEquals(ErrorKind.UNEXPECTED_STATUS, exception.getKind());
    }
}
