package me.golemcore.monitor.adapter.outbound.credentials;

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

import me.golemcore.monitor.domain.exception.CredentialStoreException;
import me.golemcore.monitor.domain.model.ErrorKind;
import me.golemcore.monitor.domain.model.Provenance;
import me.golemcore.monitor.infrastructure.config.MonitorProperties;
import me.golemcore.monitor.port.outbound.CredentialStorePort;
import me.golemcore.monitor.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * File-based credential store.
 *
 * <p>
 * The {@code primary} secret is the CLI's own credentials file and is opened
 * read-only. The {@code manual} secret lives in the workspace under
 * {@code monitor.credentials.manual-directory} and is owned by this
 * application.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalCredentialStoreAdapter implements CredentialStorePort {

    static final String MANUAL_TOKEN_FILE = "manual-token";

    private final StoragePort storagePort;
    private final MonitorProperties properties;

    @Override
    public Optional<byte[]> read(String name) {
        return switch (requireKnown(name)) {
        case PRIMARY -> readPrimary();
        case MANUAL -> readManual();
        };
    }

    @Override
    public void write(String name, byte[] secret) {
        requireManual(name);
        String directory = getManualDirectory();
        try {
            storagePort.deleteObject(directory, MANUAL_TOKEN_FILE).join();
            if (Boolean.TRUE.equals(storagePort.exists(directory, MANUAL_TOKEN_FILE).join())) {
                throw new CredentialStoreException(ErrorKind.DUPLICATE_ITEM,
                        "Existing manual token could not be replaced");
            }
            storagePort.putObject(directory, MANUAL_TOKEN_FILE, secret).join();
            log.debug("[Credentials] Manual token written");
        } catch (CompletionException e) {
            throw new CredentialStoreException(ErrorKind.UNEXPECTED_STATUS,
                    "Failed to write manual token: " + causeMessage(e), e.getCause());
        }
    }

    @Override
    public void delete(String name) {
        requireManual(name);
        try {
            storagePort.deleteObject(getManualDirectory(), MANUAL_TOKEN_FILE).join();
            log.debug("[Credentials] Manual token deleted");
        } catch (CompletionException e) {
            throw new CredentialStoreException(ErrorKind.UNEXPECTED_STATUS,
                    "Failed to delete manual token: " + causeMessage(e), e.getCause());
        }
    }

    private Optional<byte[]> readPrimary() {
        Path path = getPrimaryPath();
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new CredentialStoreException(ErrorKind.UNEXPECTED_STATUS,
                    "Failed to read credentials file: " + path, e);
        }
    }

    private Optional<byte[]> readManual() {
        try {
            return Optional.ofNullable(storagePort.getObject(getManualDirectory(), MANUAL_TOKEN_FILE).join());
        } catch (CompletionException e) {
            throw new CredentialStoreException(ErrorKind.UNEXPECTED_STATUS,
                    "Failed to read manual token: " + causeMessage(e), e.getCause());
        }
    }

    private Path getPrimaryPath() {
        String configured = properties.getCredentials().getPrimaryPath();
        return Paths.get(configured.replace("${user.home}", System.getProperty("user.home")));
    }

    private String getManualDirectory() {
        return properties.getCredentials().getManualDirectory();
    }

    private static Provenance requireKnown(String name) {
        return Provenance.fromValue(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown credential: " + name));
    }

    private static void requireManual(String name) {
        if (requireKnown(name) != Provenance.MANUAL) {
            throw new IllegalArgumentException("Credential is read-only: " + name);
        }
    }

    private static String causeMessage(CompletionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return cause.getMessage();
    }
}
