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

import me.golemcore.monitor.domain.exception.CredentialStoreException;
import me.golemcore.monitor.domain.model.ErrorKind;
import me.golemcore.monitor.infrastructure.config.MonitorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the access token from the CLI's credentials payload.
 *
 * <p>
 * The payload is not deserialized: it may contain embedded null bytes or be
 * truncated, so the {@code accessToken} field is located by pattern and the
 * extracted value is checked against the expected token prefix.
 */
@Component
@Slf4j
public class PrimaryCredentialParser {

    private static final Pattern ACCESS_TOKEN_PATTERN = Pattern.compile("\"accessToken\"\\s*:\\s*\"([^\"]+)\"");

    private final String tokenPrefix;

    public PrimaryCredentialParser(MonitorProperties properties) {
        this.tokenPrefix = properties.getCredentials().getTokenPrefix();
    }

    /**
     * @throws CredentialStoreException
     *             with {@link ErrorKind#INVALID_DATA} if no acceptable token is
     *             present
     */
    public String parse(byte[] payload) {
        String text = decode(stripNullBytes(payload));

        Matcher matcher = ACCESS_TOKEN_PATTERN.matcher(text);
        if (!matcher.find()) {
            throw new CredentialStoreException(ErrorKind.INVALID_DATA, "accessToken field not found");
        }

        String token = matcher.group(1).trim();
        if (!token.startsWith(tokenPrefix)) {
            log.debug("[TokenResolver] Rejected primary token without expected prefix");
            throw new CredentialStoreException(ErrorKind.INVALID_DATA, "accessToken has unexpected format");
        }
        return token;
    }

    private static byte[] stripNullBytes(byte[] payload) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(payload.length);
        for (byte b : payload) {
            if (b != 0) {
                out.write(b);
            }
        }
        return out.toByteArray();
    }

    private static String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new CredentialStoreException(ErrorKind.INVALID_DATA, "Credential payload is not valid UTF-8", e);
        }
    }
}
