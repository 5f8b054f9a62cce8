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
 * Failure categories surfaced through {@link ServiceState#getLastError()}.
 *
 * <p>
 * The first four kinds come from the fetch path, the remaining ones from
 * credential store access.
 */
public enum ErrorKind {

    NO_CREDENTIAL("No API token is configured.", "Sign in with the CLI or configure a token in Settings."),
    NETWORK("Could not reach the usage API.", "Check your network connection."),
    HTTP("The usage API rejected the request.", null),
    DECODING("The usage API returned an unexpected response.", null),
    INVALID_DATA("The token data is invalid or corrupted.", "Try clearing and re-entering your token."),
    ITEM_NOT_FOUND("The token was not found in the credential store.", "Configure a token in Settings."),
    UNEXPECTED_STATUS("The credential store returned an unexpected status.", null),
    DUPLICATE_ITEM("A token with this identifier already exists.",
            "Clear the existing token before saving a new one.");

    private final String failureReason;
    private final String recoverySuggestion;

    ErrorKind(String failureReason, String recoverySuggestion) {
        this.failureReason = failureReason;
        this.recoverySuggestion = recoverySuggestion;
    }

    public String getFailureReason() {
        return failureReason;
    }

    /**
     * Hint for the user, or {@code null} when there is nothing actionable.
     */
    public String getRecoverySuggestion() {
        return recoverySuggestion;
    }
}
