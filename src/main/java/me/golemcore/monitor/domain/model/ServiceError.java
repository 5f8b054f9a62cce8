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

import lombok.Builder;
import lombok.Value;

/**
 * The error recorded in {@link ServiceState} after a failed operation.
 *
 * <p>
 * {@code message} is a user-facing summary, {@code detail} carries the
 * technical cause (exception message or HTTP response body) for diagnostics.
 */
@Value
@Builder
public class ServiceError {

    private static final int MAX_DETAIL_CHARS = 2000;

    ErrorKind kind;
    String message;

    /** HTTP status for {@link ErrorKind#HTTP}, otherwise {@code null}. */
    Integer httpStatus;

    String detail;

    public String getRecoverySuggestion() {
        return kind.getRecoverySuggestion();
    }

    public static ServiceError of(ErrorKind kind, String detail) {
        return ServiceError.builder()
                .kind(kind)
                .message(kind.getFailureReason())
                .detail(truncate(detail))
                .build();
    }

    public static ServiceError noCredential(String detail) {
        return of(ErrorKind.NO_CREDENTIAL, detail);
    }

    public static ServiceError network(Throwable cause) {
        return of(ErrorKind.NETWORK, describe(cause));
    }

    public static ServiceError decoding(Throwable cause) {
        return of(ErrorKind.DECODING, describe(cause));
    }

    public static ServiceError http(int status, String body) {
        return ServiceError.builder()
                .kind(ErrorKind.HTTP)
                .message(ErrorKind.HTTP.getFailureReason() + " (HTTP " + status + ")")
                .httpStatus(status)
                .detail(truncate(body))
                .build();
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return null;
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_DETAIL_CHARS) {
            return value;
        }
        return value.substring(0, MAX_DETAIL_CHARS) + "... [truncated]";
    }
}
