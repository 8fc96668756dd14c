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
package me.golemcore.livebridge.domain.exception;

/**
 * The open platform REST API rejected a call or could not be reached.
 *
 * <p>
 * {@link #getCode()} is the envelope code returned by the platform, or
 * {@link #NO_CODE} when the failure happened below the envelope (HTTP status,
 * I/O, undecodable body).
 */
public class LiveApiException extends LiveException {

    private static final long serialVersionUID = 1L;

    public static final int NO_CODE = -1;

    private final int code;

    public LiveApiException(int code, String message) {
        super(message);
        this.code = code;
    }

    public LiveApiException(String message, Throwable cause) {
        super(message, cause);
        this.code = NO_CODE;
    }

    public int getCode() {
        return code;
    }
}
