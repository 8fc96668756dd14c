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

package me.golemcore.livebridge.adapter.outbound.openplatform;

import me.golemcore.livebridge.domain.exception.LiveConfigException;
import feign.RequestInterceptor;
import feign.RequestTemplate;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Signs open platform requests with the access key pair.
 *
 * <p>
 * For each request the signer computes the lowercase hex MD5 of the exact body
 * bytes, draws a fresh nonce and the current Unix time in seconds, and builds
 * the canonical string
 *
 * <pre>
 * x-bili-accesskeyid:&lt;key&gt;
 * x-bili-content-md5:&lt;md5&gt;
 * x-bili-signature-method:HMAC-SHA256
 * x-bili-signature-nonce:&lt;nonce&gt;
 * x-bili-signature-version:1.0
 * x-bili-timestamp:&lt;ts&gt;
 * </pre>
 *
 * joined by {@code \n} without a trailing newline. Field order and names are
 * part of the platform contract. The {@code Authorization} header carries the
 * lowercase hex HMAC-SHA256 of that string keyed by the access secret; the six
 * {@code x-bili-*} values are sent as headers of the same names.
 *
 * <p>
 * Runs as a Feign {@link RequestInterceptor}, i.e. after the JSON body has
 * been encoded.
 */
public class OpenPlatformSigner implements RequestInterceptor {

    static final String HEADER_ACCESS_KEY = "x-bili-accesskeyid";
    static final String HEADER_CONTENT_MD5 = "x-bili-content-md5";
    static final String HEADER_SIGNATURE_METHOD = "x-bili-signature-method";
    static final String HEADER_NONCE = "x-bili-signature-nonce";
    static final String HEADER_SIGNATURE_VERSION = "x-bili-signature-version";
    static final String HEADER_TIMESTAMP = "x-bili-timestamp";
    static final String HEADER_AUTHORIZATION = "Authorization";

    static final String SIGNATURE_METHOD = "HMAC-SHA256";
    static final String SIGNATURE_VERSION = "1.0";

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final String accessKey;
    private final String accessSecret;
    private final Clock clock;
    private final Supplier<String> nonceSupplier;

    public OpenPlatformSigner(String accessKey, String accessSecret, Clock clock) {
        this(accessKey, accessSecret, clock, () -> UUID.randomUUID().toString());
    }

    public OpenPlatformSigner(String accessKey, String accessSecret, Clock clock, Supplier<String> nonceSupplier) {
        this.accessKey = accessKey;
        this.accessSecret = accessSecret;
        this.clock = clock;
        this.nonceSupplier = nonceSupplier;
    }

    @Override
    public void apply(RequestTemplate template) {
        for (Map.Entry<String, String> header : sign(template.body()).entrySet()) {
            template.header(header.getKey(), header.getValue());
        }
    }

    /**
     * Build the full set of signature headers for a body, in canonical order
     * followed by {@code Authorization}.
     */
    public Map<String, String> sign(byte[] body) {
        if (accessKey == null || accessKey.isBlank() || accessSecret == null || accessSecret.isBlank()) {
            throw new LiveConfigException("Open platform access key and secret must be configured");
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HEADER_ACCESS_KEY, accessKey);
        headers.put(HEADER_CONTENT_MD5, md5Hex(body != null ? body : new byte[0]));
        headers.put(HEADER_SIGNATURE_METHOD, SIGNATURE_METHOD);
        headers.put(HEADER_NONCE, nonceSupplier.get());
        headers.put(HEADER_SIGNATURE_VERSION, SIGNATURE_VERSION);
        headers.put(HEADER_TIMESTAMP, Long.toString(clock.instant().getEpochSecond()));

        headers.put(HEADER_AUTHORIZATION, hmacSha256Hex(accessSecret, canonicalString(headers)));
        return headers;
    }

    static String canonicalString(Map<String, String> signedHeaders) {
        StringBuilder canonical = new StringBuilder();
        for (String name : new String[] { HEADER_ACCESS_KEY, HEADER_CONTENT_MD5, HEADER_SIGNATURE_METHOD,
                HEADER_NONCE, HEADER_SIGNATURE_VERSION, HEADER_TIMESTAMP }) {
            if (canonical.length() > 0) {
                canonical.append('\n');
            }
            canonical.append(name).append(':').append(signedHeaders.get(name));
        }
        return canonical.toString();
    }

    static String md5Hex(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    static String hmacSha256Hex(String secret, String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Failed to compute HMAC: " + e.getMessage(), e);
        }
    }
}
