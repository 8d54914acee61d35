package com.gridbot.exchange;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 signer for Bitkub v3 private (signed) API requests.
 *
 * sign = HMAC_SHA256(timestamp + METHOD + path(+query) + body), hex encoded.
 */
public final class Signer {

    private Signer() {}

    public static String sign(String secret, long timestampMs, String method, String pathWithQuery, String body) {
        return hmacSha256(secret, payload(timestampMs, method, pathWithQuery, body));
    }

    static String payload(long timestampMs, String method, String pathWithQuery, String body) {
        return timestampMs + method.toUpperCase(Locale.ROOT) + pathWithQuery + (body == null ? "" : body);
    }

    public static String hmacSha256(String secret, String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(
                    secret.getBytes(StandardCharsets.UTF_8),
                    "HmacSHA256"
            ));
            return HexFormat.of().formatHex(
                    mac.doFinal(data.getBytes(StandardCharsets.UTF_8))
            );
        } catch (Exception e) {
            throw new IllegalStateException("Failed to calculate HMAC-SHA256 signature", e);
        }
    }
}
