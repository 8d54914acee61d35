package com.gridbot.exchange;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SignerTest {

    @Test
    void hmacMatchesKnownVector() {
        assertThat(Signer.hmacSha256("key", "The quick brown fox jumps over the lazy dog"))
                .isEqualTo("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8");
    }

    @Test
    void payloadIsTimestampMethodPathBody() {
        assertThat(Signer.payload(1704067200000L, "post", "/api/v3/market/place-bid", "{\"sym\":\"XRP_THB\"}"))
                .isEqualTo("1704067200000POST/api/v3/market/place-bid{\"sym\":\"XRP_THB\"}");
        assertThat(Signer.payload(1L, "GET", "/api/v3/market/my-open-orders?sym=XRP_THB", null))
                .isEqualTo("1GET/api/v3/market/my-open-orders?sym=XRP_THB");
    }

    @Test
    void signIsHmacOfPayload() {
        String payload = Signer.payload(42L, "POST", "/p", "{}");
        assertThat(Signer.sign("s3cret", 42L, "POST", "/p", "{}")).isEqualTo(Signer.hmacSha256("s3cret", payload));
    }
}
