package com.teamchat.common.idempotency;

import com.teamchat.domain.model.UserRef;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClientNonceIdempotencyTest {

    @Test
    void claim_firstWins_andLaterClaimsSeeIt() {
        ClientNonceIdempotency idem = new ClientNonceIdempotency(new ClientNonceProperties(true, 16, 100L, 60L));
        String key = idem.key(UserRef.of("auth0|alice"), "n-1");

        assertNull(idem.claim(key, 1L));
        assertEquals(1L, idem.claim(key, 2L));
        assertEquals(1L, idem.get(key));
    }

    @Test
    void release_onlyRemovesOwnClaim() {
        ClientNonceIdempotency idem = new ClientNonceIdempotency(new ClientNonceProperties(null, null, null, null));
        String key = idem.key(UserRef.of("auth0|alice"), "n-2");
        idem.claim(key, 10L);

        idem.release(key, 99L);
        assertEquals(10L, idem.get(key));

        idem.release(key, 10L);
        assertNull(idem.get(key));
    }

    @Test
    void keys_areScopedBySender() {
        ClientNonceIdempotency idem = new ClientNonceIdempotency(new ClientNonceProperties(null, null, null, null));

        assertNotEquals(idem.key(UserRef.of("a"), "n"), idem.key(UserRef.of("b"), "n"));
        assertTrue(idem.enabled());
        assertFalse(new ClientNonceIdempotency(new ClientNonceProperties(false, null, null, null)).enabled());
    }
}
