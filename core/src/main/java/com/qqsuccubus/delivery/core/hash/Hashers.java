package com.qqsuccubus.delivery.core.hash;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Stable hash functions for message deduplication keys.
 * <p>
 * Murmur3 is non-cryptographic but fast and well-distributed, which is all a duplicate
 * detection key needs.
 * </p>
 */
public final class Hashers {
    private Hashers() {
    }

    /**
     * Derives an idempotence key from a message key and its payload.
     * <p>
     * A retried publish of the same key and payload yields the same value, so downstream
     * consumers can drop the duplicate.
     * </p>
     *
     * @param key     message key, may be null
     * @param payload wire payload, may be null
     * @return 32-char lowercase hex string
     */
    public static String idempotenceKey(String key, byte[] payload) {
        Hasher hasher = Hashing.murmur3_128().newHasher();
        if (key != null) {
            hasher.putString(key, StandardCharsets.UTF_8);
        }
        hasher.putByte((byte) 0);
        if (payload != null) {
            hasher.putBytes(payload);
        }
        return hasher.hash().toString();
    }
}
