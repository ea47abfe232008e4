package com.qqsuccubus.delivery.core.util;

import java.nio.charset.StandardCharsets;

public final class BytesUtils {
    private BytesUtils() {
    }

    /**
     * Encodes an application payload for the wire.
     * <p>
     * {@code byte[]} passes through, {@link String} is UTF-8, anything else is JSON.
     * </p>
     *
     * @param payload payload, may be null (tombstone)
     * @return wire bytes or null
     */
    public static byte[] toBytes(Object payload) {
        if (payload == null) {
            return null;
        }
        if (payload instanceof byte[] bytes) {
            return bytes;
        }
        if (payload instanceof String str) {
            return str.getBytes(StandardCharsets.UTF_8);
        }
        return JsonUtils.writeValueAsBytes(payload);
    }
}
