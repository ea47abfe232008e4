package com.qqsuccubus.delivery.core.hash;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HashersTest {

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testIdempotenceKey_StableForSameInput() {
        String first = Hashers.idempotenceKey("order-1", bytes("{\"qty\":2}"));
        String second = Hashers.idempotenceKey("order-1", bytes("{\"qty\":2}"));

        assertEquals(first, second);
        assertEquals(32, first.length());
        assertTrue(first.matches("[0-9a-f]+"));
    }

    @Test
    void testIdempotenceKey_KeyAndPayloadBoundary() {
        assertNotEquals(Hashers.idempotenceKey("ab", bytes("c")), Hashers.idempotenceKey("a", bytes("bc")));
        assertNotEquals(Hashers.idempotenceKey("order-1", bytes("x")), Hashers.idempotenceKey("order-2", bytes("x")));
    }
}
