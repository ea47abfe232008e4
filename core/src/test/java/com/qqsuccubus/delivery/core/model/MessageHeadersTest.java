package com.qqsuccubus.delivery.core.model;

import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageHeadersTest {

    @Test
    void testAdd_KeepsDuplicatesInOrder() {
        MessageHeaders headers = MessageHeaders.empty()
            .add("trace-id", "t1")
            .add("retry", "1")
            .add("retry", "2");

        assertEquals(3, headers.size());
        assertEquals(List.of("trace-id", "retry"), List.copyOf(headers.names()));
        assertEquals(Optional.of("2"), headers.lastValueAsString("retry"));
        assertEquals(0, MessageHeaders.empty().size());
    }

    @Test
    void testPut_ReplacesEveryEarlierValue() {
        MessageHeaders headers = MessageHeaders.empty()
            .add("retry", "1")
            .add("other", "x")
            .add("retry", "2")
            .put("retry", "3");

        assertEquals(2, headers.size());
        assertEquals("other", headers.entries().get(0).name());
        assertEquals(Optional.of("3"), headers.lastValueAsString("retry"));
    }

    @Test
    void testLastValue_MissingAndNullValues() {
        MessageHeaders headers = MessageHeaders.empty().add("tombstone", (byte[]) null);

        assertTrue(headers.contains("tombstone"));
        assertTrue(headers.lastValue("tombstone").isEmpty());
        assertFalse(headers.contains("absent"));
        assertTrue(headers.lastValueAsString("absent").isEmpty());
    }

    @Test
    void testKafkaHeaders_CopyPreservesDuplicates() {
        RecordHeaders kafka = new RecordHeaders();
        kafka.add("a", "1".getBytes(StandardCharsets.UTF_8));
        kafka.add("a", "2".getBytes(StandardCharsets.UTF_8));

        MessageHeaders headers = MessageHeaders.from(kafka);
        Headers back = headers.toKafkaHeaders();

        assertEquals(2, headers.size());
        assertEquals("2", new String(back.lastHeader("a").value(), StandardCharsets.UTF_8));
        assertSame(MessageHeaders.empty(), MessageHeaders.from(null));
        assertSame(MessageHeaders.empty(), MessageHeaders.from(new RecordHeaders()));
    }

    @Test
    void testImmutable_OriginalUnchanged() {
        MessageHeaders original = MessageHeaders.empty().add("a", "1");
        original.put("a", "2");
        original.add("b", "3");

        assertEquals(1, original.size());
        assertEquals(Optional.of("1"), original.lastValueAsString("a"));
    }
}
