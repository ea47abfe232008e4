package com.qqsuccubus.delivery.core.model;

import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.apache.kafka.common.header.internals.RecordHeaders;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, immutable header set of a message.
 * <p>
 * A name may occur more than once, as on the Kafka wire. {@link #add} appends and keeps earlier
 * values; {@link #put} replaces every earlier value of the name. Both return a new instance.
 * </p>
 */
public final class MessageHeaders {

    private static final MessageHeaders EMPTY = new MessageHeaders(Collections.emptyList());

    private final List<Entry> entries;

    private MessageHeaders(List<Entry> entries) {
        this.entries = entries;
    }

    public static MessageHeaders empty() {
        return EMPTY;
    }

    /**
     * Copies broker headers, preserving order and duplicates.
     *
     * @param headers Kafka headers, may be null
     * @return header set
     */
    public static MessageHeaders from(Headers headers) {
        if (headers == null) {
            return EMPTY;
        }
        List<Entry> copy = new ArrayList<>();
        for (Header header : headers) {
            copy.add(new Entry(header.key(), header.value()));
        }
        return copy.isEmpty() ? EMPTY : new MessageHeaders(Collections.unmodifiableList(copy));
    }

    public MessageHeaders add(String name, byte[] value) {
        List<Entry> copy = new ArrayList<>(entries);
        copy.add(new Entry(name, value));
        return new MessageHeaders(Collections.unmodifiableList(copy));
    }

    public MessageHeaders add(String name, String value) {
        return add(name, value == null ? null : value.getBytes(StandardCharsets.UTF_8));
    }

    public MessageHeaders put(String name, byte[] value) {
        List<Entry> copy = new ArrayList<>(entries.size() + 1);
        for (Entry entry : entries) {
            if (!entry.name().equals(name)) {
                copy.add(entry);
            }
        }
        copy.add(new Entry(name, value));
        return new MessageHeaders(Collections.unmodifiableList(copy));
    }

    public MessageHeaders put(String name, String value) {
        return put(name, value == null ? null : value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Last value written for the name (the one a reader of the wire sees as current).
     */
    public Optional<byte[]> lastValue(String name) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            Entry entry = entries.get(i);
            if (entry.name().equals(name)) {
                return Optional.ofNullable(entry.value());
            }
        }
        return Optional.empty();
    }

    public Optional<String> lastValueAsString(String name) {
        return lastValue(name).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    public boolean contains(String name) {
        return entries.stream().anyMatch(entry -> entry.name().equals(name));
    }

    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        entries.forEach(entry -> names.add(entry.name()));
        return names;
    }

    public List<Entry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public Headers toKafkaHeaders() {
        RecordHeaders headers = new RecordHeaders();
        for (Entry entry : entries) {
            headers.add(new RecordHeader(entry.name(), entry.value()));
        }
        return headers;
    }

    @Override
    public String toString() {
        return "MessageHeaders" + names();
    }

    /**
     * Single header occurrence.
     */
    public record Entry(String name, byte[] value) {
    }
}
