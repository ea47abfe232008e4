package com.qqsuccubus.delivery.client.support;

import org.apache.kafka.clients.producer.Callback;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * Auto-completing mock producer that rejects records carrying one specific value.
 */
public class FailingValueProducer extends MockProducer<String, byte[]> {

    private final byte[] poison;

    public FailingValueProducer(String poison) {
        super(true, new StringSerializer(), new ByteArraySerializer());
        this.poison = poison.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public synchronized Future<RecordMetadata> send(ProducerRecord<String, byte[]> record, Callback callback) {
        if (Arrays.equals(poison, record.value())) {
            KafkaException error = new KafkaException("broker rejected " + record.topic());
            if (callback != null) {
                callback.onCompletion(null, error);
            }
            CompletableFuture<RecordMetadata> future = new CompletableFuture<>();
            future.completeExceptionally(error);
            return future;
        }
        return super.send(record, callback);
    }
}
