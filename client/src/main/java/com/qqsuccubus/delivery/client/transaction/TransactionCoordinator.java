package com.qqsuccubus.delivery.client.transaction;

import com.qqsuccubus.delivery.client.error.KafkaDeliveryException;
import com.qqsuccubus.delivery.client.error.TransactionStateException;
import com.qqsuccubus.delivery.core.model.DeliveryReceipt;
import com.qqsuccubus.delivery.core.model.TransactionState;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives the transaction lifecycle of one transactional producer.
 * <p>
 * State machine:
 * <pre>
 * NOT_INITIALIZED --init--&gt; READY --begin--&gt; IN_TRANSACTION --commit/abort--&gt; READY
 * init/begin/commit failure --&gt; ERROR --abort or resetFromErrorState--&gt; READY
 * </pre>
 * </p>
 * <p>
 * State transitions are guarded by one lock; {@link #executeInTransaction} additionally
 * holds a fair lock for the whole unit of work, so concurrent callers never interleave
 * inside the same broker transaction.
 * </p>
 */
public class TransactionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(TransactionCoordinator.class);

    private final Producer<String, byte[]> producer;
    private final String transactionalId;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final ReentrantLock executionLock = new ReentrantLock(true);

    private volatile TransactionState state = TransactionState.NOT_INITIALIZED;
    private volatile boolean initialized;

    public TransactionCoordinator(Producer<String, byte[]> producer, String transactionalId) {
        this.producer = producer;
        this.transactionalId = transactionalId;
    }

    public TransactionState getState() {
        return state;
    }

    public String getTransactionalId() {
        return transactionalId;
    }

    /**
     * Registers the transactional id with the broker, fencing older producers that used it.
     *
     * @throws TransactionStateException when already initialized
     */
    public void initTransactions() {
        stateLock.lock();
        try {
            requireState("init transactions", TransactionState.NOT_INITIALIZED);
            try {
                producer.initTransactions();
                initialized = true;
                state = TransactionState.READY;
                log.info("Transactions initialized for {}", transactionalId);
            } catch (RuntimeException e) {
                state = TransactionState.ERROR;
                log.error("Failed to initialize transactions for {}", transactionalId, e);
                throw e;
            }
        } finally {
            stateLock.unlock();
        }
    }

    public void beginTransaction() {
        stateLock.lock();
        try {
            requireState("begin transaction", TransactionState.READY);
            try {
                producer.beginTransaction();
                state = TransactionState.IN_TRANSACTION;
            } catch (RuntimeException e) {
                state = TransactionState.ERROR;
                log.error("Failed to begin transaction for {}", transactionalId, e);
                throw e;
            }
        } finally {
            stateLock.unlock();
        }
    }

    public void commitTransaction() {
        stateLock.lock();
        try {
            requireState("commit transaction", TransactionState.IN_TRANSACTION);
            try {
                producer.commitTransaction();
                state = TransactionState.READY;
            } catch (RuntimeException e) {
                state = TransactionState.ERROR;
                log.error("Failed to commit transaction for {}", transactionalId, e);
                throw e;
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Aborts the open transaction. Never throws.
     * <p>
     * Legal from {@code IN_TRANSACTION} and from {@code ERROR}, where a failed commit may
     * have left the broker transaction open. In any other state the call is ignored.
     * A failed abort is logged and leaves the coordinator in {@code ERROR}.
     * </p>
     */
    public void abortTransaction() {
        stateLock.lock();
        try {
            if (state != TransactionState.IN_TRANSACTION && state != TransactionState.ERROR) {
                log.debug("Abort ignored for {} in state {}", transactionalId, state);
                return;
            }
            try {
                producer.abortTransaction();
                state = TransactionState.READY;
                log.info("Transaction aborted for {}", transactionalId);
            } catch (RuntimeException e) {
                state = TransactionState.ERROR;
                log.error("Failed to abort transaction for {}", transactionalId, e);
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Leaves {@code ERROR} after the caller has dealt with the failure.
     * Returns to {@code READY}, or to {@code NOT_INITIALIZED} when initialization never succeeded.
     */
    public void resetFromErrorState() {
        stateLock.lock();
        try {
            requireState("reset", TransactionState.ERROR);
            state = initialized ? TransactionState.READY : TransactionState.NOT_INITIALIZED;
            log.warn("Transaction state of {} reset to {}", transactionalId, state);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Sends a record inside the open transaction and waits for the broker ack.
     *
     * @param record record to send
     * @return receipt of the acknowledged record
     */
    public DeliveryReceipt send(ProducerRecord<String, byte[]> record) {
        if (state != TransactionState.IN_TRANSACTION) {
            throw new TransactionStateException("send", state, "no open transaction");
        }
        try {
            return DeliveryReceipt.from(producer.send(record).get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new KafkaDeliveryException("Transactional send to " + record.topic() + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KafkaDeliveryException("Interrupted while sending to " + record.topic(), e);
        }
    }

    /**
     * Runs {@code work} inside a fresh transaction: initializes on first use, begins, runs,
     * commits. Any failure, including a failed commit, aborts and rethrows the original error.
     *
     * @param work unit of work
     * @param <T>  result type
     * @return result of {@code work}
     */
    public <T> T executeInTransaction(TransactionalWork<T> work) {
        executionLock.lock();
        try {
            if (state == TransactionState.NOT_INITIALIZED) {
                initTransactions();
            }
            beginTransaction();
            try {
                T result = work.execute(this);
                commitTransaction();
                return result;
            } catch (Throwable e) {
                abortTransaction();
                throw propagate(e);
            }
        } finally {
            executionLock.unlock();
        }
    }

    private void requireState(String operation, TransactionState expected) {
        if (state != expected) {
            throw new TransactionStateException(operation, state, "expected " + expected);
        }
    }

    private static RuntimeException propagate(Throwable e) {
        if (e instanceof RuntimeException runtime) {
            return runtime;
        }
        if (e instanceof Error error) {
            throw error;
        }
        return new KafkaDeliveryException("Transactional work failed", e);
    }
}
