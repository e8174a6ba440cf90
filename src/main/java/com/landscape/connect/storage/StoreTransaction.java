package com.landscape.connect.storage;

/**
 * A single store transaction. Closing a transaction that was neither committed
 * nor rolled back rolls it back.
 *
 * <pre>
 * try (StoreTransaction tx = store.begin()) {
 *     store.bulkWriteDistances(entries);
 *     tx.commit();
 * }
 * </pre>
 */
public interface StoreTransaction extends AutoCloseable {

    void commit();

    void rollback();

    /**
     * Returns true until the transaction is committed or rolled back.
     */
    boolean isActive();

    @Override
    default void close() {
        if (isActive()) {
            rollback();
        }
    }
}
