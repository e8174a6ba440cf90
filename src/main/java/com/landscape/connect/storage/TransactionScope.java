package com.landscape.connect.storage;

/**
 * Capability to open a transactional unit of work against the entity store.
 * Passed to admission so a single minimum and its cache writes commit or roll back together.
 */
@FunctionalInterface
public interface TransactionScope {

    /**
     * Opens a new transaction.
     *
     * @throws StoreException if the transaction cannot be started
     */
    StoreTransaction begin();
}
