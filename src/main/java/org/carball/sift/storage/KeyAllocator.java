package org.carball.sift.storage;

/**
 * Hands out synthetic primary key values, unique per table.
 */
@FunctionalInterface
public interface KeyAllocator {

    long next(String tableName);
}
