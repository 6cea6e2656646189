package com.poc.vmmigration.util;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates migration IDs from the wall clock in milliseconds.
 * IDs are strictly increasing within the process, so two migrations created
 * in the same millisecond still get distinct, ordered IDs.
 */
public final class MigrationIdGenerator {

    private static final AtomicLong LAST_ID = new AtomicLong();

    private MigrationIdGenerator() {
        // Utility class - prevent instantiation
    }

    public static String nextId() {
        long now = System.currentTimeMillis();
        return Long.toString(LAST_ID.updateAndGet(last -> Math.max(last + 1, now)));
    }
}
