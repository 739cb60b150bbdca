/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.route;

import java.util.List;

/**
 * Time-bucketed layout handed to the storage sink.
 *
 * @param bucketDays    width of one partition bucket, in days; at least 1
 * @param retentionDays how long buckets are kept, in days; 0 is allowed
 * @param indexFields   fields the sink indexes partitions by
 */
public record Partitioning(int bucketDays, int retentionDays, List<String> indexFields) {

    public static final String TIME_FIELD = "ts";
    public static final int DEFAULT_BUCKET_DAYS = 1;
    public static final int DEFAULT_RETENTION_DAYS = 30;

    public Partitioning {
        if (bucketDays <= 0) {
            throw new IllegalArgumentException("Partition bucket must be at least one day, got " + bucketDays);
        }
        if (retentionDays < 0) {
            throw new IllegalArgumentException("Retention must not be negative, got " + retentionDays);
        }
        indexFields = List.copyOf(indexFields);
    }

    public static Partitioning byTime(int bucketDays, int retentionDays) {
        return new Partitioning(bucketDays, retentionDays, List.of(TIME_FIELD));
    }

    public static Partitioning defaults() {
        return byTime(DEFAULT_BUCKET_DAYS, DEFAULT_RETENTION_DAYS);
    }
}
