package com.openrangelabs.donpetre.credentials.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Point-in-time counters for the storage service.
 */
@Value
@Builder
public class StorageMetrics {

    StorageState state;
    long totalKeys;
    int cachedRecords;
    long cacheHits;
    long cacheMisses;
    Map<String, Long> operations;
    Map<String, Long> errors;
}
