package com.openrangelabs.donpetre.credentials.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Filters, sorting and pagination for listing stored keys. {@code cursor}, when present,
 * takes precedence over {@code offset}.
 */
@Value
@Builder(toBuilder = true)
public class KeyQueryOptions {

    Provider provider;
    KeyStatus status;
    KeyType keyType;
    List<String> tags;
    String search;
    @Builder.Default
    SortField sortBy = SortField.CREATED_AT;
    @Builder.Default
    SortOrder sortOrder = SortOrder.DESC;
    Integer limit;
    @Builder.Default
    int offset = 0;
    String cursor;

    public static KeyQueryOptions all() {
        return KeyQueryOptions.builder().build();
    }

    public enum SortField {
        NAME, CREATED_AT, LAST_USED, PROVIDER
    }

    public enum SortOrder {
        ASC, DESC
    }
}
