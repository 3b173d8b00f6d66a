package com.openrangelabs.donpetre.credentials.store;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueryOptions {

    Integer limit;
    @Builder.Default
    int offset = 0;

    public static QueryOptions unbounded() {
        return QueryOptions.builder().build();
    }
}
