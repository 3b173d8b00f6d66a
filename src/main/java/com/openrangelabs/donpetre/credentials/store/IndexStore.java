package com.openrangelabs.donpetre.credentials.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Queryable document store holding the unencrypted metadata records. Every record has
 * a textual {@code id} field, unique within its collection.
 */
public interface IndexStore {

    /**
     * Inserts or replaces the record with the same id.
     */
    Mono<Void> put(String collection, ObjectNode record);

    Mono<ObjectNode> get(String collection, String id);

    /**
     * Records whose {@code field} equals {@code value}; for array fields, records whose
     * array contains it.
     */
    Flux<ObjectNode> query(String collection, String field, String value, QueryOptions options);

    Flux<ObjectNode> getAll(String collection);

    /**
     * @return true if a record was removed
     */
    Mono<Boolean> delete(String collection, String id);

    Mono<Boolean> ping();
}
