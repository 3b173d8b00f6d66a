package com.openrangelabs.donpetre.credentials.store;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;

/**
 * Key/value store for JSON values: the encrypted records and the key-hash index.
 */
public interface BlobStore {

    Mono<JsonNode> get(String key);

    Mono<Void> set(String key, JsonNode value);

    /**
     * @return true if a value was removed
     */
    Mono<Boolean> remove(String key);

    /**
     * Values for the keys that exist; missing keys are absent from the map.
     */
    Mono<Map<String, JsonNode>> getBatch(Collection<String> keys);

    Mono<Void> setBatch(Map<String, JsonNode> values);

    Mono<Boolean> ping();
}
