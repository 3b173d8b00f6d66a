package com.openrangelabs.donpetre.credentials.store;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link BlobStore} held in memory, with deep copies in both directions.
 */
public class InMemoryBlobStore implements BlobStore {

    private final Map<String, JsonNode> values = new ConcurrentHashMap<>();

    @Override
    public Mono<JsonNode> get(String key) {
        return Mono.fromSupplier(() -> {
            JsonNode value = values.get(key);
            return value == null ? null : value.deepCopy();
        });
    }

    @Override
    public Mono<Void> set(String key, JsonNode value) {
        return Mono.fromRunnable(() -> values.put(key, value.deepCopy()));
    }

    @Override
    public Mono<Boolean> remove(String key) {
        return Mono.fromSupplier(() -> values.remove(key) != null);
    }

    @Override
    public Mono<Map<String, JsonNode>> getBatch(Collection<String> keys) {
        return Mono.fromSupplier(() -> {
            Map<String, JsonNode> found = new LinkedHashMap<>();
            for (String key : keys) {
                JsonNode value = values.get(key);
                if (value != null) {
                    found.put(key, value.deepCopy());
                }
            }
            return found;
        });
    }

    @Override
    public Mono<Void> setBatch(Map<String, JsonNode> batch) {
        return Mono.fromRunnable(() -> batch.forEach((key, value) -> values.put(key, value.deepCopy())));
    }

    @Override
    public Mono<Boolean> ping() {
        return Mono.just(true);
    }
}
