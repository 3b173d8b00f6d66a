package com.openrangelabs.donpetre.credentials.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * {@link IndexStore} held in memory. Records are deep-copied on the way in and out so
 * callers never share mutable state with the store.
 */
public class InMemoryIndexStore implements IndexStore {

    private static final String ID_FIELD = "id";

    private final Map<String, Map<String, ObjectNode>> collections = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> put(String collection, ObjectNode record) {
        return Mono.fromRunnable(() -> {
            JsonNode id = record.get(ID_FIELD);
            if (id == null || !id.isTextual() || id.asText().isEmpty()) {
                throw new IllegalArgumentException("Record in " + collection + " has no id");
            }
            collection(collection).put(id.asText(), record.deepCopy());
        });
    }

    @Override
    public Mono<ObjectNode> get(String collection, String id) {
        return Mono.fromSupplier(() -> {
            ObjectNode record = collection(collection).get(id);
            return record == null ? null : record.deepCopy();
        });
    }

    @Override
    public Flux<ObjectNode> query(String collection, String field, String value, QueryOptions options) {
        return Flux.defer(() -> {
            QueryOptions opts = options != null ? options : QueryOptions.unbounded();
            Stream<ObjectNode> matches = snapshot(collection).stream()
                    .filter(record -> matches(record.get(field), value))
                    .skip(opts.getOffset());
            if (opts.getLimit() != null) {
                matches = matches.limit(opts.getLimit());
            }
            return Flux.fromStream(matches.map(ObjectNode::deepCopy));
        });
    }

    @Override
    public Flux<ObjectNode> getAll(String collection) {
        return Flux.defer(() -> Flux.fromIterable(snapshot(collection)).map(ObjectNode::deepCopy));
    }

    @Override
    public Mono<Boolean> delete(String collection, String id) {
        return Mono.fromSupplier(() -> collection(collection).remove(id) != null);
    }

    @Override
    public Mono<Boolean> ping() {
        return Mono.just(true);
    }

    private Map<String, ObjectNode> collection(String name) {
        return collections.computeIfAbsent(name, n -> new ConcurrentHashMap<>());
    }

    private List<ObjectNode> snapshot(String name) {
        return new ArrayList<>(collection(name).values());
    }

    private static boolean matches(JsonNode node, String value) {
        if (node == null || node.isNull()) {
            return value == null;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.asText().equals(value)) {
                    return true;
                }
            }
            return false;
        }
        return node.asText().equals(value);
    }
}
