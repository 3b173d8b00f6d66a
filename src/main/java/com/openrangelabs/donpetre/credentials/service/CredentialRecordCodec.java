package com.openrangelabs.donpetre.credentials.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openrangelabs.donpetre.credentials.exception.CredentialStorageException;
import com.openrangelabs.donpetre.credentials.model.CredentialMetadata;
import com.openrangelabs.donpetre.credentials.model.EncryptedCredential;
import org.springframework.stereotype.Component;

/**
 * Converts credential records to and from the JSON documents kept in the stores.
 */
@Component
public class CredentialRecordCodec {

    private static final String ID_FIELD = "id";

    private final ObjectMapper objectMapper;

    public CredentialRecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode metadataNode(CredentialMetadata metadata) {
        return objectMapper.valueToTree(metadata);
    }

    public CredentialMetadata metadata(JsonNode node) {
        return read(node, CredentialMetadata.class);
    }

    public ObjectNode recordNode(EncryptedCredential record) {
        return objectMapper.valueToTree(record);
    }

    public EncryptedCredential record(JsonNode node) {
        return read(node, EncryptedCredential.class);
    }

    /**
     * Value of a duplicate-index entry: the id of the record holding the key.
     */
    public JsonNode hashEntry(String id) {
        return objectMapper.createObjectNode().put(ID_FIELD, id);
    }

    public String hashEntryId(JsonNode entry) {
        JsonNode id = entry.get(ID_FIELD);
        return id == null ? null : id.asText();
    }

    private <T> T read(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (Exception e) {
            throw new CredentialStorageException("Stored " + type.getSimpleName() + " is unreadable", e);
        }
    }
}
