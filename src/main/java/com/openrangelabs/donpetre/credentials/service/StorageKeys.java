package com.openrangelabs.donpetre.credentials.service;

/**
 * Collection and key names used in the index and blob stores.
 */
final class StorageKeys {

    static final String METADATA_COLLECTION = "api_keys";
    static final String BLOB_PREFIX = "api_key_";
    static final String HASH_PREFIX = "api_key_hash_";

    private StorageKeys() {
    }

    static String blobKey(String id) {
        return BLOB_PREFIX + id;
    }

    static String hashKey(String keyHash) {
        return HASH_PREFIX + keyHash;
    }
}
