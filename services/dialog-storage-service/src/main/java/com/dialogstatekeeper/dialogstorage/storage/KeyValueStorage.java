package com.dialogstatekeeper.dialogstorage.storage;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Flat key-value store for dialog records.
 *
 * <p>An empty mapping means "no record": {@link #getData} returns it for unknown keys and writing
 * it clears the record. Implementations persist mappings verbatim and do not interpret the fields.
 */
public interface KeyValueStorage {

  CompletableFuture<Map<String, Object>> getData(StorageKey key);

  CompletableFuture<Void> setData(StorageKey key, Map<String, Object> data);
}
