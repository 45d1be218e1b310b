package com.dialogstatekeeper.dialogstorage.storage;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local storage backed by a {@link ConcurrentHashMap}.
 *
 * <p>Good for tests and single-instance bots. Records are lost on restart; use {@link
 * RedisKeyValueStorage} for anything else.
 */
public class InMemoryKeyValueStorage implements KeyValueStorage {

  private final ConcurrentMap<StorageKey, Map<String, Object>> map = new ConcurrentHashMap<>();

  @Override
  public CompletableFuture<Map<String, Object>> getData(StorageKey key) {
    Map<String, Object> data = map.get(key);
    return CompletableFuture.completedFuture(
        data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data));
  }

  @Override
  public CompletableFuture<Void> setData(StorageKey key, Map<String, Object> data) {
    if (data == null || data.isEmpty()) {
      map.remove(key);
    } else {
      map.put(key, new LinkedHashMap<>(data));
    }
    return CompletableFuture.completedFuture(null);
  }

  public int size() {
    return map.size();
  }
}
