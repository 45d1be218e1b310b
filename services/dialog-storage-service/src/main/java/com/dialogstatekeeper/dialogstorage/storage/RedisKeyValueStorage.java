package com.dialogstatekeeper.dialogstorage.storage;

import com.dialogstatekeeper.dialogstorage.domain.DialogStorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import reactor.core.publisher.Mono;

/**
 * Stores each record as one JSON string value.
 *
 * <p>Values nested in a record carry their Java type where JSON alone would lose it, so a {@code
 * Long} reads back as a {@code Long}. Only JDK value types and this service's own types are
 * accepted when reading. Writing an empty mapping deletes the key. When {@code dataTtl} is set,
 * every write refreshes the expiry.
 */
@Slf4j
public class RedisKeyValueStorage implements KeyValueStorage {

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {};

  private static final PolymorphicTypeValidator TYPE_VALIDATOR =
      BasicPolymorphicTypeValidator.builder()
          .allowIfSubType("java.lang.")
          .allowIfSubType("java.math.")
          .allowIfSubType("java.time.")
          .allowIfSubType("java.util.")
          .allowIfSubType("com.dialogstatekeeper.")
          .build();

  private final ReactiveStringRedisTemplate redis;
  private final ObjectWriter writer;
  private final ObjectReader reader;
  private final RedisKeyBuilder keyBuilder;
  private final Duration dataTtl;

  public RedisKeyValueStorage(
      ReactiveStringRedisTemplate redis,
      ObjectMapper objectMapper,
      RedisKeyBuilder keyBuilder,
      Duration dataTtl) {
    ObjectMapper recordMapper =
        objectMapper
            .copy()
            .activateDefaultTyping(TYPE_VALIDATOR, ObjectMapper.DefaultTyping.JAVA_LANG_OBJECT);
    this.redis = redis;
    this.writer = recordMapper.writerFor(MAP_TYPE);
    this.reader = recordMapper.readerFor(MAP_TYPE);
    this.keyBuilder = keyBuilder;
    this.dataTtl = dataTtl;
  }

  @Override
  public CompletableFuture<Map<String, Object>> getData(StorageKey key) {
    String redisKey = keyBuilder.build(key);
    log.debug("Redis GET {}", redisKey);
    return redis
        .opsForValue()
        .get(redisKey)
        .map(this::decode)
        .defaultIfEmpty(new LinkedHashMap<>())
        .toFuture();
  }

  @Override
  public CompletableFuture<Void> setData(StorageKey key, Map<String, Object> data) {
    String redisKey = keyBuilder.build(key);
    if (data == null || data.isEmpty()) {
      log.debug("Redis DEL {}", redisKey);
      return redis.delete(redisKey).then().toFuture();
    }
    log.debug("Redis SET {}", redisKey);
    return Mono.fromCallable(() -> encode(data))
        .flatMap(
            json ->
                dataTtl == null
                    ? redis.opsForValue().set(redisKey, json)
                    : redis.opsForValue().set(redisKey, json, dataTtl))
        .then()
        .toFuture();
  }

  private String encode(Map<String, Object> data) {
    try {
      return writer.writeValueAsString(plainCopy(data));
    } catch (JsonProcessingException e) {
      throw new DialogStorageException("Failed to serialize dialog record", e);
    }
  }

  private Map<String, Object> decode(String json) {
    try {
      return reader.readValue(json);
    } catch (JsonProcessingException e) {
      throw new DialogStorageException("Failed to deserialize dialog record", e);
    }
  }

  // Immutable JDK collections have no constructor Jackson can read them back with.
  private static Map<String, Object> plainCopy(Map<?, ?> map) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : map.entrySet()) {
      copy.put(String.valueOf(e.getKey()), plain(e.getValue()));
    }
    return copy;
  }

  private static Object plain(Object value) {
    if (value instanceof Map<?, ?> map) {
      return plainCopy(map);
    }
    if (value instanceof Set<?> set) {
      Set<Object> copy = new LinkedHashSet<>();
      for (Object item : set) {
        copy.add(plain(item));
      }
      return copy;
    }
    if (value instanceof Collection<?> collection) {
      List<Object> copy = new ArrayList<>(collection.size());
      for (Object item : collection) {
        copy.add(plain(item));
      }
      return copy;
    }
    return value;
  }
}
