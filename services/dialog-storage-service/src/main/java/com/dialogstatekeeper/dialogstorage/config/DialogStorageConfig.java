package com.dialogstatekeeper.dialogstorage.config;

import com.dialogstatekeeper.dialogstorage.domain.StateRegistry;
import com.dialogstatekeeper.dialogstorage.domain.StatesGroup;
import com.dialogstatekeeper.dialogstorage.proxy.StorageProxyFactory;
import com.dialogstatekeeper.dialogstorage.storage.InMemoryKeyValueStorage;
import com.dialogstatekeeper.dialogstorage.storage.KeyValueStorage;
import com.dialogstatekeeper.dialogstorage.storage.RedisKeyBuilder;
import com.dialogstatekeeper.dialogstorage.storage.RedisKeyValueStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

@Configuration
@Slf4j
public class DialogStorageConfig {

  /** Registry from {@code dialog.storage.state-groups}; declare your own bean to replace it. */
  @Bean
  @ConditionalOnMissingBean
  public StateRegistry stateRegistry(DialogStorageProperties properties) {
    List<StatesGroup> groups = new ArrayList<>();
    for (Map.Entry<String, List<String>> e : properties.stateGroups().entrySet()) {
      groups.add(StatesGroup.of(e.getKey(), e.getValue().toArray(String[]::new)));
    }
    StateRegistry registry = StateRegistry.of(groups);
    log.info("Registered {} dialog state groups", registry.size());
    return registry;
  }

  @Bean
  public KeyValueStorage keyValueStorage(
      DialogStorageProperties properties,
      ObjectProvider<ReactiveStringRedisTemplate> redis,
      ObjectProvider<ObjectMapper> objectMapper) {
    switch (properties.type()) {
      case REDIS:
        log.info(
            "Dialog storage: redis (prefix={}, ttl={})",
            properties.keyPrefix(),
            properties.dataTtl());
        return new RedisKeyValueStorage(
            redis.getObject(),
            objectMapper.getIfAvailable(ObjectMapper::new),
            new RedisKeyBuilder(properties.keyPrefix()),
            properties.dataTtl());
      case MEMORY:
      default:
        log.info("Dialog storage: in-memory");
        return new InMemoryKeyValueStorage();
    }
  }

  @Bean
  public StorageProxyFactory storageProxyFactory(
      KeyValueStorage storage, StateRegistry registry, DialogStorageProperties properties) {
    return new StorageProxyFactory(storage, registry, properties.botId());
  }
}
