package com.dialogstatekeeper.dialogstorage.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.dialogstatekeeper.dialogstorage.domain.StateRegistry;
import com.dialogstatekeeper.dialogstorage.proxy.StorageProxy;
import com.dialogstatekeeper.dialogstorage.proxy.StorageProxyFactory;
import com.dialogstatekeeper.dialogstorage.storage.InMemoryKeyValueStorage;
import com.dialogstatekeeper.dialogstorage.storage.KeyValueStorage;
import com.dialogstatekeeper.dialogstorage.storage.RedisKeyValueStorage;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

class DialogStorageConfigTest {

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner()
          .withUserConfiguration(PropertiesConfig.class, DialogStorageConfig.class);

  @Test
  void defaults_toInMemoryStorage() {
    runner
        .withPropertyValues("dialog.storage.bot-id=42")
        .run(
            ctx -> {
              assertThat(ctx).hasSingleBean(KeyValueStorage.class);
              assertThat(ctx.getBean(KeyValueStorage.class))
                  .isInstanceOf(InMemoryKeyValueStorage.class);

              StorageProxy proxy =
                  ctx.getBean(StorageProxyFactory.class).create(1L, 2L, "private", null);
              assertThat(proxy.scope().botId()).isEqualTo(42L);
            });
  }

  @Test
  void redisType_selectsRedisStorage() {
    runner
        .withBean(ReactiveStringRedisTemplate.class, () -> mock(ReactiveStringRedisTemplate.class))
        .withPropertyValues("dialog.storage.type=redis", "dialog.storage.data-ttl=PT1H")
        .run(
            ctx -> {
              assertThat(ctx).hasSingleBean(KeyValueStorage.class);
              assertThat(ctx.getBean(KeyValueStorage.class))
                  .isInstanceOf(RedisKeyValueStorage.class);
              assertThat(ctx.getBean(DialogStorageProperties.class).type())
                  .isEqualTo(DialogStorageProperties.StorageType.REDIS);
            });
  }

  @Test
  void redisType_withoutRedisClient_failsToStart() {
    runner
        .withPropertyValues("dialog.storage.type=redis")
        .run(ctx -> assertThat(ctx).hasFailed());
  }

  @Test
  void stateGroups_areRegisteredFromProperties() {
    runner
        .withPropertyValues(
            "dialog.storage.state-groups.main=start,finish",
            "dialog.storage.state-groups.menu=root")
        .run(
            ctx -> {
              StateRegistry registry = ctx.getBean(StateRegistry.class);
              assertThat(registry.size()).isEqualTo(2);
              assertThat(registry.resolve("main:finish").name()).isEqualTo("finish");
            });
  }

  @Configuration
  @EnableConfigurationProperties(DialogStorageProperties.class)
  static class PropertiesConfig {}
}
