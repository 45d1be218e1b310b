package com.dialogstatekeeper.dialogstorage.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dialogstatekeeper.dialogstorage.domain.AccessSettings;
import com.dialogstatekeeper.dialogstorage.domain.ChatMemberStatus;
import com.dialogstatekeeper.dialogstorage.domain.Context;
import com.dialogstatekeeper.dialogstorage.domain.Stack;
import com.dialogstatekeeper.dialogstorage.domain.UnknownIntentException;
import com.dialogstatekeeper.dialogstorage.proxy.StorageProxy;
import com.dialogstatekeeper.dialogstorage.proxy.StorageProxyFactory;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@Testcontainers
@SpringBootTest
class RedisDialogStorageIT {

  @Container
  static final GenericContainer<?> redis =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

  @DynamicPropertySource
  static void props(DynamicPropertyRegistry r) {
    r.add("spring.data.redis.host", redis::getHost);
    r.add("spring.data.redis.port", () -> redis.getMappedPort(6379));
    r.add("dialog.storage.type", () -> "redis");
    r.add("dialog.storage.bot-id", () -> "555");
    r.add("dialog.storage.state-groups[Main]", () -> "step1,step2");
  }

  @Autowired StorageProxyFactory factory;

  @Autowired StringRedisTemplate plainRedis;

  private StorageProxy proxy;

  @BeforeEach
  void setUp() {
    proxy = factory.create(10L, 20L, "private", null);
  }

  @Test
  void context_roundTrip_throughRedis() {
    Context context =
        new Context("ctx1", "", factory.registry().resolve("Main:step2"), Map.of("source", "it"));
    context.getDialogData().put("page", "2");
    context.getDialogData().put("message_id", 7L);

    proxy.saveContext(context).join();

    assertThat(plainRedis.opsForValue().get("fsm:555:10:20:aiogd:context:ctx1:data"))
        .contains("\"state\":\"Main:step2\"");
    Context loaded = proxy.loadContext("ctx1").join();
    assertThat(loaded).isEqualTo(context);
    assertThat(loaded.getState()).isSameAs(factory.registry().resolve("Main:step2"));
  }

  @Test
  void stack_roundTrip_throughRedis() {
    Stack stack = new Stack("it-stack");
    stack.push(factory.registry().resolve("Main:step1"), null);
    stack.setLastMessageId(101L);
    stack.setAccessSettings(
        new AccessSettings(List.of(1L, 2L), ChatMemberStatus.ADMINISTRATOR, 99L));

    proxy.saveStack(stack).join();

    assertThat(plainRedis.opsForValue().get("fsm:555:10:20:aiogd:stack:it-stack:data"))
        .contains("administrator");
    assertThat(proxy.loadStack("it-stack").join()).isEqualTo(stack);
  }

  @Test
  void remove_deletesRedisKey() {
    Context context = new Context("ctx2", "", factory.registry().resolve("Main:step1"), null);
    proxy.saveContext(context).join();

    proxy.removeContext("ctx2").join();

    assertThat(plainRedis.hasKey("fsm:555:10:20:aiogd:context:ctx2:data")).isFalse();
    assertThatThrownBy(() -> proxy.loadContext("ctx2").join())
        .hasCauseInstanceOf(UnknownIntentException.class);
  }
}
