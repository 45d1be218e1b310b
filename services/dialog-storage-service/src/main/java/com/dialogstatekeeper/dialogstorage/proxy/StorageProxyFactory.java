package com.dialogstatekeeper.dialogstorage.proxy;

import com.dialogstatekeeper.dialogstorage.domain.StateRegistry;
import com.dialogstatekeeper.dialogstorage.storage.KeyValueStorage;

/** Creates a {@link StorageProxy} per incoming update, sharing storage and state registry. */
public class StorageProxyFactory {

  private final KeyValueStorage storage;
  private final StateRegistry registry;
  private final long botId;

  public StorageProxyFactory(KeyValueStorage storage, StateRegistry registry, long botId) {
    this.storage = storage;
    this.registry = registry;
    this.botId = botId;
  }

  public StorageProxy create(long chatId, long userId, String chatType, Long threadId) {
    return new StorageProxy(
        storage, new ConversationScope(botId, chatId, userId, chatType, threadId), registry);
  }

  public StateRegistry registry() {
    return registry;
  }
}
