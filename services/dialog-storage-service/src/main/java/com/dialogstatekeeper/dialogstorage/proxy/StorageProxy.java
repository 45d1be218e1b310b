package com.dialogstatekeeper.dialogstorage.proxy;

import com.dialogstatekeeper.dialogstorage.domain.Context;
import com.dialogstatekeeper.dialogstorage.domain.Stack;
import com.dialogstatekeeper.dialogstorage.domain.StateRegistry;
import com.dialogstatekeeper.dialogstorage.domain.UnknownIntentException;
import com.dialogstatekeeper.dialogstorage.domain.UnknownStateException;
import com.dialogstatekeeper.dialogstorage.storage.KeyValueStorage;
import com.dialogstatekeeper.dialogstorage.storage.StorageKey;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads and saves dialog contexts and stacks of one conversation.
 *
 * <p>Every load is a single read and every save or remove a single write; nothing is cached and
 * nothing is retried. Removal writes an empty record instead of deleting. Callers coordinate
 * concurrent updates of the same intent or stack themselves.
 */
@Slf4j
public class StorageProxy {

  static final String DESTINY_PREFIX = "aiogd";

  private final KeyValueStorage storage;
  private final ConversationScope scope;
  private final ContextMapper contextMapper;
  private final StackMapper stackMapper;

  public StorageProxy(KeyValueStorage storage, ConversationScope scope, StateRegistry registry) {
    this.storage = storage;
    this.scope = scope;
    this.contextMapper = new ContextMapper(registry);
    this.stackMapper = new StackMapper(new AccessSettingsMapper());
  }

  public ConversationScope scope() {
    return scope;
  }

  /**
   * Completes exceptionally with {@link UnknownIntentException} when nothing is stored for the id,
   * or with {@link UnknownStateException} when the stored state is not registered.
   */
  public CompletableFuture<Context> loadContext(String intentId) {
    StorageKey key = contextKey(intentId);
    log.debug("Loading context {}", key.destiny());
    return storage
        .getData(key)
        .thenApply(
            data -> {
              if (data == null || data.isEmpty()) {
                throw new UnknownIntentException("Context not found for intent id: " + intentId);
              }
              return contextMapper.fromRecord(intentId, data);
            });
  }

  public CompletableFuture<Void> saveContext(Context context) {
    if (context == null) {
      return CompletableFuture.completedFuture(null);
    }
    StorageKey key = contextKey(context.getId());
    log.debug("Saving context {}", key.destiny());
    return storage.setData(key, contextMapper.toRecord(context));
  }

  public CompletableFuture<Void> removeContext(String intentId) {
    StorageKey key = contextKey(intentId);
    log.debug("Removing context {}", key.destiny());
    return storage.setData(key, Map.of());
  }

  public CompletableFuture<Stack> loadStack() {
    return loadStack(Stack.DEFAULT_STACK_ID);
  }

  /** A stack that was never saved comes back empty, it is not an error. */
  public CompletableFuture<Stack> loadStack(String stackId) {
    StorageKey key = stackKey(stackId);
    log.debug("Loading stack {}", key.destiny());
    return storage
        .getData(key)
        .thenApply(
            data -> {
              if (data == null || data.isEmpty()) {
                return new Stack(stackId);
              }
              return stackMapper.fromRecord(stackId, data);
            });
  }

  /** A stack without intents and without a last message is stored as an empty record. */
  public CompletableFuture<Void> saveStack(Stack stack) {
    if (stack == null) {
      return CompletableFuture.completedFuture(null);
    }
    StorageKey key = stackKey(stack.getId());
    if (stack.isEmpty() && stack.getLastMessageId() == null) {
      log.debug("Saving empty stack {} as tombstone", key.destiny());
      return storage.setData(key, Map.of());
    }
    log.debug("Saving stack {}", key.destiny());
    return storage.setData(key, stackMapper.toRecord(stack));
  }

  public CompletableFuture<Void> removeStack(String stackId) {
    StorageKey key = stackKey(stackId);
    log.debug("Removing stack {}", key.destiny());
    return storage.setData(key, Map.of());
  }

  StorageKey contextKey(String intentId) {
    return key("context", intentId);
  }

  StorageKey stackKey(String stackId) {
    return key("stack", stackId);
  }

  private StorageKey key(String kind, String id) {
    return new StorageKey(
        scope.botId(),
        scope.chatId(),
        scope.userId(),
        scope.threadId(),
        DESTINY_PREFIX + ":" + kind + ":" + id);
  }
}
