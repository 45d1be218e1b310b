package com.dialogstatekeeper.dialogstorage.storage;

/**
 * Renders {@link StorageKey} as a Redis key.
 *
 * <p>Layout: {@code <prefix>:<bot>:<chat>[:<thread>]:<user>:<destiny>:data}.
 */
public class RedisKeyBuilder {

  private static final String SEPARATOR = ":";
  private static final String DATA_PART = "data";

  private final String prefix;

  public RedisKeyBuilder(String prefix) {
    this.prefix = prefix == null || prefix.isBlank() ? "fsm" : prefix.trim();
  }

  public String build(StorageKey key) {
    StringBuilder sb = new StringBuilder(prefix);
    sb.append(SEPARATOR).append(key.botId());
    sb.append(SEPARATOR).append(key.chatId());
    if (key.threadId() != null) {
      sb.append(SEPARATOR).append(key.threadId());
    }
    sb.append(SEPARATOR).append(key.userId());
    sb.append(SEPARATOR).append(key.destiny());
    sb.append(SEPARATOR).append(DATA_PART);
    return sb.toString();
  }
}
