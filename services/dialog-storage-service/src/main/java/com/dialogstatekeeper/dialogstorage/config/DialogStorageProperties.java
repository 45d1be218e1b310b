package com.dialogstatekeeper.dialogstorage.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param type storage backend, {@link StorageType#MEMORY} when not set
 * @param botId bot identity used in every storage key
 * @param keyPrefix first segment of Redis keys
 * @param dataTtl expiry of Redis records, {@code null} keeps them forever
 * @param stateGroups group name to local state names, in declaration order
 */
@ConfigurationProperties(prefix = "dialog.storage")
public record DialogStorageProperties(
    StorageType type,
    long botId,
    String keyPrefix,
    Duration dataTtl,
    Map<String, List<String>> stateGroups) {

  public DialogStorageProperties {
    if (type == null) {
      type = StorageType.MEMORY;
    }
    if (keyPrefix == null || keyPrefix.isBlank()) {
      keyPrefix = "fsm";
    }
    stateGroups = stateGroups == null ? Map.of() : stateGroups;
  }

  public enum StorageType {
    MEMORY,
    REDIS
  }
}
