package com.dialogstatekeeper.dialogstorage.proxy;

import com.dialogstatekeeper.dialogstorage.domain.AccessSettings;
import com.dialogstatekeeper.dialogstorage.domain.ChatMemberStatus;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts {@link AccessSettings} to and from the nested {@code access_settings} record.
 *
 * <p>{@code null} settings are written as {@code null} and an absent or empty record reads back as
 * {@code null}.
 */
public class AccessSettingsMapper {

  static final String USER_IDS = "user_ids";
  static final String MEMBER_STATUS = "member_status";
  static final String CUSTOM = "custom";

  /**
   * @throws IllegalArgumentException if {@code member_status} is not a known status
   */
  public AccessSettings parse(Object raw) {
    Map<String, Object> record = RawValues.map(raw);
    if (record.isEmpty()) {
      return null;
    }
    return new AccessSettings(
        RawValues.longs(record.get(USER_IDS)),
        memberStatus(record.get(MEMBER_STATUS)),
        record.get(CUSTOM));
  }

  public Map<String, Object> dump(AccessSettings settings) {
    if (settings == null) {
      return null;
    }
    Map<String, Object> record = new LinkedHashMap<>();
    record.put(USER_IDS, settings.userIds());
    record.put(MEMBER_STATUS, settings.memberStatus());
    record.put(CUSTOM, settings.custom());
    return record;
  }

  private static ChatMemberStatus memberStatus(Object raw) {
    if (raw == null) {
      return null;
    }
    if (raw instanceof ChatMemberStatus status) {
      return status;
    }
    String value = raw.toString();
    if (value.isEmpty()) {
      return null;
    }
    return ChatMemberStatus.fromValue(value);
  }
}
