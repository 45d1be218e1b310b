package com.dialogstatekeeper.dialogstorage.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Chat membership status as reported by the bot platform. */
public enum ChatMemberStatus {
  CREATOR("creator"),
  ADMINISTRATOR("administrator"),
  MEMBER("member"),
  RESTRICTED("restricted"),
  LEFT("left"),
  KICKED("kicked");

  private final String value;

  ChatMemberStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * @throws IllegalArgumentException if {@code value} is not a known status literal
   */
  @JsonCreator
  public static ChatMemberStatus fromValue(String value) {
    for (ChatMemberStatus status : values()) {
      if (status.value.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown chat member status: " + value);
  }
}
