package com.dialogstatekeeper.dialogstorage.domain;

import java.util.List;

/**
 * Who may interact with a dialog stack.
 *
 * @param userIds allowed users, empty means no explicit allow-list
 * @param memberStatus required chat membership status, {@code null} means no requirement
 * @param custom caller-defined data, stored as-is
 */
public record AccessSettings(List<Long> userIds, ChatMemberStatus memberStatus, Object custom) {

  public AccessSettings {
    userIds = userIds == null ? List.of() : List.copyOf(userIds);
  }

  public static AccessSettings forUsers(List<Long> userIds) {
    return new AccessSettings(userIds, null, null);
  }
}
