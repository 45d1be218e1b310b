package com.dialogstatekeeper.dialogstorage.domain;

import java.util.Objects;

/**
 * A single dialog state, identified by {@code "<group>:<name>"}.
 *
 * <p>Instances are owned by a {@link StatesGroup}; restored contexts always point at the registered
 * instance.
 */
public record State(String group, String name) {

  public static final String SEPARATOR = ":";

  public State {
    Objects.requireNonNull(group, "group");
    Objects.requireNonNull(name, "name");
    if (group.isBlank() || group.contains(SEPARATOR)) {
      throw new IllegalArgumentException("Invalid state group name: " + group);
    }
  }

  /** Canonical text stored for this state. */
  public String state() {
    return group + SEPARATOR + name;
  }

  @Override
  public String toString() {
    return state();
  }
}
