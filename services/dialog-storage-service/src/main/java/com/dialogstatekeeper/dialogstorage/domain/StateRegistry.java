package com.dialogstatekeeper.dialogstorage.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable lookup of all state groups known to the bot.
 *
 * <p>Built once at startup. Restored state text is resolved against it, so every restored {@link
 * State} is one of the instances registered here.
 */
public final class StateRegistry {

  private final Map<String, StatesGroup> byName;

  private StateRegistry(Map<String, StatesGroup> byName) {
    this.byName = byName;
  }

  public static StateRegistry of(StatesGroup... groups) {
    return of(List.of(groups));
  }

  public static StateRegistry of(Collection<StatesGroup> groups) {
    Map<String, StatesGroup> map = new LinkedHashMap<>();
    for (StatesGroup group : groups) {
      if (map.putIfAbsent(group.name(), group) != null) {
        throw new IllegalArgumentException("Duplicate state group: " + group.name());
      }
    }
    return new StateRegistry(Collections.unmodifiableMap(map));
  }

  public static StateRegistry empty() {
    return new StateRegistry(Map.of());
  }

  public Collection<StatesGroup> groups() {
    return byName.values();
  }

  public StatesGroup group(String name) {
    return byName.get(name);
  }

  public int size() {
    return byName.size();
  }

  /**
   * Resolve {@code "<group>:<name>"} to its registered state.
   *
   * @throws UnknownStateException if the group is not registered or has no such state
   */
  public State resolve(String state) {
    int sep = state.indexOf(State.SEPARATOR);
    String groupName = sep < 0 ? state : state.substring(0, sep);
    StatesGroup group = byName.get(groupName);
    if (group == null) {
      throw new UnknownStateException("Unknown state group " + groupName);
    }
    for (State candidate : group.states()) {
      if (candidate.state().equals(state)) {
        return candidate;
      }
    }
    throw new UnknownStateException("Unknown state " + state);
  }
}
