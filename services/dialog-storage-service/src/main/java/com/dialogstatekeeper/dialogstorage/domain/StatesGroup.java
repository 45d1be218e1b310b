package com.dialogstatekeeper.dialogstorage.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Named, ordered set of states belonging to one dialog. */
public record StatesGroup(String name, List<State> states) {

  public StatesGroup {
    states = List.copyOf(states);
    for (State s : states) {
      if (!s.group().equals(name)) {
        throw new IllegalArgumentException(
            "State " + s.state() + " does not belong to group " + name);
      }
    }
  }

  public static StatesGroup of(String name, String... stateNames) {
    List<State> states = new ArrayList<>(stateNames.length);
    for (String stateName : stateNames) {
      states.add(new State(name, stateName));
    }
    return new StatesGroup(name, states);
  }

  public Optional<State> state(String stateName) {
    return states.stream().filter(s -> s.name().equals(stateName)).findFirst();
  }
}
