package com.dialogstatekeeper.dialogstorage.domain;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/** Data of one running dialog (intent). */
public class Context {

  private final String id;
  private final String stackId;
  private State state;
  private Object startData;
  private final Map<String, Object> dialogData;
  private final Map<String, Object> widgetData;

  public Context(String id, String stackId, State state, Object startData) {
    this(id, stackId, state, startData, new HashMap<>(), new HashMap<>());
  }

  public Context(
      String id,
      String stackId,
      State state,
      Object startData,
      Map<String, Object> dialogData,
      Map<String, Object> widgetData) {
    this.id = Objects.requireNonNull(id, "id");
    this.stackId = Objects.requireNonNull(stackId, "stackId");
    this.state = Objects.requireNonNull(state, "state");
    this.startData = startData;
    this.dialogData = dialogData == null ? new HashMap<>() : new HashMap<>(dialogData);
    this.widgetData = widgetData == null ? new HashMap<>() : new HashMap<>(widgetData);
  }

  public String getId() {
    return id;
  }

  public String getStackId() {
    return stackId;
  }

  public State getState() {
    return state;
  }

  public void setState(State state) {
    this.state = Objects.requireNonNull(state, "state");
  }

  public Object getStartData() {
    return startData;
  }

  public void setStartData(Object startData) {
    this.startData = startData;
  }

  /** Mutable dialog-level data. */
  public Map<String, Object> getDialogData() {
    return dialogData;
  }

  /** Mutable per-widget data. */
  public Map<String, Object> getWidgetData() {
    return widgetData;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Context other)) return false;
    return id.equals(other.id)
        && stackId.equals(other.stackId)
        && state.equals(other.state)
        && Objects.equals(startData, other.startData)
        && dialogData.equals(other.dialogData)
        && widgetData.equals(other.widgetData);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, stackId, state, startData, dialogData, widgetData);
  }

  @Override
  public String toString() {
    return "Context{id=" + id + ", stackId=" + stackId + ", state=" + state + "}";
  }
}
