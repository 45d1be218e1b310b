package com.dialogstatekeeper.dialogstorage.proxy;

import com.dialogstatekeeper.dialogstorage.domain.Context;
import com.dialogstatekeeper.dialogstorage.domain.StateRegistry;
import com.dialogstatekeeper.dialogstorage.domain.UnknownStateException;
import java.util.LinkedHashMap;
import java.util.Map;

/** Flat record layout of a {@link Context}. */
public class ContextMapper {

  static final String INTENT_ID = "intent_id";
  static final String STACK_ID = "stack_id";
  static final String STATE = "state";
  static final String START_DATA = "start_data";
  static final String DIALOG_DATA = "dialog_data";
  static final String WIDGET_DATA = "widget_data";

  private final StateRegistry registry;

  public ContextMapper(StateRegistry registry) {
    this.registry = registry;
  }

  public Map<String, Object> toRecord(Context context) {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put(INTENT_ID, context.getId());
    record.put(STACK_ID, context.getStackId());
    record.put(STATE, context.getState().state());
    record.put(START_DATA, context.getStartData());
    record.put(DIALOG_DATA, new LinkedHashMap<>(context.getDialogData()));
    record.put(WIDGET_DATA, new LinkedHashMap<>(context.getWidgetData()));
    return record;
  }

  /**
   * @param intentId id the record was stored under, used when the record does not carry one
   * @throws UnknownStateException if the stored state is missing or not registered
   */
  public Context fromRecord(String intentId, Map<String, Object> record) {
    Object state = record.get(STATE);
    if (!(state instanceof String stateText)) {
      throw new UnknownStateException("No state stored for intent " + intentId);
    }
    return new Context(
        RawValues.string(record, INTENT_ID, intentId),
        RawValues.string(record, STACK_ID, ""),
        registry.resolve(stateText),
        record.get(START_DATA),
        RawValues.map(record.get(DIALOG_DATA)),
        RawValues.map(record.get(WIDGET_DATA)));
  }
}
