package com.dialogstatekeeper.dialogstorage.proxy;

import com.dialogstatekeeper.dialogstorage.domain.Stack;
import java.util.LinkedHashMap;
import java.util.Map;

/** Flat record layout of a {@link Stack}. */
public class StackMapper {

  static final String ID = "id";
  static final String INTENTS = "intents";
  static final String LAST_MESSAGE_ID = "last_message_id";
  static final String LAST_REPLY_KEYBOARD = "last_reply_keyboard";
  static final String LAST_MEDIA_ID = "last_media_id";
  static final String LAST_MEDIA_UNIQUE_ID = "last_media_unique_id";
  static final String LAST_INCOME_MEDIA_GROUP_ID = "last_income_media_group_id";
  static final String ACCESS_SETTINGS = "access_settings";

  private final AccessSettingsMapper accessSettingsMapper;

  public StackMapper(AccessSettingsMapper accessSettingsMapper) {
    this.accessSettingsMapper = accessSettingsMapper;
  }

  public Map<String, Object> toRecord(Stack stack) {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put(ID, stack.getId());
    record.put(INTENTS, stack.getIntents());
    record.put(LAST_MESSAGE_ID, stack.getLastMessageId());
    record.put(LAST_REPLY_KEYBOARD, stack.isLastReplyKeyboard());
    record.put(LAST_MEDIA_ID, stack.getLastMediaId());
    record.put(LAST_MEDIA_UNIQUE_ID, stack.getLastMediaUniqueId());
    record.put(LAST_INCOME_MEDIA_GROUP_ID, stack.getLastIncomeMediaGroupId());
    record.put(ACCESS_SETTINGS, accessSettingsMapper.dump(stack.getAccessSettings()));
    return record;
  }

  /**
   * @param stackId id the record was stored under, used when the record does not carry one
   */
  public Stack fromRecord(String stackId, Map<String, Object> record) {
    Stack stack =
        new Stack(
            RawValues.string(record, ID, stackId),
            RawValues.strings(record, INTENTS),
            RawValues.longValue(record, LAST_MESSAGE_ID),
            accessSettingsMapper.parse(record.get(ACCESS_SETTINGS)));
    stack.setLastReplyKeyboard(RawValues.bool(record, LAST_REPLY_KEYBOARD));
    stack.setLastMediaId(RawValues.string(record, LAST_MEDIA_ID, null));
    stack.setLastMediaUniqueId(RawValues.string(record, LAST_MEDIA_UNIQUE_ID, null));
    stack.setLastIncomeMediaGroupId(RawValues.string(record, LAST_INCOME_MEDIA_GROUP_ID, null));
    return stack;
  }
}
