package com.dialogstatekeeper.dialogstorage.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * History of intents opened in one conversation.
 *
 * <p>The last element of {@link #getIntents()} is the active dialog.
 */
public class Stack {

  public static final String DEFAULT_STACK_ID = "";
  public static final int MAX_DEPTH = 100;

  private final String id;
  private final List<String> intents;
  private Long lastMessageId;
  private boolean lastReplyKeyboard;
  private String lastMediaId;
  private String lastMediaUniqueId;
  private String lastIncomeMediaGroupId;
  private AccessSettings accessSettings;

  public Stack() {
    this(IntentIds.newId());
  }

  public Stack(String id) {
    this(id, List.of(), null, null);
  }

  public Stack(
      String id, List<String> intents, Long lastMessageId, AccessSettings accessSettings) {
    this.id = Objects.requireNonNull(id, "id");
    this.intents = intents == null ? new ArrayList<>() : new ArrayList<>(intents);
    this.lastMessageId = lastMessageId;
    this.accessSettings = accessSettings;
  }

  public static Stack defaultStack() {
    return new Stack(DEFAULT_STACK_ID);
  }

  /**
   * Open a new dialog on top of this stack.
   *
   * @return context of the new intent, not yet persisted
   * @throws DialogStackOverflowException if the stack already holds {@link #MAX_DEPTH} intents
   */
  public Context push(State state, Object startData) {
    if (intents.size() >= MAX_DEPTH) {
      throw new DialogStackOverflowException(
          "Cannot open more than " + MAX_DEPTH + " dialogs in stack " + id);
    }
    Context context = new Context(IntentIds.newId(), id, state, startData);
    intents.add(context.getId());
    return context;
  }

  /**
   * @return id of the removed intent
   * @throws DialogStackEmptyException if there is nothing to close
   */
  public String pop() {
    if (intents.isEmpty()) {
      throw new DialogStackEmptyException("Stack " + id + " has no intents");
    }
    return intents.remove(intents.size() - 1);
  }

  public Optional<String> lastIntentId() {
    if (intents.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(intents.get(intents.size() - 1));
  }

  public boolean isEmpty() {
    return intents.isEmpty();
  }

  public boolean isDefault() {
    return DEFAULT_STACK_ID.equals(id);
  }

  public String getId() {
    return id;
  }

  public List<String> getIntents() {
    return List.copyOf(intents);
  }

  public Long getLastMessageId() {
    return lastMessageId;
  }

  public void setLastMessageId(Long lastMessageId) {
    this.lastMessageId = lastMessageId;
  }

  public boolean isLastReplyKeyboard() {
    return lastReplyKeyboard;
  }

  public void setLastReplyKeyboard(boolean lastReplyKeyboard) {
    this.lastReplyKeyboard = lastReplyKeyboard;
  }

  public String getLastMediaId() {
    return lastMediaId;
  }

  public void setLastMediaId(String lastMediaId) {
    this.lastMediaId = lastMediaId;
  }

  public String getLastMediaUniqueId() {
    return lastMediaUniqueId;
  }

  public void setLastMediaUniqueId(String lastMediaUniqueId) {
    this.lastMediaUniqueId = lastMediaUniqueId;
  }

  public String getLastIncomeMediaGroupId() {
    return lastIncomeMediaGroupId;
  }

  public void setLastIncomeMediaGroupId(String lastIncomeMediaGroupId) {
    this.lastIncomeMediaGroupId = lastIncomeMediaGroupId;
  }

  public AccessSettings getAccessSettings() {
    return accessSettings;
  }

  public void setAccessSettings(AccessSettings accessSettings) {
    this.accessSettings = accessSettings;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Stack other)) return false;
    return id.equals(other.id)
        && intents.equals(other.intents)
        && Objects.equals(lastMessageId, other.lastMessageId)
        && lastReplyKeyboard == other.lastReplyKeyboard
        && Objects.equals(lastMediaId, other.lastMediaId)
        && Objects.equals(lastMediaUniqueId, other.lastMediaUniqueId)
        && Objects.equals(lastIncomeMediaGroupId, other.lastIncomeMediaGroupId)
        && Objects.equals(accessSettings, other.accessSettings);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        id,
        intents,
        lastMessageId,
        lastReplyKeyboard,
        lastMediaId,
        lastMediaUniqueId,
        lastIncomeMediaGroupId,
        accessSettings);
  }

  @Override
  public String toString() {
    return "Stack{id=" + id + ", intents=" + intents + ", lastMessageId=" + lastMessageId + "}";
  }
}
