package com.dialogstatekeeper.dialogstorage.proxy;

/**
 * Identifies the conversation a {@link StorageProxy} works for.
 *
 * @param chatType platform chat type ({@code private}, {@code group}, ...), informational only
 * @param threadId forum topic id, {@code null} outside of topics
 */
public record ConversationScope(
    long botId, long chatId, long userId, String chatType, Long threadId) {}
