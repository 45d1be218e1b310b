package com.dialogstatekeeper.dialogstorage.storage;

/**
 * Address of one record in the shared key-value store.
 *
 * @param threadId forum topic id, {@code null} outside of topics
 * @param destiny record kind and id, keeps different records of one chat apart
 */
public record StorageKey(long botId, long chatId, long userId, Long threadId, String destiny) {}
