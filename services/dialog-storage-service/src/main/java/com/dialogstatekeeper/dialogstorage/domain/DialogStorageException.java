package com.dialogstatekeeper.dialogstorage.domain;

/** Base type for failures raised while persisting or restoring dialog state. */
public class DialogStorageException extends RuntimeException {
  public DialogStorageException(String message) {
    super(message);
  }

  public DialogStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
