package com.dialogstatekeeper.dialogstorage.domain;

/**
 * No context is stored for the requested intent id.
 *
 * <p>The dialog has expired, was already closed or never existed.
 */
public class UnknownIntentException extends DialogStorageException {
  public UnknownIntentException(String message) {
    super(message);
  }
}
