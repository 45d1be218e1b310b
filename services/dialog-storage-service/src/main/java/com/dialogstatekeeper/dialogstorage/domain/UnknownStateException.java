package com.dialogstatekeeper.dialogstorage.domain;

/** Persisted state text does not match any registered state. */
public class UnknownStateException extends DialogStorageException {
  public UnknownStateException(String message) {
    super(message);
  }
}
