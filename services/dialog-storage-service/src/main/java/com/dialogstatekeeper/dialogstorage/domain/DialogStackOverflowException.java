package com.dialogstatekeeper.dialogstorage.domain;

public class DialogStackOverflowException extends DialogStorageException {
  public DialogStackOverflowException(String message) {
    super(message);
  }
}
