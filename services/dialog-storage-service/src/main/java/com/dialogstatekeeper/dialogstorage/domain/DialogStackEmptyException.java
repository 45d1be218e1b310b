package com.dialogstatekeeper.dialogstorage.domain;

public class DialogStackEmptyException extends DialogStorageException {
  public DialogStackEmptyException(String message) {
    super(message);
  }
}
