package com.dialogstatekeeper.dialogstorage.domain;

import java.security.SecureRandom;

/** Short random ids for intents and stacks. */
public final class IntentIds {

  private static final char[] ALPHABET =
      "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz".toCharArray();
  private static final int LENGTH = 8;
  private static final SecureRandom RANDOM = new SecureRandom();

  private IntentIds() {}

  public static String newId() {
    char[] buf = new char[LENGTH];
    for (int i = 0; i < LENGTH; i++) {
      buf[i] = ALPHABET[RANDOM.nextInt(ALPHABET.length)];
    }
    return new String(buf);
  }
}
