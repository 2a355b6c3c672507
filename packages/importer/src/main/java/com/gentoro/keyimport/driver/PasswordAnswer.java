package com.gentoro.keyimport.driver;

import java.util.Objects;

/** The user's reaction to a password prompt. {@link #toString()} never shows the password. */
public record PasswordAnswer(Kind kind, String password) {

  public enum Kind {
    SUBMIT,
    SKIP,
    CANCEL
  }

  public PasswordAnswer {
    Objects.requireNonNull(kind, "kind");
    password = password == null ? "" : password;
  }

  public static PasswordAnswer submit(String password) {
    return new PasswordAnswer(Kind.SUBMIT, password);
  }

  public static PasswordAnswer skip() {
    return new PasswordAnswer(Kind.SKIP, "");
  }

  public static PasswordAnswer cancel() {
    return new PasswordAnswer(Kind.CANCEL, "");
  }

  @Override
  public String toString() {
    return "PasswordAnswer[kind=%s]".formatted(kind);
  }
}
