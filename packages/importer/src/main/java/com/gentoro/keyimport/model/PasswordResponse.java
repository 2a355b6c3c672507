package com.gentoro.keyimport.model;

/**
 * UI answer to a {@link PasswordRequest}. Exactly one per request.
 *
 * <p>{@link #toString()} never includes the password.
 */
public record PasswordResponse(String password, boolean cancelled, boolean skip) {

  public static PasswordResponse submit(String password) {
    return new PasswordResponse(password, false, false);
  }

  public static PasswordResponse cancel() {
    return new PasswordResponse("", true, false);
  }

  public static PasswordResponse skipFile() {
    return new PasswordResponse("", false, true);
  }

  @Override
  public String toString() {
    return "PasswordResponse[password=%s, cancelled=%s, skip=%s]"
        .formatted(password == null || password.isEmpty() ? "<empty>" : "****", cancelled, skip);
  }
}
