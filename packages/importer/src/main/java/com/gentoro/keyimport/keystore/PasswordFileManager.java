package com.gentoro.keyimport.keystore;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * Locates and reads the {@code .pwd} companion of a keystore: same directory, same base name.
 * The file holds the password as UTF-8 text; surrounding whitespace is ignored.
 */
public class PasswordFileManager {
  public static final String EXTENSION = ".pwd";
  public static final long MAX_SIZE_BYTES = 1024;

  /** Companion path, whether or not it exists. */
  public Path companionOf(Path keystore) {
    String base = baseName(keystore);
    Path dir = keystore.toAbsolutePath().getParent();
    return dir == null ? Path.of(base + EXTENSION) : dir.resolve(base + EXTENSION);
  }

  /** File name without its last extension, e.g. {@code wallet} for {@code wallet.json}. */
  public static String baseName(Path file) {
    return StringUtils.substringBeforeLast(file.getFileName().toString(), ".");
  }

  /** Existing companion password file of {@code keystore}, if any. */
  public Optional<Path> findPasswordFile(Path keystore) {
    Path candidate = companionOf(keystore);
    return Files.exists(candidate) ? Optional.of(candidate) : Optional.empty();
  }

  /** Checks that {@code passwordFile} is a readable regular file of acceptable size. */
  public void validatePasswordFile(Path passwordFile) {
    String file = passwordFile.toString();
    if (!Files.exists(passwordFile)) {
      throw new KeystoreImportException(
          KeystoreErrorType.PASSWORD_FILE_NOT_FOUND, "Password file not found: " + file, file);
    }
    if (!Files.isRegularFile(passwordFile)) {
      throw new KeystoreImportException(
          KeystoreErrorType.PASSWORD_FILE_INVALID,
          "Password file is not a regular file: " + file,
          file);
    }
    if (!Files.isReadable(passwordFile)) {
      throw new KeystoreImportException(
          KeystoreErrorType.PASSWORD_FILE_UNREADABLE, "Cannot read password file: " + file, file);
    }
    long size;
    try {
      size = Files.size(passwordFile);
    } catch (IOException e) {
      throw new KeystoreImportException(
          KeystoreErrorType.PASSWORD_FILE_UNREADABLE,
          "Cannot access password file: " + file,
          file,
          e);
    }
    if (size > MAX_SIZE_BYTES) {
      throw new KeystoreImportException(
          KeystoreErrorType.PASSWORD_FILE_OVERSIZED,
          "Password file too large: %s (%d bytes, max %d bytes)"
              .formatted(file, size, MAX_SIZE_BYTES),
          file);
    }
    if (size == 0) {
      throw new KeystoreImportException(
          KeystoreErrorType.PASSWORD_FILE_EMPTY, "Password file is empty: " + file, file);
    }
  }

  /** Validated, trimmed password. */
  public String readPassword(Path passwordFile) {
    validatePasswordFile(passwordFile);
    String file = passwordFile.toString();
    byte[] content;
    try {
      content = Files.readAllBytes(passwordFile);
    } catch (IOException e) {
      throw new KeystoreImportException(
          KeystoreErrorType.PASSWORD_FILE_UNREADABLE,
          "Failed to read password file: " + file,
          file,
          e);
    }
    String password;
    try {
      password =
          StandardCharsets.UTF_8
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(content))
              .toString()
              .strip();
    } catch (CharacterCodingException e) {
      throw new KeystoreImportException(
          KeystoreErrorType.PASSWORD_FILE_CORRUPTED,
          "Password file contains invalid UTF-8 encoding: " + file,
          file,
          e);
    }
    if (password.isEmpty()) {
      throw new KeystoreImportException(
          KeystoreErrorType.PASSWORD_FILE_EMPTY, "Password file is empty: " + file, file);
    }
    return password;
  }
}
