package com.gentoro.keyimport.keystore;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KeystoreValidatorTest {
  private final KeystoreValidator validator = new KeystoreValidator();

  private KeystoreImportException rejected(String json) {
    return assertThrows(KeystoreImportException.class, () -> validator.validate(json));
  }

  @Test
  @DisplayName("Accepts scrypt and pbkdf2 V3 keystores")
  void acceptsValidKeystores() {
    assertEquals(3, validator.validate(KeystoreFixtures.SCRYPT_KEYSTORE).path("version").asInt());
    assertDoesNotThrow(() -> validator.validate(KeystoreFixtures.PBKDF2_KEYSTORE));
  }

  @Test
  @DisplayName("Malformed JSON and non-objects are INVALID_JSON")
  void rejectsMalformedJson() {
    assertEquals(KeystoreErrorType.INVALID_JSON, rejected("{ not json").getType());
    assertEquals(KeystoreErrorType.INVALID_JSON, rejected("[1, 2]").getType());
  }

  @Test
  @DisplayName("Only version 3 is supported")
  void rejectsOtherVersions() {
    String v1 = KeystoreFixtures.SCRYPT_KEYSTORE.replace("\"version\": 3", "\"version\": 1");
    KeystoreImportException ex = rejected(v1);
    assertEquals(KeystoreErrorType.INVALID_VERSION, ex.getType());
    assertEquals("version", ex.getContext().get("field"));
  }

  @Test
  @DisplayName("Address must be 40 hex characters")
  void rejectsBadAddress() {
    String bad = KeystoreFixtures.SCRYPT_KEYSTORE.replace(KeystoreFixtures.ADDRESS, "xyz");
    assertEquals(KeystoreErrorType.INVALID_ADDRESS, rejected(bad).getType());

    String missing =
        KeystoreFixtures.SCRYPT_KEYSTORE.replace(
            "\"address\": \"" + KeystoreFixtures.ADDRESS + "\",", "");
    assertEquals(KeystoreErrorType.MISSING_REQUIRED_FIELDS, rejected(missing).getType());
  }

  @Test
  @DisplayName("Missing crypto fields are reported with their path")
  void rejectsMissingCryptoField() {
    String noMac =
        KeystoreFixtures.SCRYPT_KEYSTORE.replace(
            "\"mac\": \"2103ac29920d71da29f15d75b4a16dbe95cfd7ff8faea1056c33131d846e3097\"",
            "\"other\": 1");
    KeystoreImportException ex = rejected(noMac);
    assertEquals(KeystoreErrorType.MISSING_REQUIRED_FIELDS, ex.getType());
    assertEquals("crypto.mac", ex.getContext().get("field"));

    String noPrf =
        KeystoreFixtures.PBKDF2_KEYSTORE.replace("\"prf\": \"hmac-sha256\",", "\"x\": 1,");
    assertEquals("crypto.kdfparams.prf", rejected(noPrf).getContext().get("field"));
  }

  @Test
  @DisplayName("Unknown KDFs are rejected")
  void rejectsUnknownKdf() {
    String argon = KeystoreFixtures.SCRYPT_KEYSTORE.replace("\"scrypt\"", "\"argon2\"");
    KeystoreImportException ex = rejected(argon);
    assertEquals(KeystoreErrorType.INVALID_KEYSTORE, ex.getType());
    assertTrue(ex.getMessage().contains("Unsupported KDF algorithm"));
  }

  @Test
  @DisplayName("File validation reports the file and tolerates unreadable paths")
  void validatesFiles(@TempDir Path dir) throws Exception {
    Path good = KeystoreFixtures.writeKeystore(dir, "good.json");
    Path bad = Files.writeString(dir.resolve("bad.json"), "{}");

    assertTrue(validator.isValidKeystore(good));
    assertFalse(validator.isValidKeystore(bad));
    assertFalse(validator.isValidKeystore(dir.resolve("missing.json")));

    KeystoreImportException ex =
        assertThrows(KeystoreImportException.class, () -> validator.validate(bad));
    assertEquals(bad.toString(), ex.getFile());
  }
}
