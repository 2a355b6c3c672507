package com.gentoro.keyimport.keystore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.keyimport.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Structural checks for Web3 Secret Storage (V3) keystore files. Nothing is decrypted here; a file
 * that passes may still fail with a wrong password.
 */
public class KeystoreValidator {
  private static final Pattern ADDRESS = Pattern.compile("^[0-9a-fA-F]{40}$");
  private static final List<String> SCRYPT_PARAMS = List.of("dklen", "n", "r", "p", "salt");
  private static final List<String> PBKDF2_PARAMS = List.of("dklen", "c", "prf", "salt");

  /** Parse and validate; returns the parsed tree. */
  public JsonNode validate(String json) {
    JsonNode root;
    try {
      root = JacksonUtility.getJsonMapper().readTree(json);
    } catch (JsonProcessingException e) {
      throw new KeystoreImportException(
          KeystoreErrorType.INVALID_JSON, "File does not contain valid JSON", null, e);
    }
    if (root == null || !root.isObject()) {
      throw new KeystoreImportException(
          KeystoreErrorType.INVALID_JSON, "Keystore must be a JSON object");
    }
    validateVersion(root.path("version"));
    validateAddress(root.path("address").asText(""));
    validateCrypto(root.path("crypto"));
    return root;
  }

  public JsonNode validate(Path keystore) {
    String content;
    try {
      content = Files.readString(keystore);
    } catch (IOException e) {
      throw new KeystoreImportException(
          KeystoreErrorType.CORRUPTED_FILE,
          "Cannot read keystore file: " + keystore,
          keystore.toString(),
          e);
    }
    try {
      return validate(content);
    } catch (KeystoreImportException e) {
      throw new KeystoreImportException(
          e.getType(), e.getMessage(), keystore.toString(), e.getCause());
    }
  }

  /** True when {@code keystore} can be read and passes every structural check. */
  public boolean isValidKeystore(Path keystore) {
    try {
      validate(keystore);
      return true;
    } catch (KeystoreImportException e) {
      return false;
    }
  }

  void validateVersion(JsonNode version) {
    if (!version.isIntegralNumber() || version.asInt() != 3) {
      throw field(
          KeystoreErrorType.INVALID_VERSION,
          "Invalid keystore version: %s, expected version 3"
              .formatted(version.isMissingNode() ? 0 : version.asText()),
          "version");
    }
  }

  void validateAddress(String address) {
    if (address.isEmpty()) {
      throw field(
          KeystoreErrorType.MISSING_REQUIRED_FIELDS, "Missing required field: address", "address");
    }
    String clean =
        StringUtils.startsWithIgnoreCase(address, "0x") ? address.substring(2) : address;
    if (!ADDRESS.matcher(clean).matches()) {
      throw field(
          KeystoreErrorType.INVALID_ADDRESS,
          "Invalid Ethereum address format: " + address,
          "address");
    }
  }

  void validateCrypto(JsonNode crypto) {
    requireText(crypto, "cipher", "crypto.cipher");
    requireText(crypto, "ciphertext", "crypto.ciphertext");
    requireText(crypto.path("cipherparams"), "iv", "crypto.cipherparams.iv");
    String kdf = requireText(crypto, "kdf", "crypto.kdf");
    JsonNode params = crypto.path("kdfparams");
    if (params.isMissingNode() || params.isNull()) {
      throw field(
          KeystoreErrorType.MISSING_REQUIRED_FIELDS,
          "Missing required field: crypto.kdfparams",
          "crypto.kdfparams");
    }
    requireText(crypto, "mac", "crypto.mac");

    switch (kdf.toLowerCase(Locale.ROOT)) {
      case "scrypt" -> requireParams(params, SCRYPT_PARAMS, "scrypt");
      case "pbkdf2" -> requireParams(params, PBKDF2_PARAMS, "PBKDF2");
      default -> throw field(
          KeystoreErrorType.INVALID_KEYSTORE, "Unsupported KDF algorithm: " + kdf, "crypto.kdf");
    }
  }

  private static String requireText(JsonNode parent, String name, String fieldPath) {
    String value = parent.path(name).asText("");
    if (value.isEmpty()) {
      throw field(
          KeystoreErrorType.MISSING_REQUIRED_FIELDS,
          "Missing required field: " + fieldPath,
          fieldPath);
    }
    return value;
  }

  private static void requireParams(JsonNode params, List<String> required, String kdfName) {
    if (!params.isObject()) {
      throw field(
          KeystoreErrorType.INVALID_KEYSTORE,
          "Invalid %s parameters format".formatted(kdfName),
          "crypto.kdfparams");
    }
    for (String name : required) {
      if (!params.has(name)) {
        throw field(
            KeystoreErrorType.MISSING_REQUIRED_FIELDS,
            "Missing required field: crypto.kdfparams." + name,
            "crypto.kdfparams." + name);
      }
    }
  }

  private static KeystoreImportException field(
      KeystoreErrorType type, String message, String fieldPath) {
    KeystoreImportException ex = new KeystoreImportException(type, message);
    ex.withContext("field", fieldPath);
    return ex;
  }
}
