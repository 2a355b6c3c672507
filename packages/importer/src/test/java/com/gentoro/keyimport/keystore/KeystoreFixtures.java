package com.gentoro.keyimport.keystore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Structurally valid V3 keystores for tests. The ciphertext is not real. */
public final class KeystoreFixtures {
  public static final String ADDRESS = "008aeeda4d805471df9b2a5b0f38a0c3bcba786b";

  public static final String SCRYPT_KEYSTORE =
      """
      {
        "address": "%s",
        "crypto": {
          "cipher": "aes-128-ctr",
          "ciphertext": "d172bf743a674da9cdad04534d56926ef8358534d458fffccd4e6ad2fbde479c",
          "cipherparams": { "iv": "83dbcc02d8ccb40e466191a123791e0e" },
          "kdf": "scrypt",
          "kdfparams": {
            "dklen": 32,
            "n": 262144,
            "r": 1,
            "p": 8,
            "salt": "ab0c7876052600dd703518d6fc3fe8984592145b591fc8fb5c6d43190334ba19"
          },
          "mac": "2103ac29920d71da29f15d75b4a16dbe95cfd7ff8faea1056c33131d846e3097"
        },
        "id": "3198bc9c-6672-5ab3-d995-4942343ae5b6",
        "version": 3
      }
      """
          .formatted(ADDRESS);

  public static final String PBKDF2_KEYSTORE =
      """
      {
        "address": "0x%s",
        "crypto": {
          "cipher": "aes-128-ctr",
          "ciphertext": "5318b4d5bcd28de64ee5559e671353e16f075ecae9f99c7a79a38af5f869aa46",
          "cipherparams": { "iv": "6087dab2f9fdbbfaddc31a909735c1e6" },
          "kdf": "pbkdf2",
          "kdfparams": {
            "c": 262144,
            "dklen": 32,
            "prf": "hmac-sha256",
            "salt": "ae3cd4e7013836a3df6bd7241b12db061dbe2c6785853cce422d148a624ce0bd"
          },
          "mac": "517ead924a9d0dc3124507e3393d175ce3ff7c1e96529c6c555ce9e51205e9b2"
        },
        "version": 3
      }
      """
          .formatted(ADDRESS);

  private KeystoreFixtures() {}

  public static Path writeKeystore(Path dir, String name) throws IOException {
    return Files.writeString(dir.resolve(name), SCRYPT_KEYSTORE, StandardCharsets.UTF_8);
  }

  public static Path writePassword(Path keystore, String password) throws IOException {
    Path pwd = new PasswordFileManager().companionOf(keystore);
    return Files.writeString(pwd, password, StandardCharsets.UTF_8);
  }
}
