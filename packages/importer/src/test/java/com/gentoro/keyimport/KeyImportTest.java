package com.gentoro.keyimport;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.keyimport.exception.ConfigurationException;
import com.gentoro.keyimport.keystore.KeystoreBatchImportService;
import com.gentoro.keyimport.keystore.KeystoreErrorType;
import com.gentoro.keyimport.keystore.KeystoreFixtures;
import com.gentoro.keyimport.keystore.KeystoreImportException;
import com.gentoro.keyimport.keystore.KeystoreImporter;
import com.gentoro.keyimport.model.ImportPhase;
import com.gentoro.keyimport.utility.JacksonUtility;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

class KeyImportTest {

  @TempDir Path dir;

  private KeystoreImporter importer;
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();

  @BeforeEach
  void setUp() throws Exception {
    importer = Mockito.mock(KeystoreImporter.class);
    Path keystore = KeystoreFixtures.writeKeystore(dir, "wallet.json");
    KeystoreFixtures.writePassword(keystore, "pw");
  }

  private KeyImport app(String input, String... args) {
    KeyImport app = new KeyImport(args);
    app.wire(
        new KeystoreBatchImportService(importer, ImportSettings.defaults()),
        new ConsolePasswordPrompter(
            new BufferedReader(new StringReader(input)),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            null));
    return app;
  }

  @Test
  @DisplayName("A single successful batch exits with 0 and writes the report")
  void onceSuccess() throws Exception {
    Path report = dir.resolve("out/report.json");
    KeyImport app = app("", "--dir=" + dir, "--mode=once", "--report=" + report);

    try {
      assertEquals(0, app.run());
    } finally {
      app.shutdown();
    }

    assertEquals(ImportPhase.COMPLETE, app.controller().getCurrentPhase());
    var json = JacksonUtility.getJsonMapper().readTree(report.toFile());
    assertEquals(1, json.get("successfulImports").asInt());
    assertTrue(out.toString(StandardCharsets.UTF_8).contains("Import complete"));
  }

  @Test
  @DisplayName("Failures make the exit code 1")
  void onceFailure() throws Exception {
    Mockito.doThrow(new IllegalStateException("corrupted"))
        .when(importer)
        .importKeystore(Mockito.any(), Mockito.anyString());
    KeyImport app = app("", "--files=" + dir.resolve("wallet.json"), "--mode=once");

    assertEquals(1, app.run());
    app.shutdown();
  }

  @Test
  @DisplayName("Retrying failed imports from the menu runs a second batch")
  void interactiveRetry() throws Exception {
    Mockito.doThrow(
            new KeystoreImportException(KeystoreErrorType.INCORRECT_PASSWORD, "incorrect password"))
        .doNothing()
        .when(importer)
        .importKeystore(Mockito.any(), Mockito.anyString());
    // 2 = retry failed, then 1 = return to menu after the clean second run
    KeyImport app = app("2\n1\n", "--dir=" + dir);

    assertEquals(0, app.run());
    app.shutdown();

    Mockito.verify(importer, Mockito.times(2)).importKeystore(Mockito.any(), Mockito.eq("pw"));
    String console = out.toString(StandardCharsets.UTF_8);
    assertTrue(console.contains("Import finished with problems"));
    assertTrue(console.contains("Import complete"));
  }

  @Test
  @DisplayName("Choosing different files reads a new selection")
  void interactiveReselect() throws Exception {
    Path other = Files.createDirectories(dir.resolve("other"));
    Path second = KeystoreFixtures.writeKeystore(other, "second.json");
    KeystoreFixtures.writePassword(second, "pw");
    // 2 = select different files, then the new directory, then 1 = return to menu
    KeyImport app = app("2\n" + other + "\n1\n", "--files=" + dir.resolve("wallet.json"));

    assertEquals(0, app.run());
    app.shutdown();

    Mockito.verify(importer)
        .importKeystore(
            Mockito.argThat(j -> j.walletName().equals("second")), Mockito.anyString());
  }

  @Test
  @DisplayName("Selection must name files or a directory, not both")
  void selectionErrors() {
    var none = app("");
    var ex = assertThrows(ConfigurationException.class, none::run);
    assertTrue(ex.getMessage().startsWith("Nothing to import"));

    var both = app("", "--files=a.json", "--dir=" + dir);
    assertThrows(ConfigurationException.class, both::run);
  }

  @Test
  @DisplayName("Running before initialization fails")
  void notInitialized() {
    var app = new KeyImport(new String[0]);
    assertThrows(IllegalStateException.class, app::run);
    assertThrows(IllegalStateException.class, app::configuration);
    app.shutdown();
  }
}
