package com.gentoro.keyimport.model;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ImportProgressTest {

  private static final Instant START = Instant.parse("2026-02-02T00:00:00Z");

  @Test
  @DisplayName("Percentage is exact at the end and zero without files")
  void percentage() {
    assertEquals(0.0, ImportProgress.percentageOf(0, 3));
    assertEquals(100.0 / 3, ImportProgress.percentageOf(1, 3), 1e-9);
    assertEquals(100.0, ImportProgress.percentageOf(3, 3));
    assertEquals(0.0, ImportProgress.percentageOf(2, 0));
  }

  @Test
  @DisplayName("Snapshots move through processing, password wait and finish")
  void lifecycle() {
    var progress = ImportProgress.initial(2, START).processing("a.json", 1, Duration.ofSeconds(1));
    assertEquals("a.json", progress.currentFile());
    assertEquals(50.0, progress.percentage());
    assertFalse(progress.isFinished());

    var waiting = progress.awaitingPassword("a.json", Duration.ofSeconds(2));
    assertTrue(waiting.pendingPassword());
    assertEquals("a.json", waiting.pendingFile());

    var resumed = waiting.passwordResolved(Duration.ofSeconds(3));
    assertFalse(resumed.pendingPassword());
    assertEquals("", resumed.pendingFile());

    var error =
        ImportError.from(
            ImportResult.skipped(ImportJob.of(Path.of("a.json"), "a", null), null));
    var finished = resumed.withError(error).finished(Duration.ofSeconds(4));
    assertTrue(finished.isFinished());
    assertEquals(100.0, finished.percentage());
    assertEquals(error, finished.lastError());
    assertEquals(START, finished.startTime());
  }

  @Test
  @DisplayName("Placeholder snapshot has no files and no errors")
  void none() {
    var none = ImportProgress.none();
    assertEquals(0, none.totalFiles());
    assertNull(none.lastError());
    assertFalse(none.isFinished());
  }

  @Test
  @DisplayName("Password values never show up in toString")
  void masking() {
    assertFalse(PasswordResponse.submit("s3cret").toString().contains("s3cret"));
    assertTrue(PasswordResponse.cancel().toString().contains("<empty>"));
  }
}
