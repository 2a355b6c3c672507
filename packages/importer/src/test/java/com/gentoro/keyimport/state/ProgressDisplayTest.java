package com.gentoro.keyimport.state;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.keyimport.model.ImportError;
import com.gentoro.keyimport.model.ImportProgress;
import java.time.Duration;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProgressDisplayTest {

  @Test
  void keepsLastErrorAcrossSnapshots() {
    ImportError error = new ImportError("a.json", new IllegalStateException("bad"), false);
    ImportProgress base = ImportProgress.initial(2, Instant.EPOCH);

    ProgressDisplay display =
        ProgressDisplay.reset(2)
            .apply(base.processing("a.json", 0, Duration.ZERO).withError(error));
    assertSame(error, display.lastError());

    display = display.apply(base.processing("b.json", 1, Duration.ZERO));
    assertSame(error, display.lastError());
    assertEquals(50.0, display.percentage());
    assertFalse(display.completed());

    display = display.complete();
    assertTrue(display.completed());
    assertEquals(2, display.processedFiles());
  }

  @Test
  void fileSelectionIsFilesOrDirectory() {
    assertTrue(FileSelection.empty().isEmpty());
    assertThrows(
        IllegalArgumentException.class,
        () -> new FileSelection(List.of(Path.of("a.json")), Path.of("dir")));
  }
}
