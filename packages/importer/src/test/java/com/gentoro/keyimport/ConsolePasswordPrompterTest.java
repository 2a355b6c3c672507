package com.gentoro.keyimport;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.keyimport.driver.PasswordAnswer;
import com.gentoro.keyimport.model.ImportError;
import com.gentoro.keyimport.model.ImportJob;
import com.gentoro.keyimport.model.ImportResult;
import com.gentoro.keyimport.model.ImportSummary;
import com.gentoro.keyimport.policy.CompletionAction;
import com.gentoro.keyimport.policy.CompletionReport;
import com.gentoro.keyimport.state.PasswordPrompt;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PipedReader;
import java.io.PipedWriter;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConsolePasswordPrompterTest {

  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

  private ConsolePasswordPrompter prompter(String input) {
    return prompter(new BufferedReader(new StringReader(input)));
  }

  private ConsolePasswordPrompter prompter(BufferedReader in) {
    return new ConsolePasswordPrompter(
        in, new PrintStream(buffer, true, StandardCharsets.UTF_8), null);
  }

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }

  private static final PasswordPrompt FIRST = new PasswordPrompt("keys/a.json", 1, 3, null);

  @Test
  @DisplayName("A typed line is submitted as the password")
  void submit() throws Exception {
    try (var prompter = prompter("hunter2\n")) {
      PasswordAnswer answer = prompter.prompt(FIRST).toCompletableFuture().get(5, TimeUnit.SECONDS);

      assertEquals(PasswordAnswer.Kind.SUBMIT, answer.kind());
      assertEquals("hunter2", answer.password());
    }
    assertTrue(output().contains("Password for keys/a.json (attempt 1 of 3)"));
    assertFalse(output().contains("hunter2"));
  }

  @Test
  @DisplayName("Empty line skips, the cancel command and end of input cancel")
  void skipAndCancel() {
    try (var prompter = prompter("\n :CANCEL \n")) {
      assertEquals(PasswordAnswer.Kind.SKIP, prompter.ask(FIRST).kind());
      assertEquals(PasswordAnswer.Kind.CANCEL, prompter.ask(FIRST).kind());
      assertEquals(PasswordAnswer.Kind.CANCEL, prompter.ask(FIRST).kind());
    }
  }

  @Test
  @DisplayName("Retries show the previous error")
  void retryMessage() {
    try (var prompter = prompter("x\n")) {
      prompter.ask(new PasswordPrompt("a.json", 2, 3, "Incorrect password. Please try again."));
    }
    assertTrue(output().contains("(attempt 2 of 3)"));
    assertTrue(output().contains("Incorrect password. Please try again."));
  }

  private static CompletionReport failedReport() {
    var failed =
        ImportResult.failure(
            ImportJob.of(Path.of("a.json"), "a", null),
            new IllegalStateException("incorrect password"));
    Instant now = Instant.now();
    return CompletionReport.of(ImportSummary.fromResults(List.of(failed)), now, now);
  }

  @Test
  @DisplayName("Action choice re-asks on invalid input and shows the report")
  void chooseAction() {
    CompletionAction action;
    try (var prompter = prompter("9\nabc\n2\n")) {
      action = prompter.chooseAction(failedReport());
    }

    assertEquals(CompletionAction.RETRY_FAILED, action);
    String out = output();
    assertTrue(out.contains("Import finished with problems"));
    assertTrue(out.contains("total 1, imported 0, failed 1, skipped 0"));
    assertTrue(out.contains("x a.json: incorrect password"));
    assertTrue(out.contains("2) Retry failed imports"));
    assertTrue(out.contains("Invalid choice: 9"));
    assertTrue(out.contains("Invalid choice: abc"));
  }

  @Test
  @DisplayName("A line typed after a prompt was abandoned goes to the next read")
  void abandonedPromptHandsOverInput() throws Exception {
    PipedWriter keyboard = new PipedWriter();
    try (var prompter = prompter(new BufferedReader(new PipedReader(keyboard)))) {
      CompletableFuture<PasswordAnswer> answer = prompter.prompt(FIRST).toCompletableFuture();
      assertTrue(answer.cancel(false));

      keyboard.write("2\n");
      keyboard.flush();

      assertEquals(CompletionAction.RETRY_FAILED, prompter.chooseAction(failedReport()));
      assertTrue(answer.isCancelled());
    }
  }

  @Test
  @DisplayName("End of input returns to the menu")
  void chooseActionAtEndOfInput() {
    try (var prompter = prompter("")) {
      assertEquals(CompletionAction.RETURN_TO_MENU, prompter.chooseAction(failedReport()));
    }
  }

  @Test
  @DisplayName("Error details list recovery suggestions")
  void errorDetails() {
    try (var prompter = prompter("")) {
      prompter.printErrorDetails(
          List.of(
              new ImportError("a.json", new IllegalStateException("permission denied"), false),
              new ImportError("b.json", null, true)));
    }
    String out = output();
    assertTrue(out.contains("  * Check file permissions"));
    assertTrue(out.contains("b.json (skipped)"));
  }

  @Test
  @DisplayName("Selections are trimmed and blank input is empty")
  void readSelection() {
    try (var prompter = prompter("  keys/  \n   \n")) {
      assertEquals("keys/", prompter.readSelection("> ").orElseThrow());
      assertTrue(prompter.readSelection("> ").isEmpty());
      assertTrue(prompter.readSelection("> ").isEmpty());
    }
  }
}
