package com.gentoro.keyimport;

import com.gentoro.keyimport.driver.PasswordAnswer;
import com.gentoro.keyimport.driver.PasswordPrompter;
import com.gentoro.keyimport.model.ImportError;
import com.gentoro.keyimport.model.ImportSummary;
import com.gentoro.keyimport.policy.CompletionAction;
import com.gentoro.keyimport.policy.CompletionReport;
import com.gentoro.keyimport.policy.RetryPolicy;
import com.gentoro.keyimport.state.PasswordPrompt;
import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;

/**
 * Terminal front end: reads passwords (masked when a system console is attached) and lets the
 * user pick a follow-up action once a batch is done.
 *
 * <p>An empty password line skips the keystore, {@value #CANCEL_COMMAND} cancels the prompt.
 */
public class ConsolePasswordPrompter implements PasswordPrompter, AutoCloseable {
  private static final Logger log =
      com.gentoro.keyimport.logging.LoggingService.getLogger(ConsolePasswordPrompter.class);

  public static final String CANCEL_COMMAND = ":cancel";

  private final BufferedReader in;
  private final PrintStream out;
  private final Console console;
  private final Object readLock = new Object();
  private CompletableFuture<String> pendingRead;
  private final ExecutorService executor =
      Executors.newSingleThreadExecutor(
          r -> {
            Thread t = new Thread(r, "password-prompt");
            t.setDaemon(true);
            return t;
          });

  public ConsolePasswordPrompter() {
    this(
        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
        System.out,
        System.console());
  }

  /** @param console used for masked input when not null, otherwise {@code in} is read */
  public ConsolePasswordPrompter(BufferedReader in, PrintStream out, Console console) {
    this.in = in;
    this.out = out;
    this.console = console;
  }

  /**
   * Print the prompt and read the answer on the prompt thread. Cancelling the returned future
   * abandons the prompt; a line typed after that goes to the next read on this prompter.
   */
  @Override
  public CompletionStage<PasswordAnswer> prompt(PasswordPrompt prompt) {
    CompletableFuture<PasswordAnswer> answer = new CompletableFuture<>();
    CompletableFuture<String> read;
    synchronized (readLock) {
      printPrompt(prompt);
      read =
          pendingRead != null
              ? pendingRead
              : CompletableFuture.supplyAsync(() -> readSecret("Password: "), executor);
      pendingRead = read;
    }
    read.whenComplete(
        (line, failure) -> {
          synchronized (readLock) {
            if (answer.isDone() || pendingRead != read) {
              return;
            }
            pendingRead = null;
          }
          if (failure != null) {
            answer.completeExceptionally(failure);
          } else {
            answer.complete(toAnswer(line));
          }
        });
    return answer;
  }

  PasswordAnswer ask(PasswordPrompt prompt) {
    printPrompt(prompt);
    return toAnswer(nextInput(() -> readSecret("Password: ")));
  }

  private void printPrompt(PasswordPrompt prompt) {
    out.println();
    out.printf(
        "Password for %s (attempt %d of %d)%n",
        prompt.keystoreFile(), prompt.attempt(), prompt.maxAttempts());
    if (prompt.isRetry()) {
      out.println("  " + prompt.errorMessage());
    }
    out.printf("  empty line to skip, %s to cancel%n", CANCEL_COMMAND);
  }

  private static PasswordAnswer toAnswer(String line) {
    if (line == null) {
      log.debug("Input closed while waiting for a password, cancelling");
      return PasswordAnswer.cancel();
    }
    if (CANCEL_COMMAND.equalsIgnoreCase(line.trim())) {
      return PasswordAnswer.cancel();
    }
    if (line.isEmpty()) {
      return PasswordAnswer.skip();
    }
    return PasswordAnswer.submit(line);
  }

  /**
   * Print the outcome of a batch and ask what to do next. End of input picks {@link
   * CompletionAction#RETURN_TO_MENU}.
   */
  public CompletionAction chooseAction(CompletionReport report) {
    printReport(report);
    List<CompletionAction> actions = report.availableActions();
    while (true) {
      out.println();
      for (int i = 0; i < actions.size(); i++) {
        out.printf("  %d) %s%n", i + 1, actions.get(i).label());
      }
      out.print("Choose an action: ");
      out.flush();
      String line = readLine();
      if (line == null) {
        return CompletionAction.RETURN_TO_MENU;
      }
      int choice = NumberUtils.toInt(line.trim(), -1);
      if (choice >= 1 && choice <= actions.size()) {
        return actions.get(choice - 1);
      }
      out.println("Invalid choice: " + line.trim());
    }
  }

  public void printReport(CompletionReport report) {
    ImportSummary summary = report.summary();
    out.println();
    out.println(report.isFullSuccess() ? "Import complete" : "Import finished with problems");
    out.printf(
        "  total %d, imported %d, failed %d, skipped %d (%.1fs)%n",
        summary.totalFiles(),
        summary.successfulImports(),
        summary.failedImports(),
        summary.skippedImports(),
        report.elapsedTime().toMillis() / 1000.0);
    for (ImportError error : summary.errors()) {
      out.printf(
          "  %s %s: %s%n",
          error.skipped() ? "-" : "x", error.file(), CompletionReport.shortMessage(error));
    }
  }

  public void printErrorDetails(List<ImportError> errors) {
    for (ImportError error : errors) {
      out.println();
      out.println(error.file() + (error.skipped() ? " (skipped)" : ""));
      out.println("  " + error.message());
      for (String suggestion : RetryPolicy.recoverySuggestions(error.error())) {
        out.println("  * " + suggestion);
      }
    }
  }

  public Optional<String> readSelection(String label) {
    out.print(label);
    out.flush();
    return Optional.ofNullable(StringUtils.trimToNull(readLine()));
  }

  private String readSecret(String label) {
    if (console != null) {
      char[] chars = console.readPassword(label);
      return chars == null ? null : new String(chars);
    }
    out.print(label);
    out.flush();
    return readDirect();
  }

  private String readLine() {
    return nextInput(this::readDirect);
  }

  /** Takes over the line of an abandoned prompt when one is still being read. */
  private String nextInput(Supplier<String> reader) {
    CompletableFuture<String> pending;
    synchronized (readLock) {
      pending = pendingRead;
      pendingRead = null;
    }
    if (pending == null) {
      return reader.get();
    }
    try {
      return pending.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException re) {
        throw re;
      }
      throw e;
    }
  }

  private String readDirect() {
    try {
      return in.readLine();
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read from the terminal", e);
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
