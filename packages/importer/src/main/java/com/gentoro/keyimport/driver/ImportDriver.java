package com.gentoro.keyimport.driver;

import com.gentoro.keyimport.channel.ProgressChannel;
import com.gentoro.keyimport.exception.ExceptionUtil;
import com.gentoro.keyimport.exception.KeyImportException;
import com.gentoro.keyimport.model.ImportPhase;
import com.gentoro.keyimport.model.ImportProgress;
import com.gentoro.keyimport.model.ImportSummary;
import com.gentoro.keyimport.state.ImportController;
import com.gentoro.keyimport.state.ImportEvent;
import com.gentoro.keyimport.state.PasswordPrompt;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Drives one {@link ImportController} batch to the end.
 *
 * <p>The batch and the two listeners run on pool threads; each finished task posts one message to
 * a queue that only the driving thread consumes. That thread applies progress, routes password
 * requests to the {@link PasswordPrompter}, turns answers into submit/skip/cancel, and re-issues
 * listeners that timed out while the batch is still running.
 */
public final class ImportDriver implements AutoCloseable {
  private static final Logger log =
      com.gentoro.keyimport.logging.LoggingService.getLogger(ImportDriver.class);

  private final ImportController controller;
  private final PasswordPrompter prompter;
  private final Duration idleTimeout;
  private final ExecutorService executor;
  private final BlockingQueue<Message> messages = new LinkedBlockingQueue<>();
  private CompletableFuture<PasswordAnswer> openPrompt;

  public ImportDriver(
      ImportController controller, PasswordPrompter prompter, Duration idleTimeout) {
    this.controller = Objects.requireNonNull(controller, "controller");
    this.prompter = Objects.requireNonNull(prompter, "prompter");
    this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
    AtomicInteger counter = new AtomicInteger();
    this.executor =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "import-driver-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  /**
   * Start the import for the controller's current selection and block until the batch finished
   * or was cancelled.
   *
   * @return summary of the results; empty when the import was cancelled before completing
   */
  public ImportSummary runImport() throws InterruptedException {
    controller.startImport();
    return awaitCompletion();
  }

  /** Drive a batch that has already been started with {@link ImportController#startImport()}. */
  public ImportSummary awaitCompletion() throws InterruptedException {
    messages.clear();
    Future<?> batch = submit(controller.processImportBatch());
    controller.addCleanupCallback(() -> batch.cancel(true));
    listen(ImportEvent.Listener.PROGRESS);
    listen(ImportEvent.Listener.PASSWORD_REQUESTS);

    try {
      boolean done = false;
      while (!done) {
        Message message = messages.poll(idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
        if (message != null) {
          done = handle(message);
        }
        if (controller.isCancelled()) {
          log.info("Import cancelled, stopping driver");
          done = true;
        }
      }
    } finally {
      abandonPrompt();
    }
    return controller.getSummary();
  }

  /** Cancel the running import from any thread. */
  public void cancel() {
    controller.cancelImport();
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  /** @return true when the batch is over */
  private boolean handle(Message message) {
    if (message instanceof EventMessage em) {
      return handleEvent(em.event());
    }
    if (message instanceof AnswerMessage am) {
      applyAnswer(am.answer(), am.failure());
      return false;
    }
    if (message instanceof TaskFailed tf) {
      log.error(
          "Driver task failed: {} ({})",
          ExceptionUtil.extractErrorMessage(tf.failure()),
          ExceptionUtil.formatCompactStackTrace(tf.failure()));
      if (tf.listener() == null) {
        return true;
      }
      if (isRunning()) {
        listen(tf.listener());
      }
    }
    return false;
  }

  private boolean handleEvent(ImportEvent event) {
    if (event instanceof ImportEvent.BatchComplete complete) {
      drainProgress();
      if (controller.isCancelled()) {
        return true;
      }
      controller.completeImport(complete.results());
      return true;
    }
    if (event instanceof ImportEvent.ProgressUpdate update) {
      controller.updateProgress(update.progress());
      listen(ImportEvent.Listener.PROGRESS);
    } else if (event instanceof ImportEvent.PasswordRequested requested) {
      showPrompt(requested);
      listen(ImportEvent.Listener.PASSWORD_REQUESTS);
    } else if (event instanceof ImportEvent.ContinueListening cl) {
      if (isRunning()) {
        listen(cl.listener());
      }
    } else if (event instanceof ImportEvent.ProgressStreamClosed) {
      log.debug("Progress stream closed");
    } else {
      log.debug("Ignoring {} while importing", event);
    }
    return false;
  }

  private void showPrompt(ImportEvent.PasswordRequested requested) {
    try {
      controller.handlePasswordRequest(requested.request());
    } catch (KeyImportException e) {
      log.warn(
          "Cannot show password prompt for {}: {}",
          requested.request().keystoreFile(),
          e.getMessage());
      return;
    }
    Optional<PasswordPrompt> prompt = controller.getPasswordPrompt();
    if (prompt.isEmpty()) {
      applyAnswer(PasswordAnswer.cancel(), null);
      return;
    }
    abandonPrompt();
    CompletableFuture<PasswordAnswer> answer;
    try {
      answer = prompter.prompt(prompt.get()).toCompletableFuture();
    } catch (RuntimeException e) {
      applyAnswer(null, e);
      return;
    }
    openPrompt = answer;
    answer.whenComplete(
        (a, t) -> {
          if (!(t instanceof CancellationException)) {
            messages.add(new AnswerMessage(a, t));
          }
        });
  }

  /** Cancel a prompt that has not been answered yet. */
  private void abandonPrompt() {
    CompletableFuture<PasswordAnswer> previous = openPrompt;
    openPrompt = null;
    if (previous != null && previous.cancel(false)) {
      log.debug("Abandoned an unanswered password prompt");
    }
  }

  private void applyAnswer(PasswordAnswer answer, Throwable failure) {
    PasswordAnswer effective = answer;
    if (failure != null || answer == null) {
      log.warn(
          "Password prompt failed, cancelling input: {}",
          failure == null ? "no answer" : ExceptionUtil.extractErrorMessage(failure));
      effective = PasswordAnswer.cancel();
    }
    try {
      switch (effective.kind()) {
        case SUBMIT -> controller.submitPassword(effective.password());
        case SKIP -> controller.skipPasswordInput();
        case CANCEL -> controller.cancelPasswordInput();
      }
    } catch (KeyImportException e) {
      log.warn("Password answer not delivered: {}", e.getMessage());
    }
  }

  private void drainProgress() {
    ProgressChannel channel = controller.getProgressChannel();
    try {
      Optional<ImportProgress> next;
      while ((next = channel.poll(Duration.ZERO)).isPresent()) {
        controller.updateProgress(next.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private boolean isRunning() {
    ImportPhase phase = controller.getCurrentPhase();
    return phase == ImportPhase.IMPORTING || phase == ImportPhase.PASSWORD_INPUT;
  }

  private void listen(ImportEvent.Listener listener) {
    Callable<ImportEvent> task =
        switch (listener) {
          case PROGRESS -> controller.listenForProgress();
          case PASSWORD_REQUESTS -> controller.listenForPasswordRequests();
        };
    submit(task, listener);
  }

  private Future<?> submit(Callable<? extends ImportEvent> task) {
    return submit(task, null);
  }

  private Future<?> submit(Callable<? extends ImportEvent> task, ImportEvent.Listener listener) {
    return executor.submit(
        () -> {
          try {
            messages.add(new EventMessage(task.call()));
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          } catch (Exception e) {
            messages.add(new TaskFailed(listener, e));
          }
        });
  }

  private sealed interface Message {}

  private record EventMessage(ImportEvent event) implements Message {}

  private record AnswerMessage(PasswordAnswer answer, Throwable failure) implements Message {}

  /** A pool task threw; {@code listener} is null for the batch itself. */
  private record TaskFailed(ImportEvent.Listener listener, Throwable failure)
      implements Message {}
}
