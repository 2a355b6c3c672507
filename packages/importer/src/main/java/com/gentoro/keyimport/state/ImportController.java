package com.gentoro.keyimport.state;

import com.gentoro.keyimport.ImportSettings;
import com.gentoro.keyimport.channel.PasswordHandshake;
import com.gentoro.keyimport.channel.ProgressChannel;
import com.gentoro.keyimport.channel.ProgressSink;
import com.gentoro.keyimport.exception.ChannelUnavailableException;
import com.gentoro.keyimport.exception.ExceptionUtil;
import com.gentoro.keyimport.exception.JobPreparationException;
import com.gentoro.keyimport.exception.KeyImportErrorCode;
import com.gentoro.keyimport.exception.PhaseException;
import com.gentoro.keyimport.exception.ProgressValidationException;
import com.gentoro.keyimport.model.ImportJob;
import com.gentoro.keyimport.model.ImportPhase;
import com.gentoro.keyimport.model.ImportProgress;
import com.gentoro.keyimport.model.ImportResult;
import com.gentoro.keyimport.model.ImportSummary;
import com.gentoro.keyimport.model.PasswordRequest;
import com.gentoro.keyimport.model.PasswordResponse;
import com.gentoro.keyimport.policy.CompletionAction;
import com.gentoro.keyimport.policy.CompletionReport;
import com.gentoro.keyimport.policy.RetryPlan;
import com.gentoro.keyimport.policy.RetryPolicy;
import com.gentoro.keyimport.worker.BatchImportWorker;
import com.gentoro.keyimport.worker.ErrorReport;
import com.gentoro.keyimport.worker.ErrorReporting;
import com.gentoro.keyimport.worker.RetryRecommendation;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Phase state machine of a keystore batch import.
 *
 * <p>Owns the phase, the selection, the job list, the results and the worker channels. Every
 * mutation, including the setup that runs on each phase entry, happens under one write lock. A
 * rejected operation throws and leaves every field as it was.
 *
 * <p>The worker never sees this class: {@link #processImportBatch()} hands it only the producer
 * half of the progress channel and the worker halves of the password handshake.
 */
public class ImportController {
  private static final Logger log =
      com.gentoro.keyimport.logging.LoggingService.getLogger(ImportController.class);

  private static final Map<ImportPhase, Set<ImportPhase>> TRANSITIONS =
      Map.of(
          ImportPhase.FILE_SELECTION,
          EnumSet.of(ImportPhase.IMPORTING, ImportPhase.CANCELLED),
          ImportPhase.IMPORTING,
          EnumSet.of(ImportPhase.PASSWORD_INPUT, ImportPhase.COMPLETE, ImportPhase.CANCELLED),
          ImportPhase.PASSWORD_INPUT,
          EnumSet.of(ImportPhase.IMPORTING, ImportPhase.COMPLETE, ImportPhase.CANCELLED),
          ImportPhase.COMPLETE,
          EnumSet.of(ImportPhase.FILE_SELECTION, ImportPhase.CANCELLED),
          ImportPhase.CANCELLED,
          EnumSet.of(ImportPhase.FILE_SELECTION));

  private final BatchImportWorker worker;
  private final ImportSettings settings;
  private final Clock clock;
  private final ProgressValidator validator = new ProgressValidator();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  private ImportPhase phase = ImportPhase.FILE_SELECTION;
  private FileSelection fileSelection = FileSelection.empty();
  private boolean forceManualPasswords;
  private List<ImportJob> jobs = List.of();
  private List<ImportResult> results = List.of();
  private ImportProgress currentProgress = ImportProgress.none();
  private ProgressDisplay progressDisplay = ProgressDisplay.reset(0);
  private boolean showingPopup;
  private PasswordRequest pendingPassword;
  private PasswordPrompt passwordPrompt;
  private CompletionReport completionReport;
  private boolean completed;
  private boolean cancelled;
  private String errorMessage;
  private Instant startTime;
  private List<Runnable> cleanupCallbacks = new ArrayList<>();

  private ProgressChannel progressChannel;
  private PasswordHandshake passwordHandshake;

  public ImportController(BatchImportWorker worker, ImportSettings settings) {
    this(worker, settings, Clock.systemUTC());
  }

  public ImportController(BatchImportWorker worker, ImportSettings settings, Clock clock) {
    this.worker = Objects.requireNonNull(worker, "worker");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.progressChannel = newProgressChannel();
    this.passwordHandshake = new PasswordHandshake();
  }

  /** Whether the state machine allows {@code from -> to}. A phase may always re-enter itself. */
  public static boolean isValidTransition(ImportPhase from, ImportPhase to) {
    return from == to || TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
  }

  public ImportPhase getCurrentPhase() {
    return read(() -> phase);
  }

  /**
   * Move to {@code target} and run its setup.
   *
   * @throws PhaseException when the transition is not allowed; the phase is unchanged
   */
  public void transitionToPhase(ImportPhase target) {
    write(() -> transition(target));
  }

  // ---------------------------------------------------------------- selection

  /** Replace the selection with {@code files}. Only allowed while selecting. */
  public void selectFiles(List<Path> files) {
    write(
        () -> {
          requirePhase("select files", ImportPhase.FILE_SELECTION);
          fileSelection = FileSelection.ofFiles(files);
        });
  }

  /** Replace the selection with {@code directory}. Only allowed while selecting. */
  public void selectDirectory(Path directory) {
    write(
        () -> {
          requirePhase("select directory", ImportPhase.FILE_SELECTION);
          fileSelection = FileSelection.ofDirectory(Objects.requireNonNull(directory));
        });
  }

  /** Ignore {@code .pwd} files for the next batch and ask for every password. */
  public void forceManualPasswords(boolean force) {
    write(
        () -> {
          requirePhase("change password mode", ImportPhase.FILE_SELECTION);
          forceManualPasswords = force;
        });
  }

  public FileSelection getFileSelection() {
    return read(() -> fileSelection);
  }

  // ---------------------------------------------------------------- import lifecycle

  /**
   * Build and validate the jobs for the current selection, then enter {@link
   * ImportPhase#IMPORTING}.
   *
   * @throws PhaseException when not selecting files, or nothing is selected
   * @throws JobPreparationException when the worker cannot create or validate the jobs
   */
  public void startImport() {
    write(
        () -> {
          requirePhase("start import", ImportPhase.FILE_SELECTION);
          if (fileSelection.isEmpty()) {
            throw new PhaseException(
                KeyImportErrorCode.NO_SELECTION,
                phase,
                "no files or directory selected for import");
          }

          List<ImportJob> created;
          try {
            created =
                fileSelection
                    .selectedDirectory()
                    .map(worker::createImportJobsFromDirectory)
                    .orElseGet(() -> worker.createImportJobsFromFiles(fileSelection.files()));
          } catch (RuntimeException e) {
            throw new JobPreparationException(
                "failed to create import jobs: " + ExceptionUtil.extractErrorMessage(e), e);
          }
          if (forceManualPasswords) {
            created = created.stream().map(ImportJob::withManualInput).toList();
          }

          List<ImportJob> validated;
          try {
            validated = worker.validateImportJobs(created);
          } catch (RuntimeException e) {
            throw new JobPreparationException(
                "import job validation failed: " + ExceptionUtil.extractErrorMessage(e), e);
          }

          jobs = List.copyOf(validated);
          progressChannel = newProgressChannel();
          passwordHandshake = new PasswordHandshake();
          transition(ImportPhase.IMPORTING);
          log.info("Import started with {} job(s)", jobs.size());
        });
  }

  /**
   * Unit of work that runs the worker over the current jobs and yields the results. Meant to run
   * on its own thread; it is the only place the worker is invoked.
   *
   * @throws PhaseException when no batch has been started
   */
  public Callable<ImportEvent.BatchComplete> processImportBatch() {
    return read(
        () -> {
          if (phase != ImportPhase.IMPORTING && phase != ImportPhase.PASSWORD_INPUT) {
            throw PhaseException.notAllowed("process import batch", phase);
          }
          List<ImportJob> batch = jobs;
          ProgressSink sink = progressChannel.sink();
          PasswordHandshake handshake = passwordHandshake;
          return () -> {
            try {
              List<ImportResult> batchResults =
                  worker.importBatch(
                      batch, sink, handshake.requestSink(), handshake.responseSource());
              return new ImportEvent.BatchComplete(batchResults);
            } catch (RuntimeException e) {
              log.error(
                  "Batch worker failed: {} ({})",
                  e.getMessage(),
                  ExceptionUtil.formatCompactStackTrace(e));
              sink.close();
              write(() -> errorMessage = ExceptionUtil.extractErrorMessage(e));
              return new ImportEvent.BatchComplete(
                  batch.stream().map(job -> ImportResult.failure(job, e)).toList());
            }
          };
        });
  }

  /**
   * Store a password request from the worker and show the prompt. Allowed from any phase the
   * state machine can enter {@link ImportPhase#PASSWORD_INPUT} from.
   */
  public void handlePasswordRequest(PasswordRequest request) {
    Objects.requireNonNull(request, "request");
    write(
        () -> {
          PasswordRequest previous = pendingPassword;
          pendingPassword = request;
          try {
            transition(ImportPhase.PASSWORD_INPUT);
          } catch (PhaseException e) {
            pendingPassword = previous;
            throw e;
          }
        });
  }

  /**
   * Answer the pending password request.
   *
   * @throws PhaseException when no password is being asked for
   * @throws ChannelUnavailableException when the response slot is taken
   */
  public void submitPassword(String password) {
    respond("submit password", PasswordResponse.submit(password));
  }

  public void cancelPasswordInput() {
    respond("cancel password input", PasswordResponse.cancel());
  }

  /** Skip the file whose password is being asked for; the batch continues. */
  public void skipPasswordInput() {
    respond("skip password input", PasswordResponse.skipFile());
  }

  private void respond(String operation, PasswordResponse response) {
    write(
        () -> {
          requirePhase(operation, ImportPhase.PASSWORD_INPUT);
          if (!passwordHandshake.offerResponse(response)) {
            throw new ChannelUnavailableException(
                "failed to %s - channel unavailable".formatted(operation));
          }
          pendingPassword = null;
          transition(ImportPhase.IMPORTING);
        });
  }

  /** Store the batch results and enter {@link ImportPhase#COMPLETE}. */
  public void completeImport(List<ImportResult> batchResults) {
    Objects.requireNonNull(batchResults, "results");
    write(
        () -> {
          List<ImportResult> previous = results;
          results = List.copyOf(batchResults);
          try {
            transition(ImportPhase.COMPLETE);
          } catch (PhaseException e) {
            results = previous;
            throw e;
          }
          log.info("Import complete: {}", worker.getImportSummary(results));
        });
  }

  /** Enter {@link ImportPhase#CANCELLED} from any phase. Runs the cleanup callbacks. */
  public void cancelImport() {
    write(
        () -> {
          log.info("Import cancelled in phase {}", phase);
          transition(ImportPhase.CANCELLED);
        });
  }

  /**
   * Apply a progress snapshot. Inconsistent snapshots are logged and dropped; the phase never
   * changes here.
   */
  public void updateProgress(ImportProgress progress) {
    write(
        () -> {
          try {
            validator.validate(progress, currentProgress);
          } catch (ProgressValidationException e) {
            log.warn("Invalid import progress update: {}", e.getMessage());
            return;
          }
          currentProgress = progress;
          progressDisplay = progressDisplay.apply(progress);
        });
  }

  // ---------------------------------------------------------------- listeners

  /**
   * One poll of the progress channel. Yields the next snapshot, {@link
   * ImportEvent.ContinueListening} on timeout, or {@link ImportEvent.ProgressStreamClosed} once
   * the worker closed the stream and every snapshot was read.
   */
  public Callable<ImportEvent> listenForProgress() {
    ProgressChannel channel = read(() -> progressChannel);
    return () -> {
      if (channel.isDrained()) {
        return new ImportEvent.ProgressStreamClosed();
      }
      Optional<ImportProgress> next = channel.poll(settings.progressPollTimeout());
      if (next.isPresent()) {
        return new ImportEvent.ProgressUpdate(next.get());
      }
      return channel.isDrained()
          ? new ImportEvent.ProgressStreamClosed()
          : new ImportEvent.ContinueListening(ImportEvent.Listener.PROGRESS);
    };
  }

  /** One poll for a password request; {@link ImportEvent.ContinueListening} on timeout. */
  public Callable<ImportEvent> listenForPasswordRequests() {
    PasswordHandshake handshake = read(() -> passwordHandshake);
    return () ->
        handshake
            .pollRequest(settings.passwordPollTimeout())
            .<ImportEvent>map(ImportEvent.PasswordRequested::new)
            .orElseGet(
                () -> new ImportEvent.ContinueListening(ImportEvent.Listener.PASSWORD_REQUESTS));
  }

  /** Consumer side of the current batch's progress channel. */
  public ProgressChannel getProgressChannel() {
    return read(() -> progressChannel);
  }

  /** Consumer side of the current batch's password handshake. */
  public PasswordHandshake getPasswordHandshake() {
    return read(() -> passwordHandshake);
  }

  // ---------------------------------------------------------------- completion

  /**
   * Turn a completion choice into the event the driver acts on.
   *
   * @throws PhaseException outside {@link ImportPhase#COMPLETE}
   */
  public ImportEvent handleCompletionAction(CompletionAction action) {
    Objects.requireNonNull(action, "action");
    return read(
        () -> {
          requirePhase("handle completion action", ImportPhase.COMPLETE);
          ImportEvent event =
              switch (action) {
                case RETURN_TO_MENU -> new ImportEvent.ReturnToMenu();
                case SELECT_DIFFERENT_FILES -> new ImportEvent.ReturnToSelection();
                case VIEW_ERROR_DETAILS -> new ImportEvent.ErrorDetails(
                    worker.getImportSummary(results).errors());
                case RETRY_FAILED, RETRY_WITH_MANUAL_PASSWORDS, RETRY_SKIPPED, RETRY_ALL -> {
                  RetryPlan plan = RetryPolicy.plan(action.retryStrategy(), results);
                  yield new ImportEvent.RetryRequested(plan);
                }
              };
          return event;
        });
  }

  public ImportEvent.RetryRequested retrySpecificFile(Path file) {
    return read(
        () -> {
          requirePhase("retry file", ImportPhase.COMPLETE);
          return new ImportEvent.RetryRequested(RetryPolicy.planSpecific(file));
        });
  }

  /** Go back to file selection with {@code files} already selected. */
  public void restartWithFiles(List<Path> files, boolean manualPasswords) {
    write(
        () -> {
          transition(ImportPhase.FILE_SELECTION);
          fileSelection = FileSelection.ofFiles(files);
          forceManualPasswords = manualPasswords;
        });
  }

  public void restartWith(RetryPlan plan) {
    restartWithFiles(plan.files(), plan.forceManualPasswords());
  }

  // ---------------------------------------------------------------- cleanup

  /**
   * Register work to run once when the import is cancelled or {@link #cleanup()} is called.
   * Entering {@link ImportPhase#FILE_SELECTION} discards callbacks that have not run.
   */
  public void addCleanupCallback(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    write(() -> cleanupCallbacks.add(callback));
  }

  public void cleanup() {
    write(this::runCleanup);
  }

  // ---------------------------------------------------------------- queries

  public boolean isCompleted() {
    return read(() -> completed);
  }

  public boolean isCancelled() {
    return read(() -> cancelled);
  }

  public boolean isShowingPopup() {
    return read(() -> showingPopup);
  }

  public List<ImportJob> getJobs() {
    return read(() -> jobs);
  }

  public List<ImportResult> getResults() {
    return read(() -> List.copyOf(results));
  }

  public ImportSummary getSummary() {
    return read(() -> worker.getImportSummary(results));
  }

  /** Built on entering {@link ImportPhase#COMPLETE} with results; empty otherwise. */
  public Optional<ImportSummary> getCompletionSummary() {
    return read(() -> Optional.ofNullable(completionReport).map(CompletionReport::summary));
  }

  public Optional<CompletionReport> getCompletionReport() {
    return read(() -> Optional.ofNullable(completionReport));
  }

  public ImportProgress getCurrentProgress() {
    return read(() -> currentProgress);
  }

  public ProgressDisplay getProgressDisplay() {
    return read(() -> progressDisplay);
  }

  public Optional<PasswordRequest> getPendingPassword() {
    return read(() -> Optional.ofNullable(pendingPassword));
  }

  public Optional<PasswordPrompt> getPasswordPrompt() {
    return read(() -> Optional.ofNullable(passwordPrompt));
  }

  /** Error analysis of the last batch, when the worker offers one. */
  public Optional<ErrorReport> getErrorReport() {
    return worker.errorReporting().flatMap(ErrorReporting::lastErrorReport);
  }

  public List<RetryRecommendation> getRetryRecommendations() {
    return worker.errorReporting().map(ErrorReporting::retryRecommendations).orElse(List.of());
  }

  public StateInfo getStateInfo() {
    return read(
        () ->
            new StateInfo(
                phase,
                fileSelection.files().size(),
                fileSelection.selectedDirectory().map(Path::toString).orElse(""),
                jobs.size(),
                results.size(),
                showingPopup,
                pendingPassword != null,
                completed,
                cancelled,
                errorMessage));
  }

  // ---------------------------------------------------------------- internals

  /** Caller holds the write lock. */
  private void transition(ImportPhase target) {
    Objects.requireNonNull(target, "target");
    if (!isValidTransition(phase, target)) {
      throw PhaseException.invalidTransition(phase, target);
    }
    ImportPhase from = phase;
    phase = target;
    switch (target) {
      case FILE_SELECTION -> setupFileSelection();
      case IMPORTING -> setupImporting();
      case PASSWORD_INPUT -> setupPasswordInput();
      case COMPLETE -> setupComplete();
      case CANCELLED -> setupCancelled();
    }
    log.debug("Phase transition {} -> {}", from, target);
  }

  private void setupFileSelection() {
    fileSelection = FileSelection.empty();
    forceManualPasswords = false;
    jobs = List.of();
    results = List.of();
    completed = false;
    cancelled = false;
    errorMessage = null;
    showingPopup = false;
    pendingPassword = null;
    passwordPrompt = null;
    completionReport = null;
    passwordHandshake.clear();
    // callbacks of the previous batch must not fire for the next one
    cleanupCallbacks = new ArrayList<>();
  }

  private void setupImporting() {
    showingPopup = false;
    passwordPrompt = null;
    startTime = clock.instant();
    progressDisplay = ProgressDisplay.reset(jobs.size());
    currentProgress = ImportProgress.initial(jobs.size(), startTime);
  }

  private void setupPasswordInput() {
    showingPopup = true;
    passwordPrompt =
        pendingPassword == null
            ? null
            : PasswordPrompt.from(pendingPassword, settings.maxPasswordAttempts());
  }

  private void setupComplete() {
    completed = true;
    showingPopup = false;
    pendingPassword = null;
    passwordPrompt = null;
    progressDisplay = progressDisplay.complete();
    if (!results.isEmpty()) {
      completionReport =
          CompletionReport.of(worker.getImportSummary(results), startTime, clock.instant());
    }
  }

  private void setupCancelled() {
    cancelled = true;
    showingPopup = false;
    pendingPassword = null;
    passwordPrompt = null;
    passwordHandshake.clear();
    runCleanup();
  }

  private void runCleanup() {
    List<Runnable> callbacks = cleanupCallbacks;
    cleanupCallbacks = new ArrayList<>();
    for (Runnable callback : callbacks) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        log.error("Cleanup callback failed: {}", e.getMessage(), e);
      }
    }
  }

  private void requirePhase(String operation, ImportPhase required) {
    if (phase != required) {
      throw PhaseException.notAllowed(operation, phase);
    }
  }

  private ProgressChannel newProgressChannel() {
    return new ProgressChannel(settings.progressCapacity(), settings.progressSendTimeout());
  }

  private <T> T read(Supplier<T> action) {
    lock.readLock().lock();
    try {
      return action.get();
    } finally {
      lock.readLock().unlock();
    }
  }

  private void write(Runnable action) {
    lock.writeLock().lock();
    try {
      action.run();
    } finally {
      lock.writeLock().unlock();
    }
  }
}
