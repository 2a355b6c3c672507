package com.gentoro.keyimport.keystore;

import com.gentoro.keyimport.ImportSettings;
import com.gentoro.keyimport.channel.PasswordRequestSink;
import com.gentoro.keyimport.channel.PasswordResponseSource;
import com.gentoro.keyimport.channel.ProgressSink;
import com.gentoro.keyimport.exception.ExceptionUtil;
import com.gentoro.keyimport.model.ImportError;
import com.gentoro.keyimport.model.ImportJob;
import com.gentoro.keyimport.model.ImportProgress;
import com.gentoro.keyimport.model.ImportResult;
import com.gentoro.keyimport.model.ImportSummary;
import com.gentoro.keyimport.model.PasswordRequest;
import com.gentoro.keyimport.model.PasswordResponse;
import com.gentoro.keyimport.worker.BatchImportWorker;
import com.gentoro.keyimport.worker.ErrorReport;
import com.gentoro.keyimport.worker.ErrorReporting;
import com.gentoro.keyimport.worker.RetryRecommendation;
import com.gentoro.keyimport.worker.UserAction;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * {@link BatchImportWorker} for V3 keystore files. Passwords come from the job, from a {@code
 * .pwd} companion file, or from the user through the password handshake; the actual decryption
 * is done by a {@link KeystoreImporter}.
 */
public class KeystoreBatchImportService implements BatchImportWorker, ErrorReporting {
  private static final Logger log =
      com.gentoro.keyimport.logging.LoggingService.getLogger(KeystoreBatchImportService.class);

  static final String INCORRECT_PASSWORD_MESSAGE = "Incorrect password. Please try again.";
  static final String EMPTY_PASSWORD_MESSAGE =
      "Password cannot be empty. Please enter a valid password.";

  private final KeystoreImporter importer;
  private final PasswordFileManager passwordFiles;
  private final KeystoreValidator validator;
  private final int maxPasswordAttempts;
  private final Duration passwordInputTimeout;
  private final Clock clock;

  private volatile ErrorAggregator errorAggregator;

  public KeystoreBatchImportService(KeystoreImporter importer, ImportSettings settings) {
    this(
        importer,
        new PasswordFileManager(),
        new KeystoreValidator(),
        settings.maxPasswordAttempts(),
        settings.passwordInputTimeout(),
        Clock.systemUTC());
  }

  public KeystoreBatchImportService(
      KeystoreImporter importer,
      PasswordFileManager passwordFiles,
      KeystoreValidator validator,
      int maxPasswordAttempts,
      Duration passwordInputTimeout,
      Clock clock) {
    this.importer = Objects.requireNonNull(importer, "importer");
    this.passwordFiles = Objects.requireNonNull(passwordFiles, "passwordFiles");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.maxPasswordAttempts = maxPasswordAttempts;
    this.passwordInputTimeout =
        Objects.requireNonNull(passwordInputTimeout, "passwordInputTimeout");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public List<ImportJob> createImportJobsFromFiles(List<Path> files) {
    if (files == null || files.isEmpty()) {
      throw new KeystoreImportException(
          KeystoreErrorType.IMPORT_JOB_VALIDATION_FAILED, "no keystore files provided");
    }
    List<ImportJob> jobs = new ArrayList<>(files.size());
    for (Path file : files) {
      if (!Files.exists(file)) {
        throw new KeystoreImportException(
            KeystoreErrorType.FILE_NOT_FOUND,
            "keystore file not found: " + file,
            file.toString());
      }
      Path passwordFile = passwordFiles.findPasswordFile(file).orElse(null);
      ImportJob job = ImportJob.of(file, PasswordFileManager.baseName(file), passwordFile);
      log.debug(
          "Prepared import job for {} (password file: {})",
          file,
          passwordFile == null ? "none" : passwordFile.getFileName());
      jobs.add(job);
    }
    return jobs;
  }

  @Override
  public List<ImportJob> createImportJobsFromDirectory(Path directory) {
    if (directory == null || StringUtils.isBlank(directory.toString())) {
      throw new KeystoreImportException(
          KeystoreErrorType.DIRECTORY_SCAN_FAILED, "directory path cannot be empty");
    }
    if (!Files.exists(directory)) {
      throw new KeystoreImportException(
          KeystoreErrorType.DIRECTORY_SCAN_FAILED,
          "directory not found: " + directory,
          directory.toString());
    }
    if (!Files.isDirectory(directory)) {
      throw new KeystoreImportException(
          KeystoreErrorType.DIRECTORY_SCAN_FAILED,
          "path is not a directory: " + directory,
          directory.toString());
    }
    DirectoryScan scan = scanDirectory(directory);
    if (scan.keystores().isEmpty()) {
      String message = "no valid keystore files found in directory: " + directory;
      if (!scan.rejected().isEmpty()) {
        message += " (found %d invalid files)".formatted(scan.rejected().size());
      }
      throw new KeystoreImportException(
          KeystoreErrorType.DIRECTORY_SCAN_FAILED, message, directory.toString());
    }
    log.info(
        "Found {} keystore file(s) in {} ({} rejected)",
        scan.keystores().size(),
        directory,
        scan.rejected().size());
    return createImportJobsFromFiles(scan.keystores());
  }

  /**
   * Recursively collect {@code *.json} files that pass structural validation. Unreadable entries
   * and invalid files are reported, not thrown.
   */
  public DirectoryScan scanDirectory(Path directory) {
    List<Path> keystores = new ArrayList<>();
    List<DirectoryScan.Rejected> rejected = new ArrayList<>();
    try {
      Files.walkFileTree(
          directory,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
              if (!attrs.isRegularFile()
                  || !file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")) {
                return FileVisitResult.CONTINUE;
              }
              if (validator.isValidKeystore(file)) {
                keystores.add(file);
              } else {
                rejected.add(new DirectoryScan.Rejected(file, "invalid keystore format"));
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
              rejected.add(new DirectoryScan.Rejected(file, "access error: " + exc.getMessage()));
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException e) {
      throw new KeystoreImportException(
          KeystoreErrorType.DIRECTORY_SCAN_FAILED,
          "error scanning directory %s: %s".formatted(directory, e.getMessage()),
          directory.toString(),
          e);
    }
    keystores.sort(null);
    return new DirectoryScan(keystores, rejected);
  }

  @Override
  public List<ImportJob> validateImportJobs(List<ImportJob> jobs) {
    if (jobs == null || jobs.isEmpty()) {
      throw new KeystoreImportException(
          KeystoreErrorType.IMPORT_JOB_VALIDATION_FAILED, "no import jobs provided");
    }
    List<ImportJob> validated = new ArrayList<>(jobs.size());
    for (int i = 0; i < jobs.size(); i++) {
      ImportJob job = jobs.get(i);
      String path = job.keystorePath().toString();
      if (path.isEmpty()) {
        throw new KeystoreImportException(
            KeystoreErrorType.IMPORT_JOB_VALIDATION_FAILED,
            "job %d: keystore path cannot be empty".formatted(i));
      }
      if (!Files.exists(job.keystorePath())) {
        throw new KeystoreImportException(
            KeystoreErrorType.FILE_NOT_FOUND,
            "job %d: keystore file not found: %s".formatted(i, path),
            path);
      }
      if (StringUtils.isBlank(job.walletName())) {
        throw new KeystoreImportException(
            KeystoreErrorType.IMPORT_JOB_VALIDATION_FAILED,
            "job %d: wallet name cannot be empty".formatted(i),
            path);
      }
      if (job.passwordPath() != null) {
        try {
          passwordFiles.validatePasswordFile(job.passwordPath());
        } catch (KeystoreImportException e) {
          log.warn(
              "Password file for {} is unusable, falling back to manual input: {}",
              job.fileName(),
              e.getMessage());
          job = job.withManualInput();
        }
      }
      validated.add(job);
    }
    return validated;
  }

  @Override
  public synchronized List<ImportResult> importBatch(
      List<ImportJob> jobs,
      ProgressSink progress,
      PasswordRequestSink passwordRequests,
      PasswordResponseSource passwordResponses) {
    List<ImportResult> results = new ArrayList<>();
    try {
      if (jobs == null || jobs.isEmpty()) {
        errorAggregator = new ErrorAggregator(0, clock);
        return results;
      }
      errorAggregator = new ErrorAggregator(jobs.size(), clock);
      BatchRun run = new BatchRun(jobs.size(), progress, passwordRequests, passwordResponses);
      log.info("Starting import of {} keystore(s)", jobs.size());
      run.publish(run.progress);

      for (int i = 0; i < jobs.size(); i++) {
        ImportJob job = jobs.get(i);
        run.progress = run.progress.processing(job.fileName(), i, run.elapsed());
        run.publish(run.progress);

        ImportResult result = processJob(job, run);
        results.add(result);
        if (result.success()) {
          errorAggregator.addSuccess();
          log.debug("Imported {} as '{}'", job.fileName(), job.walletName());
        } else {
          errorAggregator.addError(
              result.error(),
              job.keystorePath().toString(),
              result.skipped() ? UserAction.SKIP : UserAction.NONE);
          run.progress = run.progress.withError(ImportError.from(result));
          if (result.skipped()) {
            log.info("Skipped {}: {}", job.fileName(), result.errorMessage());
          } else {
            log.warn("Import of {} failed: {}", job.fileName(), result.errorMessage());
          }
        }
      }

      progress.publishFinal(run.progress.finished(run.elapsed()));
      log.info(
          "Import batch finished in {} ms",
          Duration.between(run.start, clock.instant()).toMillis());
      return results;
    } finally {
      progress.close();
    }
  }

  private ImportResult processJob(ImportJob job, BatchRun run) {
    String password = StringUtils.isNotEmpty(job.manualPassword()) ? job.manualPassword() : null;
    boolean requiresInput = job.requiresInput();

    if (password == null && job.passwordPath() != null) {
      try {
        password = passwordFiles.readPassword(job.passwordPath());
      } catch (KeystoreImportException e) {
        log.warn(
            "Cannot use password file for {}, asking for the password instead: {}",
            job.fileName(),
            e.getMessage());
        requiresInput = true;
      }
    }

    if (password == null && requiresInput) {
      try {
        password = requestPassword(job, run);
      } catch (KeystoreImportException e) {
        return e.isUserAction() ? ImportResult.skipped(job, e) : ImportResult.failure(job, e);
      }
    }

    if (password == null) {
      return ImportResult.failure(
          job,
          new KeystoreImportException(
              KeystoreErrorType.BATCH_IMPORT_FAILED,
              "no password available for keystore import",
              job.keystorePath().toString()));
    }

    try {
      importer.importKeystore(job, password);
      return ImportResult.success(job);
    } catch (KeystoreImportException e) {
      return ImportResult.failure(job, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ImportResult.failure(
          job,
          new KeystoreImportException(
              KeystoreErrorType.BATCH_IMPORT_FAILED,
              "keystore import interrupted",
              job.keystorePath().toString(),
              e));
    } catch (Exception e) {
      return ImportResult.failure(
          job,
          new KeystoreImportException(
              KeystoreErrorType.BATCH_IMPORT_FAILED,
              "keystore import failed: " + ExceptionUtil.extractErrorMessage(e),
              job.keystorePath().toString(),
              e));
    }
  }

  /**
   * Ask for a password until it verifies, the user gives up, or the attempts run out.
   *
   * @throws KeystoreImportException with a password input type when no password was obtained
   */
  private String requestPassword(ImportJob job, BatchRun run) {
    String file = job.keystorePath().toString();
    String previousError = null;

    for (int attempt = 1; attempt <= maxPasswordAttempts; attempt++) {
      run.progress = run.progress.awaitingPassword(job.fileName(), run.elapsed());
      run.publish(run.progress);

      PasswordRequest request =
          new PasswordRequest(file, attempt, attempt > 1 ? previousError : null, attempt > 1);
      if (!run.passwordRequests.offerRequest(request)) {
        run.progress = run.progress.passwordResolved(run.elapsed());
        run.publish(run.progress);
        throw new KeystoreImportException(
            KeystoreErrorType.PASSWORD_INPUT_TIMEOUT,
            "failed to send password request - communication error",
            file);
      }
      log.debug(
          "Requested password for {} (attempt {} of {})",
          job.fileName(),
          attempt,
          maxPasswordAttempts);

      Optional<PasswordResponse> answer;
      try {
        answer = run.passwordResponses.awaitResponse(passwordInputTimeout);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new KeystoreImportException(
            KeystoreErrorType.PASSWORD_INPUT_CANCELLED, "password input interrupted", file, e);
      }

      run.progress = run.progress.passwordResolved(run.elapsed());
      run.publish(run.progress);

      if (answer.isEmpty()) {
        throw new KeystoreImportException(
            KeystoreErrorType.PASSWORD_INPUT_TIMEOUT,
            "password input timeout after %d seconds".formatted(passwordInputTimeout.toSeconds()),
            file);
      }
      PasswordResponse response = answer.get();
      if (response.cancelled()) {
        throw new KeystoreImportException(
            KeystoreErrorType.PASSWORD_INPUT_CANCELLED, "password input cancelled by user", file);
      }
      if (response.skip()) {
        throw new KeystoreImportException(
            KeystoreErrorType.PASSWORD_INPUT_SKIPPED, "import skipped by user", file);
      }
      if (StringUtils.isEmpty(response.password())) {
        previousError = EMPTY_PASSWORD_MESSAGE;
        if (attempt < maxPasswordAttempts) {
          continue;
        }
        throw new KeystoreImportException(
            KeystoreErrorType.PASSWORD_INPUT_INVALID, "empty password provided", file);
      }
      if (importer.verifyPassword(job.keystorePath(), response.password())) {
        return response.password();
      }
      previousError = INCORRECT_PASSWORD_MESSAGE;
      log.debug("Password rejected for {} (attempt {})", job.fileName(), attempt);
    }

    throw new KeystoreImportException(
        KeystoreErrorType.MAX_PASSWORD_ATTEMPTS_EXCEEDED,
        "incorrect password after %d attempts".formatted(maxPasswordAttempts),
        file);
  }

  @Override
  public ImportSummary getImportSummary(List<ImportResult> results) {
    return ImportSummary.fromResults(results);
  }

  @Override
  public Optional<ErrorReporting> errorReporting() {
    return Optional.of(this);
  }

  @Override
  public Optional<ErrorReport> lastErrorReport() {
    ErrorAggregator aggregator = errorAggregator;
    return aggregator == null ? Optional.empty() : Optional.of(aggregator.generateReport());
  }

  @Override
  public List<RetryRecommendation> retryRecommendations() {
    ErrorAggregator aggregator = errorAggregator;
    return aggregator == null ? List.of() : aggregator.retryRecommendations();
  }

  /** Result of {@link #scanDirectory(Path)}. */
  public record DirectoryScan(List<Path> keystores, List<Rejected> rejected) {
    public DirectoryScan {
      keystores = List.copyOf(keystores);
      rejected = List.copyOf(rejected);
    }

    public record Rejected(Path path, String reason) {}
  }

  /** Mutable state of one {@link #importBatch} call. */
  private final class BatchRun {
    final Instant start = clock.instant();
    final ProgressSink progressSink;
    final PasswordRequestSink passwordRequests;
    final PasswordResponseSource passwordResponses;
    ImportProgress progress;

    BatchRun(
        int total,
        ProgressSink progressSink,
        PasswordRequestSink passwordRequests,
        PasswordResponseSource passwordResponses) {
      this.progressSink = progressSink;
      this.passwordRequests = passwordRequests;
      this.passwordResponses = passwordResponses;
      this.progress = ImportProgress.initial(total, start);
    }

    Duration elapsed() {
      return Duration.between(start, clock.instant());
    }

    void publish(ImportProgress snapshot) {
      progressSink.publish(snapshot);
    }
  }
}
