package com.gentoro.keyimport;

import com.gentoro.keyimport.driver.ImportDriver;
import com.gentoro.keyimport.exception.ConfigurationException;
import com.gentoro.keyimport.exception.ExceptionUtil;
import com.gentoro.keyimport.exception.KeyImportException;
import com.gentoro.keyimport.keystore.KeystoreBatchImportService;
import com.gentoro.keyimport.keystore.KeystoreImporter;
import com.gentoro.keyimport.keystore.KeystoreImporters;
import com.gentoro.keyimport.model.ImportPhase;
import com.gentoro.keyimport.model.ImportSummary;
import com.gentoro.keyimport.policy.CompletionAction;
import com.gentoro.keyimport.policy.CompletionReport;
import com.gentoro.keyimport.state.ImportController;
import com.gentoro.keyimport.state.ImportEvent;
import com.gentoro.keyimport.worker.BatchImportWorker;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Wires configuration, logging, the keystore worker, the controller and the console front end,
 * then runs imports until the user leaves the completion menu.
 */
public class KeyImport {
  private static final Logger log =
      com.gentoro.keyimport.logging.LoggingService.getLogger(KeyImport.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private ImportSettings settings;
  private ImportController controller;
  private ConsolePasswordPrompter prompter;
  private final SummaryReportWriter reportWriter = new SummaryReportWriter();
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private volatile Thread shutdownHook;

  public KeyImport(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.keyimport.logging.LoggingService.applyConfiguration(configuration());
    this.settings = ImportSettings.from(configuration());

    KeystoreImporter importer =
        KeystoreImporters.create(settings.keystoreImporter(), configuration());
    wire(new KeystoreBatchImportService(importer, settings), new ConsolePasswordPrompter());

    if (shutdownHook == null) {
      shutdownHook = new Thread(this::shutdown, "keyimport-shutdown-hook");
      Runtime.getRuntime().addShutdownHook(shutdownHook);
    }
  }

  /** Build the controller around an already created worker and prompter. */
  void wire(BatchImportWorker worker, ConsolePasswordPrompter prompter) {
    if (settings == null) {
      this.settings = ImportSettings.defaults();
    }
    this.controller = new ImportController(worker, settings);
    this.prompter = prompter;
  }

  /**
   * Run the import for the selection given on the command line.
   *
   * @return process exit code: 0 when every keystore was imported, 1 when some failed or were
   *     skipped, 2 when the import was cancelled
   */
  public int run() throws InterruptedException {
    if (controller == null) {
      throw new IllegalStateException("KeyImport not initialized. Call initialize() first.");
    }
    applySelection(startupParameters.files(), startupParameters.directory());
    controller.forceManualPasswords(startupParameters.manualPasswords());

    boolean interactive = !"once".equalsIgnoreCase(startupParameters.mode());
    ImportSummary summary = ImportSummary.empty();
    while (true) {
      summary = runBatch();
      if (controller.isCancelled()) {
        log.info("Import cancelled");
        return 2;
      }
      Optional<CompletionReport> report = controller.getCompletionReport();
      if (report.isEmpty()) {
        break;
      }
      Path reportFile = startupParameters.reportFile();
      if (reportFile != null) {
        reportWriter.write(report.get(), reportFile);
      }
      if (!interactive) {
        prompter.printReport(report.get());
        break;
      }
      if (!followUp(report.get())) {
        break;
      }
    }
    return summary.failedImports() + summary.skippedImports() == 0 ? 0 : 1;
  }

  private ImportSummary runBatch() throws InterruptedException {
    try (ImportDriver driver =
        new ImportDriver(controller, prompter, settings.progressPollTimeout())) {
      return driver.runImport();
    }
  }

  /** @return true when another batch has been prepared */
  private boolean followUp(CompletionReport report) {
    while (true) {
      CompletionAction action = prompter.chooseAction(report);
      ImportEvent event = controller.handleCompletionAction(action);
      if (event instanceof ImportEvent.RetryRequested retry) {
        if (retry.plan().isEmpty()) {
          log.info("Nothing to retry for {}", action.label());
          continue;
        }
        controller.restartWith(retry.plan());
        return true;
      }
      if (event instanceof ImportEvent.ErrorDetails details) {
        prompter.printErrorDetails(details.errors());
        continue;
      }
      if (event instanceof ImportEvent.ReturnToSelection) {
        Optional<String> input =
            prompter.readSelection("Keystore files (comma separated) or a directory: ");
        if (input.isEmpty()) {
          continue;
        }
        controller.transitionToPhase(ImportPhase.FILE_SELECTION);
        applySelection(input.get());
        return true;
      }
      return false;
    }
  }

  private void applySelection(String input) {
    List<Path> paths =
        Arrays.stream(StringUtils.split(input, ','))
            .map(String::trim)
            .filter(StringUtils::isNotEmpty)
            .map(Path::of)
            .toList();
    if (paths.size() == 1 && Files.isDirectory(paths.get(0))) {
      applySelection(List.of(), paths.get(0));
    } else {
      applySelection(paths, null);
    }
  }

  private void applySelection(List<Path> files, Path directory) {
    if (!files.isEmpty() && directory != null) {
      throw new ConfigurationException("Use either --files or --dir, not both");
    }
    if (directory != null) {
      controller.selectDirectory(directory);
    } else if (!files.isEmpty()) {
      controller.selectFiles(files);
    } else {
      throw new ConfigurationException(
          "Nothing to import: pass --files=a.json,b.json or --dir=path");
    }
  }

  /** Cancel a running import and release resources. Safe to call more than once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    try {
      if (controller != null && !controller.isCompleted() && !controller.isCancelled()) {
        controller.cancelImport();
      }
    } catch (KeyImportException e) {
      log.debug("Cancel during shutdown failed: {}", ExceptionUtil.extractErrorMessage(e));
    } finally {
      if (prompter != null) {
        prompter.close();
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new IllegalStateException("KeyImport not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public ImportController controller() {
    return controller;
  }
}
