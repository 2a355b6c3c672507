package com.gentoro.keyimport.worker;

import com.gentoro.keyimport.channel.PasswordRequestSink;
import com.gentoro.keyimport.channel.PasswordResponseSource;
import com.gentoro.keyimport.channel.ProgressSink;
import com.gentoro.keyimport.model.ImportJob;
import com.gentoro.keyimport.model.ImportResult;
import com.gentoro.keyimport.model.ImportSummary;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Collaborator that turns a selection into jobs and runs them. The orchestration layer never
 * decrypts anything itself.
 *
 * <p>Job creation and validation failures are reported by throwing; per-job import failures are
 * reported as unsuccessful {@link ImportResult}s, never as exceptions.
 */
public interface BatchImportWorker {

  List<ImportJob> createImportJobsFromFiles(List<Path> files);

  List<ImportJob> createImportJobsFromDirectory(Path directory);

  /**
   * Validate jobs before a run.
   *
   * @return the jobs to run; implementations may adjust jobs (for example drop an unusable
   *     password file and switch the job to interactive input) but never add or remove any
   */
  List<ImportJob> validateImportJobs(List<ImportJob> jobs);

  /**
   * Run every job sequentially, returning one result per job in input order.
   *
   * <p>Password handshake contract: offer exactly one request on {@code passwordRequests}, then
   * block on {@code passwordResponses} until the UI answers. The progress sink must be closed
   * before returning.
   */
  List<ImportResult> importBatch(
      List<ImportJob> jobs,
      ProgressSink progress,
      PasswordRequestSink passwordRequests,
      PasswordResponseSource passwordResponses);

  ImportSummary getImportSummary(List<ImportResult> results);

  /**
   * Optional error reporting capability. May be absent; callers must handle {@link
   * Optional#empty()}.
   */
  default Optional<ErrorReporting> errorReporting() {
    return Optional.empty();
  }
}
