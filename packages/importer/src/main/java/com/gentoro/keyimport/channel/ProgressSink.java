package com.gentoro.keyimport.channel;

import com.gentoro.keyimport.model.ImportProgress;

/** Worker-side half of the progress channel. */
public interface ProgressSink {

  /**
   * Best-effort publish. Waits at most the configured send timeout and drops the snapshot when
   * the consumer is too far behind.
   *
   * @return true when the snapshot was enqueued
   */
  boolean publish(ImportProgress progress);

  /** Publish the last snapshot of a batch. Always enqueued, evicting older snapshots if needed. */
  void publishFinal(ImportProgress progress);

  /** Signal end of stream. Later publishes are ignored. */
  void close();
}
