package com.gentoro.keyimport.channel;

import com.gentoro.keyimport.model.ImportProgress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Bounded worker-to-consumer queue of {@link ImportProgress} snapshots.
 *
 * <p>Producers never block longer than {@code sendTimeout}; intermediate snapshots may be lost
 * under back-pressure, the final one may not. The consumer polls with a timeout and is told when
 * the stream has been closed and fully drained.
 */
public final class ProgressChannel implements ProgressSink {
  private static final Logger log =
      com.gentoro.keyimport.logging.LoggingService.getLogger(ProgressChannel.class);

  public static final int DEFAULT_CAPACITY = 500;
  public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofMillis(500);

  private final BlockingQueue<ImportProgress> queue;
  private final Duration sendTimeout;
  private volatile boolean closed;

  public ProgressChannel() {
    this(DEFAULT_CAPACITY, DEFAULT_SEND_TIMEOUT);
  }

  public ProgressChannel(int capacity, Duration sendTimeout) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Progress channel capacity must be positive: " + capacity);
    }
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout");
  }

  @Override
  public boolean publish(ImportProgress progress) {
    Objects.requireNonNull(progress, "progress");
    if (closed) {
      log.debug("Progress channel closed, ignoring snapshot for '{}'", progress.currentFile());
      return false;
    }
    try {
      if (queue.offer(progress, sendTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.warn(
        "Progress update dropped, channel may be blocked (file: {}, progress: {}%)",
        progress.currentFile(),
        String.format("%.1f", progress.percentage()));
    return false;
  }

  @Override
  public void publishFinal(ImportProgress progress) {
    Objects.requireNonNull(progress, "progress");
    if (closed) {
      log.debug("Progress channel closed, final snapshot ignored");
      return;
    }
    while (!queue.offer(progress)) {
      ImportProgress evicted = queue.poll();
      if (evicted != null) {
        log.debug(
            "Evicted stale snapshot ({} of {}) to deliver final progress",
            evicted.processedFiles(),
            evicted.totalFiles());
      }
    }
  }

  @Override
  public void close() {
    closed = true;
  }

  /** Producer half handed to the worker; exposes none of the consumer operations. */
  public ProgressSink sink() {
    ProgressChannel channel = this;
    return new ProgressSink() {
      @Override
      public boolean publish(ImportProgress progress) {
        return channel.publish(progress);
      }

      @Override
      public void publishFinal(ImportProgress progress) {
        channel.publishFinal(progress);
      }

      @Override
      public void close() {
        channel.close();
      }
    };
  }

  /** Next snapshot, or empty when none arrived within {@code timeout}. */
  public Optional<ImportProgress> poll(Duration timeout) throws InterruptedException {
    return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  public boolean isClosed() {
    return closed;
  }

  /** Closed and nothing left to read. */
  public boolean isDrained() {
    return closed && queue.isEmpty();
  }

  public int size() {
    return queue.size();
  }
}
