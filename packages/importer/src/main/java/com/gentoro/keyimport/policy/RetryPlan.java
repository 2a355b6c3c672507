package com.gentoro.keyimport.policy;

import java.nio.file.Path;
import java.util.List;

/**
 * Files to import again and how.
 *
 * @param forceManualPasswords ignore {@code .pwd} files and ask for every password
 */
public record RetryPlan(RetryStrategy strategy, List<Path> files, boolean forceManualPasswords) {

  public RetryPlan {
    files = List.copyOf(files);
  }

  public boolean isEmpty() {
    return files.isEmpty();
  }
}
