package com.gentoro.keyimport.state;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * What the user picked: a list of files or one directory, never both.
 *
 * @param directory null when files were picked
 */
public record FileSelection(List<Path> files, Path directory) {

  public FileSelection {
    files = files == null ? List.of() : List.copyOf(files);
    if (!files.isEmpty() && directory != null) {
      throw new IllegalArgumentException("Select files or a directory, not both");
    }
  }

  public static FileSelection empty() {
    return new FileSelection(List.of(), null);
  }

  public static FileSelection ofFiles(List<Path> files) {
    return new FileSelection(files, null);
  }

  public static FileSelection ofDirectory(Path directory) {
    return new FileSelection(List.of(), directory);
  }

  public boolean isEmpty() {
    return files.isEmpty() && directory == null;
  }

  public Optional<Path> selectedDirectory() {
    return Optional.ofNullable(directory);
  }
}
