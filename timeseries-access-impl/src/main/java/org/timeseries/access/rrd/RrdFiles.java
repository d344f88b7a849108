package org.timeseries.access.rrd;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/** Filesystem preparation for adapters that run rrdtool on this host. */
@Slf4j
final class RrdFiles {

  private RrdFiles() {}

  /** Creates {@code directory} if needed. Returns false when it is missing or not writable. */
  static boolean ensureDirectory(Path directory) {
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      log.warn("Cannot create RRD directory {}: {}", directory, e.getMessage());
      return false;
    }
    if (!Files.isWritable(directory)) {
      log.warn("RRD directory {} is not writable", directory);
      return false;
    }
    return true;
  }

  /** Creates the parent folders of a file about to be created by rrdtool. */
  static void ensureParent(Path file) {
    Path parent = file.getParent();
    if (parent != null && !ensureDirectory(parent)) {
      log.debug("Parent of {} could not be prepared, rrdtool will report the failure", file);
    }
  }
}
