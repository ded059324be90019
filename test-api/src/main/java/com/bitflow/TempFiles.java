package com.bitflow;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Scratch directories for tests. Everything handed out is removed by
 * {@link #cleanup()}, or when the JVM exits if a test never calls it.
 */
public class TempFiles {

  private static final Logger logger = LoggerFactory.getLogger(TempFiles.class);

  private final Deque<File> created = new ArrayDeque<File>();
  private final Thread exitHook = new Thread(this::deleteAll, "temp-files-cleanup");

  public TempFiles() {
    Runtime.getRuntime().addShutdownHook(exitHook);
  }

  public final File createTempDir() throws IOException {
    File dir = Files.createTempDirectory("bitflow").toFile().getCanonicalFile();
    synchronized (created) {
      created.push(dir);
    }
    return dir;
  }

  /**
   * Writes {@code content} to a new file under a fresh scratch directory.
   */
  public final File createTempFile(String name, byte[] content) throws IOException {
    File file = new File(createTempDir(), name);
    FileUtils.writeByteArrayToFile(file, content);
    return file;
  }

  public void cleanup() {
    deleteAll();
    try {
      Runtime.getRuntime().removeShutdownHook(exitHook);
    } catch (IllegalStateException e) {
      logger.debug("JVM already shutting down, leaving cleanup to the exit hook");
    }
  }

  private void deleteAll() {
    synchronized (created) {
      while (!created.isEmpty()) {
        File dir = created.pop();
        try {
          FileUtils.forceDelete(dir);
        } catch (IOException e) {
          logger.debug("Could not delete {}", dir, e);
        }
      }
    }
  }
}
