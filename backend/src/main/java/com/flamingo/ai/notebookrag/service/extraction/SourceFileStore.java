package com.flamingo.ai.notebookrag.service.extraction;

import com.flamingo.ai.notebookrag.config.RagConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Reads uploaded files stored by the upload layer under a local root directory. */
@Component
@Slf4j
public class SourceFileStore {

  private final Path root;

  public SourceFileStore(RagConfig ragConfig) {
    this.root = Path.of(ragConfig.getExtraction().getFileStorageRoot()).toAbsolutePath().normalize();
    log.info("Source files are read from {}", root);
  }

  /**
   * Reads a stored file.
   *
   * @param storedPath path relative to the storage root, or absolute inside it
   * @return file contents
   * @throws IOException if the file cannot be read or lies outside the root
   */
  public byte[] read(String storedPath) throws IOException {
    Path resolved = root.resolve(storedPath).normalize();
    if (!resolved.startsWith(root)) {
      throw new IOException("Path escapes file storage root: " + storedPath);
    }
    return Files.readAllBytes(resolved);
  }
}
