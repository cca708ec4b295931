package com.flamingo.ai.notebookrag.service.audio;

import com.flamingo.ai.notebookrag.config.RagConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes an empty {@code .mp3} file per overview. Stands in until a text-to-speech backend is
 * configured.
 */
@Component
@Slf4j
public class PlaceholderAudioRenderer implements AudioRenderer {

  private final Path storageDir;
  private final String publicPathPrefix;

  public PlaceholderAudioRenderer(RagConfig ragConfig) {
    this.storageDir = Path.of(ragConfig.getAudio().getStorageDir());
    this.publicPathPrefix = ragConfig.getAudio().getPublicPathPrefix();
  }

  @Override
  public String render(UUID notebookId, String script) {
    String fileName = UUID.randomUUID() + ".mp3";
    try {
      Files.createDirectories(storageDir);
      Files.write(storageDir.resolve(fileName), new byte[0]);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write audio asset " + fileName, e);
    }
    log.info(
        "Wrote placeholder audio {} for notebook {} ({} char script)",
        fileName,
        notebookId,
        script.length());
    return publicPathPrefix + fileName;
  }

  @Override
  public void delete(String assetReference) {
    if (assetReference == null || !assetReference.startsWith(publicPathPrefix)) {
      return;
    }
    String fileName = assetReference.substring(publicPathPrefix.length());
    Path file = storageDir.resolve(fileName).normalize();
    if (!file.startsWith(storageDir.normalize())) {
      log.warn("Refusing to delete audio asset outside storage dir: {}", assetReference);
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to delete audio asset " + fileName, e);
    }
  }
}
