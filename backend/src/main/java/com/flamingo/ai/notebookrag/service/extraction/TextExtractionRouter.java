package com.flamingo.ai.notebookrag.service.extraction;

import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.exception.UnsupportedSourceException;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a source to the first {@link SourceTextExtractor} that supports it.
 *
 * <p>Extractors are injected in {@code @Order} order. The ingestion orchestrator depends only on
 * this router.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextExtractionRouter {

  private final List<SourceTextExtractor> extractors;

  /**
   * Extracts the plain text of a source.
   *
   * @throws UnsupportedSourceException if no extractor handles the source kind
   */
  @Timed(value = "source.extract", description = "Time to extract source text")
  public String extract(Source source) {
    SourceTextExtractor extractor =
        extractors.stream()
            .filter(e -> e.supports(source))
            .findFirst()
            .orElseThrow(
                () ->
                    new UnsupportedSourceException(
                        source.getId(), "No extractor for source kind " + source.getKind()));
    log.debug(
        "Extracting source {} ({}) with {}",
        source.getId(),
        source.getKind(),
        extractor.getClass().getSimpleName());
    return extractor.extract(source);
  }
}
