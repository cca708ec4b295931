package com.flamingo.ai.notebookrag.service.extraction;

import com.flamingo.ai.notebookrag.domain.entity.Source;

/**
 * Converts one kind of source into plain text.
 *
 * <p>Implementations throw subtypes of {@link
 * com.flamingo.ai.notebookrag.exception.ExtractionException} and never retry.
 */
public interface SourceTextExtractor {

  boolean supports(Source source);

  String extract(Source source);
}
