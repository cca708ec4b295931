package com.flamingo.ai.notebookrag.service.extraction;

import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.domain.enums.SourceKind;
import com.flamingo.ai.notebookrag.exception.SourceFetchException;
import com.flamingo.ai.notebookrag.exception.UnreadableSourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Fetches a website source and extracts its main content. */
@Component
@Order(30)
@RequiredArgsConstructor
@Slf4j
public class WebsiteTextExtractor implements SourceTextExtractor {

  private final WebPageFetcher pageFetcher;
  private final HtmlContentExtractor htmlContentExtractor;

  @Override
  public boolean supports(Source source) {
    return source.getKind() == SourceKind.WEBSITE;
  }

  @Override
  public String extract(Source source) {
    WebPageFetcher.FetchedPage page;
    try {
      page = pageFetcher.fetch(source.getUrl());
    } catch (RuntimeException e) {
      log.warn("Fetching {} failed: {}", source.getUrl(), e.getMessage());
      throw new SourceFetchException(source.getId(), source.getUrl(), e);
    }

    try {
      String text = htmlContentExtractor.extract(page.body(), page.contentType());
      log.debug("Extracted {} chars from {}", text.length(), source.getUrl());
      return text;
    } catch (Exception e) {
      throw new UnreadableSourceException(
          source.getId(), "Failed to parse HTML of " + source.getUrl() + ": " + e.getMessage(), e);
    }
  }
}
