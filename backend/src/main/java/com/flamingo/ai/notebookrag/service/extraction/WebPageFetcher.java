package com.flamingo.ai.notebookrag.service.extraction;

import com.flamingo.ai.notebookrag.config.RagConfig;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** Downloads web pages for website sources. */
@Component
@Slf4j
public class WebPageFetcher {

  private final WebClient webClient;
  private final Duration timeout;

  public WebPageFetcher(RagConfig ragConfig) {
    RagConfig.Extraction extraction = ragConfig.getExtraction();
    this.timeout = extraction.getFetchTimeout();
    this.webClient =
        WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, extraction.getUserAgent())
            .codecs(
                configurer -> configurer.defaultCodecs().maxInMemorySize(extraction.getMaxPageBytes()))
            .build();
  }

  /** Raw page body with its declared content type. */
  public record FetchedPage(byte[] body, String contentType) {}

  /**
   * Fetches a page, following the client's default redirect handling.
   *
   * @param url absolute http(s) URL
   * @return the page body
   * @throws RuntimeException on connection failure, timeout or a non-2xx status
   */
  public FetchedPage fetch(String url) {
    log.debug("Fetching {}", url);
    ResponseEntity<byte[]> response =
        webClient
            .get()
            .uri(url)
            .accept(MediaType.TEXT_HTML, MediaType.APPLICATION_XHTML_XML, MediaType.ALL)
            .retrieve()
            .toEntity(byte[].class)
            .timeout(timeout)
            .block();
    if (response == null) {
      throw new IllegalStateException("Empty response from " + url);
    }
    MediaType contentType = response.getHeaders().getContentType();
    byte[] body = response.getBody() != null ? response.getBody() : new byte[0];
    return new FetchedPage(body, contentType != null ? contentType.toString() : null);
  }
}
