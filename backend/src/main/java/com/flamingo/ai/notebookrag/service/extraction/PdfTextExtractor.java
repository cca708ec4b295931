package com.flamingo.ai.notebookrag.service.extraction;

import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.domain.enums.SourceKind;
import com.flamingo.ai.notebookrag.exception.UnreadableSourceException;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Extracts the text of every page of a PDF as one stream using PDFBox. */
@Component
@Order(10)
@RequiredArgsConstructor
@Slf4j
public class PdfTextExtractor implements SourceTextExtractor {

  private final SourceFileStore fileStore;

  @Override
  public boolean supports(Source source) {
    return source.getKind() == SourceKind.PDF;
  }

  @Override
  public String extract(Source source) {
    byte[] bytes;
    try {
      bytes = fileStore.read(source.getFilePath());
    } catch (IOException e) {
      throw new UnreadableSourceException(
          source.getId(), "Cannot read PDF file " + source.getFilePath(), e);
    }
    return extractText(source, bytes);
  }

  String extractText(Source source, byte[] bytes) {
    try (PDDocument document = Loader.loadPDF(bytes)) {
      String text = new PDFTextStripper().getText(document);
      log.debug(
          "Extracted {} chars from {} PDF pages of source {}",
          text.length(),
          document.getNumberOfPages(),
          source.getId());
      if (text.isBlank()) {
        throw new UnreadableSourceException(
            source.getId(), "PDF contains no extractable text: " + source.getTitle());
      }
      return text;
    } catch (IOException e) {
      throw new UnreadableSourceException(
          source.getId(), "Failed to parse PDF " + source.getTitle() + ": " + e.getMessage(), e);
    }
  }
}
