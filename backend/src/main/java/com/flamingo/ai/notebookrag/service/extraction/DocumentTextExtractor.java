package com.flamingo.ai.notebookrag.service.extraction;

import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.domain.enums.SourceKind;
import com.flamingo.ai.notebookrag.exception.UnreadableSourceException;
import com.flamingo.ai.notebookrag.exception.UnsupportedSourceException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

/**
 * Extracts text sources: inline text as submitted, plain text files decoded as UTF-8, and
 * word-processor documents parsed by Apache Tika.
 */
@Component
@Order(20)
@RequiredArgsConstructor
@Slf4j
public class DocumentTextExtractor implements SourceTextExtractor {

  private static final Set<String> PLAIN_TYPES =
      Set.of("text/plain", "text/markdown", "text/x-markdown", "text/csv");

  private static final Set<String> STRUCTURED_TYPES =
      Set.of(
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
          "application/msword",
          "application/vnd.oasis.opendocument.text",
          "application/rtf",
          "text/rtf");

  private static final Map<String, String> TYPES_BY_EXTENSION =
      Map.of(
          "txt", "text/plain",
          "md", "text/markdown",
          "csv", "text/csv",
          "docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
          "doc", "application/msword",
          "odt", "application/vnd.oasis.opendocument.text",
          "rtf", "application/rtf");

  private final SourceFileStore fileStore;

  @Override
  public boolean supports(Source source) {
    return source.getKind() == SourceKind.TEXT;
  }

  @Override
  public String extract(Source source) {
    if (source.getFilePath() == null) {
      if (source.getInlineText() == null) {
        throw new UnreadableSourceException(source.getId(), "Text source has no content");
      }
      return source.getInlineText();
    }

    String mimeType = effectiveMimeType(source);
    boolean plain = PLAIN_TYPES.contains(mimeType);
    if (!plain && !STRUCTURED_TYPES.contains(mimeType)) {
      throw new UnsupportedSourceException(
          source.getId(), "Unsupported text document type: " + mimeType);
    }

    byte[] bytes;
    try {
      bytes = fileStore.read(source.getFilePath());
    } catch (IOException e) {
      throw new UnreadableSourceException(
          source.getId(), "Cannot read file " + source.getFilePath(), e);
    }
    return plain ? new String(bytes, StandardCharsets.UTF_8) : parseStructured(source, bytes);
  }

  String parseStructured(Source source, byte[] bytes) {
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, effectiveMimeType(source));
    try (InputStream in = new ByteArrayInputStream(bytes)) {
      new AutoDetectParser().parse(in, handler, metadata, new ParseContext());
    } catch (IOException | SAXException | TikaException e) {
      throw new UnreadableSourceException(
          source.getId(), "Failed to parse " + source.getTitle() + ": " + e.getMessage(), e);
    }
    String text = handler.toString();
    log.debug("Tika extracted {} chars from source {}", text.length(), source.getId());
    return text;
  }

  static String effectiveMimeType(Source source) {
    String mimeType = source.getMimeType();
    if (mimeType != null && !mimeType.isBlank()) {
      int separator = mimeType.indexOf(';');
      String bare = separator >= 0 ? mimeType.substring(0, separator) : mimeType;
      return bare.trim().toLowerCase(Locale.ROOT);
    }
    String path = source.getFilePath();
    int dot = path.lastIndexOf('.');
    if (dot < 0) {
      return "application/octet-stream";
    }
    String extension = path.substring(dot + 1).toLowerCase(Locale.ROOT);
    return TYPES_BY_EXTENSION.getOrDefault(extension, "application/octet-stream");
  }
}
