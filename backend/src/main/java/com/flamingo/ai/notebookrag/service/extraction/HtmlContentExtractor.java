package com.flamingo.ai.notebookrag.service.extraction;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import javax.xml.parsers.DocumentBuilderFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.html.HtmlMapper;
import org.apache.tika.parser.html.IdentityHtmlMapper;
import org.apache.tika.sax.ToXMLContentHandler;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Extracts readable text from an HTML page.
 *
 * <p>Tika parses the page into XHTML, keeping every element and its class and id attributes.
 * Page chrome ({@code script, style, nav, footer, header, aside, iframe}) is removed, then the
 * primary content element is chosen in this order: {@code main}, {@code article}, class {@code
 * content}, id {@code content}, class {@code main}, {@code body}. The text of its {@code p},
 * headings, {@code li} and {@code blockquote} elements is joined with blank lines. A page without
 * any such element falls back to its whole text.
 */
@Component
@Slf4j
public class HtmlContentExtractor {

  private static final Set<String> CHROME_ELEMENTS =
      Set.of("script", "style", "nav", "footer", "header", "aside", "iframe", "noscript");

  private static final Set<String> TEXT_ELEMENTS =
      Set.of("p", "h1", "h2", "h3", "h4", "h5", "h6", "li", "blockquote");

  private static final List<Predicate<Element>> PRIMARY_CONTENT =
      List.of(
          el -> "main".equals(localName(el)),
          el -> "article".equals(localName(el)),
          el -> hasClass(el, "content"),
          el -> "content".equals(el.getAttribute("id")),
          el -> hasClass(el, "main"),
          el -> "body".equals(localName(el)));

  /**
   * Extracts the main text of a page.
   *
   * @param html raw page bytes
   * @param contentType declared content type, may carry a charset; null if unknown
   * @return extracted text, possibly empty
   * @throws Exception if the page cannot be parsed
   */
  public String extract(byte[] html, String contentType) throws Exception {
    Document dom = toDom(html, contentType);
    Element root = dom.getDocumentElement();

    List<Element> chrome = new ArrayList<>();
    collect(root, el -> CHROME_ELEMENTS.contains(localName(el)), chrome);
    for (Element el : chrome) {
      if (el.getParentNode() != null) {
        el.getParentNode().removeChild(el);
      }
    }

    Element primary = findPrimaryContent(root);
    if (primary != null) {
      List<Element> blocks = new ArrayList<>();
      collect(primary, el -> TEXT_ELEMENTS.contains(localName(el)), blocks);
      List<String> texts = new ArrayList<>();
      for (Element block : blocks) {
        String text = block.getTextContent().trim();
        if (!text.isEmpty()) {
          texts.add(text);
        }
      }
      if (!texts.isEmpty()) {
        return String.join("\n\n", texts);
      }
    }
    log.debug("No block-level text found, falling back to full page text");
    return root.getTextContent().replaceAll("\\s+", " ").trim();
  }

  private Document toDom(byte[] html, String contentType) throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, contentType != null ? contentType : "text/html");
    ParseContext context = new ParseContext();
    context.set(HtmlMapper.class, IdentityHtmlMapper.INSTANCE);
    try (InputStream in = new ByteArrayInputStream(html)) {
      new AutoDetectParser().parse(in, handler, metadata, context);
    }

    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setNamespaceAware(true);
    return dbf.newDocumentBuilder().parse(new ByteArrayInputStream(out.toByteArray()));
  }

  private Element findPrimaryContent(Element root) {
    for (Predicate<Element> candidate : PRIMARY_CONTENT) {
      Element found = findFirst(root, candidate);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  private static Element findFirst(Element el, Predicate<Element> predicate) {
    if (predicate.test(el)) {
      return el;
    }
    NodeList children = el.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      if (children.item(i) instanceof Element child) {
        Element found = findFirst(child, predicate);
        if (found != null) {
          return found;
        }
      }
    }
    return null;
  }

  /** Collects matching descendants (and {@code el} itself) in document order. */
  private static void collect(Element el, Predicate<Element> predicate, List<Element> out) {
    if (predicate.test(el)) {
      out.add(el);
    }
    NodeList children = el.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child instanceof Element element) {
        collect(element, predicate, out);
      }
    }
  }

  private static String localName(Element el) {
    String name = el.getLocalName() != null ? el.getLocalName() : el.getTagName();
    return name.toLowerCase(Locale.ROOT);
  }

  private static boolean hasClass(Element el, String className) {
    String classes = el.getAttribute("class");
    return !classes.isBlank() && Arrays.asList(classes.trim().split("\\s+")).contains(className);
  }
}
