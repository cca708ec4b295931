package com.flamingo.ai.notebookrag.service.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.notebookrag.domain.entity.Notebook;
import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.domain.enums.SourceKind;
import com.flamingo.ai.notebookrag.domain.enums.SourceStatus;
import com.flamingo.ai.notebookrag.domain.repository.NotebookRepository;
import com.flamingo.ai.notebookrag.domain.repository.SourceRepository;
import com.flamingo.ai.notebookrag.elasticsearch.VectorStore;
import com.flamingo.ai.notebookrag.exception.NotebookNotFoundException;
import com.flamingo.ai.notebookrag.exception.SourceNotFoundException;
import com.flamingo.ai.notebookrag.service.ingestion.IngestionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("SourceServiceImpl Tests")
class SourceServiceImplTest {

  @Mock private SourceRepository sourceRepository;
  @Mock private NotebookRepository notebookRepository;
  @Mock private IngestionService ingestionService;
  @Mock private VectorStore vectorStore;

  private SourceServiceImpl sourceService;
  private UUID notebookId;

  @BeforeEach
  void setUp() {
    sourceService =
        new SourceServiceImpl(
            sourceRepository,
            notebookRepository,
            ingestionService,
            vectorStore,
            new SimpleMeterRegistry());

    notebookId = UUID.randomUUID();
    Notebook notebook = Notebook.builder().id(notebookId).ownerId("u").title("t").build();
    when(notebookRepository.findById(notebookId)).thenReturn(Optional.of(notebook));
    when(sourceRepository.save(any(Source.class)))
        .thenAnswer(
            inv -> {
              Source source = inv.getArgument(0);
              source.setId(UUID.randomUUID());
              return source;
            });
  }

  @Test
  @DisplayName("Should add pasted text as a pending source and submit it")
  void shouldAddTextAndSubmit() {
    Source source = sourceService.addText(notebookId, null, "Some pasted text");

    assertThat(source.getStatus()).isEqualTo(SourceStatus.PENDING);
    assertThat(source.getKind()).isEqualTo(SourceKind.TEXT);
    assertThat(source.getTitle()).isEqualTo("Pasted text");
    assertThat(source.getInlineText()).isEqualTo("Some pasted text");
    verify(ingestionService).submit(source.getId());
  }

  @Test
  @DisplayName("Should infer the kind of an uploaded file from its MIME type")
  void shouldInferFileKind() {
    Source source =
        sourceService.addFile(
            notebookId, null, null, "notebooks/abc/report.pdf", "application/pdf", 1024L);

    assertThat(source.getKind()).isEqualTo(SourceKind.PDF);
    assertThat(source.getTitle()).isEqualTo("report.pdf");
    assertThat(source.getFileSize()).isEqualTo(1024L);
  }

  @Test
  @DisplayName("Should add a website by URL")
  void shouldAddUrl() {
    Source source =
        sourceService.addUrl(notebookId, SourceKind.WEBSITE, "Blog", "https://example.com/post");

    assertThat(source.getKind()).isEqualTo(SourceKind.WEBSITE);
    assertThat(source.getUrl()).isEqualTo("https://example.com/post");
  }

  @Test
  @DisplayName("Should reject invalid URL sources")
  void shouldRejectInvalidUrl() {
    assertThatThrownBy(() -> sourceService.addUrl(notebookId, SourceKind.PDF, "x", "https://a"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> sourceService.addUrl(notebookId, SourceKind.WEBSITE, "x", "ftp://example.com"))
        .isInstanceOf(IllegalArgumentException.class);
    verify(sourceRepository, never()).save(any());
  }

  @Test
  @DisplayName("Should fail for an unknown notebook")
  void shouldFail_whenNotebookMissing() {
    UUID missing = UUID.randomUUID();
    when(notebookRepository.findById(missing)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> sourceService.addText(missing, "t", "text"))
        .isInstanceOf(NotebookNotFoundException.class);
    verify(ingestionService, never()).submit(any());
  }

  @Test
  @DisplayName("Should delegate resubmission to ingestion")
  void shouldResubmit() {
    UUID sourceId = UUID.randomUUID();
    when(sourceRepository.existsById(sourceId)).thenReturn(true);
    when(ingestionService.submit(sourceId)).thenReturn(true);

    assertThat(sourceService.resubmit(sourceId)).isTrue();
  }

  @Test
  @DisplayName("Should purge chunks before deleting the source")
  void shouldDeleteSource() {
    UUID sourceId = UUID.randomUUID();
    Source source = Source.builder().id(sourceId).kind(SourceKind.TEXT).title("t").build();
    when(sourceRepository.findById(sourceId)).thenReturn(Optional.of(source));

    sourceService.delete(sourceId);

    InOrder order = inOrder(vectorStore, sourceRepository);
    order.verify(vectorStore).deleteBySource(sourceId);
    order.verify(sourceRepository).delete(source);
  }

  @Test
  @DisplayName("Should fail to delete a missing source")
  void shouldFailDelete_whenMissing() {
    UUID sourceId = UUID.randomUUID();
    when(sourceRepository.findById(sourceId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> sourceService.delete(sourceId))
        .isInstanceOf(SourceNotFoundException.class);
  }
}
