package com.flamingo.ai.notebookrag.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion, retrieval and generation pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Chat chat = new Chat();
  private Summary summary = new Summary();
  private Embedding embedding = new Embedding();
  private Extraction extraction = new Extraction();
  private Generation generation = new Generation();
  private Audio audio = new Audio();
  private Llm llm = new Llm();
  private Jobs jobs = new Jobs();

  @Getter
  @Setter
  public static class Chunking {
    private int maxChunkSize = 1000;
    private int overlap = 200;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;
  }

  @Getter
  @Setter
  public static class Chat {
    private int historyWindow = 10;

    /** Maximum excerpt length attached to a citation. */
    private int excerptLength = 200;
  }

  @Getter
  @Setter
  public static class Summary {
    private int maxInputChars = 5000;
    private String placeholder = "No summary could be generated for this content.";
  }

  @Getter
  @Setter
  public static class Embedding {
    private String openAiModel = "text-embedding-3-small";
    private Integer dimensions = 1536;
    private int maxInputChars = 8000;
  }

  @Getter
  @Setter
  public static class Extraction {
    private String fileStorageRoot = "uploads";
    private Duration fetchTimeout = Duration.ofSeconds(30);
    private int maxPageBytes = 5 * 1024 * 1024;
    private String userAgent = "Mozilla/5.0 (compatible; NotebookRag/0.1)";
  }

  @Getter
  @Setter
  public static class Generation {
    private int maxSources = 5;
    private int sourcePreviewChars = 1000;
  }

  @Getter
  @Setter
  public static class Audio {
    private String storageDir = "audio";
    private String publicPathPrefix = "/audio/";
    private Duration urlTtl = Duration.ofHours(24);
    private int sourcePreviewChars = 1000;
  }

  @Getter
  @Setter
  public static class Llm {
    private double defaultTemperature = 0.7;
    private int defaultMaxTokens = 1000;
    private Duration timeout = Duration.ofSeconds(120);
    private String ollamaBaseUrl = "http://localhost:11434";
  }

  @Getter
  @Setter
  public static class Jobs {
    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 100;
  }
}
