package com.flamingo.ai.notebookrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the notebook ingestion and retrieval-augmented chat back end. */
@SpringBootApplication
public class NotebookRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(NotebookRagApplication.class, args);
  }
}
