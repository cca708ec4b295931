package com.flamingo.ai.notebookrag.service.notebook;

import java.util.List;

/** Notebook presentation fields produced from its sources. */
public record GeneratedContent(
    String title, String summary, String icon, String color, List<String> exampleQuestions) {}
