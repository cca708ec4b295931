package com.flamingo.ai.notebookrag.service.provider;

import java.util.Map;
import lombok.Builder;

/**
 * Fields an administrator submits when creating or updating a provider configuration. Null fields
 * are left unchanged on update.
 */
@Builder
public record ProviderConfigCommand(
    String name,
    String provider,
    String model,
    String apiKey,
    String baseUrl,
    Boolean active,
    Boolean defaultConfig,
    Map<String, Object> extraConfig) {}
