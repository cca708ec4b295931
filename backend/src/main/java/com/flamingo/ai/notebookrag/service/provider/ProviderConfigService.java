package com.flamingo.ai.notebookrag.service.provider;

import com.flamingo.ai.notebookrag.domain.entity.ProviderConfig;
import com.flamingo.ai.notebookrag.domain.enums.ProviderType;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/** Manages LLM provider configurations and resolves the one to use for a call. */
public interface ProviderConfigService {

  List<ProviderConfig> listConfigs();

  ProviderConfig getConfig(UUID id);

  /**
   * Creates a configuration. When it is marked default, every other row loses the flag.
   *
   * @throws com.flamingo.ai.notebookrag.exception.UnsupportedProviderException for unknown
   *     provider names
   */
  ProviderConfig createConfig(ProviderConfigCommand command);

  ProviderConfig updateConfig(UUID id, ProviderConfigCommand command);

  void deleteConfig(UUID id);

  /**
   * Resolves the configuration chat calls dispatch to: the default active row, else the oldest
   * active row. Read at call time so admin changes apply to the next call.
   *
   * @throws com.flamingo.ai.notebookrag.exception.NoActiveProviderException if none is active
   */
  ProviderConfig resolveActive();

  /** Returns the preferred active configuration of one provider. */
  Optional<ProviderConfig> resolveActive(ProviderType type);

  /** Parses the stored extra configuration JSON; malformed JSON yields an empty map. */
  Map<String, Object> extraConfig(ProviderConfig config);
}
