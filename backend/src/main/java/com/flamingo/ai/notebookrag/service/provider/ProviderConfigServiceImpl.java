package com.flamingo.ai.notebookrag.service.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.notebookrag.domain.entity.ProviderConfig;
import com.flamingo.ai.notebookrag.domain.enums.ProviderType;
import com.flamingo.ai.notebookrag.domain.repository.ProviderConfigRepository;
import com.flamingo.ai.notebookrag.exception.NoActiveProviderException;
import com.flamingo.ai.notebookrag.exception.ProviderConfigNotFoundException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of {@link ProviderConfigService} backed by JPA. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProviderConfigServiceImpl implements ProviderConfigService {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ProviderConfigRepository providerConfigRepository;
  private final ObjectMapper objectMapper;

  @Override
  @Transactional(readOnly = true)
  public List<ProviderConfig> listConfigs() {
    return providerConfigRepository.findAllByOrderByCreatedAtAsc();
  }

  @Override
  @Transactional(readOnly = true)
  public ProviderConfig getConfig(UUID id) {
    return providerConfigRepository
        .findById(id)
        .orElseThrow(() -> new ProviderConfigNotFoundException(id));
  }

  @Override
  @Transactional
  public ProviderConfig createConfig(ProviderConfigCommand command) {
    ProviderType type = ProviderType.fromValue(command.provider());
    ProviderConfig config =
        ProviderConfig.builder()
            .name(command.name() != null ? command.name() : type.value() + " " + command.model())
            .provider(type.value())
            .model(command.model())
            .apiKey(command.apiKey())
            .baseUrl(command.baseUrl())
            .active(command.active() == null || command.active())
            .defaultConfig(Boolean.TRUE.equals(command.defaultConfig()))
            .extraConfig(writeExtraConfig(command.extraConfig()))
            .build();
    ProviderConfig saved = providerConfigRepository.save(config);
    if (saved.isDefaultConfig()) {
      providerConfigRepository.clearDefaultExcept(saved.getId());
    }
    log.info("Created provider config {} ({} / {})", saved.getId(), type.value(), saved.getModel());
    return saved;
  }

  @Override
  @Transactional
  public ProviderConfig updateConfig(UUID id, ProviderConfigCommand command) {
    ProviderConfig config = getConfig(id);
    if (command.name() != null) {
      config.setName(command.name());
    }
    if (command.provider() != null) {
      config.setProvider(ProviderType.fromValue(command.provider()).value());
    }
    if (command.model() != null) {
      config.setModel(command.model());
    }
    if (command.apiKey() != null) {
      config.setApiKey(command.apiKey());
    }
    if (command.baseUrl() != null) {
      config.setBaseUrl(command.baseUrl());
    }
    if (command.active() != null) {
      config.setActive(command.active());
    }
    if (command.defaultConfig() != null) {
      config.setDefaultConfig(command.defaultConfig());
    }
    if (command.extraConfig() != null) {
      config.setExtraConfig(writeExtraConfig(command.extraConfig()));
    }
    ProviderConfig saved = providerConfigRepository.save(config);
    if (saved.isDefaultConfig()) {
      providerConfigRepository.clearDefaultExcept(saved.getId());
    }
    return saved;
  }

  @Override
  @Transactional
  public void deleteConfig(UUID id) {
    if (!providerConfigRepository.existsById(id)) {
      throw new ProviderConfigNotFoundException(id);
    }
    providerConfigRepository.deleteById(id);
    log.info("Deleted provider config {}", id);
  }

  @Override
  @Transactional(readOnly = true)
  public ProviderConfig resolveActive() {
    return providerConfigRepository.findByActiveTrueOrderByDefaultConfigDescCreatedAtAsc().stream()
        .findFirst()
        .orElseThrow(NoActiveProviderException::new);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<ProviderConfig> resolveActive(ProviderType type) {
    return providerConfigRepository
        .findByActiveTrueAndProviderOrderByDefaultConfigDescCreatedAtAsc(type.value())
        .stream()
        .findFirst();
  }

  @Override
  public Map<String, Object> extraConfig(ProviderConfig config) {
    String json = config.getExtraConfig();
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      Map<String, Object> parsed = objectMapper.readValue(json, MAP_TYPE);
      return parsed != null ? parsed : Map.of();
    } catch (JsonProcessingException e) {
      log.warn("Ignoring malformed extra config on provider {}: {}", config.getId(), e.getMessage());
      return Map.of();
    }
  }

  private String writeExtraConfig(Map<String, Object> extraConfig) {
    if (extraConfig == null || extraConfig.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(extraConfig);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Extra config is not serializable", e);
    }
  }
}
