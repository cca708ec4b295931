package com.flamingo.ai.notebookrag.service.audio;

import com.flamingo.ai.notebookrag.domain.enums.AudioOverviewStatus;
import java.time.LocalDateTime;

/**
 * Read view of a notebook's audio overview.
 *
 * @param status null if no overview was ever requested
 * @param url asset URL, null unless the overview is completed and not expired
 * @param expiresAt when the URL stops being served
 */
public record AudioOverview(AudioOverviewStatus status, String url, LocalDateTime expiresAt) {}
