package com.flamingo.ai.voicecompanion.service.health;

import com.flamingo.ai.voicecompanion.api.dto.response.SystemStats;

/** Service interface for health checks and system statistics. */
public interface HealthService {

  /**
   * Gets system-wide statistics: live sessions, upload records and the serving knowledge store
   * version.
   *
   * @return system statistics
   */
  SystemStats getSystemStats();
}
