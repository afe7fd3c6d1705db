package com.incidentradar.analytics;

import com.incidentradar.analytics.config.AnalyticsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot entrypoint for the incident analytics API service.
 *
 * <p>The application answers filtered aggregation queries over the incident sources, serves
 * merged classification views and records human evaluations.
 */
@SpringBootApplication
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsApplication {
  /**
   * Starts the analytics API application.
   *
   * @param args standard Spring Boot startup arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(AnalyticsApplication.class, args);
  }
}
