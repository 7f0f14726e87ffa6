package com.flamingo.ai.redline.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the redline document pipeline. */
@Configuration
@ConfigurationProperties(prefix = "redline")
@Getter
@Setter
public class RedlineConfig {

  private Security security = new Security();
  private Admission admission = new Admission();
  private Upload upload = new Upload();
  private Editing editing = new Editing();

  @Getter
  @Setter
  public static class Security {
    /** Shared bearer token required on every {@code /v1} route. */
    private String apiKey;
  }

  @Getter
  @Setter
  public static class Admission {
    /** Maximum number of editing sessions alive at the same time. */
    private int maxConcurrentSessions = 4;

    /** How long a request may wait for a free session slot before it is rejected as overload. */
    private Duration acquireTimeout = Duration.ofSeconds(30);
  }

  @Getter
  @Setter
  public static class Upload {
    /** Largest accepted ratio of declared decompressed size to upload size. */
    private double maxRatio = 100.0;

    /** Largest accepted total decompressed size across all archive entries. */
    private long maxDecompressedBytes = 500L * 1024 * 1024; // 500 MB
  }

  @Getter
  @Setter
  public static class Editing {
    /** Author recorded on tracked changes and comments. */
    private String authorName = "API User";

    private String authorEmail = "api@redline.local";
  }
}
