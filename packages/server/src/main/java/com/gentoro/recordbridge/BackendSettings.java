package com.gentoro.recordbridge;

import com.gentoro.recordbridge.exception.ConfigException;
import com.gentoro.recordbridge.logging.LoggingService;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Resolved, immutable settings handed to the core: where the backend lives, who to log in as,
 * and the timeouts and limits applied to every call. The core never reads configuration itself.
 */
public final class BackendSettings {
  private final String baseUrl;
  private final String username;
  private final String password;
  private final String knowledgeBase;
  private final String language;
  private final Duration connectTimeout;
  private final Duration readTimeout;
  private final Duration callTimeout;
  private final Duration safetyMargin;
  private final Duration defaultTokenValidity;
  private final int defaultSearchLimit;
  private final int maxSearchLimit;
  private final int searchParallelism;

  private BackendSettings(Builder b) {
    this.baseUrl = stripTrailingSlash(b.baseUrl);
    this.username = b.username;
    this.password = b.password;
    this.knowledgeBase = b.knowledgeBase;
    this.language = b.language;
    this.connectTimeout = b.connectTimeout;
    this.readTimeout = b.readTimeout;
    this.callTimeout = b.callTimeout;
    this.safetyMargin = b.safetyMargin;
    this.defaultTokenValidity = b.defaultTokenValidity;
    this.defaultSearchLimit = b.defaultSearchLimit;
    this.maxSearchLimit = b.maxSearchLimit;
    this.searchParallelism = b.searchParallelism;
  }

  /**
   * Resolve settings from the {@code backend.*}, {@code auth.*} and {@code search.*} keys.
   *
   * @throws ConfigException if base URL or any part of the credential seed is missing
   */
  public static BackendSettings fromConfiguration(Configuration cfg) {
    BackendSettings settings =
        builder()
            .baseUrl(resolved(cfg, "backend.base-url"))
            .username(resolved(cfg, "backend.username"))
            .password(resolved(cfg, "backend.password"))
            .knowledgeBase(resolved(cfg, "backend.kb"))
            .language(cfg.getString("backend.language", "en"))
            .connectTimeout(Duration.ofMillis(cfg.getLong("backend.timeout.connect-ms", 10_000L)))
            .readTimeout(Duration.ofMillis(cfg.getLong("backend.timeout.read-ms", 30_000L)))
            .callTimeout(Duration.ofMillis(cfg.getLong("backend.timeout.call-ms", 30_000L)))
            .safetyMargin(Duration.ofSeconds(cfg.getLong("auth.safety-margin-seconds", 60L)))
            .defaultTokenValidity(
                Duration.ofMinutes(cfg.getLong("auth.default-validity-minutes", 15L)))
            .defaultSearchLimit(cfg.getInt("search.default-limit", 50))
            .maxSearchLimit(cfg.getInt("search.max-limit", 500))
            .searchParallelism(cfg.getInt("search.parallelism", 4))
            .build();
    settings.validate();
    return settings;
  }

  /** Null for absent keys and for {@code ${env:...}} placeholders no variable resolved. */
  private static String resolved(Configuration cfg, String key) {
    String value = cfg.getString(key, null);
    return value == null || value.contains("${") ? null : value;
  }

  /** Fail fast on anything the core cannot run without. */
  public void validate() {
    List<String> missing = new ArrayList<>();
    if (isBlank(baseUrl)) missing.add("backend.base-url");
    if (isBlank(username)) missing.add("backend.username");
    if (isBlank(password)) missing.add("backend.password");
    if (isBlank(knowledgeBase)) missing.add("backend.kb");
    if (!missing.isEmpty()) {
      throw new ConfigException("Missing required configuration: " + String.join(", ", missing));
    }
    if (defaultSearchLimit < 1 || maxSearchLimit < defaultSearchLimit) {
      throw new ConfigException(
          "Invalid search limits: default=%d max=%d".formatted(defaultSearchLimit, maxSearchLimit));
    }
    if (searchParallelism < 1) {
      throw new ConfigException("search.parallelism must be at least 1");
    }
  }

  public String baseUrl() {
    return baseUrl;
  }

  public String username() {
    return username;
  }

  public String password() {
    return password;
  }

  public String knowledgeBase() {
    return knowledgeBase;
  }

  public String language() {
    return language;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  public Duration readTimeout() {
    return readTimeout;
  }

  public Duration callTimeout() {
    return callTimeout;
  }

  public Duration safetyMargin() {
    return safetyMargin;
  }

  public Duration defaultTokenValidity() {
    return defaultTokenValidity;
  }

  public int defaultSearchLimit() {
    return defaultSearchLimit;
  }

  public int maxSearchLimit() {
    return maxSearchLimit;
  }

  public int searchParallelism() {
    return searchParallelism;
  }

  @Override
  public String toString() {
    return "BackendSettings{baseUrl=%s, username=%s, password=%s, kb=%s, lang=%s, callTimeout=%s}"
        .formatted(
            baseUrl, username, LoggingService.MASK, knowledgeBase, language, callTimeout);
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  private static String stripTrailingSlash(String url) {
    if (url == null) return null;
    String u = url.trim();
    while (u.endsWith("/")) {
      u = u.substring(0, u.length() - 1);
    }
    return u;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String baseUrl;
    private String username;
    private String password;
    private String knowledgeBase;
    private String language = "en";
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(30);
    private Duration callTimeout = Duration.ofSeconds(30);
    private Duration safetyMargin = Duration.ofSeconds(60);
    private Duration defaultTokenValidity = Duration.ofMinutes(15);
    private int defaultSearchLimit = 50;
    private int maxSearchLimit = 500;
    private int searchParallelism = 4;

    private Builder() {}

    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder knowledgeBase(String knowledgeBase) {
      this.knowledgeBase = knowledgeBase;
      return this;
    }

    public Builder language(String language) {
      this.language = Objects.requireNonNullElse(language, "en");
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder readTimeout(Duration readTimeout) {
      this.readTimeout = readTimeout;
      return this;
    }

    public Builder callTimeout(Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    public Builder safetyMargin(Duration safetyMargin) {
      this.safetyMargin = safetyMargin;
      return this;
    }

    public Builder defaultTokenValidity(Duration defaultTokenValidity) {
      this.defaultTokenValidity = defaultTokenValidity;
      return this;
    }

    public Builder defaultSearchLimit(int defaultSearchLimit) {
      this.defaultSearchLimit = defaultSearchLimit;
      return this;
    }

    public Builder maxSearchLimit(int maxSearchLimit) {
      this.maxSearchLimit = maxSearchLimit;
      return this;
    }

    public Builder searchParallelism(int searchParallelism) {
      this.searchParallelism = searchParallelism;
      return this;
    }

    public BackendSettings build() {
      return new BackendSettings(this);
    }
  }
}
