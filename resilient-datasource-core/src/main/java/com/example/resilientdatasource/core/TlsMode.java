package com.example.resilientdatasource.core;

import java.util.Locale;
import java.util.Optional;

/** Transport encryption policy for database connections. */
public enum TlsMode {
  /** Plain TCP. */
  DISABLED("DISABLED"),
  /** Encrypted transport without server certificate validation. */
  PERMISSIVE("REQUIRED"),
  /** Encrypted transport with certificate and host name validation. */
  VERIFY("VERIFY_IDENTITY");

  private final String sslMode;

  TlsMode(final String sslMode) {
    this.sslMode = sslMode;
  }

  /**
   * Returns the MySQL Connector/J {@code sslMode} property value for this policy.
   *
   * @return driver ssl mode
   */
  public String sslMode() {
    return sslMode;
  }

  /**
   * Parses a configuration value, accepting either the enum name or a boolean-style flag ({@code
   * true} maps to {@link #PERMISSIVE}, {@code false} to {@link #DISABLED}).
   *
   * @param value raw configuration value, may be null
   * @return parsed mode, empty when the value is blank or unknown
   */
  public static Optional<TlsMode> parse(final String value) {
    if (value == null || value.isBlank()) return Optional.empty();
    final var normalized = value.trim().toUpperCase(Locale.ROOT);
    switch (normalized) {
      case "TRUE":
        return Optional.of(PERMISSIVE);
      case "FALSE":
        return Optional.of(DISABLED);
      default:
        try {
          return Optional.of(TlsMode.valueOf(normalized));
        } catch (final IllegalArgumentException e) {
          return Optional.empty();
        }
    }
  }
}
