package com.example.failoverclient.core;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Resilience settings recognized in a flat option map.
 *
 * <p>Each setting is resolved from, in order: the option map (under its name or a legacy alias), a
 * system property, an environment variable, the default.
 *
 * <ul>
 *   <li>{@code maxRetry} / {@code aurora_max_retry}, failover.max.retry / FAILOVER_MAX_RETRY
 *       (default 5)
 *   <li>{@code disconnectOnReadOnly} / {@code aurora_disconnect_on_readonly},
 *       failover.disconnect.on.readonly / FAILOVER_DISCONNECT_ON_READONLY (default false)
 *   <li>{@code sleepBeforeDisconnect} / {@code aurora_disconnect_sleep}, in seconds,
 *       failover.sleep.before.disconnect / FAILOVER_SLEEP_BEFORE_DISCONNECT (default 0)
 *   <li>{@code readOnlyVariable}, failover.readonly.variable / FAILOVER_READONLY_VARIABLE (default
 *       innodb_read_only)
 * </ul>
 *
 * <p>Keys that are not recognized here, other than {@code url}, are driver properties (see {@link
 * #driverProperties(Map)}).
 *
 * @param maxRetry maximum reconnect attempts
 * @param disconnectOnReadOnly close instead of reconnecting on read-only errors
 * @param sleepBeforeDisconnect delay before closing on a read-only error
 * @param readOnlyVariable server variable checked after reconnecting on a read-only error
 */
public record FailoverSettings(
    int maxRetry,
    boolean disconnectOnReadOnly,
    Duration sleepBeforeDisconnect,
    String readOnlyVariable) {

  public static final String MAX_RETRY = "maxRetry";
  public static final String DISCONNECT_ON_READ_ONLY = "disconnectOnReadOnly";
  public static final String SLEEP_BEFORE_DISCONNECT = "sleepBeforeDisconnect";
  public static final String READ_ONLY_VARIABLE = "readOnlyVariable";
  public static final String URL = "url";

  public static final String DEFAULT_READ_ONLY_VARIABLE = "innodb_read_only";

  private static final Pattern VARIABLE_NAME = Pattern.compile("[A-Za-z0-9_]+");

  private static final Map<String, List<String>> ALIASES =
      Map.of(
          MAX_RETRY, List.of(MAX_RETRY, "aurora_max_retry"),
          DISCONNECT_ON_READ_ONLY,
          List.of(DISCONNECT_ON_READ_ONLY, "aurora_disconnect_on_readonly"),
          SLEEP_BEFORE_DISCONNECT, List.of(SLEEP_BEFORE_DISCONNECT, "aurora_disconnect_sleep"),
          READ_ONLY_VARIABLE, List.of(READ_ONLY_VARIABLE));

  private static final Set<String> RESERVED_KEYS =
      Set.of(
          URL,
          MAX_RETRY,
          "aurora_max_retry",
          DISCONNECT_ON_READ_ONLY,
          "aurora_disconnect_on_readonly",
          SLEEP_BEFORE_DISCONNECT,
          "aurora_disconnect_sleep",
          READ_ONLY_VARIABLE);

  public FailoverSettings {
    if (maxRetry < 0) throw new IllegalArgumentException("maxRetry must be >= 0");
    if (sleepBeforeDisconnect == null || sleepBeforeDisconnect.isNegative())
      throw new IllegalArgumentException("sleepBeforeDisconnect must be non-negative");
    if (readOnlyVariable == null || !VARIABLE_NAME.matcher(readOnlyVariable).matches())
      throw new IllegalArgumentException(
          "readOnlyVariable must match [A-Za-z0-9_]+: " + readOnlyVariable);
  }

  /**
   * Resolves settings from system properties, environment variables and defaults only.
   *
   * @return resolved settings
   */
  public static FailoverSettings defaults() {
    return resolve(Map.of());
  }

  /**
   * Resolves settings from an option map, falling back to system properties, environment
   * variables and defaults.
   *
   * @param options option map, may contain driver properties too
   * @return resolved settings
   * @throws IllegalArgumentException if a recognized value is malformed
   */
  public static FailoverSettings resolve(final Map<String, String> options) {
    final var maxRetry =
        lookup(options, MAX_RETRY)
            .map(v -> parse(MAX_RETRY, v, Integer::parseInt))
            .orElse(RetryPolicy.DEFAULT_MAX_RETRY);
    final var disconnect =
        lookup(options, DISCONNECT_ON_READ_ONLY)
            .map(v -> parseBoolean(DISCONNECT_ON_READ_ONLY, v))
            .orElse(false);
    final var sleep =
        lookup(options, SLEEP_BEFORE_DISCONNECT)
            .map(v -> parse(SLEEP_BEFORE_DISCONNECT, v, FailoverSettings::seconds))
            .orElse(Duration.ZERO);
    final var variable =
        lookup(options, READ_ONLY_VARIABLE).orElse(DEFAULT_READ_ONLY_VARIABLE);

    try {
      return new FailoverSettings(maxRetry, disconnect, sleep, variable);
    } catch (final IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid failover option: " + e.getMessage(), e);
    }
  }

  /**
   * Returns the option entries that are not resilience settings, nor {@code url}.
   *
   * @param options option map
   * @return driver properties, in the iteration order of {@code options}
   */
  public static Map<String, String> driverProperties(final Map<String, String> options) {
    final var result = new LinkedHashMap<String, String>();
    options.forEach(
        (key, value) -> {
          if (!RESERVED_KEYS.contains(key) && value != null) result.put(key, value);
        });
    return result;
  }

  /**
   * Returns the query that reports the read-only status variable.
   *
   * @return status query for MySQL-compatible servers
   */
  public String statusQuery() {
    return "SHOW GLOBAL VARIABLES LIKE '%s'".formatted(readOnlyVariable);
  }

  /**
   * Returns the retry policy implied by {@link #maxRetry()}.
   *
   * @return retry policy with default backoff
   */
  public RetryPolicy retryPolicy() {
    return RetryPolicy.of(maxRetry);
  }

  private static Optional<String> lookup(final Map<String, String> options, final String key) {
    final var propertyKey = toPropertyKey(key);
    final var envKey = propertyKey.replace('.', '_').toUpperCase(Locale.ROOT);
    return ALIASES.get(key).stream()
        .map(options::get)
        .filter(v -> v != null && !v.isBlank())
        .findFirst()
        .or(() -> Optional.ofNullable(System.getProperty(propertyKey)))
        .or(() -> Optional.ofNullable(System.getenv(envKey)))
        .filter(v -> !v.isBlank())
        .map(String::trim);
  }

  /**
   * Returns whether the option map carries a non-blank value for a setting, under its name or an
   * alias. System properties and environment variables are not consulted.
   *
   * @param options option map
   * @param key setting name, e.g. {@link #MAX_RETRY}
   * @return true if the map sets the value
   */
  static boolean isSet(final Map<String, String> options, final String key) {
    return ALIASES.get(key).stream()
        .map(options::get)
        .anyMatch(v -> v != null && !v.isBlank());
  }

  static String toPropertyKey(final String key) {
    return switch (key) {
      case MAX_RETRY -> "failover.max.retry";
      case DISCONNECT_ON_READ_ONLY -> "failover.disconnect.on.readonly";
      case SLEEP_BEFORE_DISCONNECT -> "failover.sleep.before.disconnect";
      case READ_ONLY_VARIABLE -> "failover.readonly.variable";
      default -> throw new IllegalArgumentException("Unknown failover option: " + key);
    };
  }

  private static Duration seconds(final String value) {
    final var millis = new BigDecimal(value).movePointRight(3).longValueExact();
    return Duration.ofMillis(millis);
  }

  private static boolean parseBoolean(final String key, final String value) {
    return switch (value.toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default ->
          throw new IllegalArgumentException(
              "Invalid failover option %s: not a boolean: %s".formatted(key, value));
    };
  }

  private static <T> T parse(
      final String key, final String value, final Function<String, T> parser) {
    try {
      return parser.apply(value);
    } catch (final RuntimeException e) {
      throw new IllegalArgumentException(
          "Invalid failover option %s: %s".formatted(key, value), e);
    }
  }
}
