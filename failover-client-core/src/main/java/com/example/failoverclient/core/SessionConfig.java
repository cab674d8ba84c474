package com.example.failoverclient.core;

/**
 * Per-connection settings carried over when {@link ResilientClient} replaces its session.
 *
 * <p>Every field is optional: {@code null} means "not set, keep the driver default". The session
 * that owns the config applies the connection-level fields ({@code autoCommit}, {@code
 * transactionIsolation}, {@code catalog}, {@code schema}) to its connection and the statement-level
 * fields ({@code queryTimeoutSeconds}, {@code fetchSize}, {@code maxRows}) to each statement it
 * creates.
 *
 * @param autoCommit auto-commit mode
 * @param transactionIsolation one of the {@link java.sql.Connection} {@code TRANSACTION_*} levels
 * @param catalog current catalog (database)
 * @param schema current schema
 * @param queryTimeoutSeconds statement query timeout in seconds
 * @param fetchSize statement fetch size hint
 * @param maxRows maximum rows per result set
 */
public record SessionConfig(
    Boolean autoCommit,
    Integer transactionIsolation,
    String catalog,
    String schema,
    Integer queryTimeoutSeconds,
    Integer fetchSize,
    Integer maxRows) {

  private static final SessionConfig EMPTY =
      new SessionConfig(null, null, null, null, null, null, null);

  public SessionConfig {
    if (queryTimeoutSeconds != null && queryTimeoutSeconds < 0)
      throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
    if (fetchSize != null && fetchSize < 0)
      throw new IllegalArgumentException("fetchSize must be >= 0");
    if (maxRows != null && maxRows < 0) throw new IllegalArgumentException("maxRows must be >= 0");
  }

  /**
   * Returns a config with no field set.
   *
   * @return empty config
   */
  public static SessionConfig empty() {
    return EMPTY;
  }

  /**
   * Returns whether no field is set.
   *
   * @return true if every field is null
   */
  public boolean isEmpty() {
    return equals(EMPTY);
  }

  /**
   * Overlays the set fields of {@code other} on top of this config.
   *
   * @param other config whose non-null fields win, may be null
   * @return merged config
   */
  public SessionConfig merge(final SessionConfig other) {
    if (other == null) return this;
    return new SessionConfig(
        pick(other.autoCommit, autoCommit),
        pick(other.transactionIsolation, transactionIsolation),
        pick(other.catalog, catalog),
        pick(other.schema, schema),
        pick(other.queryTimeoutSeconds, queryTimeoutSeconds),
        pick(other.fetchSize, fetchSize),
        pick(other.maxRows, maxRows));
  }

  public SessionConfig withAutoCommit(final Boolean value) {
    return new SessionConfig(
        value, transactionIsolation, catalog, schema, queryTimeoutSeconds, fetchSize, maxRows);
  }

  public SessionConfig withTransactionIsolation(final Integer value) {
    return new SessionConfig(
        autoCommit, value, catalog, schema, queryTimeoutSeconds, fetchSize, maxRows);
  }

  public SessionConfig withCatalog(final String value) {
    return new SessionConfig(
        autoCommit, transactionIsolation, value, schema, queryTimeoutSeconds, fetchSize, maxRows);
  }

  public SessionConfig withSchema(final String value) {
    return new SessionConfig(
        autoCommit, transactionIsolation, catalog, value, queryTimeoutSeconds, fetchSize, maxRows);
  }

  public SessionConfig withQueryTimeoutSeconds(final Integer value) {
    return new SessionConfig(
        autoCommit, transactionIsolation, catalog, schema, value, fetchSize, maxRows);
  }

  public SessionConfig withFetchSize(final Integer value) {
    return new SessionConfig(
        autoCommit, transactionIsolation, catalog, schema, queryTimeoutSeconds, value, maxRows);
  }

  public SessionConfig withMaxRows(final Integer value) {
    return new SessionConfig(
        autoCommit, transactionIsolation, catalog, schema, queryTimeoutSeconds, fetchSize, value);
  }

  private static <T> T pick(final T preferred, final T fallback) {
    return preferred != null ? preferred : fallback;
  }
}
