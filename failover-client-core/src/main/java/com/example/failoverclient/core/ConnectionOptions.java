package com.example.failoverclient.core;

import com.example.failoverclient.core.secrets.DbSecret;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Raw driver connection options, stored by {@link ResilientClient} and passed unchanged to {@link
 * DriverAdapter#connect(ConnectionOptions)} on every (re)connect.
 *
 * @param url JDBC url of the endpoint
 * @param properties driver properties such as {@code user} and {@code password}
 */
public record ConnectionOptions(String url, Map<String, String> properties) {

  public ConnectionOptions {
    if (url == null || url.isBlank()) throw new IllegalArgumentException("url is required");
    properties = Map.copyOf(properties);
  }

  /**
   * Creates options for a url with user and password properties.
   *
   * @param url JDBC url
   * @param user database user
   * @param password database password
   * @return connection options
   */
  public static ConnectionOptions of(final String url, final String user, final String password) {
    final var props = new LinkedHashMap<String, String>();
    if (user != null) props.put("user", user);
    if (password != null) props.put("password", password);
    return new ConnectionOptions(url, props);
  }

  /**
   * Builds options from an RDS-format database secret.
   *
   * <p>MySQL-family engines ({@code mysql}, {@code aurora}, {@code aurora-mysql}, {@code mariadb})
   * map to {@code jdbc:mysql://}, PostgreSQL-family engines to {@code jdbc:postgresql://}.
   *
   * @param secret the database secret
   * @return connection options
   * @throws IllegalArgumentException if the engine is missing or unsupported
   */
  public static ConnectionOptions fromSecret(final DbSecret secret) {
    final var engine =
        secret.engine() == null ? "" : secret.engine().toLowerCase(Locale.ROOT).trim();
    final String scheme;
    if (engine.startsWith("postgres") || engine.equals("aurora-postgresql")) {
      scheme = "postgresql";
    } else if (engine.equals("mysql")
        || engine.equals("mariadb")
        || engine.equals("aurora")
        || engine.equals("aurora-mysql")) {
      scheme = "mysql";
    } else {
      throw new IllegalArgumentException("Unsupported database engine: " + secret.engine());
    }

    final var dbname = secret.dbname() == null ? "" : secret.dbname();
    final var url = "jdbc:%s://%s:%d/%s".formatted(scheme, secret.host(), secret.port(), dbname);
    return of(url, secret.username(), secret.password());
  }

  /**
   * Returns a copy with one more driver property.
   *
   * @param key property name
   * @param value property value
   * @return new options
   */
  public ConnectionOptions withProperty(final String key, final String value) {
    final var props = new LinkedHashMap<>(properties);
    props.put(key, value);
    return new ConnectionOptions(url, props);
  }

  /**
   * Returns the driver properties as {@link Properties} for {@link java.sql.DriverManager}.
   *
   * @return new properties instance
   */
  public Properties toProperties() {
    final var props = new Properties();
    props.putAll(properties);
    return props;
  }

  @Override
  public String toString() {
    final var redacted = new LinkedHashMap<String, String>(properties);
    redacted.computeIfPresent("password", (k, v) -> "****");
    return "ConnectionOptions[url=" + url + ", properties=" + redacted + "]";
  }
}
