/**
 * Root package for the failover-client library.
 *
 * <p>This package contains a database client that keeps working across failover of a clustered
 * endpoint: when the old writer turns read-only or drops the connection, the client reconnects,
 * verifies the new session and rethrows the original error so the caller can decide what to do
 * with the failed statement.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.failoverclient.core.ResilientClient} – the client and its reconnection
 *       protocol.
 *   <li>{@link com.example.failoverclient.core.ErrorClassifier} – maps driver errors to an {@link
 *       com.example.failoverclient.core.ErrorClass}.
 *   <li>{@link com.example.failoverclient.core.RetryPolicy} – attempt budget and linear backoff.
 *   <li>{@link com.example.failoverclient.core.FailoverSettings} – option-map, system property
 *       and environment variable lookup of the resilience settings.
 *   <li>{@link com.example.failoverclient.core.DriverAdapter} and {@link
 *       com.example.failoverclient.core.DatabaseSession} – the contract a database driver
 *       implements.
 *   <li>{@link com.example.failoverclient.core.jdbc.JdbcDriverAdapter} – the JDBC implementation.
 *   <li>{@link com.example.failoverclient.core.secrets.SecretHelper} – reads connection settings
 *       from AWS Secrets Manager.
 * </ul>
 */
package com.example.failoverclient.core;
