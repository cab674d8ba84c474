package com.example.failoverclient.core.secrets;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * RDS-format database secret, as stored in AWS Secrets Manager for managed clusters.
 *
 * @param username database username
 * @param password database password
 * @param engine database engine identifier (e.g., mysql, aurora-mysql, postgres)
 * @param host cluster endpoint host name
 * @param port database port number
 * @param dbname default database
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DbSecret(
    String username, String password, String engine, String host, int port, String dbname) {

  @Override
  public String toString() {
    return "DbSecret[username=%s, engine=%s, host=%s, port=%d, dbname=%s]"
        .formatted(username, engine, host, port, dbname);
  }
}
