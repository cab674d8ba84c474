package com.example.failoverclient.core.secrets;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.function.Supplier;

/** Loads {@link DbSecret}s from AWS Secrets Manager and parses them with Jackson. */
public final class SecretHelper {

  private static volatile Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

  private SecretHelper() {}

  /**
   * Sets the supplier of the {@link ObjectMapper} used to parse secrets.
   *
   * @param supplier mapper supplier
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /**
   * Fetches a secret and parses it into a {@link DbSecret}.
   *
   * @param secretId the identifier/name of the secret
   * @return the parsed secret
   * @throws RuntimeException if the secret cannot be fetched or parsed
   */
  public static DbSecret getDbSecret(final String secretId) {
    try {
      return parse(SecretsManagerProvider.getSecret(secretId));
    } catch (final Exception exception) {
      throw new RuntimeException("Failed to load DB secret " + secretId, exception);
    }
  }

  static DbSecret parse(final String json) throws Exception {
    return mapperSupplier.get().readValue(json, DbSecret.class);
  }
}
