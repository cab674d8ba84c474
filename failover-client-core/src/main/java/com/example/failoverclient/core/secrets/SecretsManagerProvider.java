package com.example.failoverclient.core.secrets;

import java.net.URI;
import java.util.Optional;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;

/**
 * Lazily built AWS Secrets Manager client.
 *
 * <p>Configuration, system property first, then environment variable:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION (default us-east-1)
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (endpoint override, e.g. Localstack)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID and aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 *       (static credentials; the default provider chain is used otherwise)
 * </ul>
 */
public final class SecretsManagerProvider {

  private static volatile SecretsManagerClient client;

  private SecretsManagerProvider() {}

  /**
   * Fetches the current secret string.
   *
   * @param secretId the secret identifier or name
   * @return the secret string
   */
  public static String getSecret(final String secretId) {
    final var request = GetSecretValueRequest.builder().secretId(secretId).build();
    return getClient().getSecretValue(request).secretString();
  }

  /** Closes the current client; the next call builds a new one from the current configuration. */
  public static synchronized void resetClient() {
    final var current = client;
    client = null;
    if (current != null) current.close();
  }

  static synchronized SecretsManagerClient getClient() {
    return Optional.ofNullable(client).orElseGet(() -> client = buildClient());
  }

  private static SecretsManagerClient buildClient() {
    final var builder =
        SecretsManagerClient.builder()
            .region(setting("aws.region", "AWS_REGION").map(Region::of).orElse(Region.US_EAST_1))
            .credentialsProvider(credentials());
    setting("aws.sm.endpoint", "AWS_SM_ENDPOINT")
        .map(URI::create)
        .ifPresent(builder::endpointOverride);
    return builder.build();
  }

  private static AwsCredentialsProvider credentials() {
    return setting("aws.accessKeyId", "AWS_ACCESS_KEY_ID")
        .flatMap(
            accessKey ->
                setting("aws.secretAccessKey", "AWS_SECRET_ACCESS_KEY")
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .<AwsCredentialsProvider>map(StaticCredentialsProvider::create)
        .orElseGet(() -> DefaultCredentialsProvider.builder().build());
  }

  private static Optional<String> setting(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .filter(value -> !value.isBlank());
  }
}
