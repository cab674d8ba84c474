package com.example.failoverclient.core.secrets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import org.junit.jupiter.api.*;
import org.mockito.MockedStatic;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;

class SecretsManagerProviderTest {

  private MockedStatic<SecretsManagerProvider> clientStaticMock;

  @BeforeEach
  void setup() {
    clearAwsProps();
    SecretsManagerProvider.resetClient();
  }

  @AfterEach
  void tearDown() {
    if (clientStaticMock != null) {
      clientStaticMock.close();
      clientStaticMock = null;
    }
    SecretsManagerProvider.resetClient();
    clearAwsProps();
  }

  private static void clearAwsProps() {
    System.clearProperty("aws.region");
    System.clearProperty("aws.sm.endpoint");
    System.clearProperty("aws.accessKeyId");
    System.clearProperty("aws.secretAccessKey");
  }

  @Test
  @DisplayName("getClient honors region, endpoint and credential properties and is reused")
  void getClientHonorsProperties() {
    System.setProperty("aws.region", "eu-west-1");
    System.setProperty("aws.sm.endpoint", "http://localhost:4566");
    System.setProperty("aws.accessKeyId", "test");
    System.setProperty("aws.secretAccessKey", "test");

    final var client = SecretsManagerProvider.getClient();

    assertNotNull(client);
    assertSame(client, SecretsManagerProvider.getClient());
    assertEquals("eu-west-1", client.serviceClientConfiguration().region().id());
  }

  @Test
  @DisplayName("getSecret returns the secret string of the current version")
  void getSecretReturnsSecretString() {
    final var mockClient = mock(SecretsManagerClient.class);
    when(mockClient.getSecretValue(any(GetSecretValueRequest.class)))
        .thenReturn(GetSecretValueResponse.builder().secretString("{\"username\":\"u\"}").build());

    clientStaticMock = mockStatic(SecretsManagerProvider.class, CALLS_REAL_METHODS);
    clientStaticMock.when(SecretsManagerProvider::getClient).thenReturn(mockClient);

    assertEquals("{\"username\":\"u\"}", SecretsManagerProvider.getSecret("db/secret"));
    verify(mockClient)
        .getSecretValue(
            argThat((GetSecretValueRequest r) -> "db/secret".equals(r.secretId())));
  }
}
