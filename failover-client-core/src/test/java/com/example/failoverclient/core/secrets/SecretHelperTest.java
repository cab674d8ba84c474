package com.example.failoverclient.core.secrets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.mockito.MockedStatic;

public class SecretHelperTest {

  private MockedStatic<SecretsManagerProvider> providerMock;

  @AfterEach
  void cleanup() {
    if (providerMock != null) {
      providerMock.close();
      providerMock = null;
    }
    SecretHelper.setMapperSupplier(ObjectMapper::new);
  }

  @Test
  void shouldParseRdsSecretIgnoringExtraFields() throws Exception {
    final var json =
        """
        {
          "username": "app",
          "password": "pw",
          "engine": "aurora-mysql",
          "host": "cluster.local",
          "port": 3306,
          "dbname": "appdb",
          "dbClusterIdentifier": "prod-cluster"
        }
        """;

    final var secret = SecretHelper.parse(json);

    assertEquals(
        new DbSecret("app", "pw", "aurora-mysql", "cluster.local", 3306, "appdb"), secret);
    assertFalse(secret.toString().contains("pw"));
  }

  @Test
  void shouldFailOnInvalidJson() {
    assertThrows(JsonProcessingException.class, () -> SecretHelper.parse("invalid json"));
  }

  @Test
  void shouldUseConfiguredMapper() throws Exception {
    final var mapper = spy(new ObjectMapper());
    SecretHelper.setMapperSupplier(() -> mapper);

    SecretHelper.parse("{\"username\":\"app\"}");

    verify(mapper).readValue("{\"username\":\"app\"}", DbSecret.class);
  }

  @Test
  @DisplayName("getDbSecret reads the secret string from Secrets Manager")
  void shouldLoadSecretFromProvider() {
    providerMock = mockStatic(SecretsManagerProvider.class);
    providerMock
        .when(() -> SecretsManagerProvider.getSecret("db/secret"))
        .thenReturn(
            "{\"username\":\"u\",\"password\":\"p\",\"engine\":\"mysql\","
                + "\"host\":\"h\",\"port\":3306,\"dbname\":\"d\"}");

    final var secret = SecretHelper.getDbSecret("db/secret");

    assertEquals("h", secret.host());
    assertEquals(3306, secret.port());
  }

  @Test
  @DisplayName("getDbSecret wraps fetch and parse failures")
  void shouldWrapFailures() {
    providerMock = mockStatic(SecretsManagerProvider.class);
    providerMock.when(() -> SecretsManagerProvider.getSecret(anyString())).thenReturn("not json");

    final var error =
        assertThrows(RuntimeException.class, () -> SecretHelper.getDbSecret("db/secret"));

    assertTrue(error.getMessage().contains("db/secret"));
    assertInstanceOf(JsonProcessingException.class, error.getCause());
  }
}
