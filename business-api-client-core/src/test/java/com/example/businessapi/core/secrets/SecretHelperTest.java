package com.example.businessapi.core.secrets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.example.businessapi.core.auth.TestKeys;
import com.example.businessapi.core.errors.ApiClientException;
import com.example.businessapi.core.errors.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.JWSAlgorithm;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import software.amazon.awssdk.core.exception.SdkClientException;

public class SecretHelperTest {

  private static final String SECRET_ID = "prod/business-api";

  private MockedStatic<SecretsManagerProvider> providerMock;
  private String pem;

  @BeforeEach
  void setup() {
    pem = TestKeys.pem(TestKeys.ecKeyPair().getPrivate());
    providerMock = mockStatic(SecretsManagerProvider.class);
  }

  @AfterEach
  void cleanup() {
    providerMock.close();
    SecretHelper.setMapperSupplier(ObjectMapper::new);
  }

  private String secretJson(final String extra) throws Exception {
    final var node = new ObjectMapper().createObjectNode();
    node.put("keyId", "KEY123");
    node.put("issuerId", "BUSINESSAPI.issuer-1");
    node.put("privateKey", pem);
    node.put("scope", "school.api");
    if (extra != null) node.put(extra, "ignored");
    return new ObjectMapper().writeValueAsString(node);
  }

  @Test
  void shouldBuildCredentialFromSecret() throws Exception {
    providerMock
        .when(() -> SecretsManagerProvider.getSecret(SECRET_ID))
        .thenReturn(secretJson(null));

    final var credential = SecretHelper.getCredential(SECRET_ID);

    assertEquals("KEY123", credential.keyId());
    assertEquals("BUSINESSAPI.issuer-1", credential.issuerId());
    assertEquals("school.api", credential.scope());
    assertEquals(JWSAlgorithm.ES256, credential.signingKey().algorithm());
  }

  @Test
  void shouldIgnoreExtraFields() throws Exception {
    providerMock
        .when(() -> SecretsManagerProvider.getSecret(SECRET_ID))
        .thenReturn(secretJson("rotatedAt"));

    assertEquals("KEY123", SecretHelper.getCredentialSecret(SECRET_ID).keyId());
  }

  @Test
  void shouldUseConfiguredMapperSupplier() throws Exception {
    final var calls = new AtomicInteger();
    SecretHelper.setMapperSupplier(
        () -> {
          calls.incrementAndGet();
          return new ObjectMapper();
        });
    providerMock
        .when(() -> SecretsManagerProvider.getSecret(SECRET_ID))
        .thenReturn(secretJson(null));

    SecretHelper.getCredentialSecret(SECRET_ID);

    assertEquals(1, calls.get());
  }

  @Test
  void shouldRejectMissingKey() {
    providerMock
        .when(() -> SecretsManagerProvider.getSecret(SECRET_ID))
        .thenReturn("{\"keyId\":\"KEY123\",\"issuerId\":\"issuer\"}");

    assertThrows(ValidationException.class, () -> SecretHelper.getCredential(SECRET_ID));
  }

  @Test
  void shouldRejectInvalidJson() {
    providerMock
        .when(() -> SecretsManagerProvider.getSecret(SECRET_ID))
        .thenReturn("invalid json");

    assertThrows(ValidationException.class, () -> SecretHelper.getCredential(SECRET_ID));
  }

  @Test
  void shouldRejectBlankSecretId() {
    assertThrows(ValidationException.class, () -> SecretHelper.getCredential(" "));
    providerMock.verifyNoInteractions();
  }

  @Test
  void shouldWrapSdkFailures() {
    providerMock
        .when(() -> SecretsManagerProvider.getSecret(anyString()))
        .thenThrow(SdkClientException.create("Unable to execute HTTP request"));

    final var ex =
        assertThrows(ApiClientException.class, () -> SecretHelper.getCredential(SECRET_ID));
    assertInstanceOf(SdkClientException.class, ex.getCause());
  }

  @Test
  void shouldNotPrintPrivateKey() throws Exception {
    providerMock
        .when(() -> SecretsManagerProvider.getSecret(SECRET_ID))
        .thenReturn(secretJson(null));

    final var secret = SecretHelper.getCredentialSecret(SECRET_ID);

    assertFalse(secret.toString().contains("PRIVATE KEY"));
    assertEquals(pem, secret.privateKey());
  }
}
