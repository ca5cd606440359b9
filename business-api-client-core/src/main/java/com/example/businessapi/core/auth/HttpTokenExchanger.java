package com.example.businessapi.core.auth;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.businessapi.core.CallCancelledException;
import com.example.businessapi.core.CallContext;
import com.example.businessapi.core.errors.AuthenticationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicNameValuePair;

/**
 * Exchanges a signed client assertion for an access token using the OAuth2 client-credentials
 * grant with a JWT bearer client assertion.
 */
public final class HttpTokenExchanger implements TokenExchanger {

  private static final System.Logger LOGGER = System.getLogger(HttpTokenExchanger.class.getName());

  public static final String DEFAULT_TOKEN_ENDPOINT =
      "https://account.apple.com/auth/oauth2/v2/token";

  static final String CLIENT_ASSERTION_TYPE =
      "urn:ietf:params:oauth:client-assertion-type:jwt-bearer";

  private final Credential credential;
  private final URI tokenEndpoint;
  private final CloseableHttpClient httpClient;
  private final ClientAssertionFactory assertions;
  private final ObjectMapper mapper;
  private final Clock clock;

  public HttpTokenExchanger(
      final Credential credential,
      final URI tokenEndpoint,
      final CloseableHttpClient httpClient,
      final ClientAssertionFactory assertions,
      final ObjectMapper mapper,
      final Clock clock) {
    if (credential == null) throw new IllegalArgumentException("credential is required");
    if (tokenEndpoint == null) throw new IllegalArgumentException("tokenEndpoint is required");
    if (httpClient == null) throw new IllegalArgumentException("httpClient is required");
    this.credential = credential;
    this.tokenEndpoint = tokenEndpoint;
    this.httpClient = httpClient;
    this.assertions = assertions == null ? new ClientAssertionFactory() : assertions;
    this.mapper = mapper == null ? new ObjectMapper() : mapper;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  @Override
  public Token exchange(final CallContext ctx) {
    ctx.throwIfCancelled();

    final var audience =
        credential.audience() == null ? tokenEndpoint.toString() : credential.audience();
    final List<NameValuePair> form =
        List.of(
            new BasicNameValuePair("grant_type", "client_credentials"),
            new BasicNameValuePair("client_id", credential.issuerId()),
            new BasicNameValuePair("client_assertion_type", CLIENT_ASSERTION_TYPE),
            new BasicNameValuePair("client_assertion", assertions.create(credential, audience)),
            new BasicNameValuePair("scope", credential.scope()));

    final var post = new HttpPost(tokenEndpoint);
    post.setHeader(HttpHeaders.ACCEPT, "application/json");
    post.setEntity(new UrlEncodedFormEntity(form, StandardCharsets.UTF_8));

    try (var ignored = ctx.onCancel(post::cancel)) {
      final var token = httpClient.execute(post, this::toToken);
      LOGGER.log(
          INFO,
          "Obtained access token for {0} (scope {1}), expires at {2}",
          credential.issuerId(),
          credential.scope(),
          token.expiresAt());
      return token;
    } catch (final IOException e) {
      if (ctx.isCancelled() || Thread.currentThread().isInterrupted())
        throw new CallCancelledException(
            ctx.cancellationReason().orElse("thread interrupted"), e);
      LOGGER.log(WARNING, "Token request to {0} failed: {1}", tokenEndpoint, e.getMessage());
      throw new AuthenticationException("Token request failed: " + e.getMessage(), e);
    }
  }

  private Token toToken(final ClassicHttpResponse response) throws IOException {
    final var entity = response.getEntity();
    final var body =
        entity == null ? "" : new String(EntityUtils.toByteArray(entity), StandardCharsets.UTF_8);

    if (response.getCode() != 200) {
      LOGGER.log(WARNING, "Token endpoint answered {0}", response.getCode());
      throw new AuthenticationException(
          String.format("token request failed with status %d: %s", response.getCode(), body));
    }

    final TokenResponse parsed;
    try {
      parsed = mapper.readValue(body, TokenResponse.class);
    } catch (final IOException e) {
      throw new AuthenticationException("Malformed token response: " + e.getMessage(), e);
    }

    if (parsed.accessToken() == null || parsed.accessToken().isBlank())
      throw new AuthenticationException("Token response missing access_token");
    if (parsed.expiresIn() == null || parsed.expiresIn() <= 0)
      throw new AuthenticationException("Token response has no positive expires_in");

    return new Token(
        parsed.accessToken(),
        clock.instant().plusSeconds(parsed.expiresIn()),
        parsed.scope() == null ? credential.scope() : parsed.scope());
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TokenResponse(
      @JsonProperty("access_token") String accessToken,
      @JsonProperty("token_type") String tokenType,
      @JsonProperty("expires_in") Long expiresIn,
      @JsonProperty("scope") String scope) {}
}
