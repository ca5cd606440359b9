package com.example.businessapi.core.auth;

import com.example.businessapi.core.CallContext;

/**
 * Source of bearer tokens for outgoing requests. Implementations are shared by every thread using
 * the client.
 */
public interface TokenProvider {

  /**
   * Returns a token that stays valid for at least the provider's skew, exchanging a new one when
   * needed.
   *
   * @param ctx cancellation scope of the calling request
   * @return usable token
   * @throws com.example.businessapi.core.errors.AuthenticationException if the exchange fails
   */
  Token getToken(CallContext ctx);

  /**
   * Drops the cached token and obtains a new one, typically after the API rejected the current
   * token with 401.
   *
   * @param ctx cancellation scope of the calling request
   * @throws com.example.businessapi.core.errors.AuthenticationException if the exchange fails
   */
  void forceRefresh(CallContext ctx);
}
