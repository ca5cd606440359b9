package com.example.businessapi.core.auth;

import com.example.businessapi.core.CallContext;

/** Performs one token exchange against the authorization server. */
@FunctionalInterface
public interface TokenExchanger {

  /**
   * @param ctx cancellation scope; cancelling it aborts the exchange
   * @return freshly issued token
   * @throws com.example.businessapi.core.errors.AuthenticationException if signing or the exchange
   *     fails
   * @throws com.example.businessapi.core.CallCancelledException if {@code ctx} is cancelled
   */
  Token exchange(CallContext ctx);
}
