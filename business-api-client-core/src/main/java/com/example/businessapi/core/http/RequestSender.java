package com.example.businessapi.core.http;

import com.example.businessapi.core.CallContext;
import java.io.IOException;

/** Sends a single request. No retries, no status interpretation. */
@FunctionalInterface
public interface RequestSender {

  /**
   * @param ctx cancellation scope; cancelling it aborts the exchange
   * @param request request to send
   * @param bearerToken access token for the {@code Authorization} header
   * @return the response, whatever its status
   * @throws IOException if no response was received
   */
  ApiResponse send(CallContext ctx, ApiRequest request, String bearerToken) throws IOException;
}
