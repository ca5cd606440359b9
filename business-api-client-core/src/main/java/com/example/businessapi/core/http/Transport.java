package com.example.businessapi.core.http;

import com.example.businessapi.core.CallContext;

/** Executes API requests, returning only successful responses. */
@FunctionalInterface
public interface Transport {

  /**
   * @param ctx cancellation scope
   * @param request request to execute
   * @return a 2xx response
   * @throws com.example.businessapi.core.errors.ApiClientException for any failure
   */
  ApiResponse execute(CallContext ctx, ApiRequest request);
}
