/**
 * Root package for the business-api-client library.
 *
 * <p>This package contains a small set of focused classes that call the Business/School Manager
 * REST API: OAuth2 client-credentials authentication with a signed JWT assertion, retry of
 * throttled and failing requests, cursor pagination and structured error reporting.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.businessapi.core.BusinessApiClient}: facade wiring the pieces below,
 *       configurable from code, system properties/environment or AWS Secrets Manager.
 *   <li>{@link com.example.businessapi.core.CallContext}: per-call cancellation and deadline.
 *   <li>{@link com.example.businessapi.core.auth.OAuth2TokenProvider}: caches the access token
 *       and refreshes it with at most one exchange in flight.
 *   <li>{@link com.example.businessapi.core.auth.HttpTokenExchanger}: performs the token request
 *       with a client assertion from {@link
 *       com.example.businessapi.core.auth.ClientAssertionFactory}.
 *   <li>{@link com.example.businessapi.core.http.RetryableTransport}: authenticated execution with
 *       401 refresh, {@code Retry-After} handling and exponential backoff.
 *   <li>{@link com.example.businessapi.core.pagination.PaginationWalker}: follows {@code
 *       links.next} with cycle detection and a page cap.
 *   <li>{@link com.example.businessapi.core.errors.ErrorClassifier}: maps non-2xx responses to
 *       exceptions.
 *   <li>{@link com.example.businessapi.core.secrets.SecretHelper}: loads credentials from AWS
 *       Secrets Manager.
 * </ul>
 */
package com.example.businessapi.core;
