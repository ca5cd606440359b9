/**
 * Unchecked exceptions raised by the client, all rooted at {@link
 * com.example.businessapi.core.errors.ApiClientException}.
 */
package com.example.businessapi.core.errors;
