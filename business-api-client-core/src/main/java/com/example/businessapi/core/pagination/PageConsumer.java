package com.example.businessapi.core.pagination;

/**
 * Receives the raw JSON body of each page, in order.
 *
 * @param <E> exception the consumer may throw; it aborts the walk and reaches the caller unchanged
 */
@FunctionalInterface
public interface PageConsumer<E extends Exception> {
  void consume(byte[] page) throws E;
}
