package com.example.resilientdatasource.core.pool;

/**
 * Connection counts reported by the native pool.
 *
 * @param total open connections
 * @param active connections currently handed out
 * @param idle connections waiting in the pool
 * @param awaiting threads blocked waiting for a connection
 */
public record PoolStats(int total, int active, int idle, int awaiting) {
  public static final PoolStats EMPTY = new PoolStats(0, 0, 0, 0);
}
