package io.b2mash.b2b.rolepermissions.permission.cache;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the permission check cache.
 *
 * @param backend {@code redis} for a shared cache, {@code local} for an in-process Caffeine cache
 * @param ttl lifetime of a cached check result
 * @param scanBatchSize number of keys deleted per round trip during invalidation
 * @param localMaxEntries size bound of the local backend
 * @param executorPoolSize threads used for background cache writes and invalidations
 */
@ConfigurationProperties(prefix = "permissions.cache")
public record PermissionCacheProperties(
    String backend,
    Duration ttl,
    int scanBatchSize,
    long localMaxEntries,
    int executorPoolSize) {

  public PermissionCacheProperties {
    if (backend == null || backend.isBlank()) {
      backend = "redis";
    }
    if (ttl == null) {
      ttl = Duration.ofSeconds(300);
    }
    if (scanBatchSize <= 0) {
      scanBatchSize = 100;
    }
    if (localMaxEntries <= 0) {
      localMaxEntries = 100_000;
    }
    if (executorPoolSize <= 0) {
      executorPoolSize = 2;
    }
  }
}
