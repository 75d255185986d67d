package io.b2mash.b2b.rolepermissions.permission.cache;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Key/value backend behind {@link PermissionCacheService}. Implementations may throw. */
public interface PermissionCacheStore {

  Optional<String> get(String key);

  void set(String key, String value, Duration ttl);

  /** Keys matching a glob pattern ({@code *} and {@code ?} wildcards). */
  List<String> scanKeys(String pattern);

  /** Returns the number of keys removed. */
  long delete(Collection<String> keys);
}
