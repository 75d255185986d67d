package io.b2mash.b2b.rolepermissions.permission.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Shared store backed by Redis. Key enumeration uses incremental SCAN, never KEYS. */
public class RedisPermissionCacheStore implements PermissionCacheStore {

  private final StringRedisTemplate redisTemplate;
  private final int scanCount;

  public RedisPermissionCacheStore(StringRedisTemplate redisTemplate, int scanCount) {
    this.redisTemplate = redisTemplate;
    this.scanCount = scanCount;
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(redisTemplate.opsForValue().get(key));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    redisTemplate.opsForValue().set(key, value, ttl);
  }

  @Override
  public List<String> scanKeys(String pattern) {
    var options = ScanOptions.scanOptions().match(pattern).count(scanCount).build();
    var keys = new ArrayList<String>();
    try (Cursor<String> cursor = redisTemplate.scan(options)) {
      while (cursor.hasNext()) {
        keys.add(cursor.next());
      }
    }
    return keys;
  }

  @Override
  public long delete(Collection<String> keys) {
    if (keys.isEmpty()) {
      return 0;
    }
    Long removed = redisTemplate.delete(keys);
    return removed != null ? removed : 0;
  }
}
