package io.b2mash.b2b.rolepermissions.permission.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/** In-process store for single-node deployments and tests. Entries expire per their own TTL. */
public class CaffeinePermissionCacheStore implements PermissionCacheStore {

  private record Entry(String value, Duration ttl) {}

  private final Cache<String, Entry> cache;

  public CaffeinePermissionCacheStore(long maximumSize) {
    this(maximumSize, Ticker.systemTicker());
  }

  CaffeinePermissionCacheStore(long maximumSize, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(
                new Expiry<String, Entry>() {
                  @Override
                  public long expireAfterCreate(String key, Entry entry, long currentTime) {
                    return entry.ttl().toNanos();
                  }

                  @Override
                  public long expireAfterUpdate(
                      String key, Entry entry, long currentTime, long currentDuration) {
                    return entry.ttl().toNanos();
                  }

                  @Override
                  public long expireAfterRead(
                      String key, Entry entry, long currentTime, long currentDuration) {
                    return currentDuration;
                  }
                })
            .ticker(ticker)
            .build();
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(cache.getIfPresent(key)).map(Entry::value);
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    cache.put(key, new Entry(value, ttl));
  }

  @Override
  public List<String> scanKeys(String pattern) {
    var regex = globToRegex(pattern);
    return cache.asMap().keySet().stream().filter(k -> regex.matcher(k).matches()).toList();
  }

  @Override
  public long delete(Collection<String> keys) {
    long removed = 0;
    for (String key : keys) {
      if (cache.asMap().remove(key) != null) {
        removed++;
      }
    }
    return removed;
  }

  static Pattern globToRegex(String glob) {
    var regex = new StringBuilder();
    var literal = new StringBuilder();
    for (char c : glob.toCharArray()) {
      if (c == '*' || c == '?') {
        if (!literal.isEmpty()) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '*' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (!literal.isEmpty()) {
      regex.append(Pattern.quote(literal.toString()));
    }
    return Pattern.compile(regex.toString());
  }
}
