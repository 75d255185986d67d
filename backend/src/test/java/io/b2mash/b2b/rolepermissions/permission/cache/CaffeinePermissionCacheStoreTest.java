package io.b2mash.b2b.rolepermissions.permission.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CaffeinePermissionCacheStoreTest {

  private final AtomicLong nanos = new AtomicLong();
  private CaffeinePermissionCacheStore store;

  @BeforeEach
  void setUp() {
    store = new CaffeinePermissionCacheStore(100, nanos::get);
  }

  @Test
  void entryExpiresAfterItsOwnTtl() {
    store.set("perm:a", "1", Duration.ofSeconds(10));
    store.set("perm:b", "0", Duration.ofSeconds(60));

    nanos.addAndGet(Duration.ofSeconds(11).toNanos());

    assertThat(store.get("perm:a")).isEmpty();
    assertThat(store.get("perm:b")).contains("0");
  }

  @Test
  void overwriteRestartsTtl() {
    store.set("perm:a", "1", Duration.ofSeconds(10));
    nanos.addAndGet(Duration.ofSeconds(8).toNanos());
    store.set("perm:a", "0", Duration.ofSeconds(10));
    nanos.addAndGet(Duration.ofSeconds(8).toNanos());

    assertThat(store.get("perm:a")).contains("0");
  }

  @Test
  void scanKeys_matchesGlobPattern() {
    store.set("perm:ws1:u1:projects:read", "1", Duration.ofMinutes(1));
    store.set("perm:ws1:u2:projects:read", "1", Duration.ofMinutes(1));
    store.set("perm:ws2:u1:projects:read", "1", Duration.ofMinutes(1));

    assertThat(store.scanKeys("perm:ws1:*"))
        .containsExactlyInAnyOrder("perm:ws1:u1:projects:read", "perm:ws1:u2:projects:read");
    assertThat(store.scanKeys("perm:ws?:u1:*")).hasSize(2);
    assertThat(store.scanKeys("other:*")).isEmpty();
  }

  @Test
  void globToRegex_treatsRegexCharactersLiterally() {
    assertThat(CaffeinePermissionCacheStore.globToRegex("perm.a+:*").matcher("perm.a+:x").matches())
        .isTrue();
    assertThat(CaffeinePermissionCacheStore.globToRegex("perm.a+:*").matcher("permXaa:x").matches())
        .isFalse();
  }

  @Test
  void delete_countsOnlyPresentKeys() {
    store.set("perm:a", "1", Duration.ofMinutes(1));
    store.set("perm:b", "1", Duration.ofMinutes(1));

    assertThat(store.delete(List.of("perm:a", "perm:b", "perm:missing"))).isEqualTo(2);
    assertThat(store.get("perm:a")).isEmpty();
  }
}
