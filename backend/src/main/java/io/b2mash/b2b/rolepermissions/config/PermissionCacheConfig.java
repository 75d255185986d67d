package io.b2mash.b2b.rolepermissions.config;

import io.b2mash.b2b.rolepermissions.permission.cache.CaffeinePermissionCacheStore;
import io.b2mash.b2b.rolepermissions.permission.cache.PermissionCacheProperties;
import io.b2mash.b2b.rolepermissions.permission.cache.PermissionCacheStore;
import io.b2mash.b2b.rolepermissions.permission.cache.RedisPermissionCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(PermissionCacheProperties.class)
public class PermissionCacheConfig {

  private static final Logger log = LoggerFactory.getLogger(PermissionCacheConfig.class);

  @Bean
  @ConditionalOnProperty(
      prefix = "permissions.cache",
      name = "backend",
      havingValue = "redis",
      matchIfMissing = true)
  PermissionCacheStore redisPermissionCacheStore(
      StringRedisTemplate redisTemplate, PermissionCacheProperties properties) {
    log.info("Permission cache backend: redis (ttl={})", properties.ttl());
    return new RedisPermissionCacheStore(redisTemplate, properties.scanBatchSize());
  }

  @Bean
  @ConditionalOnProperty(prefix = "permissions.cache", name = "backend", havingValue = "local")
  PermissionCacheStore localPermissionCacheStore(PermissionCacheProperties properties) {
    log.info(
        "Permission cache backend: local (ttl={}, maxEntries={})",
        properties.ttl(),
        properties.localMaxEntries());
    return new CaffeinePermissionCacheStore(properties.localMaxEntries());
  }

  /** Runs cache writes and invalidations off the request thread. Saturation drops the task. */
  @Bean(name = "permissionCacheExecutor")
  ThreadPoolTaskExecutor permissionCacheExecutor(PermissionCacheProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executorPoolSize());
    executor.setMaxPoolSize(properties.executorPoolSize());
    executor.setQueueCapacity(10_000);
    executor.setThreadNamePrefix("perm-cache-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(5);
    return executor;
  }
}
