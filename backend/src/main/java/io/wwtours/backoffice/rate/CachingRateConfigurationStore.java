package io.wwtours.backoffice.rate;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/** Reuses the loaded snapshot for {@code pricing.cache-ttl}. */
@Component
@Primary
public class CachingRateConfigurationStore implements RateConfigurationStore {

  private static final String KEY = "current";

  private final Cache<String, RateConfiguration> cache;
  private final PropertiesRateConfigurationStore delegate;

  public CachingRateConfigurationStore(
      PropertiesRateConfigurationStore delegate, RateConfigurationProperties properties) {
    this.delegate = delegate;
    this.cache =
        Caffeine.newBuilder().expireAfterWrite(properties.cacheTtl()).maximumSize(1).build();
  }

  @Override
  public RateConfiguration current() {
    return cache.get(KEY, k -> delegate.current());
  }

  /** Drops the cached snapshot so the next read reloads it. */
  public void evict() {
    cache.invalidateAll();
  }
}
