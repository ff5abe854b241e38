package com.github.salilvnair.funnelengine.annotation;

import com.github.salilvnair.funnelengine.config.FunnelEngineCacheConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Caches parsed funnel graphs per funnel id. Triggers Spring's
 * {@link org.springframework.cache.annotation.EnableCaching}, so the default
 * ConcurrentMapCacheManager or any provider on the classpath is used.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(FunnelEngineCacheConfiguration.class)
public @interface EnableFunnelEngineCaching {
}
