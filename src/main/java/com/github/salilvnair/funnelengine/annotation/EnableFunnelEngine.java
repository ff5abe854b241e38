package com.github.salilvnair.funnelengine.annotation;

import com.github.salilvnair.funnelengine.config.FunnelEngineAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(FunnelEngineAutoConfiguration.class)
public @interface EnableFunnelEngine {
}
