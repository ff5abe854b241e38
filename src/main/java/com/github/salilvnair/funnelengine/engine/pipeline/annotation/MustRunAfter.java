package com.github.salilvnair.funnelengine.engine.pipeline.annotation;

import com.github.salilvnair.funnelengine.engine.pipeline.TransitionStep;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MustRunAfter {
    Class<? extends TransitionStep>[] value();
}
