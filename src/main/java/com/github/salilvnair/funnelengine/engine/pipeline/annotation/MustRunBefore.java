package com.github.salilvnair.funnelengine.engine.pipeline.annotation;

import com.github.salilvnair.funnelengine.engine.pipeline.TransitionStep;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MustRunBefore {
    Class<? extends TransitionStep>[] value();
}
