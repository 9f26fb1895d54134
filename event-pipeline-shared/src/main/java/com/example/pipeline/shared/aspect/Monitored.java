package com.example.pipeline.shared.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface Monitored {
    /**
     * Kind of operation being monitored (e.g. "service", "controller"), used as a metric name segment.
     */
    String value();
}
