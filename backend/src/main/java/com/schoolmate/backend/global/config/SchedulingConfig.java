package com.schoolmate.backend.global.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration(proxyBeanMethods = false)
@EnableScheduling
@ConditionalOnProperty(value = "schoolmate.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
