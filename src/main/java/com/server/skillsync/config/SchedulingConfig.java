package com.server.skillsync.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 定时任务开关
 * matching.reconciliation.enabled=false 时不注册任何定时任务
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "matching.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
