package com.server.skillsync.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 客户端，只用于定时对账的分布式锁
 * 关闭对账时不创建，也就不需要 Redis
 */
@Configuration
@ConditionalOnProperty(name = "matching.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
public class RedissonConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String host;

    @Value("${spring.data.redis.port:6379}")
    private int port;

    @Value("${spring.data.redis.password:}")
    private String password;

    // 看门狗超时时间，默认30秒
    @Value("${redisson.lock.watchdog.timeout:30000}")
    private long watchdogTimeout;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();

        // 对账可能运行较久，由看门狗自动续期
        config.setLockWatchdogTimeout(watchdogTimeout);

        config.useSingleServer()
                .setAddress("redis://" + host + ":" + port)
                .setPassword(password.isEmpty() ? null : password)
                .setDatabase(0)
                .setConnectionPoolSize(8)
                .setConnectionMinimumIdleSize(2)
                .setConnectTimeout(10000)
                .setTimeout(3000)
                .setRetryAttempts(3)
                .setRetryInterval(1500);

        return Redisson.create(config);
    }
}
