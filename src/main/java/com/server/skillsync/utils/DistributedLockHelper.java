package com.server.skillsync.utils;

import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 分布式锁工具类
 * 基于Redisson实现，未指定租期时由看门狗自动延长锁的有效期
 */
@Component
@ConditionalOnProperty(name = "matching.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
public class DistributedLockHelper {
    private static final Logger logger = LoggerFactory.getLogger(DistributedLockHelper.class);

    private final RedissonClient redissonClient;

    public DistributedLockHelper(RedissonClient redissonClient) {
        this.redissonClient = redissonClient;
    }

    /**
     * 尝试获取分布式锁
     * @param lockKey 锁的key
     * @param waitTime 等待时间
     * @param timeUnit 时间单位
     * @return 是否获取成功
     */
    public boolean tryLock(String lockKey, long waitTime, TimeUnit timeUnit) {
        try {
            RLock lock = redissonClient.getLock(lockKey);
            boolean locked = lock.tryLock(waitTime, timeUnit);
            if (locked) {
                logger.debug("成功获取分布式锁，lockKey: {}", lockKey);
            } else {
                logger.info("分布式锁已被其他实例持有，lockKey: {}", lockKey);
            }
            return locked;
        } catch (InterruptedException e) {
            logger.error("获取分布式锁过程中被中断，lockKey: {}", lockKey, e);
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            logger.error("获取分布式锁异常，lockKey: {}", lockKey, e);
            return false;
        }
    }

    /**
     * 释放分布式锁
     * @param lockKey 锁的key
     */
    public void unlock(String lockKey) {
        try {
            RLock lock = redissonClient.getLock(lockKey);
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                logger.debug("成功释放分布式锁，lockKey: {}", lockKey);
            } else {
                logger.warn("当前线程并未持有该锁，无需释放，lockKey: {}", lockKey);
            }
        } catch (Exception e) {
            logger.error("释放分布式锁异常，lockKey: {}", lockKey, e);
        }
    }
}
