package com.server.skillsync.match.mq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.server.skillsync.config.RabbitMQConfig;
import com.server.skillsync.match.enums.TriggerSource;
import com.server.skillsync.match.exception.SnapshotNotFoundException;
import com.server.skillsync.match.mq.message.ProjectEventMessage;
import com.server.skillsync.match.mq.message.UserEventMessage;
import com.server.skillsync.match.pipeline.MatchTrigger;
import com.server.skillsync.match.pipeline.MatchingPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 用户事件与项目事件消费者
 * 正常返回即确认；格式错误或实体不存在时拒绝且不重新入队（进入死信队列）；
 * 其他失败首次投递时重新入队，重投后仍失败则进入死信队列
 */
@Component
public class MatchEventConsumer {
    private static final Logger logger = LoggerFactory.getLogger(MatchEventConsumer.class);

    private final MatchingPipeline matchingPipeline;
    private final ObjectMapper objectMapper;

    public MatchEventConsumer(MatchingPipeline matchingPipeline, ObjectMapper objectMapper) {
        this.matchingPipeline = matchingPipeline;
        this.objectMapper = objectMapper;
    }

    @RabbitListener(queues = RabbitMQConfig.USER_EVENTS_QUEUE)
    public void handleUserEvent(Message message) {
        String routingKey = message.getMessageProperties().getReceivedRoutingKey();
        if (!RabbitMQConfig.USER_CREATED_KEY.equals(routingKey)
                && !RabbitMQConfig.USER_UPDATED_KEY.equals(routingKey)) {
            logger.debug("忽略用户事件: {}", routingKey);
            return;
        }

        UserEventMessage event = parse(message, UserEventMessage.class);
        if (isBlank(event.getUserId())) {
            throw new AmqpRejectAndDontRequeueException("用户事件缺少 userId: " + routingKey);
        }
        logger.info("收到用户事件 {}，userId: {}", routingKey, event.getUserId());
        process(MatchTrigger.forUser(event.getUserId(), TriggerSource.EVENT), message.getMessageProperties());
    }

    @RabbitListener(queues = RabbitMQConfig.PROJECT_EVENTS_QUEUE)
    public void handleProjectEvent(Message message) {
        String routingKey = message.getMessageProperties().getReceivedRoutingKey();
        if (!RabbitMQConfig.PROJECT_CREATED_KEY.equals(routingKey)) {
            logger.debug("忽略项目事件: {}", routingKey);
            return;
        }

        ProjectEventMessage event = parse(message, ProjectEventMessage.class);
        if (isBlank(event.getProjectId())) {
            throw new AmqpRejectAndDontRequeueException("项目事件缺少 projectId: " + routingKey);
        }
        logger.info("收到项目事件 {}，projectId: {}", routingKey, event.getProjectId());
        process(MatchTrigger.forProject(event.getProjectId(), TriggerSource.EVENT), message.getMessageProperties());
    }

    private void process(MatchTrigger trigger, MessageProperties properties) {
        try {
            matchingPipeline.process(trigger);
        } catch (SnapshotNotFoundException e) {
            logger.warn("触发实体不存在，丢弃事件: {}", e.getMessage());
            throw new AmqpRejectAndDontRequeueException(e.getMessage(), e);
        } catch (RuntimeException e) {
            if (Boolean.TRUE.equals(properties.getRedelivered())) {
                logger.error("重投后仍处理失败，转入死信队列: side={}, id={}",
                        trigger.side(), trigger.entityId(), e);
                throw new AmqpRejectAndDontRequeueException("匹配生成失败", e);
            }
            logger.error("匹配生成失败，消息将重新入队: side={}, id={}", trigger.side(), trigger.entityId(), e);
            throw e;
        }
    }

    private <T> T parse(Message message, Class<T> type) {
        try {
            T event = objectMapper.readValue(message.getBody(), type);
            if (event == null) {
                throw new AmqpRejectAndDontRequeueException("事件内容为空");
            }
            return event;
        } catch (IOException e) {
            throw new AmqpRejectAndDontRequeueException("事件内容不是合法的 JSON", e);
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
