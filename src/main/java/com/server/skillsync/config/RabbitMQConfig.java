package com.server.skillsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.amqp.SimpleRabbitListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ配置类
 * 入站：用户事件与项目事件队列；出站：匹配事件交换机；两个入站队列共用一个死信队列
 */
@Configuration
public class RabbitMQConfig {
    private static final Logger logger = LoggerFactory.getLogger(RabbitMQConfig.class);

    // 用户事件
    public static final String USER_EVENTS_EXCHANGE = "user_events";
    public static final String USER_EVENTS_QUEUE = "user_events";
    public static final String USER_EVENTS_PATTERN = "user.*";
    public static final String USER_CREATED_KEY = "user.created";
    public static final String USER_UPDATED_KEY = "user.updated";

    // 项目事件
    public static final String PROJECT_EVENTS_EXCHANGE = "project_events";
    public static final String PROJECT_EVENTS_QUEUE = "project_events";
    public static final String PROJECT_EVENTS_PATTERN = "project.*";
    public static final String PROJECT_CREATED_KEY = "project.created";

    // 匹配事件（出站）
    public static final String MATCHING_EVENTS_EXCHANGE = "matching_events";
    public static final String MATCH_CREATED_BATCH_KEY = "match.created-batch";
    public static final String MATCH_CREATED_KEY = "match.created";

    // 死信
    public static final String MATCHING_DLX = "matching_events.dlx";
    public static final String MATCHING_DLQ = "matching.dead_letter";
    public static final String MATCHING_DLK = "matching.dead_letter";

    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        Jackson2JsonMessageConverter converter = new Jackson2JsonMessageConverter(objectMapper);
        converter.setCreateMessageIds(true);
        return converter;
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, MessageConverter jsonMessageConverter) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(jsonMessageConverter);
        template.setConfirmCallback((correlationData, ack, cause) -> {
            if (!ack) {
                logger.error("消息发送失败: {}", cause);
            }
        });
        return template;
    }

    /**
     * 监听容器
     * 并发数和预取数量来自 spring.rabbitmq.listener.simple.*，
     * 关闭时最多等待 shutdown-timeout 让处理中的消息完成
     */
    @Bean
    public SimpleRabbitListenerContainerFactory rabbitListenerContainerFactory(
            SimpleRabbitListenerContainerFactoryConfigurer configurer,
            ConnectionFactory connectionFactory,
            @Value("${matching.listener.shutdown-timeout-ms:30000}") long shutdownTimeoutMs) {
        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        configurer.configure(factory, connectionFactory);
        factory.setAcknowledgeMode(AcknowledgeMode.AUTO);
        factory.setDefaultRequeueRejected(true);
        factory.setContainerCustomizer(container -> container.setShutdownTimeout(shutdownTimeoutMs));
        return factory;
    }

    @Bean
    public Queue userEventsQueue() {
        return QueueBuilder.durable(USER_EVENTS_QUEUE)
                .withArgument("x-dead-letter-exchange", MATCHING_DLX)
                .withArgument("x-dead-letter-routing-key", MATCHING_DLK)
                .build();
    }

    @Bean
    public Queue projectEventsQueue() {
        return QueueBuilder.durable(PROJECT_EVENTS_QUEUE)
                .withArgument("x-dead-letter-exchange", MATCHING_DLX)
                .withArgument("x-dead-letter-routing-key", MATCHING_DLK)
                .build();
    }

    @Bean
    public Queue matchingDeadLetterQueue() {
        return QueueBuilder.durable(MATCHING_DLQ).build();
    }

    @Bean
    public TopicExchange userEventsExchange() {
        return new TopicExchange(USER_EVENTS_EXCHANGE);
    }

    @Bean
    public TopicExchange projectEventsExchange() {
        return new TopicExchange(PROJECT_EVENTS_EXCHANGE);
    }

    @Bean
    public TopicExchange matchingEventsExchange() {
        return new TopicExchange(MATCHING_EVENTS_EXCHANGE);
    }

    @Bean
    public DirectExchange matchingDeadLetterExchange() {
        return new DirectExchange(MATCHING_DLX);
    }

    @Bean
    public Binding userEventsBinding(Queue userEventsQueue, TopicExchange userEventsExchange) {
        return BindingBuilder
                .bind(userEventsQueue)
                .to(userEventsExchange)
                .with(USER_EVENTS_PATTERN);
    }

    @Bean
    public Binding projectEventsBinding(Queue projectEventsQueue, TopicExchange projectEventsExchange) {
        return BindingBuilder
                .bind(projectEventsQueue)
                .to(projectEventsExchange)
                .with(PROJECT_EVENTS_PATTERN);
    }

    @Bean
    public Binding matchingDeadLetterBinding(Queue matchingDeadLetterQueue, DirectExchange matchingDeadLetterExchange) {
        return BindingBuilder
                .bind(matchingDeadLetterQueue)
                .to(matchingDeadLetterExchange)
                .with(MATCHING_DLK);
    }
}
