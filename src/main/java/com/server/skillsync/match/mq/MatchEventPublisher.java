package com.server.skillsync.match.mq;

import com.server.skillsync.config.MatchingConfig;
import com.server.skillsync.config.RabbitMQConfig;
import com.server.skillsync.match.entity.Match;
import com.server.skillsync.match.enums.TriggerSide;
import com.server.skillsync.match.mq.message.MatchBatchMessage;
import com.server.skillsync.match.mq.message.MatchCreatedMessage;
import com.server.skillsync.match.mq.message.MatchPreview;
import com.server.skillsync.match.pipeline.MatchGenerationSummary;
import com.server.skillsync.match.pipeline.MatchTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 匹配事件生产者
 * 发布失败只记录日志，已保存的匹配不会回滚
 */
@Component
public class MatchEventPublisher {
    private static final Logger logger = LoggerFactory.getLogger(MatchEventPublisher.class);

    private final RabbitTemplate rabbitTemplate;
    private final MatchingConfig matchingConfig;

    public MatchEventPublisher(RabbitTemplate rabbitTemplate, MatchingConfig matchingConfig) {
        this.rabbitTemplate = rabbitTemplate;
        this.matchingConfig = matchingConfig;
    }

    /**
     * 发布一次触发的结果
     * 先为每条新匹配发布 match.created，再发布一条 match.created-batch
     */
    public void publishBatch(MatchGenerationSummary summary) {
        MatchingConfig.PublishingConfig publishing = matchingConfig.getPublishing();

        if (publishing.isPublishPerMatchEvents()) {
            for (Match match : summary.createdMatches()) {
                send(RabbitMQConfig.MATCH_CREATED_KEY, MatchCreatedMessage.from(match));
            }
        }

        if (summary.createdCount() == 0 && !publishing.isPublishEmptyBatches()) {
            logger.debug("触发 {} 没有新匹配，跳过批次事件", summary.trigger().entityId());
            return;
        }
        send(RabbitMQConfig.MATCH_CREATED_BATCH_KEY, buildBatchMessage(summary, publishing.getPreviewSize()));
    }

    MatchBatchMessage buildBatchMessage(MatchGenerationSummary summary, int previewSize) {
        MatchTrigger trigger = summary.trigger();
        MatchBatchMessage message = new MatchBatchMessage();
        message.setTriggerSide(trigger.side().getMetricTag());
        message.setTriggerId(trigger.entityId());
        message.setSource(trigger.source().name().toLowerCase(Locale.ROOT));
        if (trigger.side() == TriggerSide.USER) {
            message.setUserId(trigger.entityId());
        } else {
            message.setProjectId(trigger.entityId());
        }
        message.setEvaluatedCount(summary.evaluatedCount());
        message.setMatchCount(summary.createdCount());

        List<MatchPreview> topMatches = summary.createdMatches().stream()
                .sorted(Comparator.comparingInt(Match::getScore).reversed())
                .limit(previewSize)
                .map(MatchPreview::from)
                .toList();
        message.setTopMatches(topMatches);
        message.setTimestamp(LocalDateTime.now());
        return message;
    }

    private void send(String routingKey, Object message) {
        try {
            rabbitTemplate.convertAndSend(RabbitMQConfig.MATCHING_EVENTS_EXCHANGE, routingKey, message);
        } catch (AmqpException e) {
            logger.error("发布匹配事件失败，routingKey: {}", routingKey, e);
        }
    }
}
