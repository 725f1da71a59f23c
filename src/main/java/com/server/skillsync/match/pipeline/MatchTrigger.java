package com.server.skillsync.match.pipeline;

import com.server.skillsync.match.enums.TriggerSide;
import com.server.skillsync.match.enums.TriggerSource;

/**
 * 一次匹配触发：由哪一侧的哪个实体、通过什么途径触发
 */
public record MatchTrigger(TriggerSide side, String entityId, TriggerSource source) {

    public static MatchTrigger forUser(String userId, TriggerSource source) {
        return new MatchTrigger(TriggerSide.USER, userId, source);
    }

    public static MatchTrigger forProject(String projectId, TriggerSource source) {
        return new MatchTrigger(TriggerSide.PROJECT, projectId, source);
    }
}
