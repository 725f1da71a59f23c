package com.server.skillsync.match.service.matcher;

import com.server.skillsync.collaborator.dto.ProjectSnapshot;
import com.server.skillsync.collaborator.dto.UserSnapshot;
import com.server.skillsync.config.MatchingConfig;
import com.server.skillsync.match.enums.MatchFactor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 可用时间匹配：按用户可投入时间查表
 */
@Component
public class AvailabilityMatchStrategy implements FactorStrategy {

    private final MatchingConfig matchingConfig;

    public AvailabilityMatchStrategy(MatchingConfig matchingConfig) {
        this.matchingConfig = matchingConfig;
    }

    @Override
    public MatchFactor factor() {
        return MatchFactor.AVAILABILITY;
    }

    @Override
    public double calculate(UserSnapshot user, ProjectSnapshot project) {
        String availability = ScoringSupport.normalize(user.availability());
        if (!availability.isEmpty()) {
            for (Map.Entry<String, Integer> entry : matchingConfig.getAvailability().getScores().entrySet()) {
                if (ScoringSupport.normalize(entry.getKey()).equals(availability)) {
                    return entry.getValue();
                }
            }
        }
        return matchingConfig.getNeutralScore();
    }

    @Override
    public String describe(int score) {
        return "你的可投入时间符合项目要求";
    }
}
