package com.server.skillsync.match.service.matcher;

import com.server.skillsync.collaborator.dto.ProjectSnapshot;
import com.server.skillsync.collaborator.dto.UserSnapshot;
import com.server.skillsync.config.MatchingConfig;
import com.server.skillsync.match.enums.MatchFactor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 经验匹配：用户经验等级与项目难度等级每相差一级扣 25 分
 * 任一侧等级缺失或无法识别时取中性分
 */
@Component
public class ExperienceMatchStrategy implements FactorStrategy {

    private final MatchingConfig matchingConfig;

    public ExperienceMatchStrategy(MatchingConfig matchingConfig) {
        this.matchingConfig = matchingConfig;
    }

    @Override
    public MatchFactor factor() {
        return MatchFactor.EXPERIENCE;
    }

    @Override
    public double calculate(UserSnapshot user, ProjectSnapshot project) {
        MatchingConfig.ExperienceConfig config = matchingConfig.getExperience();
        Integer userLevel = lookup(config.getUserLevels(), user.experience());
        Integer projectLevel = lookup(config.getProjectLevels(), project.difficulty());
        if (userLevel == null || projectLevel == null) {
            return matchingConfig.getNeutralScore();
        }
        int gap = Math.abs(userLevel - projectLevel);
        return Math.max(0, 100 - config.getPenaltyPerLevel() * gap);
    }

    private Integer lookup(Map<String, Integer> levels, String label) {
        if (ScoringSupport.isBlank(label)) {
            return null;
        }
        String normalized = ScoringSupport.normalize(label);
        for (Map.Entry<String, Integer> entry : levels.entrySet()) {
            if (ScoringSupport.normalize(entry.getKey()).equals(normalized)) {
                return entry.getValue();
            }
        }
        return null;
    }

    @Override
    public String describe(int score) {
        return "你的经验水平与项目难度非常契合";
    }
}
