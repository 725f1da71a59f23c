package com.server.skillsync.match.service.matcher;

import com.server.skillsync.collaborator.dto.ProjectSnapshot;
import com.server.skillsync.collaborator.dto.UserSnapshot;
import com.server.skillsync.config.MatchingConfig;
import com.server.skillsync.match.enums.MatchFactor;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * 技能匹配：必需技能覆盖率占 70%，可选技能覆盖率占 30%
 * 项目没有必需技能时分数为 0
 */
@Component
public class SkillMatchStrategy implements FactorStrategy {

    private final MatchingConfig matchingConfig;

    public SkillMatchStrategy(MatchingConfig matchingConfig) {
        this.matchingConfig = matchingConfig;
    }

    @Override
    public MatchFactor factor() {
        return MatchFactor.SKILL;
    }

    @Override
    public double calculate(UserSnapshot user, ProjectSnapshot project) {
        Set<String> required = ScoringSupport.normalizedSet(project.requiredSkills());
        if (required.isEmpty()) {
            return 0.0;
        }
        Set<String> userSkills = ScoringSupport.normalizedSet(user.skills());
        MatchingConfig.SkillConfig config = matchingConfig.getSkill();

        double score = config.getRequiredShare() * coverage(required, userSkills);

        Set<String> optional = ScoringSupport.normalizedSet(project.optionalSkills());
        if (!optional.isEmpty()) {
            score += config.getOptionalShare() * coverage(optional, userSkills);
        }
        return ScoringSupport.clamp(score);
    }

    private double coverage(Set<String> wanted, Set<String> owned) {
        long hit = wanted.stream().filter(owned::contains).count();
        return (double) hit / wanted.size();
    }

    @Override
    public String describe(int score) {
        return String.format("技能高度匹配：你具备项目所需技能的 %d%%", score);
    }
}
