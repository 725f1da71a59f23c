package com.server.skillsync.match.service.matcher;

import com.server.skillsync.collaborator.dto.ProjectSnapshot;
import com.server.skillsync.collaborator.dto.UserSnapshot;
import com.server.skillsync.config.MatchingConfig;
import com.server.skillsync.match.enums.MatchFactor;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * 兴趣匹配：项目类别命中偏好类型占 60%，项目标签被兴趣覆盖的比例占 40%
 * 用户没有任何偏好数据时取中性分
 */
@Component
public class InterestMatchStrategy implements FactorStrategy {

    private final MatchingConfig matchingConfig;

    public InterestMatchStrategy(MatchingConfig matchingConfig) {
        this.matchingConfig = matchingConfig;
    }

    @Override
    public MatchFactor factor() {
        return MatchFactor.INTEREST;
    }

    @Override
    public double calculate(UserSnapshot user, ProjectSnapshot project) {
        Set<String> projectTypes = ScoringSupport.normalizedSet(user.projectTypes());
        Set<String> interests = ScoringSupport.normalizedSet(user.interests());
        if (projectTypes.isEmpty() && interests.isEmpty()) {
            return matchingConfig.getNeutralScore();
        }
        MatchingConfig.InterestConfig config = matchingConfig.getInterest();

        double score = 0.0;
        String category = ScoringSupport.normalize(project.category());
        if (!category.isEmpty() && projectTypes.contains(category)) {
            score += config.getCategoryShare();
        }

        Set<String> tags = ScoringSupport.normalizedSet(project.tags());
        if (!tags.isEmpty() && !interests.isEmpty()) {
            // 某个兴趣包含该标签即视为命中
            long matched = tags.stream()
                    .filter(tag -> interests.stream().anyMatch(interest -> interest.contains(tag)))
                    .count();
            score += config.getTagShare() * ((double) matched / tags.size());
        }
        return ScoringSupport.clamp(score);
    }

    @Override
    public String describe(int score) {
        return "该项目符合你的兴趣和偏好";
    }
}
