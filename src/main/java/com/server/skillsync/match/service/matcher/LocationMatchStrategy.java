package com.server.skillsync.match.service.matcher;

import com.server.skillsync.collaborator.dto.ProjectSnapshot;
import com.server.skillsync.collaborator.dto.UserSnapshot;
import com.server.skillsync.config.MatchingConfig;
import com.server.skillsync.match.enums.MatchFactor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * 地点匹配：完全一致得满分，否则按逗号分隔的地点片段重合比例计分
 */
@Component
public class LocationMatchStrategy implements FactorStrategy {

    private final MatchingConfig matchingConfig;

    public LocationMatchStrategy(MatchingConfig matchingConfig) {
        this.matchingConfig = matchingConfig;
    }

    @Override
    public MatchFactor factor() {
        return MatchFactor.LOCATION;
    }

    @Override
    public double calculate(UserSnapshot user, ProjectSnapshot project) {
        if (ScoringSupport.isBlank(user.location()) || ScoringSupport.isBlank(project.location())) {
            return matchingConfig.getNeutralScore();
        }
        String userLocation = ScoringSupport.normalize(user.location());
        String projectLocation = ScoringSupport.normalize(project.location());
        List<String> userParts = split(userLocation);
        List<String> projectParts = split(projectLocation);
        // 只有逗号和空白的地点等同于未填写
        if (userParts.isEmpty() || projectParts.isEmpty()) {
            return matchingConfig.getNeutralScore();
        }
        if (userLocation.equals(projectLocation)) {
            return 100.0;
        }

        long common = userParts.stream().filter(projectParts::contains).count();
        return 100.0 * common / Math.max(userParts.size(), projectParts.size());
    }

    private List<String> split(String location) {
        return Arrays.stream(location.split(","))
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .toList();
    }

    @Override
    public String describe(int score) {
        return "你与项目位于同一地点";
    }
}
