package com.server.skillsync.match.entity;

import com.server.skillsync.match.enums.MatchFactor;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.EnumMap;
import java.util.Map;

/**
 * 各维度子分数，均为 0-100 的整数
 * 综合分数只由这些子分数加权得出
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class MatchFactors {

    @Column(name = "skill_match", nullable = false)
    private int skillMatch;

    @Column(name = "experience_match", nullable = false)
    private int experienceMatch;

    @Column(name = "availability_match", nullable = false)
    private int availabilityMatch;

    @Column(name = "location_match", nullable = false)
    private int locationMatch;

    @Column(name = "interest_match", nullable = false)
    private int interestMatch;

    public static MatchFactors of(Map<MatchFactor, Integer> scores) {
        return new MatchFactors(
                scores.getOrDefault(MatchFactor.SKILL, 0),
                scores.getOrDefault(MatchFactor.EXPERIENCE, 0),
                scores.getOrDefault(MatchFactor.AVAILABILITY, 0),
                scores.getOrDefault(MatchFactor.LOCATION, 0),
                scores.getOrDefault(MatchFactor.INTEREST, 0)
        );
    }

    public int get(MatchFactor factor) {
        return switch (factor) {
            case SKILL -> skillMatch;
            case EXPERIENCE -> experienceMatch;
            case AVAILABILITY -> availabilityMatch;
            case LOCATION -> locationMatch;
            case INTEREST -> interestMatch;
        };
    }

    public Map<MatchFactor, Integer> asMap() {
        Map<MatchFactor, Integer> map = new EnumMap<>(MatchFactor.class);
        for (MatchFactor factor : MatchFactor.values()) {
            map.put(factor, get(factor));
        }
        return map;
    }
}
