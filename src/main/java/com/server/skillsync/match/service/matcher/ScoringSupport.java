package com.server.skillsync.match.service.matcher;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 评分策略共用的文本归一化工具
 */
final class ScoringSupport {

    private ScoringSupport() {
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static Set<String> normalizedSet(Collection<String> values) {
        return values.stream()
                .map(ScoringSupport::normalize)
                .filter(v -> !v.isEmpty())
                .collect(Collectors.toSet());
    }

    static double clamp(double score) {
        return Math.max(0.0, Math.min(100.0, score));
    }
}
