package com.server.skillsync.match.entity;

import com.server.skillsync.match.converter.StringListConverter;
import com.server.skillsync.match.enums.MatchStatus;
import com.server.skillsync.match.enums.TriggerSource;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 用户与项目之间的匹配记录
 * 同一 (用户, 项目) 组合最多一条，由数据库唯一约束保证
 */
@Entity
@Table(name = "matches",
        uniqueConstraints = @UniqueConstraint(name = "uk_match_user_project", columnNames = {"user_id", "project_id"}),
        indexes = {
                @Index(name = "idx_match_user_score", columnList = "user_id, match_score"),
                @Index(name = "idx_match_project_score", columnList = "project_id, match_score")
        })
@Getter
@Setter
public class Match {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(name = "match_score", nullable = false)
    private int score;

    @Embedded
    private MatchFactors factors;

    @Convert(converter = StringListConverter.class)
    @Column(name = "match_reasons", length = 2000)
    private List<String> reasons = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "match_status", nullable = false, length = 20)
    private MatchStatus status = MatchStatus.PENDING;

    // 反馈字段全部为空时 Hibernate 会把该属性读成 null
    @Embedded
    private MatchFeedback feedback;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_source", length = 20)
    private TriggerSource triggerSource;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
