package com.server.skillsync.match.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 用户对匹配结果的反馈，创建匹配后才可附加
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
public class MatchFeedback {

    @Column(name = "feedback_rating")
    private Integer rating;

    @Column(name = "feedback_comment", length = 1000)
    private String comment;

    @Column(name = "feedback_helpful")
    private Boolean helpful;

    @Column(name = "feedback_submitted_at")
    private LocalDateTime submittedAt;
}
