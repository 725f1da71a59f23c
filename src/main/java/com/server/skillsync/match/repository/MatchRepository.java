package com.server.skillsync.match.repository;

import com.server.skillsync.match.entity.Match;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface MatchRepository extends JpaRepository<Match, Long> {
    // 检查用户和项目之间是否已有匹配
    boolean existsByUserIdAndProjectId(String userId, String projectId);

    // 用户的匹配列表，排序由 Pageable 决定
    Page<Match> findByUserIdAndScoreGreaterThanEqual(String userId, int minScore, Pageable pageable);

    // 项目的匹配列表
    Page<Match> findByProjectIdAndScoreGreaterThanEqual(String projectId, int minScore, Pageable pageable);

    // 用户侧触发：批量查出已匹配过的项目
    @Query("SELECT m.projectId FROM Match m WHERE m.userId = :userId AND m.projectId IN :projectIds")
    List<String> findMatchedProjectIds(@Param("userId") String userId,
                                       @Param("projectIds") Collection<String> projectIds);

    // 项目侧触发：批量查出已匹配过的用户
    @Query("SELECT m.userId FROM Match m WHERE m.projectId = :projectId AND m.userId IN :userIds")
    List<String> findMatchedUserIds(@Param("projectId") String projectId,
                                    @Param("userIds") Collection<String> userIds);
}
