package com.server.skillsync.match.controller;

import com.server.skillsync.config.MatchingConfig;
import com.server.skillsync.match.controller.response.MatchGenerationResponse;
import com.server.skillsync.match.controller.response.MatchPageResponse;
import com.server.skillsync.match.controller.response.MatchResponse;
import com.server.skillsync.match.dto.FeedbackRequest;
import com.server.skillsync.match.dto.GenerateMatchesRequest;
import com.server.skillsync.match.dto.StatusUpdateRequest;
import com.server.skillsync.match.entity.Match;
import com.server.skillsync.match.enums.MatchStatus;
import com.server.skillsync.match.enums.TriggerSource;
import com.server.skillsync.match.pipeline.MatchGenerationSummary;
import com.server.skillsync.match.pipeline.MatchTrigger;
import com.server.skillsync.match.pipeline.MatchingPipeline;
import com.server.skillsync.match.service.MatchQueryService;
import com.server.skillsync.match.service.MatchService;
import com.server.skillsync.utils.exception.InvalidRequestException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/matches")
@Tag(name = "匹配管理", description = "匹配查询、状态变更、反馈与手动生成接口")
public class MatchController {
    private static final Logger logger = LoggerFactory.getLogger(MatchController.class);

    @Autowired
    private MatchQueryService matchQueryService;

    @Autowired
    private MatchService matchService;

    @Autowired
    private MatchingPipeline matchingPipeline;

    @Autowired
    private MatchingConfig matchingConfig;

    @GetMapping("/user/{userId}")
    @Operation(summary = "获取用户的匹配", description = "按分数倒序分页返回，默认附加项目详情")
    public ResponseEntity<MatchPageResponse> getUserMatches(
            @PathVariable String userId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer minScore,
            @RequestParam(defaultValue = "true") boolean withDetails) {

        logger.info("查询用户 {} 的匹配，页码: {}", userId, page);
        return ResponseEntity.ok(matchQueryService.listForUser(
                userId, page, resolveLimit(limit), resolveMinScore(minScore), withDetails));
    }

    @GetMapping("/project/{projectId}")
    @Operation(summary = "获取项目的匹配", description = "按分数倒序分页返回，默认附加用户详情")
    public ResponseEntity<MatchPageResponse> getProjectMatches(
            @PathVariable String projectId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer minScore,
            @RequestParam(defaultValue = "true") boolean withDetails) {

        logger.info("查询项目 {} 的匹配，页码: {}", projectId, page);
        return ResponseEntity.ok(matchQueryService.listForProject(
                projectId, page, resolveLimit(limit), resolveMinScore(minScore), withDetails));
    }

    @GetMapping("/{matchId}")
    @Operation(summary = "获取单个匹配")
    public ResponseEntity<MatchResponse> getMatch(@PathVariable Long matchId) {
        return ResponseEntity.ok(matchQueryService.getMatch(matchId));
    }

    @PutMapping("/{matchId}/status")
    @Operation(summary = "更新匹配状态", description = "pending→viewed→interested→applied，任何非终态都可变为 rejected")
    public ResponseEntity<MatchResponse> updateStatus(
            @PathVariable Long matchId,
            @Valid @RequestBody StatusUpdateRequest request) {

        MatchStatus status = MatchStatus.fromValue(request.getStatus());
        if (status == null) {
            throw new InvalidRequestException("status", "无法识别的状态: " + request.getStatus());
        }
        logger.info("更新匹配 {} 状态为 {}", matchId, status);
        Match match = matchService.transitionStatus(matchId, status);
        return ResponseEntity.ok(MatchResponse.fromEntity(match));
    }

    @PostMapping("/{matchId}/feedback")
    @Operation(summary = "提交匹配反馈", description = "评分 1-5，可附带评论，会覆盖之前的反馈")
    public ResponseEntity<MatchResponse> submitFeedback(
            @PathVariable Long matchId,
            @Valid @RequestBody FeedbackRequest request) {

        logger.info("收到匹配 {} 的反馈，评分: {}", matchId, request.getRating());
        Match match = matchService.attachFeedback(
                matchId, request.getRating(), request.getComment(), request.getHelpful());
        return ResponseEntity.ok(MatchResponse.fromEntity(match));
    }

    @PostMapping("/generate")
    @Operation(summary = "手动生成匹配", description = "提供 userId 或 projectId 之一，同步执行并返回结果")
    public ResponseEntity<MatchGenerationResponse> generateMatches(@RequestBody GenerateMatchesRequest request) {
        boolean hasUser = StringUtils.hasText(request.getUserId());
        boolean hasProject = StringUtils.hasText(request.getProjectId());
        if (hasUser == hasProject) {
            throw new InvalidRequestException("必须且只能提供 userId 或 projectId 其中之一");
        }

        MatchTrigger trigger = hasUser
                ? MatchTrigger.forUser(request.getUserId(), TriggerSource.MANUAL)
                : MatchTrigger.forProject(request.getProjectId(), TriggerSource.MANUAL);
        logger.info("手动生成匹配: side={}, id={}", trigger.side(), trigger.entityId());

        MatchGenerationSummary summary = matchingPipeline.process(trigger);
        return ResponseEntity.ok(MatchGenerationResponse.fromSummary(summary));
    }

    private int resolveLimit(Integer limit) {
        return limit != null ? limit : matchingConfig.getQuery().getDefaultPageSize();
    }

    private int resolveMinScore(Integer minScore) {
        return minScore != null ? minScore : matchingConfig.getCreationThreshold();
    }
}
