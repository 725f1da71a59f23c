package com.server.skillsync.match.controller;

import com.server.skillsync.config.MatchingConfig;
import com.server.skillsync.match.MatchFixtures;
import com.server.skillsync.match.controller.response.MatchPageResponse;
import com.server.skillsync.match.controller.response.MatchResponse;
import com.server.skillsync.match.entity.Match;
import com.server.skillsync.match.enums.MatchStatus;
import com.server.skillsync.match.enums.TriggerSource;
import com.server.skillsync.match.exception.CollaboratorUnavailableException;
import com.server.skillsync.match.exception.InvalidStatusTransitionException;
import com.server.skillsync.match.exception.MatchNotFoundException;
import com.server.skillsync.match.pipeline.MatchGenerationSummary;
import com.server.skillsync.match.pipeline.MatchTrigger;
import com.server.skillsync.match.pipeline.MatchingPipeline;
import com.server.skillsync.match.service.MatchQueryService;
import com.server.skillsync.match.service.MatchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MatchController.class)
@Import(MatchingConfig.class)
@DisplayName("匹配接口")
class MatchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MatchQueryService matchQueryService;

    @MockBean
    private MatchService matchService;

    @MockBean
    private MatchingPipeline matchingPipeline;

    @Test
    @DisplayName("未指定 limit 和 minScore 时使用默认值")
    void listUsesDefaults() throws Exception {
        MatchResponse match = MatchResponse.fromEntity(MatchFixtures.match(7L, "u1", "p1", 82));
        when(matchQueryService.listForUser("u1", 1, 20, 30, true))
                .thenReturn(MatchPageResponse.of(List.of(match), 1, 1, 1));

        mockMvc.perform(get("/api/matches/user/u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matches[0].id").value(7))
                .andExpect(jsonPath("$.matches[0].matchScore").value(82))
                .andExpect(jsonPath("$.matches[0].status").value("pending"))
                .andExpect(jsonPath("$.matches[0].factors.skillMatch").value(82))
                .andExpect(jsonPath("$.pagination.current").value(1))
                .andExpect(jsonPath("$.pagination.total").value(1));
    }

    @Test
    @DisplayName("项目匹配列表透传分页与过滤参数")
    void projectListPassesParameters() throws Exception {
        when(matchQueryService.listForProject("p1", 2, 5, 60, false))
                .thenReturn(MatchPageResponse.of(List.of(), 2, 3, 12));

        mockMvc.perform(get("/api/matches/project/p1")
                        .param("page", "2")
                        .param("limit", "5")
                        .param("minScore", "60")
                        .param("withDetails", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pagination.pages").value(3));
    }

    @Test
    @DisplayName("匹配不存在返回 404")
    void matchNotFound() throws Exception {
        when(matchQueryService.getMatch(99L)).thenThrow(new MatchNotFoundException(99L));

        mockMvc.perform(get("/api/matches/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.data.errorCode").value("MATCH_NOT_FOUND"));
    }

    @Test
    @DisplayName("状态值大小写不敏感")
    void updateStatus() throws Exception {
        Match match = MatchFixtures.match(3L, "u1", "p1", 70);
        match.setStatus(MatchStatus.VIEWED);
        when(matchService.transitionStatus(3L, MatchStatus.VIEWED)).thenReturn(match);

        mockMvc.perform(put("/api/matches/3/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"Viewed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("viewed"));
    }

    @Test
    @DisplayName("无法识别的状态返回 400")
    void unknownStatus() throws Exception {
        mockMvc.perform(put("/api/matches/3/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"archived\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data.errorCode").value("INVALID_REQUEST"));

        verify(matchService, never()).transitionStatus(anyLong(), any());
    }

    @Test
    @DisplayName("非法状态迁移返回 409")
    void illegalTransition() throws Exception {
        when(matchService.transitionStatus(3L, MatchStatus.APPLIED))
                .thenThrow(new InvalidStatusTransitionException(3L, MatchStatus.PENDING, MatchStatus.APPLIED));

        mockMvc.perform(put("/api/matches/3/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"applied\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.data.errorCode").value("INVALID_STATUS_TRANSITION"));
    }

    @Test
    @DisplayName("反馈评分超出范围返回 400")
    void feedbackValidation() throws Exception {
        mockMvc.perform(post("/api/matches/3/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":6}"))
                .andExpect(status().isBadRequest());

        verify(matchService, never()).attachFeedback(anyLong(), anyInt(), any(), any());
    }

    @Test
    @DisplayName("提交反馈")
    void submitFeedback() throws Exception {
        Match match = MatchFixtures.match(3L, "u1", "p1", 70);
        when(matchService.attachFeedback(eq(3L), eq(4), eq("不错"), eq(true))).thenReturn(match);

        mockMvc.perform(post("/api/matches/3/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":4,\"comment\":\"不错\",\"helpful\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(3));
    }

    @Test
    @DisplayName("手动生成必须且只能提供一个 id")
    void generateRequiresExactlyOneId() throws Exception {
        mockMvc.perform(post("/api/matches/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/matches/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\",\"projectId\":\"p1\"}"))
                .andExpect(status().isBadRequest());

        verify(matchingPipeline, never()).process(any());
    }

    @Test
    @DisplayName("手动生成返回本次新建的匹配")
    void generateForProject() throws Exception {
        MatchTrigger trigger = MatchTrigger.forProject("p1", TriggerSource.MANUAL);
        when(matchingPipeline.process(trigger)).thenReturn(new MatchGenerationSummary(
                trigger, 4, 1, 1, 0, List.of(
                        MatchFixtures.match(1L, "u1", "p1", 90),
                        MatchFixtures.match(2L, "u2", "p1", 45))));

        mockMvc.perform(post("/api/matches/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"p1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.triggerSide").value("project"))
                .andExpect(jsonPath("$.matchCount").value(2))
                .andExpect(jsonPath("$.evaluatedCount").value(4))
                .andExpect(jsonPath("$.matches.length()").value(2));
    }

    @Test
    @DisplayName("协作服务不可用返回 503")
    void collaboratorUnavailable() throws Exception {
        when(matchingPipeline.process(any()))
                .thenThrow(new CollaboratorUnavailableException("用户服务不可用"));

        mockMvc.perform(post("/api/matches/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.data.errorCode").value("COLLABORATOR_UNAVAILABLE"));
    }
}
