package com.server.skillsync.match.controller.response;

import lombok.Data;

import java.util.List;

/**
 * 匹配列表分页响应
 */
@Data
public class MatchPageResponse {
    private List<MatchResponse> matches;
    private Pagination pagination;

    public static MatchPageResponse of(List<MatchResponse> matches, int current, int pages, long total) {
        MatchPageResponse response = new MatchPageResponse();
        response.setMatches(matches);
        response.setPagination(new Pagination(current, pages, total));
        return response;
    }

    // 页码从 1 开始
    public record Pagination(int current, int pages, long total) {
    }
}
