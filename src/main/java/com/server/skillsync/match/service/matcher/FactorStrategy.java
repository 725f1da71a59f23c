package com.server.skillsync.match.service.matcher;

import com.server.skillsync.collaborator.dto.ProjectSnapshot;
import com.server.skillsync.collaborator.dto.UserSnapshot;
import com.server.skillsync.match.enums.MatchFactor;

public interface FactorStrategy {

    /**
     * @return 该策略负责的匹配维度
     */
    MatchFactor factor();

    /**
     * 计算单个维度的原始分数
     * @param user    用户快照
     * @param project 项目快照
     * @return 0-100 之间的分数，未取整
     */
    double calculate(UserSnapshot user, ProjectSnapshot project);

    /**
     * 生成该维度的匹配理由，只在分数超过披露阈值时调用
     * @param score 取整后的维度分数
     */
    String describe(int score);
}
