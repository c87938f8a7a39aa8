package com.surveyaudit.ml;

import java.util.Map;

/**
 * 机器人集成模型得分
 *
 * @param probability 校准后的最终概率
 * @param rawScore    加权投票后的未校准得分
 * @param members     成员名 → 成员得分，按成员声明顺序
 */
public record BotScore(double probability, double rawScore, Map<String, MemberScore> members) {

    /**
     * @param probability  成员模型输出
     * @param weight       投票权重
     * @param contribution 权重 × 输出
     */
    public record MemberScore(double probability, double weight, double contribution) {
    }
}
