package com.omr.engine.evaluation;

import com.omr.common.dto.AnswerKey;
import com.omr.engine.config.ThresholdProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 按标准答案计分。不在答案中的字段（学号等）不计分。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerKeyEvaluator {

    private final ThresholdProperties properties;

    public double evaluate(Map<String, String> omrResponse, AnswerKey answerKey) {
        double score = 0;
        int correct = 0;
        int incorrect = 0;
        int unmarked = 0;
        for (Map.Entry<String, String> entry : answerKey.getQuestions().entrySet()) {
            String answer = omrResponse.get(entry.getKey());
            if (answer == null || answer.isEmpty() || answer.equals(properties.getEmptyValue())) {
                score += answerKey.getUnmarked();
                unmarked++;
            } else if (answer.equals(entry.getValue())) {
                score += answerKey.getCorrect();
                correct++;
            } else {
                score += answerKey.getIncorrect();
                incorrect++;
            }
        }
        log.debug("计分完成: 对 {} / 错 {} / 未答 {}，得分 {}", correct, incorrect, unmarked, score);
        return score;
    }
}
