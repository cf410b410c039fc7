package com.omr.engine.evaluation;

import com.omr.common.dto.AnswerKey;
import com.omr.engine.config.ThresholdProperties;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AnswerKeyEvaluatorTest {

    private final AnswerKeyEvaluator evaluator = new AnswerKeyEvaluator(new ThresholdProperties());

    @Test
    void scoresCorrectIncorrectAndUnmarked() {
        AnswerKey key = AnswerKey.builder()
                .questions(Map.of("q1", "A", "q2", "B", "q3", "C"))
                .correct(4)
                .incorrect(-1)
                .unmarked(0)
                .build();
        Map<String, String> response = new LinkedHashMap<>();
        response.put("q1", "A");
        response.put("q2", "C");
        response.put("q3", "");

        assertThat(evaluator.evaluate(response, key)).isEqualTo(3.0);
    }

    @Test
    void ignoresFieldsOutsideTheKey() {
        AnswerKey key = AnswerKey.builder().questions(Map.of("q1", "A")).build();

        assertThat(evaluator.evaluate(Map.of("q1", "A", "roll", "1234"), key)).isEqualTo(1.0);
    }

    @Test
    void multiMarkedAnswerIsComparedAsIs() {
        AnswerKey key = AnswerKey.builder().questions(Map.of("q1", "A", "q2", "BD")).build();

        assertThat(evaluator.evaluate(Map.of("q1", "AB", "q2", "BD"), key)).isEqualTo(1.0);
    }

    @Test
    void missingResponseCountsAsUnmarked() {
        AnswerKey key = AnswerKey.builder().questions(Map.of("q1", "A")).unmarked(-0.5).build();

        assertThat(evaluator.evaluate(Map.of(), key)).isEqualTo(-0.5);
    }
}
