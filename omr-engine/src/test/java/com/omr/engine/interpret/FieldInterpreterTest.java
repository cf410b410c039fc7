package com.omr.engine.interpret;

import com.omr.common.dto.BubbleSample;
import com.omr.common.dto.FieldDefinition;
import com.omr.common.dto.FieldInterpretation;
import com.omr.common.dto.ScanQuality;
import com.omr.common.dto.ThresholdMethod;
import com.omr.engine.config.ThresholdProperties;
import com.omr.engine.threshold.ThresholdStrategyFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FieldInterpreterTest {

    private ThresholdProperties properties;
    private FieldInterpreter interpreter;
    private final FieldDefinition field = FieldDefinition.builder().fieldId("q1").fieldType("MCQ4").build();

    @BeforeEach
    void setUp() {
        properties = new ThresholdProperties();
        interpreter = new FieldInterpreter(properties, new ThresholdStrategyFactory(properties));
    }

    @Test
    void twoLowBubblesAreMultiMarked() {
        FieldInterpretation result = interpreter.interpret(field,
                List.of(BubbleSample.of("A", 50), BubbleSample.of("B", 55), BubbleSample.of("C", 200)), 127.5);

        assertThat(result.getThreshold().getValue()).isCloseTo(127.5, within(0.5));
        assertThat(result.getMarkedLabels()).containsExactly("A", "B");
        assertThat(result.isMultiMarked()).isTrue();
        assertThat(result.getAnswer()).isEqualTo("AB");
    }

    @Test
    void singleLowBubbleIsNotMultiMarked() {
        FieldInterpretation result = interpreter.interpret(field,
                List.of(BubbleSample.of("A", 50), BubbleSample.of("B", 200), BubbleSample.of("C", 205)), 127.5);

        assertThat(result.getMarkedLabels()).containsExactly("A");
        assertThat(result.isMultiMarked()).isFalse();
    }

    @Test
    void fourBubbleFieldMarksOnlyTheDarkOne() {
        properties.setMinJump(25);

        FieldInterpretation result = interpreter.interpret(field, List.of(
                BubbleSample.of("A", 40), BubbleSample.of("B", 210),
                BubbleSample.of("C", 215), BubbleSample.of("D", 220)), 160);

        assertThat(result.getThreshold().getValue()).isCloseTo(125.0, within(0.5));
        assertThat(result.getMarkedLabels()).containsExactly("A");
        assertThat(result.isMultiMarked()).isFalse();
        assertThat(result.getAnswer()).isEqualTo("A");
        assertThat(result.getQuality()).isEqualTo(ScanQuality.EXCELLENT);
    }

    @Test
    void closeTwoBubbleFieldUsesFileThresholdInsteadOfTheirMidpoint() {
        properties.setMinGapTwoBubbles(30);

        FieldInterpretation result = interpreter.interpret(field,
                List.of(BubbleSample.of("A", 118), BubbleSample.of("B", 122)), 100);

        assertThat(result.getThreshold().getValue()).isEqualTo(100.0);
        assertThat(result.getThreshold().isFallbackUsed()).isTrue();
        assertThat(result.getThreshold().getMethod()).isEqualTo(ThresholdMethod.LOCAL_FALLBACK_TO_GLOBAL);
        assertThat(result.getMarkedLabels()).isEmpty();
        assertThat(result.getAnswer()).isEmpty();
    }

    @Test
    void repeatedInterpretationIsIdentical() {
        List<BubbleSample> samples = List.of(
                BubbleSample.of("A", 61.3), BubbleSample.of("B", 190.2), BubbleSample.of("C", 58.9));

        FieldInterpretation first = interpreter.interpret(field, samples, 131.7);
        FieldInterpretation second = interpreter.interpret(field, samples, 131.7);

        assertThat(second).isEqualTo(first);
        assertThat(Double.doubleToRawLongBits(second.getThreshold().getValue()))
                .isEqualTo(Double.doubleToRawLongBits(first.getThreshold().getValue()));
    }

    @Test
    void markedLabelsFollowFieldPositionOrder() {
        FieldInterpretation result = interpreter.interpret(field, List.of(
                BubbleSample.of("A", 60), BubbleSample.of("B", 200), BubbleSample.of("C", 40)), 127.5);

        assertThat(result.getMarkedLabels()).containsExactly("A", "C");
        assertThat(result.getAnswer()).isEqualTo("AC");
    }

    @Test
    void emptyFieldIsBlankWithPoorQuality() {
        FieldInterpretation result = interpreter.interpret(field, List.of(), 127.5);

        assertThat(result.getMarkedLabels()).isEmpty();
        assertThat(result.isMultiMarked()).isFalse();
        assertThat(result.getQuality()).isEqualTo(ScanQuality.POOR);
        assertThat(result.getStdDeviation()).isZero();
        assertThat(result.getAnswer()).isEqualTo(properties.getEmptyValue());
    }

    @Test
    void allBubblesMarkedIsReportedAsEmptyAnswer() {
        List<BubbleSample> samples = List.of(BubbleSample.of("A", 40), BubbleSample.of("B", 45));

        FieldInterpretation result = interpreter.interpret(field, samples, 200);

        assertThat(result.getMarkedLabels()).containsExactly("A", "B");
        assertThat(result.isMultiMarked()).isTrue();
        assertThat(result.getAnswer()).isEmpty();

        properties.setAllMarkedAsEmpty(false);
        assertThat(interpreter.interpret(field, samples, 200).getAnswer()).isEqualTo("AB");
    }

    @Test
    void customEmptyValueIsUsedForBlankFields() {
        properties.setEmptyValue("-");

        FieldInterpretation result = interpreter.interpret(field,
                List.of(BubbleSample.of("A", 220), BubbleSample.of("B", 222), BubbleSample.of("C", 219)), 120);

        assertThat(result.getAnswer()).isEqualTo("-");
    }

    @Test
    void countsBubblesWhereLocalAndGlobalDecisionsDiffer() {
        FieldInterpretation result = interpreter.interpret(field,
                List.of(BubbleSample.of("A", 50), BubbleSample.of("B", 55), BubbleSample.of("C", 200)), 52);

        assertThat(result.getDisparityCount()).isEqualTo(1);
    }

    @Test
    void qualityFollowsSpread() {
        assertThat(ScanQuality.fromStdDeviation(60)).isEqualTo(ScanQuality.EXCELLENT);
        assertThat(ScanQuality.fromStdDeviation(50)).isEqualTo(ScanQuality.GOOD);
        assertThat(ScanQuality.fromStdDeviation(31)).isEqualTo(ScanQuality.GOOD);
        assertThat(ScanQuality.fromStdDeviation(20)).isEqualTo(ScanQuality.ACCEPTABLE);
        assertThat(ScanQuality.fromStdDeviation(15)).isEqualTo(ScanQuality.POOR);
    }

    @Test
    void adaptiveModeBlendsGlobalAndLocal() {
        properties.setMode(ThresholdProperties.ThresholdMode.ADAPTIVE);

        FieldInterpretation result = interpreter.interpret(field,
                List.of(BubbleSample.of("A", 40), BubbleSample.of("B", 200), BubbleSample.of("C", 210)), 127.5);

        assertThat(result.getThreshold().getMethod()).isEqualTo(ThresholdMethod.ADAPTIVE);
        assertThat(result.getThreshold().getValue()).isCloseTo(120.0, within(1e-9));
        assertThat(result.getMarkedLabels()).containsExactly("A");
    }
}
