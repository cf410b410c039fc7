package com.omr.engine.aggregate;

import com.omr.common.dto.BubbleSample;
import com.omr.common.dto.FieldInterpretation;
import com.omr.common.dto.ThresholdResult;
import com.omr.engine.config.ThresholdProperties;
import com.omr.engine.threshold.GlobalThresholdStrategy;
import com.omr.engine.threshold.ThresholdStrategy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileAggregateStoreTest {

    @Test
    void collectsSamplesPerFieldAndForWholeFile() {
        FileAggregateStore store = new FileAggregateStore("a.png",
                new GlobalThresholdStrategy(new ThresholdProperties()));

        store.record("q1", List.of(BubbleSample.of("A", 40), BubbleSample.of("B", 210)));
        store.record("q2", List.of(BubbleSample.of("A", 205), BubbleSample.of("B", 45)));

        assertThat(store.samplesFor("q1")).extracting(BubbleSample::getLabel).containsExactly("A", "B");
        assertThat(store.samplesFor("missing")).isEmpty();
        assertThat(store.allSamplesForFile()).extracting(BubbleSample::getMeanIntensity)
                .containsExactly(40.0, 210.0, 205.0, 45.0);
        assertThat(store.globalThresholdForFile().getValue()).isEqualTo(125.0);
    }

    @Test
    void globalThresholdIsComputedOnce() {
        AtomicInteger calls = new AtomicInteger();
        ThresholdStrategy counting = samples -> {
            calls.incrementAndGet();
            return ThresholdResult.builder().value(100).build();
        };
        FileAggregateStore store = new FileAggregateStore("a.png", counting);
        store.record("q1", List.of(BubbleSample.of("A", 40)));

        ThresholdResult first = store.globalThresholdForFile();
        ThresholdResult second = store.globalThresholdForFile();

        assertThat(second).isSameAs(first);
        assertThat(calls).hasValue(1);
    }

    @Test
    void rejectsSamplesAfterGlobalThreshold() {
        FileAggregateStore store = new FileAggregateStore("a.png",
                new GlobalThresholdStrategy(new ThresholdProperties()));
        store.record("q1", List.of(BubbleSample.of("A", 40)));
        store.globalThresholdForFile();

        assertThatThrownBy(() -> store.record("q2", List.of(BubbleSample.of("A", 50))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void interpretationsKeepInsertionOrderAndCloseOnFinish() {
        FileAggregateStore store = new FileAggregateStore("a.png",
                new GlobalThresholdStrategy(new ThresholdProperties()));
        store.putInterpretation(FieldInterpretation.builder().fieldId("q2").build());
        store.putInterpretation(FieldInterpretation.builder().fieldId("q1").build());
        store.finish();

        assertThat(store.isFinished()).isTrue();
        assertThat(store.interpretations()).containsOnlyKeys("q2", "q1");
        assertThat(store.interpretations().keySet()).containsExactly("q2", "q1");
        assertThatThrownBy(() -> store.putInterpretation(FieldInterpretation.builder().fieldId("q3").build()))
                .isInstanceOf(IllegalStateException.class);
    }
}
