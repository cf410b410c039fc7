package com.omr.output;

import com.omr.common.dto.FileResult;
import com.omr.common.exception.OmrException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvResultSinkTest {

    @TempDir
    Path outputDir;

    @Test
    void writesResultsMultiMarkedAndErrorsSeparately() throws Exception {
        try (CsvResultSink sink = new CsvResultSink(outputDir, List.of("q1", "q2"))) {
            sink.write(result(0, "a.png", Map.of("q1", "A", "q2", "B"), false, 2.0));
            sink.writeError(FileResult.failed(1, "b.png", "无法读取图片"));
            sink.write(result(2, "c.png", Map.of("q1", "AC"), true, null));

            assertThat(sink.getWritten()).isEqualTo(2);
        }

        assertThat(read(CsvResultSink.RESULTS_FILE)).containsExactly(
                "input_index,file_path,score,multi_marked,q1,q2",
                "0,a.png,2.0,false,A,B",
                "2,c.png,,true,AC,");
        assertThat(read(CsvResultSink.MULTI_MARKED_FILE)).containsExactly(
                "input_index,file_path,score,multi_marked,q1,q2",
                "2,c.png,,true,AC,");
        assertThat(read(CsvResultSink.ERRORS_FILE)).containsExactly(
                "input_index,file_path,reason",
                "1,b.png,无法读取图片");
    }

    @Test
    void rowsAreVisibleBeforeClose() throws Exception {
        try (CsvResultSink sink = new CsvResultSink(outputDir, List.of("q1"))) {
            sink.write(result(0, "a.png", Map.of("q1", "D"), false, null));

            assertThat(read(CsvResultSink.RESULTS_FILE)).hasSize(2);
        }
    }

    @Test
    void closesAlreadyOpenedFilesWhenALaterOneFails() {
        List<BufferedWriter> opened = new ArrayList<>();
        CsvResultSink.WriterOpener opener = file -> {
            if (file.getFileName().toString().equals(CsvResultSink.ERRORS_FILE)) {
                throw new IOException("disk full");
            }
            BufferedWriter writer = new BufferedWriter(new StringWriter());
            opened.add(writer);
            return writer;
        };

        assertThatThrownBy(() -> new CsvResultSink(outputDir, List.of("q1"), opener))
                .isInstanceOf(OmrException.class)
                .hasRootCauseMessage("disk full");

        assertThat(opened).hasSize(2);
        for (BufferedWriter writer : opened) {
            assertThatThrownBy(() -> writer.write("x")).isInstanceOf(IOException.class);
        }
    }

    @Test
    void escapesSeparatorsAndQuotes() {
        assertThat(CsvResultSink.escape("plain")).isEqualTo("plain");
        assertThat(CsvResultSink.escape("a,b")).isEqualTo("\"a,b\"");
        assertThat(CsvResultSink.escape("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
        assertThat(CsvResultSink.escape(null)).isEmpty();
    }

    private List<String> read(String name) throws Exception {
        return Files.readAllLines(outputDir.resolve(name), StandardCharsets.UTF_8);
    }

    private static FileResult result(int idx, String path, Map<String, String> response,
                                     boolean multiMarked, Double score) {
        return FileResult.builder()
                .inputIndex(idx)
                .filePath(path)
                .omrResponse(new LinkedHashMap<>(response))
                .multiMarked(multiMarked)
                .score(score)
                .build();
    }
}
