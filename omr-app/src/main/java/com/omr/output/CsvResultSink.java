package com.omr.output;

import com.omr.common.dto.FileResult;
import com.omr.common.exception.OmrException;
import com.omr.dispatcher.sink.ResultSink;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV 结果输出：
 * - Results.csv：所有成功识别的文件
 * - MultiMarked.csv：存在多涂字段的文件（同时也写入 Results.csv）
 * - Errors.csv：处理失败的文件及原因
 * <p>
 * 每行写完立即 flush，批次中途失败时已输出的行不会丢失。
 */
@Slf4j
public class CsvResultSink implements ResultSink, Closeable {

    public static final String RESULTS_FILE = "Results.csv";
    public static final String MULTI_MARKED_FILE = "MultiMarked.csv";
    public static final String ERRORS_FILE = "Errors.csv";

    private final List<String> fieldIds;
    private final BufferedWriter results;
    private final BufferedWriter multiMarked;
    private final BufferedWriter errors;

    private int written;

    public CsvResultSink(Path outputDir, List<String> fieldIds) {
        this(outputDir, fieldIds, file -> Files.newBufferedWriter(file, StandardCharsets.UTF_8));
    }

    CsvResultSink(Path outputDir, List<String> fieldIds, WriterOpener opener) {
        this.fieldIds = List.copyOf(fieldIds);
        List<BufferedWriter> opened = new ArrayList<>(3);
        try {
            Files.createDirectories(outputDir);
            List<String> header = new ArrayList<>(List.of("input_index", "file_path", "score", "multi_marked"));
            header.addAll(this.fieldIds);
            opened.add(open(opener, outputDir.resolve(RESULTS_FILE), header));
            opened.add(open(opener, outputDir.resolve(MULTI_MARKED_FILE), header));
            opened.add(open(opener, outputDir.resolve(ERRORS_FILE), List.of("input_index", "file_path", "reason")));
        } catch (IOException | RuntimeException e) {
            // 已打开的文件先关闭再抛出
            closeQuietly(opened, e);
            if (e instanceof OmrException) {
                throw (OmrException) e;
            }
            throw new OmrException(OmrException.OUTPUT_ERROR, "无法创建结果文件: " + outputDir, e);
        }
        this.results = opened.get(0);
        this.multiMarked = opened.get(1);
        this.errors = opened.get(2);
        log.info("结果输出目录: {}", outputDir.toAbsolutePath());
    }

    @Override
    public void write(FileResult result) {
        List<String> row = new ArrayList<>();
        row.add(String.valueOf(result.getInputIndex()));
        row.add(result.getFilePath());
        row.add(result.getScore() != null ? String.valueOf(result.getScore()) : "");
        row.add(String.valueOf(result.isMultiMarked()));
        for (String fieldId : fieldIds) {
            row.add(result.getOmrResponse().getOrDefault(fieldId, ""));
        }
        writeRow(results, row);
        if (result.isMultiMarked()) {
            writeRow(multiMarked, row);
        }
        written++;
    }

    @Override
    public void writeError(FileResult result) {
        writeRow(errors, List.of(String.valueOf(result.getInputIndex()), result.getFilePath(),
                result.getErrorReason() != null ? result.getErrorReason() : ""));
    }

    public int getWritten() {
        return written;
    }

    @Override
    public void close() throws IOException {
        IOException first = null;
        for (BufferedWriter writer : List.of(results, multiMarked, errors)) {
            try {
                writer.close();
            } catch (IOException e) {
                if (first == null) first = e;
            }
        }
        if (first != null) throw first;
    }

    private static BufferedWriter open(WriterOpener opener, Path file, List<String> header) throws IOException {
        BufferedWriter writer = opener.open(file);
        try {
            writeRow(writer, header);
        } catch (OmrException e) {
            closeQuietly(List.of(writer), e);
            throw e;
        }
        return writer;
    }

    private static void closeQuietly(List<BufferedWriter> writers, Exception primary) {
        for (BufferedWriter writer : writers) {
            try {
                writer.close();
            } catch (IOException e) {
                primary.addSuppressed(e);
            }
        }
    }

    /**
     * 打开一个结果文件的写入器。
     */
    @FunctionalInterface
    interface WriterOpener {
        BufferedWriter open(Path file) throws IOException;
    }

    private static void writeRow(BufferedWriter writer, List<String> cells) {
        try {
            List<String> escaped = new ArrayList<>(cells.size());
            for (String cell : cells) {
                escaped.add(escape(cell));
            }
            writer.write(String.join(",", escaped));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new OmrException(OmrException.OUTPUT_ERROR, "写入结果行失败", e);
        }
    }

    static String escape(String cell) {
        if (cell == null) return "";
        if (cell.contains(",") || cell.contains("\"") || cell.contains("\n")) {
            return "\"" + cell.replace("\"", "\"\"") + "\"";
        }
        return cell;
    }
}
