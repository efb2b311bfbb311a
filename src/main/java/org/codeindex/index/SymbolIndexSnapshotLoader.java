package org.codeindex.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 读取预先构建好的符号索引快照（JSON）。
 * <p>
 * 快照格式：
 * <pre>
 * {
 *   "sourceRoot": "/work/project/",
 *   "files": { "1": "/work/project/src/main.cpp" },
 *   "symbols": [
 *     { "fileId": 1, "line": 10, "column": 5, "symbolName": "main", "displayName": "main()",
 *       "kind": "FunctionDecl", "definition": true,
 *       "startLine": 10, "startColumn": 1, "endLine": 20, "endColumn": 2 }
 *   ]
 * }
 * </pre>
 * 这里只负责“加载”，不负责从源码构建索引。
 */
public class SymbolIndexSnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(SymbolIndexSnapshotLoader.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public SymbolIndex load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("符号索引快照不存在或不是普通文件：" + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new IllegalStateException("读取符号索引快照失败：" + file, e);
        }
    }

    public SymbolIndex load(InputStream in, String sourceName) {
        SnapshotDocument document;
        try {
            document = OBJECT_MAPPER.readValue(in, SnapshotDocument.class);
        } catch (IOException e) {
            throw new IllegalStateException("符号索引快照格式错误：" + sourceName + "（" + e.getMessage() + "）", e);
        }
        if (document == null) {
            throw new IllegalStateException("符号索引快照为空：" + sourceName);
        }

        SymbolIndex index;
        try {
            FileRegistry files = FileRegistry.of(document.sourceRoot(), document.files());
            List<SymbolEntry> entries = document.symbols() == null ? List.of() : document.symbols();
            List<SymbolRecord> records = new ArrayList<>(entries.size());
            for (SymbolEntry entry : entries) {
                records.add(entry.toRecord());
            }
            index = new TreeMapSymbolIndex(files, records);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("符号索引快照内容不合法：" + sourceName + "（" + e.getMessage() + "）", e);
        }
        log.info("已加载符号索引快照 {}：{} 个文件，{} 个符号", sourceName, index.files().size(), index.size());
        return index;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SnapshotDocument(String sourceRoot, Map<Integer, String> files, List<SymbolEntry> symbols) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SymbolEntry(
            long fileId,
            long line,
            long column,
            String symbolName,
            String displayName,
            String kind,
            boolean definition,
            long startLine,
            long startColumn,
            long endLine,
            long endColumn
    ) {

        SymbolRecord toRecord() {
            return new SymbolRecord(
                    new Location(toInt("fileId", fileId), toInt("line", line), toInt("column", column)),
                    symbolName,
                    displayName,
                    SymbolKind.parse(kind),
                    definition,
                    toInt("startLine", startLine),
                    toInt("startColumn", startColumn),
                    toInt("endLine", endLine),
                    toInt("endColumn", endColumn)
            );
        }

        // 快照里按无符号 32 位书写，这里只接受 0 ~ Integer.MAX_VALUE
        private static int toInt(String field, long value) {
            if (value < 0 || value > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(field + " 超出支持范围（0 ~ " + Integer.MAX_VALUE + "）：" + value);
            }
            return (int) value;
        }
    }
}
