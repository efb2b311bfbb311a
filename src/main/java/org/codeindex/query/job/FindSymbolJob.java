package org.codeindex.query.job;

import org.codeindex.index.SymbolRecord;
import org.codeindex.query.QueryContext;
import org.codeindex.query.QueryJob;
import org.codeindex.query.QueryRequest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * 按符号名查找位置：精确匹配（或 {@code partial=true} 时包含匹配），定义优先，其余按 Location 升序。
 */
public class FindSymbolJob extends QueryJob {

    private final String symbolName;
    private final boolean partial;

    public FindSymbolJob(QueryRequest request, QueryContext context, String symbolName, boolean partial) {
        super(request, context);
        if (symbolName == null || symbolName.isBlank()) {
            throw new IllegalArgumentException("参数错误：symbolName 不能为空");
        }
        this.symbolName = symbolName;
        this.partial = partial;
    }

    @Override
    protected int execute() {
        int fileId = fileFilter();
        Collection<SymbolRecord> candidates = fileId != 0 ? index().symbolsInFile(fileId) : index().symbols();
        List<SymbolRecord> matches = new ArrayList<>();
        for (SymbolRecord record : candidates) {
            if (matches(record)) {
                matches.add(record);
            }
        }
        // List.sort 是稳定排序：定义在前，同类内部保持索引顺序
        matches.sort(Comparator.comparing((SymbolRecord r) -> !r.definition()));
        for (SymbolRecord record : matches) {
            if (!write(record.location()) && shouldStop()) {
                break;
            }
        }
        return EXIT_OK;
    }

    private boolean matches(SymbolRecord record) {
        String name = record.symbolName();
        return partial ? name.contains(symbolName) : name.equals(symbolName);
    }
}
