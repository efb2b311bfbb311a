package org.codeindex.query.job;

import org.codeindex.index.SymbolRecord;
import org.codeindex.query.QueryContext;
import org.codeindex.query.QueryJob;
import org.codeindex.query.QueryRequest;

import java.util.Collection;

/**
 * 列出符号位置（按 Location 升序），可带展示名/种类/所在函数等附加信息。
 * <p>
 * 只有一个字面路径过滤且正好是已注册文件时，只枚举该文件，避免扫描整个索引。
 */
public class ListSymbolsJob extends QueryJob {

    public ListSymbolsJob(QueryRequest request, QueryContext context) {
        super(request, context);
    }

    @Override
    protected int execute() {
        int fileId = fileFilter();
        Collection<SymbolRecord> records = fileId != 0 ? index().symbolsInFile(fileId) : index().symbols();
        for (SymbolRecord record : records) {
            if (!write(record.location()) && shouldStop()) {
                break;
            }
        }
        return EXIT_OK;
    }
}
