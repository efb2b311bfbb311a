package org.codeindex.query.job;

import org.codeindex.query.QueryContext;
import org.codeindex.query.QueryJob;
import org.codeindex.query.QueryRequest;

/**
 * 列出索引中的全部文件路径（按 fileId 升序），经过路径过滤/系统头文件过滤/条数上限。
 */
public class ListFilesJob extends QueryJob {

    public ListFilesJob(QueryRequest request, QueryContext context) {
        super(request, context);
    }

    @Override
    protected int execute() {
        for (Integer fileId : index().files().paths().keySet()) {
            if (!writeFiltered(formatter().registeredPath(fileId), formatter().path(fileId)) && shouldStop()) {
                break;
            }
        }
        return EXIT_OK;
    }
}
