package com.apexframe.core.lifecycle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 批量操作结果：单个失败不会中断其余扩展
 *
 * @param succeeded 成功的扩展 ID（按执行顺序）
 * @param failed    失败的扩展 ID -> 原因
 */
public record BulkOperationReport(String operation, List<String> succeeded, Map<String, String> failed) {

    public BulkOperationReport {
        succeeded = List.copyOf(succeeded);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }

    public boolean isAllSucceeded() {
        return failed.isEmpty();
    }
}
