package com.deepansh.billbot.tool;

import com.deepansh.billbot.model.ResultRecord;

import java.util.List;

public record SearchToolResult(List<ResultRecord> results, boolean needsRefinementHint) {

    public static SearchToolResult empty() {
        return new SearchToolResult(List.of(), false);
    }
}
