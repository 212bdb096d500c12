package com.deepansh.billbot.tool;

import com.deepansh.billbot.model.ContentType;
import com.deepansh.billbot.model.SearchFilters;

import java.util.List;

/**
 * Arguments of one search tool call.
 * {@code previousResultIds} lets the backend skip records already accumulated.
 */
public record SearchToolRequest(ContentType contentType,
                                String query,
                                String searchType,
                                SearchFilters filters,
                                int limit,
                                int iteration,
                                List<String> previousResultIds) {
}
