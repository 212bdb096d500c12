package com.deepansh.billbot.search;

import com.deepansh.billbot.model.ContentType;
import com.deepansh.billbot.model.ResultRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicated, capped set of records found by one session.
 * The first sighting of a (type, id) pair wins; later copies are dropped even
 * when they score higher. Not thread-safe: owned by a single search run.
 */
public class ResultAccumulator {

    private final int cap;
    private final Map<ResultRecord.Key, Entry> entries = new LinkedHashMap<>();

    public ResultAccumulator(int cap) {
        this.cap = cap;
    }

    /**
     * Adds the unseen records of one tool response, best scores first, until the cap.
     *
     * @return how many records were new
     */
    public int merge(List<ResultRecord> records, int iteration, String query) {
        List<ResultRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparingDouble(ResultRecord::getRelevanceScore).reversed());

        int added = 0;
        for (ResultRecord record : ordered) {
            if (isFull()) break;
            if (entries.containsKey(record.key())) continue;
            entries.put(record.key(), new Entry(record, iteration, query));
            added++;
        }
        return added;
    }

    public int size() {
        return entries.size();
    }

    public boolean isFull() {
        return entries.size() >= cap;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Ids already held for one content type, in insertion order. */
    public List<String> contentIds(ContentType type) {
        return entries.keySet().stream()
                .filter(key -> key.contentType() == type)
                .map(ResultRecord.Key::contentId)
                .toList();
    }

    /** Entries by descending relevance; ties keep discovery order. */
    public List<Entry> ranked() {
        List<Entry> out = new ArrayList<>(entries.values());
        out.sort(Comparator.comparingDouble((Entry e) -> e.record().getRelevanceScore()).reversed());
        return out;
    }

    /** A record with the iteration and query that first found it. */
    public record Entry(ResultRecord record, int iteration, String query) {
    }
}
