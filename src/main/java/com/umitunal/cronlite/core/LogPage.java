package com.umitunal.cronlite.core;

import java.util.List;

/**
 * One page of a job's execution history, newest first.
 */
public class LogPage {
    private final List<ExecutionLogEntry> entries;
    private final long total;
    private final int offset;
    private final int limit;

    public LogPage(List<ExecutionLogEntry> entries, long total, int offset, int limit) {
        this.entries = List.copyOf(entries);
        this.total = total;
        this.offset = offset;
        this.limit = limit;
    }

    public List<ExecutionLogEntry> getEntries() { return entries; }
    public long getTotal() { return total; }
    public int getOffset() { return offset; }
    public int getLimit() { return limit; }

    public boolean hasMore() {
        return offset + entries.size() < total;
    }
}
