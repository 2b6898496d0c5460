package com.umitunal.cronlite.collaborator;

import java.util.List;

/**
 * Result of scanning one target. A report without threats is clean.
 */
public class ScanReport {
    private final String target;
    private final long filesScanned;
    private final List<String> threats;

    public ScanReport(String target, long filesScanned, List<String> threats) {
        this.target = target;
        this.filesScanned = filesScanned;
        this.threats = List.copyOf(threats);
    }

    public static ScanReport clean(String target, long filesScanned) {
        return new ScanReport(target, filesScanned, List.of());
    }

    public String getTarget() { return target; }
    public long getFilesScanned() { return filesScanned; }
    public List<String> getThreats() { return threats; }

    public boolean isClean() {
        return threats.isEmpty();
    }
}
