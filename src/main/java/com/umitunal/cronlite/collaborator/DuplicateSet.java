package com.umitunal.cronlite.collaborator;

import java.util.List;

/**
 * Files sharing one content checksum.
 */
public class DuplicateSet {
    private final String checksum;
    private final List<String> fileIds;

    public DuplicateSet(String checksum, List<String> fileIds) {
        this.checksum = checksum;
        this.fileIds = List.copyOf(fileIds);
    }

    public String getChecksum() { return checksum; }
    public List<String> getFileIds() { return fileIds; }

    public boolean isDuplicate() {
        return fileIds.size() > 1;
    }

    @Override
    public String toString() {
        return "DuplicateSet{checksum='" + checksum + "', files=" + fileIds + "}";
    }
}
