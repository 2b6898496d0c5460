package com.umitunal.cronlite.collaborator;

import java.util.List;

/**
 * Index of stored file content by checksum.
 */
public interface ChecksumIndex {

    /**
     * Group live files by content checksum.
     */
    List<DuplicateSet> groupByChecksum() throws Exception;
}
