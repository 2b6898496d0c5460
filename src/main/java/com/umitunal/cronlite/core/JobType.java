package com.umitunal.cronlite.core;

/**
 * Closed set of task types. The tag is the persisted and user-facing name.
 */
public enum JobType {
    BACKUP("backup"),
    CLEANUP("cleanup"),
    VIRUS_SCAN("virus_scan"),
    DUPLICATE_DETECTION("duplicate_detection"),
    WEBHOOK("webhook");

    private final String tag;

    JobType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Resolve a type from its tag.
     *
     * @throws UnknownJobTypeException if no type carries the tag
     */
    public static JobType fromTag(String tag) {
        for (JobType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new UnknownJobTypeException(tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}
