package com.umitunal.cronlite.collaborator;

/**
 * Antivirus engine scanning stored files.
 */
public interface VirusScanner {

    ScanReport scan(String target) throws Exception;
}
