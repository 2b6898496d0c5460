package com.umitunal.cronlite.collaborator;

/**
 * Remote storage backend used for backups (object storage, FTP, SFTP).
 */
public interface RemoteStorage {

    /**
     * Copy a locally stored object to the remote backend.
     *
     * @param localRef reference of the local file or folder
     */
    TransferResult copyToRemote(String localRef) throws Exception;
}
