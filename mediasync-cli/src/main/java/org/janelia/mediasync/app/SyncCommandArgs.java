package org.janelia.mediasync.app;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import org.janelia.mediasync.asyncservice.sync.SyncRequest;

@Parameters(commandDescription = "Sync the catalog of one provider or, if no provider is given, of all enabled providers")
class SyncCommandArgs {
    @Parameter(names = "-provider", description = "Storage provider ID")
    Long providerId;
    @Parameter(names = "-maxFiles", description = "Maximum number of new files to add; 0 means no limit")
    int maxFiles = 0;
    @Parameter(names = "-keepDeleted", description = "Keep catalog items whose files are no longer listed", arity = 0)
    boolean keepDeleted = false;
    @Parameter(names = "-updateExisting", description = "Compare and update items that are already in the catalog", arity = 0)
    boolean updateExisting = false;
    @Parameter(names = "-fullSync", description = "Full sync - always compare existing items", arity = 0)
    boolean fullSync = false;
    @Parameter(names = "-folder", description = "Only sync the given folder")
    String folderId;
    @Parameter(names = "-nonRecursive", description = "Do not descend into sub folders", arity = 0)
    boolean nonRecursive = false;

    SyncRequest toSyncRequest() {
        return new SyncRequest()
                .setFullSync(fullSync)
                .setRemoveDeleted(!keepDeleted)
                .setSkipExisting(!updateExisting)
                .setMaxFiles(maxFiles)
                .setFolderId(folderId)
                .setRecursive(!nonRecursive);
    }
}
