package org.janelia.mediasync.app;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(commandDescription = "Evict the least recently used cache entries until the cache fits the target size")
class CacheEvictCommandArgs {
    @Parameter(names = "-target", description = "Target cache size in bytes", required = true)
    long targetSizeBytes;
}
