package org.janelia.mediasync.app;

import com.beust.jcommander.Parameters;

@Parameters(commandDescription = "Display the content cache statistics")
class CacheStatsCommandArgs {
}
