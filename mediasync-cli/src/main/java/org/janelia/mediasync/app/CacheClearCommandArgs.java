package org.janelia.mediasync.app;

import com.beust.jcommander.Parameters;

@Parameters(commandDescription = "Remove all entries from the content cache")
class CacheClearCommandArgs {
}
