package org.janelia.mediasync.app;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(commandDescription = "Report what a sync of the provider would add without changing the catalog")
class ScanCommandArgs {
    @Parameter(names = "-provider", description = "Storage provider ID", required = true)
    Long providerId;
}
