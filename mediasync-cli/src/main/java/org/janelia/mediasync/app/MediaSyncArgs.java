package org.janelia.mediasync.app;

import com.beust.jcommander.JCommander;
import org.apache.commons.lang3.StringUtils;
import org.janelia.mediasync.cdi.ApplicationConfigProvider;

/**
 * Command line of the media sync application: the global options followed by one command.
 */
class MediaSyncArgs {

    static final String SYNC_CMD = "sync";
    static final String SCAN_CMD = "scan";
    static final String CACHE_STATS_CMD = "cache-stats";
    static final String CACHE_EVICT_CMD = "cache-evict";
    static final String CACHE_CLEAR_CMD = "cache-clear";

    final AppArgs appArgs = new AppArgs();
    final SyncCommandArgs syncArgs = new SyncCommandArgs();
    final ScanCommandArgs scanArgs = new ScanCommandArgs();
    final CacheStatsCommandArgs cacheStatsArgs = new CacheStatsCommandArgs();
    final CacheEvictCommandArgs cacheEvictArgs = new CacheEvictCommandArgs();
    final CacheClearCommandArgs cacheClearArgs = new CacheClearCommandArgs();
    private final JCommander cmdline;
    private String command;

    MediaSyncArgs() {
        cmdline = JCommander.newBuilder()
                .programName("mediasync")
                .addObject(appArgs)
                .addCommand(SYNC_CMD, syncArgs)
                .addCommand(SCAN_CMD, scanArgs)
                .addCommand(CACHE_STATS_CMD, cacheStatsArgs)
                .addCommand(CACHE_EVICT_CMD, cacheEvictArgs)
                .addCommand(CACHE_CLEAR_CMD, cacheClearArgs)
                .build();
    }

    static MediaSyncArgs parse(String[] args) {
        MediaSyncArgs mediaSyncArgs = new MediaSyncArgs();
        mediaSyncArgs.cmdline.parse(args);
        mediaSyncArgs.command = mediaSyncArgs.cmdline.getParsedCommand();
        // update the dynamic config
        ApplicationConfigProvider.setAppDynamicArgs(mediaSyncArgs.appArgs.appDynamicConfig);
        return mediaSyncArgs;
    }

    String getCommand() {
        return command;
    }

    boolean shouldDisplayUsage() {
        return appArgs.displayUsage || StringUtils.isBlank(command);
    }

    String usage() {
        StringBuilder output = new StringBuilder();
        cmdline.getUsageFormatter().usage(output);
        return output.toString();
    }
}
