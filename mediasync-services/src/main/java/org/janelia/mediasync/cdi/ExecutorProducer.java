package org.janelia.mediasync.cdi;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.janelia.mediasync.cdi.qualifier.IntPropertyValue;
import org.janelia.mediasync.cdi.qualifier.MediaSyncDefault;
import org.slf4j.Logger;

@ApplicationScoped
public class ExecutorProducer {
    @Inject
    private Logger logger;

    @ApplicationScoped
    @Produces
    @MediaSyncDefault
    public ExecutorService createExecutorService(@IntPropertyValue(name = "service.executor.ThreadPoolSize", defaultValue = 20) int threadPoolSize) {
        final ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("MEDIASYNC-%03d")
                .setDaemon(true)
                .build();
        return Executors.newFixedThreadPool(threadPoolSize > 0 ? threadPoolSize : 20, threadFactory);
    }

    public void shutdownExecutor(@Disposes @MediaSyncDefault ExecutorService executorService) throws InterruptedException {
        logger.info("Shutting down mediasync executor: {}", executorService);
        executorService.shutdown();
        executorService.awaitTermination(1, TimeUnit.MINUTES);
    }

}
