package org.janelia.mediasync.dao.mongo.utils;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Generates unique, time ordered long identifiers. The layout of an id is
 * [41 bits millis since CUSTOM_EPOCH | 8 bits deployment context | 14 bits sequence].
 */
public class TimebasedIdentifierGenerator {

    private static final long CUSTOM_EPOCH = 1262304000000L; // 2010-01-01T00:00:00Z
    private static final int CONTEXT_BITS = 8;
    private static final int SEQUENCE_BITS = 14;
    private static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;

    private final long deploymentContext;
    private long lastTimestamp = -1L;
    private long sequence;

    public TimebasedIdentifierGenerator(int deploymentContext) {
        Preconditions.checkArgument(deploymentContext >= 0 && deploymentContext < (1 << CONTEXT_BITS),
                "Deployment context must be between 0 and %s", (1 << CONTEXT_BITS) - 1);
        this.deploymentContext = deploymentContext;
    }

    public synchronized Long generateId() {
        long timestamp = System.currentTimeMillis();
        if (timestamp < lastTimestamp) {
            // clock moved back so keep using the last timestamp
            timestamp = lastTimestamp;
        }
        if (timestamp == lastTimestamp) {
            sequence = (sequence + 1) & MAX_SEQUENCE;
            if (sequence == 0) {
                timestamp = waitForNextMillis(lastTimestamp);
            }
        } else {
            sequence = 0;
        }
        lastTimestamp = timestamp;
        return ((timestamp - CUSTOM_EPOCH) << (CONTEXT_BITS + SEQUENCE_BITS))
                | (deploymentContext << SEQUENCE_BITS)
                | sequence;
    }

    public List<Long> generateIdList(int n) {
        List<Long> idList = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            idList.add(generateId());
        }
        return idList;
    }

    private long waitForNextMillis(long lastTimestamp) {
        long timestamp = System.currentTimeMillis();
        while (timestamp <= lastTimestamp) {
            timestamp = System.currentTimeMillis();
        }
        return timestamp;
    }
}
