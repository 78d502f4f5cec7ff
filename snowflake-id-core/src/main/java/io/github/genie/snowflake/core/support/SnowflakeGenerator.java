package io.github.genie.snowflake.core.support;

import io.github.genie.snowflake.core.SnowflakeId;
import io.github.genie.snowflake.core.log.Log;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.LockSupport;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe snowflake id generator. Ids minted by one instance are strictly
 * increasing for a given node id.
 * <p>
 * When more than {@link SnowflakeId#MAX_SEQUENCE} + 1 ids are requested within
 * one millisecond, {@link #generate(int)} blocks until the clock advances. The
 * wait has no timeout and ignores interrupts.
 */
public class SnowflakeGenerator {

    private static final long PARK_NANOS = TimeUnit.MICROSECONDS.toNanos(10);

    private final Log log = Log.get(SnowflakeGenerator.class);

    private final Lock lock = new ReentrantLock();
    private final MillisClock clock;

    private long lastTimestamp;
    private int sequence;
    private boolean clockMovedBackwards;

    public SnowflakeGenerator() {
        this(MillisClock.SYSTEM);
    }

    public SnowflakeGenerator(MillisClock clock) {
        this.clock = clock;
        log.debug(() -> "snowflake generator created, epoch: " + SnowflakeId.EPOCH);
    }

    public long generate(int nodeId) {
        SnowflakeId.requireValidNodeId(nodeId);
        lock.lock();
        try {
            long timestamp = currentTimestamp();
            if (timestamp < lastTimestamp) {
                onClockMovedBackwards(timestamp);
                timestamp = lastTimestamp;
            } else {
                clockMovedBackwards = false;
            }
            if (timestamp == lastTimestamp) {
                sequence = (sequence + 1) & SnowflakeId.MAX_SEQUENCE;
                if (sequence == 0) {
                    timestamp = awaitNextMillis();
                }
            } else {
                sequence = 0;
            }
            lastTimestamp = timestamp;
            return SnowflakeId.compose(timestamp, nodeId, sequence);
        } finally {
            lock.unlock();
        }
    }

    private void onClockMovedBackwards(long timestamp) {
        if (!clockMovedBackwards) {
            clockMovedBackwards = true;
            long last = lastTimestamp;
            log.warn(() -> "clock moved backwards by " + (last - timestamp) + "ms, " +
                           "continuing sequence of " + (last + SnowflakeId.EPOCH));
        }
    }

    private long awaitNextMillis() {
        long last = lastTimestamp;
        log.trace(() -> "sequence exhausted at " + (last + SnowflakeId.EPOCH) + ", awaiting next millisecond");
        long timestamp = currentTimestamp();
        while (timestamp <= last) {
            LockSupport.parkNanos(PARK_NANOS);
            timestamp = currentTimestamp();
        }
        return timestamp;
    }

    private long currentTimestamp() {
        return clock.now() - SnowflakeId.EPOCH;
    }

}
