package io.github.genie.snowflake.core;

import java.time.Instant;

/**
 * Bit layout of a snowflake id, most significant bit first:
 * <pre>
 * | 42 bits timestamp | 10 bits node id | 12 bits sequence |
 * </pre>
 * The timestamp counts milliseconds since {@link #EPOCH}.
 */
public final class SnowflakeId {

    public static final long EPOCH = 1288834974657L;

    public static final int TIMESTAMP_BITS = 42;
    public static final int NODE_ID_BITS = 10;
    public static final int SEQUENCE_BITS = 12;

    public static final int NODE_ID_SHIFT = SEQUENCE_BITS;
    public static final int TIMESTAMP_SHIFT = NODE_ID_BITS + SEQUENCE_BITS;

    public static final long MAX_TIMESTAMP = (1L << TIMESTAMP_BITS) - 1;
    public static final int MAX_NODE_ID = (1 << NODE_ID_BITS) - 1;
    public static final int MAX_SEQUENCE = (1 << SEQUENCE_BITS) - 1;

    private SnowflakeId() {
    }

    public static long compose(long timestamp, int nodeId, int sequence) {
        return timestamp << TIMESTAMP_SHIFT | (long) nodeId << NODE_ID_SHIFT | sequence;
    }

    public static long timestamp(long id) {
        return id >>> TIMESTAMP_SHIFT;
    }

    public static int nodeId(long id) {
        return (int) (id >>> NODE_ID_SHIFT) & MAX_NODE_ID;
    }

    public static int sequence(long id) {
        return (int) id & MAX_SEQUENCE;
    }

    /**
     * @return creation time of the id in milliseconds since the Unix epoch
     */
    public static long getTime(long id) {
        return timestamp(id) + EPOCH;
    }

    public static Instant generationTime(long id) {
        return Instant.ofEpochMilli(getTime(id));
    }

    public static boolean isValidNodeId(int nodeId) {
        return nodeId >= 0 && nodeId <= MAX_NODE_ID;
    }

    public static int requireValidNodeId(int nodeId) {
        if (!isValidNodeId(nodeId)) {
            throw new IllegalArgumentException(
                    "nodeId " + nodeId + " out of range, 0 <= nodeId <= " + MAX_NODE_ID
            );
        }
        return nodeId;
    }

}
