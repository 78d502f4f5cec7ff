package io.github.genie.snowflake.core.support;

import io.github.genie.snowflake.core.IdGenerator;
import io.github.genie.snowflake.core.SnowflakeId;

public class NodeIdGenerator implements IdGenerator {

    private final SnowflakeGenerator generator;
    private final int nodeId;

    public NodeIdGenerator(int nodeId) {
        this(new SnowflakeGenerator(), nodeId);
    }

    public NodeIdGenerator(SnowflakeGenerator generator, int nodeId) {
        this.generator = generator;
        this.nodeId = SnowflakeId.requireValidNodeId(nodeId);
    }

    @Override
    public long nextId() {
        return generator.generate(nodeId);
    }

    public int getNodeId() {
        return nodeId;
    }

}
