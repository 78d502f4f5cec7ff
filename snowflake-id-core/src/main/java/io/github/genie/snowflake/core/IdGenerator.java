package io.github.genie.snowflake.core;

import io.github.genie.snowflake.core.codec.IdCodec;

public interface IdGenerator {

    long nextId();

    default String nextIdString() {
        return IdCodec.encodeToString(nextId());
    }

}
