package io.github.genie.snowflake.core.support;

@FunctionalInterface
public interface MillisClock {

    MillisClock SYSTEM = System::currentTimeMillis;

    /**
     * @return current time in milliseconds since the Unix epoch
     */
    long now();

}
