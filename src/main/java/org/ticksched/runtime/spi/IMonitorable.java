package org.ticksched.runtime.spi;

import java.util.Map;

/**
 * A component that exposes numeric metrics for monitoring.
 */
public interface IMonitorable {

    /**
     * Returns a snapshot of the current metrics, keyed by snake_case name.
     *
     * @return a new map; callers may modify it
     */
    Map<String, Number> getMetrics();
}
