package org.ticksched.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ticksched.runtime.spi.ITaskFailureHandler;

/**
 * Default failure handler: logs the failure and lets the loop continue.
 * Stack traces are logged at DEBUG only.
 */
public class LoggingTaskFailureHandler implements ITaskFailureHandler {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingTaskFailureHandler.class);

    @Override
    public void onFailure(long tick, Runnable action, RuntimeException failure) {
        LOG.warn("Scheduled callback failed at tick {}: {}", tick, failure.toString());
        LOG.debug("Exception details:", failure);
    }
}
