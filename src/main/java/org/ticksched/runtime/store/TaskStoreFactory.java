package org.ticksched.runtime.store;

import org.ticksched.runtime.spi.ITaskStore;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Creates {@link ITaskStore} instances by configuration name.
 */
public final class TaskStoreFactory {

    /** Lock-free queue, drained and partially re-inserted on every collect. */
    public static final String DRAIN_REINSERT = "drain-reinsert";

    /** Skip list ordered by due tick, drained by range. */
    public static final String TICK_INDEXED = "tick-indexed";

    private TaskStoreFactory() {
    }

    /**
     * Creates a new, empty store.
     *
     * @param storeName one of {@link #DRAIN_REINSERT} or {@link #TICK_INDEXED}
     * @return the new store
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ITaskStore create(String storeName) {
        if (storeName == null) {
            throw new IllegalArgumentException("Task store name cannot be null");
        }
        return switch (storeName) {
            case DRAIN_REINSERT -> new DrainReinsertTaskStore();
            case TICK_INDEXED -> new TickIndexedTaskStore();
            default -> throw new IllegalArgumentException(String.format(
                "Unknown task store '%s'. Supported stores: %s, %s",
                storeName, DRAIN_REINSERT, TICK_INDEXED
            ));
        };
    }

    /**
     * Creates a store from the {@code store} key of the scheduler options.
     * Falls back to {@link #DRAIN_REINSERT} when the key is absent.
     *
     * @param options the {@code ticksched.scheduler} section
     * @return the new store
     * @throws IllegalArgumentException if the configured value is invalid
     */
    public static ITaskStore fromConfig(Config options) {
        try {
            String storeName = options.hasPath("store") ? options.getString("store") : DRAIN_REINSERT;
            return create(storeName);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid task store configuration", e);
        }
    }
}
