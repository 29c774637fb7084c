package org.ticksched.services;

/**
 * Lifecycle of a long-running component with its own thread.
 */
public interface IService {

    /**
     * The lifecycle states of a service.
     */
    enum State {
        /** Not running; {@link #start()} is allowed. */
        STOPPED,
        /** The service thread is active. */
        RUNNING,
        /** The service thread is alive but idle until {@link #resume()}. */
        PAUSED,
        /** The service thread died unexpectedly or could not be stopped. */
        ERROR
    }

    /**
     * Starts the service thread.
     *
     * @throws IllegalStateException if the service is not {@link State#STOPPED}
     */
    void start();

    /**
     * Stops the service and waits for its thread to terminate.
     *
     * @throws IllegalStateException if the service is neither running nor paused
     */
    void stop();

    /**
     * Pauses a running service.
     *
     * @throws IllegalStateException if the service is not {@link State#RUNNING}
     */
    void pause();

    /**
     * Resumes a paused service.
     *
     * @throws IllegalStateException if the service is not {@link State#PAUSED}
     */
    void resume();

    /**
     * Returns the current lifecycle state.
     *
     * @return the state
     */
    State getCurrentState();
}
