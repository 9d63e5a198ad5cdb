package dk.cloudcreate.projections.common;

/**
 * Life cycle of a long running component, such as a projector host that keeps a subscription open
 */
public interface Lifecycle {
    /**
     * Start the component. Calling {@link #start()} on a component that is already started has no effect
     */
    void start();

    /**
     * Stop the component and release the threads it owns. Calling {@link #stop()} on a component that is
     * already stopped has no effect
     */
    void stop();

    /**
     * @return true if {@link #start()} has been called and {@link #stop()} hasn't been called since
     */
    boolean isStarted();
}
