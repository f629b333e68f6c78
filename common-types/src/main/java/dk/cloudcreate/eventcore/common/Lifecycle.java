package dk.cloudcreate.eventcore.common;

/**
 * A background component with its own threads, such as the outbox relay, the event bus or a subscriber worker.<br>
 * Both {@link #start()} and {@link #stop()} may be called repeatedly; a call that doesn't change the state is a no-op.
 */
public interface Lifecycle {
    /**
     * Start the component's threads. Ignored if {@link #isStarted()}
     */
    void start();

    /**
     * Stop the component's threads and wait briefly for in-flight work. Ignored unless {@link #isStarted()}
     */
    void stop();

    boolean isStarted();
}
