package tasktree.persistence.store;

/**
 * Handle for a live query. Closing it stops snapshot delivery and frees the listener;
 * a subscription that is never closed keeps receiving snapshots indefinitely.
 */
public interface Subscription extends AutoCloseable {

    /**
     * Releases the subscription. Calling it more than once has no effect.
     */
    @Override
    void close();

    /**
     * @return true until {@link #close()} has been called
     */
    boolean isActive();
}
