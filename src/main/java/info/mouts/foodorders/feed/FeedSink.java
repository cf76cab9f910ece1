package info.mouts.foodorders.feed;

import java.io.IOException;

/**
 * Outbound side of one live feed connection.
 */
public interface FeedSink {
    /**
     * Writes one named event.
     *
     * @throws IOException if the client is gone
     */
    void send(String eventName, Object payload) throws IOException;

    /**
     * Writes a keep-alive that clients ignore.
     *
     * @throws IOException if the client is gone
     */
    void heartbeat() throws IOException;

    void complete();
}
