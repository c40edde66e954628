package com.clauselens.infrastructure.stream;

import java.io.IOException;

/**
 * Outbound side of one status stream subscriber.
 */
public interface StatusEventSink {

    /**
     * @throws IOException when the client can no longer be reached
     */
    void send(String eventName, Object payload) throws IOException;

    void complete();

    /**
     * Registers the callback run once when the client disconnects, times out or errors.
     */
    void onClose(Runnable callback);
}
