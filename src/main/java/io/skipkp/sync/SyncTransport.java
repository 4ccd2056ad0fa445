package io.skipkp.sync;

import io.skipkp.config.PeerConfig;

import java.io.IOException;
import java.time.Duration;

/**
 * Delivers one serialized sync message to a peer's {@code /sync} endpoint.
 *
 * <p>An {@link IOException} means the peer was not reached and the send may be retried; any HTTP
 * reply, including an error status, is returned as a {@link Response}.
 */
public interface SyncTransport {

    Response post(PeerConfig peer, String body, Duration timeout) throws IOException, InterruptedException;

    record Response(int status, String body) {
        public boolean ok() {
            return status / 100 == 2;
        }
    }
}
