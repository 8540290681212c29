package io.shotmatrix.automation;

import io.shotmatrix.runtime.CancellationToken;

import java.net.URI;

/**
 * Starts and stops one automation server per port.
 */
public interface AutomationServerController {
    /**
     * Starts a server on {@code port} and waits until it answers.
     *
     * @return base URL of the running server
     */
    URI start(int port, CancellationToken token);

    void stop(int port);
}
