package io.shotmatrix.automation;

import io.shotmatrix.config.Selector;

import java.util.Optional;

/**
 * A live UI automation session on one device. Lookups never block; callers poll.
 */
public interface AutomationSession extends AutoCloseable {
    Optional<AutomationElement> findNow(Selector selector);

    void rotate(Orientation orientation);

    String pageSource();

    @Override
    void close();
}
