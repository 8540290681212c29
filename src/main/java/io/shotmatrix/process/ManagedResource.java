package io.shotmatrix.process;

/**
 * Something a job started that must be stopped even if the job never gets to its own teardown.
 */
public interface ManagedResource {
    String description();

    void stop() throws Exception;
}
