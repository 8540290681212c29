package io.shotmatrix.process;

import io.shotmatrix.automation.AutomationServerController;

import java.util.concurrent.atomic.AtomicBoolean;

public final class ManagedAutomationServer implements ManagedResource {
    private final AutomationServerController controller;
    private final int port;
    private final AtomicBoolean stopped = new AtomicBoolean();

    public ManagedAutomationServer(AutomationServerController controller, int port) {
        this.controller = controller;
        this.port = port;
    }

    public static String registryId(String jobId) {
        return jobId + ":server";
    }

    public int port() {
        return port;
    }

    @Override
    public String description() {
        return "automation server on port " + port;
    }

    @Override
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            controller.stop(port);
        }
    }
}
