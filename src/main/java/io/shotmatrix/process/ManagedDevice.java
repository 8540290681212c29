package io.shotmatrix.process;

import io.shotmatrix.device.DeviceDriver;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A booted simulator or emulator. Stopping is idempotent so teardown and drain can race safely.
 */
public final class ManagedDevice implements ManagedResource {
    private final DeviceDriver driver;
    private final String deviceId;
    private final AtomicBoolean stopped = new AtomicBoolean();

    public ManagedDevice(DeviceDriver driver, String deviceId) {
        this.driver = driver;
        this.deviceId = deviceId;
    }

    public static String registryId(String jobId) {
        return jobId + ":device";
    }

    public String deviceId() {
        return deviceId;
    }

    @Override
    public String description() {
        return driver.platform().displayName() + " device " + deviceId;
    }

    @Override
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            driver.shutdown(deviceId);
        }
    }
}
