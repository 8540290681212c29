package io.shotmatrix.config;

import java.time.Duration;

public final class Defaults {
    public static final int BASE_PORT = 4723;
    public static final int PORT_OFFSET = 10;
    public static final int MIN_PORT = 1024;
    public static final int MAX_PORT = 65535;
    public static final int MAX_PORT_OFFSET = 100;
    public static final int PORTS_PER_JOB = 3;
    public static final int EMULATOR_START_PORT = 5554;
    public static final int EMULATOR_END_PORT = 5680;

    public static final Duration ELEMENT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DISMISSOR_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DISMISSOR_SETTLE = Duration.ofMillis(500);
    public static final Duration ORIENTATION_SETTLE = Duration.ofSeconds(1);
    public static final Duration ELEMENT_POLL_INTERVAL = Duration.ofMillis(250);
    public static final Duration DEVICE_OPERATION_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEVICE_POLL_INTERVAL = Duration.ofSeconds(2);
    public static final Duration SHORT_OPERATION_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration SERVER_START_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(30);
    public static final double DEFAULT_WAIT_SECONDS = 1.0d;
    public static final Duration ESTIMATED_JOB_DURATION = Duration.ofMinutes(2);

    public static final int MAX_DEVICE_LOG_BYTES = 50_000;
    public static final String LOG_TRUNCATION_MARKER = "... (truncated) ...\n";
    public static final String OUTPUT_ROOT = "Screenshots";

    private Defaults() {
    }

    /**
     * Each job holds a whole emulator/simulator plus an automation server, so only half the
     * processors are used.
     */
    public static int parallelismFor(int jobCount, int processors) {
        if (jobCount <= 1) {
            return 1;
        }
        return Math.max(1, Math.min(jobCount, processors / 2));
    }
}
