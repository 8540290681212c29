package io.shotmatrix.process;

import java.util.List;

public record DrainOutcome(
        List<String> stopped,
        List<String> failed,
        List<String> timedOut
) {
    public DrainOutcome {
        stopped = List.copyOf(stopped);
        failed = List.copyOf(failed);
        timedOut = List.copyOf(timedOut);
    }

    public static DrainOutcome empty() {
        return new DrainOutcome(List.of(), List.of(), List.of());
    }

    public int total() {
        return stopped.size() + failed.size() + timedOut.size();
    }

    public boolean clean() {
        return failed.isEmpty() && timedOut.isEmpty();
    }
}
