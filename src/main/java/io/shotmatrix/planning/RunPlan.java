package io.shotmatrix.planning;

import io.shotmatrix.model.Platform;
import io.shotmatrix.model.RunJob;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record RunPlan(
        List<RunJob> jobs,
        int totalPlatforms,
        int totalDevices,
        int totalLanguages,
        int totalScreenshots,
        Duration estimatedDuration,
        Map<Platform, Path> artifactPaths
) {
    public RunPlan {
        jobs = List.copyOf(jobs);
        artifactPaths = artifactPaths == null || artifactPaths.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(artifactPaths));
    }

    public int size() {
        return jobs.size();
    }
}
