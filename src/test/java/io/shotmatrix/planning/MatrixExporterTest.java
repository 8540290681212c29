package io.shotmatrix.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shotmatrix.ConfigFixtures;
import io.shotmatrix.model.RunOverrides;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

final class MatrixExporterTest {
    private static final Path OUTPUT = Path.of("Screenshots");

    private static RunPlan plan() {
        return RunPlanBuilder.planOnly((platform, build) -> Optional.empty())
                .build(ConfigFixtures.config(), OUTPUT, PlanFilters.none(), new PortAllocator(), RunOverrides.none());
    }

    @Test
    void githubMatrixListsEveryJobUnderInclude() {
        ObjectNode matrix = new MatrixExporter().export(plan(), MatrixFormat.GITHUB);

        JsonNode include = matrix.path("include");
        Assertions.assertEquals(4, include.size());
        JsonNode first = include.get(0);
        Assertions.assertEquals("job-0", first.path("job_id").asText());
        Assertions.assertEquals("ios", first.path("platform").asText());
        Assertions.assertEquals("iPhone 15 Pro", first.path("device").asText());
        Assertions.assertEquals("en-US", first.path("language").asText());
        Assertions.assertEquals(2, first.path("screenshots").size());
        Assertions.assertEquals("home", first.path("screenshots").get(0).asText());
        Assertions.assertTrue(first.path("output_dir").asText().endsWith("en-US"));
        Assertions.assertEquals("android", include.get(3).path("platform").asText());
    }

    @Test
    void gitlabMatrixUsesUpperCaseKeysPerJob() {
        ObjectNode matrix = new MatrixExporter().export(plan(), MatrixFormat.GITLAB);

        Assertions.assertEquals(4, matrix.size());
        JsonNode job = matrix.path("JOB_2");
        Assertions.assertEquals("job-2", job.path("JOB_ID").asText());
        Assertions.assertEquals("android", job.path("PLATFORM").asText());
        Assertions.assertEquals("Pixel 7", job.path("DEVICE").asText());
        Assertions.assertEquals("en-US", job.path("LANGUAGE").asText());
        Assertions.assertFalse(job.path("OUTPUT_DIR").asText().isEmpty());
    }

    @Test
    void azureMatrixNestsJobsUnderStrategy() {
        ObjectNode matrix = new MatrixExporter().export(plan(), MatrixFormat.AZURE);

        JsonNode jobs = matrix.path("strategy").path("matrix");
        Assertions.assertEquals(4, jobs.size());
        Assertions.assertEquals("job-1", jobs.path("job_1").path("jobId").asText());
        Assertions.assertEquals("de-DE", jobs.path("job_1").path("language").asText());
        Assertions.assertTrue(jobs.path("job_1").has("outputDir"));
    }

    @Test
    void formatNamesAreCaseInsensitive() {
        Assertions.assertEquals(MatrixFormat.GITLAB, MatrixFormat.fromString("GitLab"));
        Assertions.assertEquals(MatrixFormat.GITHUB, MatrixFormat.fromString(null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> MatrixFormat.fromString("jenkins"));
    }
}
