package io.shotmatrix.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shotmatrix.ConfigFixtures;
import io.shotmatrix.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class ShotMatrixCommandTest {

    @Test
    void validateConfigReportsCounts() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-cli-validate-");
        try {
            Path config = ConfigFixtures.write(dir, ConfigFixtures.tree());

            Captured captured = execute("validate-config", "--config", config.toString());

            Assertions.assertEquals(ShotMatrixCommand.EXIT_OK, captured.exitCode);
            JsonNode out = Jsons.mapper().readTree(captured.stdout);
            Assertions.assertTrue(out.path("valid").asBoolean());
            Assertions.assertEquals(1, out.path("ios_devices").asInt());
            Assertions.assertEquals(1, out.path("android_devices").asInt());
            Assertions.assertEquals(2, out.path("languages").asInt());
            Assertions.assertEquals(2, out.path("screenshots").asInt());
            Assertions.assertEquals(64, out.path("config_hash").asText().length());
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void planPrintsFilteredJobsWithoutNeedingBuilds() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-cli-plan-");
        try {
            Path config = ConfigFixtures.write(dir, ConfigFixtures.tree());

            Captured captured = execute("plan", "-c", config.toString(), "-o", dir.resolve("shots").toString(),
                    "--platforms", "android", "--langs", "de-DE,en-US");

            Assertions.assertEquals(ShotMatrixCommand.EXIT_OK, captured.exitCode, captured.stderr);
            JsonNode out = Jsons.mapper().readTree(captured.stdout);
            Assertions.assertEquals(2, out.path("total_jobs").asInt());
            JsonNode first = out.path("jobs").get(0);
            Assertions.assertEquals("android", first.path("platform").asText());
            Assertions.assertEquals("en-US", first.path("language").asText());
            Assertions.assertEquals("en_US", first.path("locale").asText());
            Assertions.assertEquals(3, first.path("ports").size());
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void dryRunPrintsThePlanAndStartsNothing() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-cli-dry-");
        try {
            Path config = ConfigFixtures.write(dir, ConfigFixtures.tree());
            Path output = dir.resolve("shots");

            Captured captured = execute("run", "--dry-run", "-c", config.toString(), "-o", output.toString());

            Assertions.assertEquals(ShotMatrixCommand.EXIT_OK, captured.exitCode, captured.stderr);
            Assertions.assertEquals(4, Jsons.mapper().readTree(captured.stdout).path("total_jobs").asInt());
            Assertions.assertFalse(Files.exists(output));
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void generateMatrixExportsGithubIncludeRows() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-cli-matrix-");
        try {
            Path config = ConfigFixtures.write(dir, ConfigFixtures.tree());

            Captured captured = execute("generate-matrix", "-c", config.toString(), "--platforms", "ios");

            Assertions.assertEquals(ShotMatrixCommand.EXIT_OK, captured.exitCode, captured.stderr);
            Assertions.assertEquals(2, Jsons.mapper().readTree(captured.stdout).path("include").size());
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void unknownMatrixFormatIsAConfigurationError() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-cli-format-");
        try {
            Path config = ConfigFixtures.write(dir, ConfigFixtures.tree());

            Captured captured = execute("generate-matrix", "-c", config.toString(), "--format", "jenkins");

            Assertions.assertEquals(ShotMatrixCommand.EXIT_CONFIG_ERROR, captured.exitCode);
            Assertions.assertTrue(captured.stderr.contains("Configuration error"));
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void invalidConfigExitsWithConfigErrorAndListsProblems() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-cli-invalid-");
        try {
            ObjectNode tree = ConfigFixtures.tree();
            tree.putArray("languages");
            tree.putArray("screenshots");
            Path config = ConfigFixtures.write(dir, tree);

            Captured captured = execute("validate-config", "-c", config.toString());

            Assertions.assertEquals(ShotMatrixCommand.EXIT_CONFIG_ERROR, captured.exitCode);
            Assertions.assertTrue(captured.stderr.contains("  - "), captured.stderr);
            Assertions.assertTrue(captured.stdout.isBlank());
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void missingConfigFileIsAConfigurationError() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-cli-missing-");
        try {
            Captured captured = execute("plan", "-c", dir.resolve("nope.json").toString());

            Assertions.assertEquals(ShotMatrixCommand.EXIT_CONFIG_ERROR, captured.exitCode);
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }

    private static Captured execute(String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int exitCode = new CommandLine(new ShotMatrixCommand()).execute(args);
            return new Captured(exitCode, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private record Captured(int exitCode, String stdout, String stderr) {
    }
}
