package io.shotmatrix.planning;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shotmatrix.config.ScreenshotPlan;
import io.shotmatrix.model.RunJob;
import io.shotmatrix.util.Jsons;

/**
 * Read-only projection of a plan into CI matrix documents.
 */
public final class MatrixExporter {

    public ObjectNode export(RunPlan plan, MatrixFormat format) {
        return switch (format) {
            case GITHUB -> github(plan);
            case GITLAB -> gitlab(plan);
            case AZURE -> azure(plan);
        };
    }

    private ObjectNode github(RunPlan plan) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        ArrayNode include = root.putArray("include");
        for (RunJob job : plan.jobs()) {
            ObjectNode row = include.addObject();
            row.put("job_id", job.jobId());
            row.put("platform", job.platform().key());
            row.put("device", job.deviceName());
            row.put("language", job.language());
            ArrayNode names = row.putArray("screenshots");
            for (ScreenshotPlan screenshot : job.screenshots()) {
                names.add(screenshot.name());
            }
            row.put("output_dir", job.outputDirectory().toString());
        }
        return root;
    }

    private ObjectNode gitlab(RunPlan plan) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        for (RunJob job : plan.jobs()) {
            ObjectNode row = root.putObject("JOB_" + job.index());
            row.put("JOB_ID", job.jobId());
            row.put("PLATFORM", job.platform().key());
            row.put("DEVICE", job.deviceName());
            row.put("LANGUAGE", job.language());
            row.put("OUTPUT_DIR", job.outputDirectory().toString());
        }
        return root;
    }

    private ObjectNode azure(RunPlan plan) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        ObjectNode matrix = root.putObject("strategy").putObject("matrix");
        for (RunJob job : plan.jobs()) {
            ObjectNode row = matrix.putObject("job_" + job.index());
            row.put("jobId", job.jobId());
            row.put("platform", job.platform().key());
            row.put("device", job.deviceName());
            row.put("language", job.language());
            row.put("outputDir", job.outputDirectory().toString());
        }
        return root;
    }
}
