package com.chronofill.backend.service.transform;

import com.chronofill.backend.config.BackfillProperties;
import com.chronofill.backend.service.plan.ReprocessingPlan;
import com.chronofill.backend.service.plan.ReprocessingPlanner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Launches the configured transformation command as a child process for one chunk:
 * {@code <command> --select <models> --vars <json>}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessChunkTransformRunner implements ChunkTransformRunner {

    private static final Pattern TOTAL_PATTERN = Pattern.compile("Total=(\\d+)");

    private final BackfillProperties properties;
    private final ReprocessingPlanner reprocessingPlanner;
    private final ObjectMapper objectMapper;

    @Override
    public ChunkTransformResult run(ChunkTransformRequest request) {
        ReprocessingPlan plan = reprocessingPlanner.plan(request.tenantId(), request.sourceSystem(),
                request.chunkStartDate(), request.chunkEndDate());
        if (plan.isEmpty()) {
            log.info("No models affected for source={} jobId={}, nothing to run",
                    request.sourceSystem().getValue(), request.jobId());
            return ChunkTransformResult.success(0);
        }

        List<String> command = buildCommand(request, plan.affectedModels());
        BackfillProperties.Transform config = properties.getTransform();
        Path output = null;
        try {
            output = Files.createTempFile("backfill-chunk-" + request.jobId() + "-", ".log");
            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile());
            if (config.getWorkingDirectory() != null && !config.getWorkingDirectory().isBlank()) {
                builder.directory(new File(config.getWorkingDirectory()));
            }
            log.info("Launching transform jobId={} chunk={} models={}", request.jobId(), request.chunkIndex(),
                    plan.affectedModels().size());
            Process process = builder.start();
            if (!process.waitFor(config.getTimeoutMinutes(), TimeUnit.MINUTES)) {
                process.destroyForcibly();
                return ChunkTransformResult.failure("Transform timed out after " + config.getTimeoutMinutes() + " minutes");
            }
            String text = Files.readString(output, StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                return ChunkTransformResult.failure(truncate("Transform exited with code " + process.exitValue()
                        + ": " + text, config.getMaxErrorLength()));
            }
            return ChunkTransformResult.success(extractRowCount(text));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ChunkTransformResult.failure("Transform interrupted");
        } catch (IOException e) {
            throw new IllegalStateException("Unable to launch transform for job " + request.jobId(), e);
        } finally {
            deleteQuietly(output);
        }
    }

    List<String> buildCommand(ChunkTransformRequest request, List<String> models) {
        List<String> command = new ArrayList<>(properties.getTransform().getCommand());
        command.add("--select");
        command.addAll(models);
        command.add("--vars");
        command.add(varsJson(request));
        return command;
    }

    static long extractRowCount(String output) {
        if (output == null) {
            return 0;
        }
        Matcher matcher = TOTAL_PATTERN.matcher(output);
        return matcher.find() ? Long.parseLong(matcher.group(1)) : 0;
    }

    private String varsJson(ChunkTransformRequest request) {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("backfill_start_date", request.chunkStartDate().toString());
        vars.put("backfill_end_date", request.chunkEndDate().toString());
        vars.put("backfill_tenant_id", request.tenantId());
        try {
            return objectMapper.writeValueAsString(vars);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transform variables", e);
        }
    }

    private static String truncate(String message, int limit) {
        return message.length() <= limit ? message : message.substring(0, limit);
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete transform output {}: {}", path, e.getMessage());
        }
    }
}
