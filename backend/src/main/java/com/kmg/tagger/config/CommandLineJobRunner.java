package com.kmg.tagger.config;

import com.kmg.tagger.dto.JobRequest;
import com.kmg.tagger.dto.JobView;
import com.kmg.tagger.model.JobStatus;
import com.kmg.tagger.model.Profile;
import com.kmg.tagger.service.TaggingJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Runs a single job when the application is started with {@code --input=<path>} and reports the
 * outcome as the process exit code.
 */
@Component
@Order(1)
public class CommandLineJobRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(CommandLineJobRunner.class);
    static final String INPUT = "input";

    private final TaggingJobService jobService;
    private volatile int exitCode;

    public CommandLineJobRunner(TaggingJobService jobService) {
        this.jobService = jobService;
    }

    public static boolean isCommandLineInvocation(String[] args) {
        return Arrays.stream(args).anyMatch(arg -> arg.equals("--" + INPUT) || arg.startsWith("--" + INPUT + "="));
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(INPUT)) {
            return;
        }
        try {
            JobView result = jobService.runJob(toRequest(args));
            exitCode = result.status() == JobStatus.COMPLETED ? 0 : 1;
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error(e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static JobRequest toRequest(ApplicationArguments args) {
        String input = value(args, INPUT);
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("--input requires a file or folder path");
        }
        String profile = value(args, "profile");
        String maxImages = value(args, "max-images");
        String threshold = value(args, "sequence-threshold");
        return new JobRequest(
                input,
                profile == null ? null : Profile.fromId(profile),
                flag(args, "fuzzy-numbers"),
                value(args, "output-dir"),
                flag(args, "resume"),
                flag(args, "reset"),
                flag(args, "dry-run"),
                maxImages == null ? null : parsePositive("max-images", maxImages),
                flag(args, "warm-up"),
                flag(args, "detect-sequences"),
                threshold == null ? null : parseThreshold(threshold),
                flag(args, "sequence-dry-run"),
                flag(args, "skip-sequence-sharpness"),
                value(args, "model")
        );
    }

    private static String value(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    private static boolean flag(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return false;
        }
        String value = value(args, name);
        return value == null || value.isBlank() || Boolean.parseBoolean(value);
    }

    private static int parsePositive(String name, String value) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 1) {
                throw new IllegalArgumentException("--" + name + " must be at least 1");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a number: " + value, e);
        }
    }

    private static double parseThreshold(String value) {
        try {
            double parsed = Double.parseDouble(value);
            if (parsed < 0) {
                throw new IllegalArgumentException("--sequence-threshold must not be negative");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--sequence-threshold must be a number: " + value, e);
        }
    }
}
