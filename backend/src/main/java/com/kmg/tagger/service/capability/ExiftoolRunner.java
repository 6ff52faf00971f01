package com.kmg.tagger.service.capability;

import com.kmg.tagger.config.TaggerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs the exiftool binary. Availability is probed once and remembered for the lifetime of
 * the bean.
 */
@Component
public class ExiftoolRunner {
    private static final Logger log = LoggerFactory.getLogger(ExiftoolRunner.class);
    private static final int MAX_STDERR_BYTES = 16 * 1024;

    private final String executable;
    private final Duration defaultTimeout;
    private volatile Boolean available;

    public ExiftoolRunner(TaggerProperties properties) {
        this(properties.getExiftool().getPath(), Duration.ofSeconds(properties.getExiftool().getTimeoutSeconds()));
    }

    ExiftoolRunner(String executable, Duration defaultTimeout) {
        this.executable = executable;
        this.defaultTimeout = defaultTimeout;
    }

    public boolean isAvailable() {
        Boolean cached = available;
        if (cached != null) {
            return cached;
        }
        boolean probed;
        try {
            probed = run(List.of("-ver"), Duration.ofSeconds(10)).exitCode() == 0;
        } catch (IOException e) {
            log.debug("exiftool probe failed: {}", e.getMessage());
            probed = false;
        }
        if (!probed) {
            log.warn("exiftool not found at '{}'. Install with: brew install exiftool / apt install libimage-exiftool-perl",
                    executable);
        }
        available = probed;
        return probed;
    }

    public ExiftoolResult run(List<String> arguments) throws IOException {
        return run(arguments, defaultTimeout);
    }

    public ExiftoolResult run(List<String> arguments, Duration timeout) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(arguments);

        Process process = new ProcessBuilder(command).start();
        ExecutorService streams = Executors.newFixedThreadPool(2);
        try {
            Future<byte[]> stdout = streams.submit(() -> readAll(process.getInputStream(), Integer.MAX_VALUE));
            Future<byte[]> stderr = streams.submit(() -> readAll(process.getErrorStream(), MAX_STDERR_BYTES));

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("exiftool timed out after " + timeout.toSeconds() + "s");
            }

            String errorText = new String(stderr.get(), StandardCharsets.UTF_8).trim();
            if (!errorText.isEmpty()) {
                log.debug("[exiftool-stderr] {}", errorText);
            }
            return new ExiftoolResult(process.exitValue(), stdout.get(), errorText);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for exiftool", e);
        } catch (ExecutionException e) {
            throw new IOException("Failed to read exiftool output", e.getCause());
        } finally {
            streams.shutdownNow();
        }
    }

    private static byte[] readAll(InputStream in, int limit) throws IOException {
        try (in) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                if (out.size() < limit) {
                    out.write(buffer, 0, Math.min(read, limit - out.size()));
                }
            }
            return out.toByteArray();
        }
    }

    public record ExiftoolResult(int exitCode, byte[] stdout, String stderr) {
    }
}
