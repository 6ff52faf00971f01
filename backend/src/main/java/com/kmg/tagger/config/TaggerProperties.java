package com.kmg.tagger.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "tagger")
public class TaggerProperties {
    @NotBlank
    private String baseDir;
    @NotNull
    private Inference inference = new Inference();
    @NotNull
    private Pipeline pipeline = new Pipeline();
    @NotNull
    private Image image = new Image();
    @NotNull
    private Sequence sequence = new Sequence();
    @NotNull
    private Exiftool exiftool = new Exiftool();
    @NotNull
    private Progress progress = new Progress();
    @NotNull
    private Output output = new Output();
    @NotNull
    private Logs logs = new Logs();

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public Inference getInference() {
        return inference;
    }

    public void setInference(Inference inference) {
        this.inference = inference;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Image getImage() {
        return image;
    }

    public void setImage(Image image) {
        this.image = image;
    }

    public Sequence getSequence() {
        return sequence;
    }

    public void setSequence(Sequence sequence) {
        this.sequence = sequence;
    }

    public Exiftool getExiftool() {
        return exiftool;
    }

    public void setExiftool(Exiftool exiftool) {
        this.exiftool = exiftool;
    }

    public Progress getProgress() {
        return progress;
    }

    public void setProgress(Progress progress) {
        this.progress = progress;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public enum Backend {
        OLLAMA,
        LLAMA_CPP
    }

    public static class Inference {
        @NotNull
        private Backend backend = Backend.OLLAMA;
        @NotBlank
        private String serverUrl = "http://localhost:11434";
        private String model;
        @NotEmpty
        private List<String> preferredModels = new ArrayList<>(List.of(
                "qwen2.5vl:7b", "minicpm-v", "llava:7b", "llava:13b", "llava"));
        @Min(1)
        private int timeoutSeconds = 300;
        @Min(1)
        private int pullTimeoutSeconds = 3600;
        private double temperature = 0.1;
        @Min(1)
        private int maxTokens = 500;

        public Backend getBackend() {
            return backend;
        }

        public void setBackend(Backend backend) {
            this.backend = backend;
        }

        public String getServerUrl() {
            return serverUrl;
        }

        public void setServerUrl(String serverUrl) {
            this.serverUrl = serverUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<String> getPreferredModels() {
            return preferredModels;
        }

        public void setPreferredModels(List<String> preferredModels) {
            this.preferredModels = preferredModels;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getPullTimeoutSeconds() {
            return pullTimeoutSeconds;
        }

        public void setPullTimeoutSeconds(int pullTimeoutSeconds) {
            this.pullTimeoutSeconds = pullTimeoutSeconds;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    public static class Pipeline {
        @Min(1)
        private int prepareTimeoutSeconds = 60;

        public int getPrepareTimeoutSeconds() {
            return prepareTimeoutSeconds;
        }

        public void setPrepareTimeoutSeconds(int prepareTimeoutSeconds) {
            this.prepareTimeoutSeconds = prepareTimeoutSeconds;
        }
    }

    public static class Image {
        @Min(64)
        private int normalizeSize = 2500;
        @Min(0)
        private long reencodeThresholdBytes = 2L * 1024 * 1024;
        private float jpegQuality = 0.85f;

        public int getNormalizeSize() {
            return normalizeSize;
        }

        public void setNormalizeSize(int normalizeSize) {
            this.normalizeSize = normalizeSize;
        }

        public long getReencodeThresholdBytes() {
            return reencodeThresholdBytes;
        }

        public void setReencodeThresholdBytes(long reencodeThresholdBytes) {
            this.reencodeThresholdBytes = reencodeThresholdBytes;
        }

        public float getJpegQuality() {
            return jpegQuality;
        }

        public void setJpegQuality(float jpegQuality) {
            this.jpegQuality = jpegQuality;
        }
    }

    public static class Sequence {
        @DecimalMin("0.0")
        private double thresholdSeconds = 0.5;

        public double getThresholdSeconds() {
            return thresholdSeconds;
        }

        public void setThresholdSeconds(double thresholdSeconds) {
            this.thresholdSeconds = thresholdSeconds;
        }
    }

    public static class Exiftool {
        @NotBlank
        private String path = "exiftool";
        @Min(1)
        private int timeoutSeconds = 60;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Progress {
        @NotBlank
        private String fileName = ".racing_tagger_progress.json";
        @NotBlank
        private String lockFileName = ".racing_tagger.lock";

        public String getFileName() {
            return fileName;
        }

        public void setFileName(String fileName) {
            this.fileName = fileName;
        }

        public String getLockFileName() {
            return lockFileName;
        }

        public void setLockFileName(String lockFileName) {
            this.lockFileName = lockFileName;
        }
    }

    public static class Output {
        @NotBlank
        private String reportDir;
        @NotBlank
        private String completionFile;

        public String getReportDir() {
            return reportDir;
        }

        public void setReportDir(String reportDir) {
            this.reportDir = reportDir;
        }

        public String getCompletionFile() {
            return completionFile;
        }

        public void setCompletionFile(String completionFile) {
            this.completionFile = completionFile;
        }
    }

    public static class Logs {
        @NotBlank
        private String dir;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }
}
