package com.kmg.tagger.config;

import com.kmg.tagger.service.capability.ExiftoolRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
@Order(0)
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final TaggerProperties properties;
    private final ExiftoolRunner exiftoolRunner;

    public StartupInitializer(TaggerProperties properties, ExiftoolRunner exiftoolRunner) {
        this.properties = properties;
        this.exiftoolRunner = exiftoolRunner;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        if (exiftoolRunner.isAvailable()) {
            log.info("exiftool found: {}", properties.getExiftool().getPath());
        }
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(Path.of(properties.getBaseDir()));
        Files.createDirectories(Path.of(properties.getOutput().getReportDir()));
        Files.createDirectories(Path.of(properties.getLogs().getDir()));
    }
}
