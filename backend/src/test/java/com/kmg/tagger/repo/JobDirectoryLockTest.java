package com.kmg.tagger.repo;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobDirectoryLockTest {

    @Test
    void secondLockOnSameDirectoryFails(@TempDir Path dir) {
        Path lockFile = dir.resolve(".racing_tagger.lock");
        try (JobDirectoryLock first = JobDirectoryLock.acquire(lockFile)) {
            assertThat(first.lockFile()).exists();
            assertThatThrownBy(() -> JobDirectoryLock.acquire(lockFile))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Another run");
        }
    }

    @Test
    void closingReleasesLockButKeepsLockFile(@TempDir Path dir) {
        Path lockFile = dir.resolve(".racing_tagger.lock");

        JobDirectoryLock.acquire(lockFile).close();

        assertThat(Files.exists(lockFile)).isTrue();
        try (JobDirectoryLock second = JobDirectoryLock.acquire(lockFile)) {
            assertThat(second.lockFile()).isEqualTo(lockFile);
            assertThatThrownBy(() -> JobDirectoryLock.acquire(lockFile))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
