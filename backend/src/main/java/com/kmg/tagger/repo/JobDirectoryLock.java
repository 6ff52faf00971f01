package com.kmg.tagger.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive lock on a job directory so two runs never write the same progress file.
 * The lock file itself is left in place on close; only the lock on it is released.
 */
public final class JobDirectoryLock implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobDirectoryLock.class);

    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock lock;

    private JobDirectoryLock(Path lockFile, FileChannel channel, FileLock lock) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.lock = lock;
    }

    public static JobDirectoryLock acquire(Path lockFile) {
        FileChannel channel = null;
        try {
            Files.createDirectories(lockFile.getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                throw new IllegalStateException("Another run is already using " + lockFile.getParent());
            }
            return new JobDirectoryLock(lockFile, channel, lock);
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            throw new IllegalStateException("Another run is already using " + lockFile.getParent(), e);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new IllegalStateException("Failed to lock job directory " + lockFile.getParent(), e);
        } catch (RuntimeException e) {
            closeQuietly(channel);
            throw e;
        }
    }

    public Path lockFile() {
        return lockFile;
    }

    @Override
    public void close() {
        try {
            lock.release();
            channel.close();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to release lock " + lockFile, e);
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Failed to close lock channel: {}", e.getMessage());
        }
    }
}
