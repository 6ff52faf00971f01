package com.kmg.tagger.service.capability;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.kmg.tagger.model.ImageItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code DateTimeOriginal} and {@code SubSecTimeOriginal} in process.
 */
@Component
public class ExifTimeSignatureReader implements TimeSignatureReader {
    private static final Logger log = LoggerFactory.getLogger(ExifTimeSignatureReader.class);
    private static final DateTimeFormatter EXIF_FORMAT = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    @Override
    public Map<ImageItem, LocalDateTime> readCaptureInstants(List<ImageItem> items) {
        Map<ImageItem, LocalDateTime> instants = new LinkedHashMap<>();
        for (ImageItem item : items) {
            try {
                LocalDateTime instant = readOne(item);
                if (instant != null) {
                    instants.put(item, instant);
                }
            } catch (ImageProcessingException | IOException e) {
                log.debug("Failed to read timestamp for {}: {}", item.name(), e.getMessage());
            }
        }
        log.debug("Read timestamps for {}/{} images", instants.size(), items.size());
        return instants;
    }

    private LocalDateTime readOne(ImageItem item) throws ImageProcessingException, IOException {
        Metadata metadata = ImageMetadataReader.readMetadata(item.path().toFile());
        for (ExifSubIFDDirectory directory : metadata.getDirectoriesOfType(ExifSubIFDDirectory.class)) {
            String dateText = directory.getString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL);
            if (dateText == null || dateText.isBlank()) {
                continue;
            }
            String subSec = directory.getString(ExifSubIFDDirectory.TAG_SUBSECOND_TIME_ORIGINAL);
            LocalDateTime parsed = parse(dateText, subSec);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    /**
     * Parses an EXIF date with optional sub-second digits. The digits are a decimal fraction,
     * so they are right-padded (or truncated) to six places and used as microseconds.
     */
    static LocalDateTime parse(String dateText, String subSec) {
        LocalDateTime base;
        try {
            base = LocalDateTime.parse(dateText.trim(), EXIF_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
        if (subSec == null) {
            return base;
        }
        String digits = subSec.trim();
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            return base;
        }
        String micros = (digits + "000000").substring(0, 6);
        return base.withNano(Integer.parseInt(micros) * 1000);
    }
}
