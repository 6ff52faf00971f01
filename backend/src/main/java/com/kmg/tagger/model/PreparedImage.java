package com.kmg.tagger.model;

/**
 * Output of the prepare stage: the image as a base64 JPEG (or original bytes) ready to be
 * sent to the inference server.
 */
public record PreparedImage(ImageItem item, String base64Data, int byteCount) {
}
