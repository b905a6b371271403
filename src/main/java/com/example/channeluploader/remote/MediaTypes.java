package com.example.channeluploader.remote;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Detects the media type declared on an uploaded file part.
 */
public class MediaTypes {
    static final String OCTET_STREAM = "application/octet-stream";

    private final Tika tika;

    public MediaTypes() {
        this.tika = new Tika();
    }

    public String detect(Path path) {
        try {
            MediaType mediaType = MediaType.parse(tika.detect(path));
            return mediaType == null ? OCTET_STREAM : mediaType.toString();
        } catch (IOException ex) {
            return OCTET_STREAM;
        }
    }
}
