package com.logsentinel.core.scan;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens a log file for a single streaming pass.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface LogFileOpener {

    /**
     * @param file regular file to read
     * @return a reader positioned at the start of the file; the caller closes it
     * @throws IOException if the file cannot be opened
     */
    BufferedReader open(Path file) throws IOException;

    /**
     * UTF-8 reader that drops malformed and unmappable byte sequences instead
     * of failing, so binary noise inside a log never aborts its scan.
     *
     * @return the default opener
     */
    static LogFileOpener lenientUtf8() {
        return file -> {
            CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.IGNORE)
                    .onUnmappableCharacter(CodingErrorAction.IGNORE);
            return new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder));
        };
    }
}
