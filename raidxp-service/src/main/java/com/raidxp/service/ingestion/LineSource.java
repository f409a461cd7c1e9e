package com.raidxp.service.ingestion;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * Ordered source of complete log lines with an explicit read cursor.
 *
 * <p>{@link #poll()} returns the line at the cursor without moving it, so a line
 * whose processing failed is returned again by the next poll. Only
 * {@link #acknowledge()} moves the cursor past it.
 */
public interface LineSource extends Closeable {

    /**
     * Returns the next complete line, without its terminator, or empty if none is
     * available yet. Never blocks.
     */
    Optional<String> poll() throws IOException;

    /**
     * Moves the cursor past the line returned by the last {@link #poll()}.
     * No-op if there is none.
     */
    void acknowledge();
}
