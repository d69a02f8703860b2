package io.github.pierce.xmlflat.export;

import io.github.pierce.xmlflat.RowSet;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a {@link RowSet} to a file.
 *
 * <p>Rows may have different key sets; writers use {@link RowSet#getColumns()}
 * as the header and leave absent values empty.</p>
 */
public interface RowSetWriter {

    void write(RowSet rows, Path target) throws IOException;

    /**
     * File extension written by this writer, without the dot.
     */
    String extension();
}
