package teranet.mapdev.listings.writer;

import teranet.mapdev.listings.model.Table;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a whole table to one file in a single format.
 *
 * Implementations overwrite an existing target file.
 */
public interface TableWriter {

    OutputFormat getFormat();

    void write(Table table, Path target) throws IOException;
}
