package teranet.mapdev.listings.writer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import teranet.mapdev.listings.model.Table;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Indented JSON array with one object per row, keys in column order.
 * Timestamps are written as ISO-8601 strings, missing values as null.
 */
@Component
public class JsonTableWriter implements TableWriter {

    private static final Logger logger = LoggerFactory.getLogger(JsonTableWriter.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.JSON;
    }

    @Override
    public void write(Table table, Path target) throws IOException {
        try (OutputStream outputStream = Files.newOutputStream(target)) {
            objectMapper.writeValue(outputStream, table.getRows());
        }
        logger.debug("Wrote {} records to {}", table.rowCount(), target);
    }
}
