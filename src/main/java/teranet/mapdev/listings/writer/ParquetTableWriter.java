package teranet.mapdev.listings.writer;

import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.Schema.Field;
import org.apache.avro.Schema.Type;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import teranet.mapdev.listings.model.ColumnType;
import teranet.mapdev.listings.model.Table;
import teranet.mapdev.listings.service.TableNamingService;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Columnar output through parquet-avro, SNAPPY compressed.
 *
 * Every column is a nullable Avro field typed from the column's inferred type:
 * LONG → long, DOUBLE → double, BOOLEAN → boolean, DATETIME → timestamp-millis (UTC
 * wall clock), anything else → string. Field names are sanitized to Avro identifiers.
 */
@Component
public class ParquetTableWriter implements TableWriter {

    private static final Logger logger = LoggerFactory.getLogger(ParquetTableWriter.class);

    private static final String RECORD_NAME = "listing";
    private static final String RECORD_NAMESPACE = "teranet.mapdev.listings";

    private final TableNamingService tableNamingService;

    public ParquetTableWriter(TableNamingService tableNamingService) {
        this.tableNamingService = tableNamingService;
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.PARQUET;
    }

    @Override
    public void write(Table table, Path target) throws IOException {
        List<String> columns = table.getColumns();
        List<String> fieldNames = tableNamingService.toColumnIdentifiers(columns);
        Map<String, ColumnType> types = table.schema();
        Schema schema = buildSchema(columns, fieldNames, types);

        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(new NioOutputFile(target))
                .withSchema(schema)
                .withCompressionCodec(CompressionCodecName.SNAPPY)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .build()) {

            for (Map<String, Object> row : table.getRows()) {
                GenericRecord record = new GenericData.Record(schema);
                for (int i = 0; i < columns.size(); i++) {
                    String column = columns.get(i);
                    record.put(fieldNames.get(i), toAvroValue(row.get(column), types.get(column)));
                }
                writer.write(record);
            }
        }

        logger.debug("Wrote {} rows to {}", table.rowCount(), target);
    }

    Schema buildSchema(List<String> columns, List<String> fieldNames, Map<String, ColumnType> types) {
        List<Field> fields = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            Schema fieldSchema = avroType(types.get(columns.get(i)));
            fields.add(new Field(fieldNames.get(i), nullable(fieldSchema), null, Field.NULL_DEFAULT_VALUE));
        }
        Schema record = Schema.createRecord(RECORD_NAME, null, RECORD_NAMESPACE, false);
        record.setFields(fields);
        return record;
    }

    private static Schema nullable(Schema schema) {
        List<Schema> union = new ArrayList<>(2);
        union.add(Schema.create(Type.NULL));
        union.add(schema);
        return Schema.createUnion(union);
    }

    private Schema avroType(ColumnType type) {
        switch (type) {
            case LONG:
                return Schema.create(Type.LONG);
            case DOUBLE:
                return Schema.create(Type.DOUBLE);
            case BOOLEAN:
                return Schema.create(Type.BOOLEAN);
            case DATETIME:
                return LogicalTypes.timestampMillis().addToSchema(Schema.create(Type.LONG));
            default:
                return Schema.create(Type.STRING);
        }
    }

    private Object toAvroValue(Object value, ColumnType type) {
        if (value == null) {
            return null;
        }
        switch (type) {
            case LONG:
                return ((Number) value).longValue();
            case DOUBLE:
                return ((Number) value).doubleValue();
            case BOOLEAN:
                return value;
            case DATETIME:
                return ((LocalDateTime) value).toInstant(ZoneOffset.UTC).toEpochMilli();
            default:
                return value.toString();
        }
    }
}
