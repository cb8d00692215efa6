package ai.promoted.metrics.engagement.common.format;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.TimeUnit;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.schema.Type;

/**
 * Reads flat parquet files (reference feeds) into string cells. Dates are rendered as {@code
 * yyyy-MM-dd} and timestamps as {@code yyyy-MM-dd HH:mm:ss.SSSSSS} in UTC.
 */
public class ParquetTabularFileReader implements TabularFileReader {
  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

  @Override
  public TabularFile read(Path path) throws IOException {
    InputFile inputFile = ParquetFiles.inputFile(path);
    ImmutableList<String> headers;
    try (ParquetFileReader fileReader = ParquetFileReader.open(inputFile)) {
      headers =
          fileReader.getFooter().getFileMetaData().getSchema().getFields().stream()
              .map(Type::getName)
              .collect(ImmutableList.toImmutableList());
    }

    ImmutableList.Builder<ImmutableList<String>> rows = ImmutableList.builder();
    try (ParquetReader<GenericRecord> reader =
        AvroParquetReader.<GenericRecord>builder(inputFile)
            .withDataModel(GenericData.get())
            .withConf(ParquetFiles.localConfiguration())
            .build()) {
      GenericRecord record;
      while ((record = reader.read()) != null) {
        ImmutableList.Builder<String> cells = ImmutableList.builder();
        for (String header : headers) {
          Schema.Field field = record.getSchema().getField(header);
          cells.add(field == null ? "" : toText(record.get(header), field.schema()));
        }
        rows.add(cells.build());
      }
    }
    return TabularFile.create(headers, rows.build());
  }

  private static String toText(Object value, Schema schema) {
    if (value == null) {
      return "";
    }
    LogicalType logicalType = nonNull(schema).getLogicalType();
    if (logicalType instanceof LogicalTypes.Date && value instanceof Integer) {
      return LocalDate.ofEpochDay((Integer) value).toString();
    }
    if (logicalType instanceof LogicalTypes.TimestampMillis && value instanceof Long) {
      return TIMESTAMP.format(Instant.ofEpochMilli((Long) value));
    }
    if (logicalType instanceof LogicalTypes.TimestampMicros && value instanceof Long) {
      long micros = (Long) value;
      return TIMESTAMP.format(
          Instant.ofEpochSecond(
              Math.floorDiv(micros, TimeUnit.SECONDS.toMicros(1)),
              TimeUnit.MICROSECONDS.toNanos(Math.floorMod(micros, TimeUnit.SECONDS.toMicros(1)))));
    }
    return value.toString().trim();
  }

  // Nullable columns come back as a union with null.
  private static Schema nonNull(Schema schema) {
    if (schema.getType() != Schema.Type.UNION) {
      return schema;
    }
    return schema.getTypes().stream()
        .filter(type -> type.getType() != Schema.Type.NULL)
        .findFirst()
        .orElse(schema);
  }
}
