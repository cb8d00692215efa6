package ai.promoted.metrics.engagement.common.format;

import java.io.IOException;
import java.nio.file.Path;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.hadoop.util.HadoopOutputFile;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.OutputFile;

/** Local-filesystem access for parquet-avro readers and writers. */
public final class ParquetFiles {

  /**
   * Hadoop configuration for local files. The raw local filesystem skips the {@code .crc} side
   * files that the checksummed one writes next to every output.
   */
  public static Configuration localConfiguration() {
    Configuration conf = new Configuration();
    conf.set("fs.file.impl", org.apache.hadoop.fs.RawLocalFileSystem.class.getName());
    conf.setBoolean("fs.file.impl.disable.cache", true);
    return conf;
  }

  public static InputFile inputFile(Path path) throws IOException {
    return HadoopInputFile.fromPath(toHadoopPath(path), localConfiguration());
  }

  public static OutputFile outputFile(Path path) throws IOException {
    return HadoopOutputFile.fromPath(toHadoopPath(path), localConfiguration());
  }

  private static org.apache.hadoop.fs.Path toHadoopPath(Path path) {
    return new org.apache.hadoop.fs.Path(path.toAbsolutePath().toUri());
  }

  private ParquetFiles() {}
}
