package ai.promoted.metrics.engagement.common.job;

import ai.promoted.metrics.engagement.common.table.AvroEngagementStore;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import picocli.CommandLine.Option;

/** The persisted event store and processed-file manifest. */
public class StoreSegment implements JobSegment {

  @Option(
      names = {"--storeDir"},
      defaultValue = "data",
      description = "Directory of the persisted event store.  Default=data")
  public String storeDir = "data";

  @Option(
      names = {"--fullReset"},
      negatable = true,
      description = "Delete the store and merge every input file again.  Default=false")
  public boolean fullReset = false;

  @Override
  public void validateArgs() {
    Preconditions.checkArgument(!storeDir.isBlank(), "--storeDir must be specified.");
  }

  public Path getStoreDir() {
    return Paths.get(storeDir);
  }

  public AvroEngagementStore openStore() throws IOException {
    return AvroEngagementStore.open(getStoreDir());
  }
}
