package ai.promoted.metrics.engagement.job.engagement;

/** The store could not durably commit a merged file. */
public class StoreCommitException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String filename;

  public StoreCommitException(String filename, Throwable cause) {
    super("Store commit failed, file=" + filename + ": " + cause.getMessage(), cause);
    this.filename = filename;
  }

  public String getFilename() {
    return filename;
  }
}
