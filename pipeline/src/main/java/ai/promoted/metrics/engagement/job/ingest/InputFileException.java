package ai.promoted.metrics.engagement.job.ingest;

/** An input file that cannot be merged: unreadable, missing required columns or no valid rows. */
public class InputFileException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String filename;

  public InputFileException(String filename, String message) {
    super(message + ", file=" + filename);
    this.filename = filename;
  }

  public InputFileException(String filename, String message, Throwable cause) {
    super(message + ", file=" + filename, cause);
    this.filename = filename;
  }

  public String getFilename() {
    return filename;
  }
}
