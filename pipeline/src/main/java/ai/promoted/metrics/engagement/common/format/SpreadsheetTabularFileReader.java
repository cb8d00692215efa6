package ai.promoted.metrics.engagement.common.format;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

/**
 * Reads the first sheet of an XLSX/XLS export. The first non-empty row is the header.
 *
 * <p>Date cells are rendered as {@code yyyy-MM-dd HH:mm:ss[.SSS]}. Spreadsheet exports usually
 * carry whole seconds only, which {@link TimestampParser} reports as a precision warning. Numeric
 * cells are rendered the way the spreadsheet displays them so identifiers keep their digits.
 */
public class SpreadsheetTabularFileReader implements TabularFileReader {
  private static final Logger LOGGER = LogManager.getLogger(SpreadsheetTabularFileReader.class);
  private static final DateTimeFormatter WHOLE_SECONDS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
  private static final DateTimeFormatter MILLIS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

  @Override
  public TabularFile read(Path path) throws IOException {
    try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
      if (workbook.getNumberOfSheets() == 0) {
        throw new IOException("Spreadsheet has no sheets, file=" + path);
      }
      if (workbook.getNumberOfSheets() > 1) {
        LOGGER.warn(
            "Only the first of {} sheets is read, file={}", workbook.getNumberOfSheets(), path);
      }
      Sheet sheet = workbook.getSheetAt(0);
      DataFormatter formatter = new DataFormatter();
      FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

      ImmutableList<String> headers = null;
      ImmutableList.Builder<ImmutableList<String>> rows = ImmutableList.builder();
      for (Row row : sheet) {
        int width = headers == null ? Math.max(row.getLastCellNum(), 0) : headers.size();
        ImmutableList.Builder<String> cells = ImmutableList.builder();
        boolean anyValue = false;
        for (int i = 0; i < width; i++) {
          String value = toText(row.getCell(i), formatter, evaluator);
          anyValue |= !value.isEmpty();
          cells.add(value);
        }
        if (!anyValue) {
          continue;
        }
        if (headers == null) {
          headers = cells.build();
        } else {
          rows.add(cells.build());
        }
      }
      if (headers == null) {
        throw new IOException("Spreadsheet has no header row, file=" + path);
      }
      return TabularFile.create(headers, rows.build());
    } catch (EncryptedDocumentException | IllegalArgumentException e) {
      throw new IOException("Unreadable spreadsheet, file=" + path, e);
    }
  }

  private static String toText(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
    if (cell == null || cell.getCellType() == CellType.BLANK) {
      return "";
    }
    if (cell.getCellType() == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
      LocalDateTime value = cell.getLocalDateTimeCellValue();
      return value.getNano() == 0 ? WHOLE_SECONDS.format(value) : MILLIS.format(value);
    }
    return formatter.formatCellValue(cell, evaluator).trim();
  }
}
