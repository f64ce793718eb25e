package com.acme.intake.processor.file;

import com.acme.intake.config.ColumnSpec;
import com.acme.intake.config.ColumnType;
import com.acme.intake.core.ValidationException;
import com.acme.intake.domain.IntakeRecord;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;

/**
 * Records of one sheet, built lazily while iterating. Can be iterated once only.
 *
 * <p>Blank rows are skipped. Rows without a key, or repeating a key seen earlier in the same
 * sheet, are dropped with a warning. A cell that does not fit its column type fails the whole
 * sheet, as does a sheet whose data rows are all dropped.
 */
@Slf4j
public class ParsedSheet implements Iterable<IntakeRecord>, AutoCloseable {

  private final Workbook workbook;
  private final Sheet sheet;
  private final UUID jobId;
  private final ColumnSpec keyColumn;
  private final Map<ColumnSpec, Integer> columnIndexes;
  private final ParseReport report = new ParseReport();
  private boolean iterated;

  ParsedSheet(Workbook workbook, Sheet sheet, UUID jobId, ColumnSpec keyColumn,
      Map<ColumnSpec, Integer> columnIndexes) {
    this.workbook = workbook;
    this.sheet = sheet;
    this.jobId = jobId;
    this.keyColumn = keyColumn;
    this.columnIndexes = columnIndexes;
  }

  @Override
  public synchronized Iterator<IntakeRecord> iterator() {
    if (iterated) {
      throw new IllegalStateException("Sheet for job " + jobId + " was already iterated");
    }
    iterated = true;
    return new RecordIterator(sheet.getFirstRowNum() + 1, sheet.getLastRowNum());
  }

  /** Drains the sheet into memory. */
  public List<IntakeRecord> toList() {
    List<IntakeRecord> records = new ArrayList<>();
    forEach(records::add);
    return records;
  }

  /** Counts so far. Complete once iteration has finished. */
  public ParseReport report() {
    return report;
  }

  @Override
  public void close() {
    try {
      workbook.close();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to close workbook for job " + jobId, e);
    }
  }

  private final class RecordIterator implements Iterator<IntakeRecord> {

    private final int lastRow;
    private final Set<String> seenKeys = new HashSet<>();
    private int nextRow;
    private IntakeRecord next;
    private boolean finished;

    RecordIterator(int firstRow, int lastRow) {
      this.nextRow = firstRow;
      this.lastRow = lastRow;
    }

    @Override
    public boolean hasNext() {
      if (next == null && !finished) {
        advance();
      }
      return next != null;
    }

    @Override
    public IntakeRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      IntakeRecord record = next;
      next = null;
      return record;
    }

    private void advance() {
      while (nextRow <= lastRow) {
        int rowIndex = nextRow++;
        IntakeRecord record = toRecord(sheet.getRow(rowIndex), rowIndex + 1);
        if (record != null) {
          next = record;
          return;
        }
      }
      finished = true;
      finish();
    }

    private IntakeRecord toRecord(Row row, int rowNumber) {
      if (isBlank(row)) {
        return null;
      }
      report.dataRow();

      Cell keyCell = row.getCell(columnIndexes.get(keyColumn), Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
      String key = (String) CellReader.read(keyCell, ColumnType.TEXT, rowNumber, keyColumn.name());
      if (key == null) {
        drop(String.format("Row %d: blank %s, row dropped", rowNumber, keyColumn.name()));
        return null;
      }
      if (!seenKeys.add(key)) {
        drop(String.format("Row %d: %s '%s' already seen in this file, row dropped",
            rowNumber, keyColumn.name(), key));
        return null;
      }

      Map<String, Object> fields = new LinkedHashMap<>();
      for (Map.Entry<ColumnSpec, Integer> entry : columnIndexes.entrySet()) {
        ColumnSpec column = entry.getKey();
        if (column.equals(keyColumn)) {
          fields.put(column.name(), key);
          continue;
        }
        Cell cell = entry.getValue() == null
            ? null
            : row.getCell(entry.getValue(), Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
        fields.put(column.name(), CellReader.read(cell, column.type(), rowNumber, column.name()));
      }
      report.accepted();
      return new IntakeRecord(key, fields, jobId);
    }

    private void drop(String warning) {
      log.warn("Job {}: {}", jobId, warning);
      report.dropped(warning);
    }

    private void finish() {
      if (report.getDataRows() == 0) {
        throw new ValidationException("Sheet '" + sheet.getSheetName() + "' has no data rows");
      }
      if (report.getAccepted() == 0) {
        throw new ValidationException(String.format(
            "All %d data rows of sheet '%s' were dropped: %s",
            report.getDataRows(), sheet.getSheetName(), report.getWarnings()));
      }
      log.debug("Job {}: finished reading sheet '{}' ({})", jobId, sheet.getSheetName(), report);
    }
  }

  static boolean isBlank(Row row) {
    if (row == null) {
      return true;
    }
    for (Cell cell : row) {
      if (!CellReader.isBlank(cell)) {
        return false;
      }
    }
    return true;
  }
}
