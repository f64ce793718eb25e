package com.acme.intake.processor.file;

import com.acme.intake.config.ColumnSpec;
import com.acme.intake.config.IntakeConfig;
import com.acme.intake.config.SheetLayout;
import com.acme.intake.core.ValidationException;
import com.acme.intake.repository.DedupRepository;
import jakarta.inject.Singleton;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

/**
 * Fingerprints, dedup-checks and parses incoming workbooks (.xlsx and .xls).
 */
@Slf4j
@Singleton
public class FileProcessor {

  private final DedupRepository dedup;
  private final SheetLayout layout;

  public FileProcessor(DedupRepository dedup, IntakeConfig config) {
    this.dedup = dedup;
    this.layout = config.getLayout();
  }

  /** Lower-case hex SHA-256 of the raw bytes. */
  public String fingerprint(byte[] content) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /** True only when a job with this content has committed. */
  public boolean isDuplicate(String contentHash) {
    return dedup.isCommitted(contentHash);
  }

  /**
   * Opens the workbook and matches the header row of its first sheet against the layout. Rows are
   * read later, while the returned sheet is iterated.
   *
   * @throws ValidationException when the content is not a readable workbook, the header row lacks
   *     the key or a required column, or there are no rows below the header
   */
  public ParsedSheet parse(byte[] content, UUID jobId) {
    if (content == null || content.length == 0) {
      throw new ValidationException("File is empty");
    }
    Workbook workbook = open(content);
    try {
      if (workbook.getNumberOfSheets() == 0) {
        throw new ValidationException("Workbook has no sheets");
      }
      Sheet sheet = workbook.getSheetAt(0);
      Row header = sheet.getPhysicalNumberOfRows() == 0 ? null : sheet.getRow(sheet.getFirstRowNum());
      if (header == null) {
        throw new ValidationException("Sheet '" + sheet.getSheetName() + "' has no header row");
      }
      Map<ColumnSpec, Integer> indexes = matchHeader(header, sheet.getSheetName());
      if (sheet.getLastRowNum() <= header.getRowNum()) {
        throw new ValidationException("Sheet '" + sheet.getSheetName() + "' has no data rows");
      }
      log.info("Job {}: parsing sheet '{}' with {} matched columns, up to {} data rows",
          jobId, sheet.getSheetName(), indexes.values().stream().filter(i -> i != null).count(),
          sheet.getLastRowNum() - header.getRowNum());
      return new ParsedSheet(workbook, sheet, jobId, layout.keyColumn(), indexes);
    } catch (RuntimeException e) {
      closeQuietly(workbook, e);
      throw e;
    }
  }

  /** Column to cell index, in layout order. Optional columns missing from the header map to null. */
  private Map<ColumnSpec, Integer> matchHeader(Row header, String sheetName) {
    Map<String, Integer> positions = new HashMap<>();
    for (Cell cell : header) {
      String name = SheetLayout.normalizeHeader(CellReader.headerText(cell));
      if (!name.isEmpty()) {
        positions.putIfAbsent(name, cell.getColumnIndex());
      }
    }

    Map<ColumnSpec, Integer> indexes = new LinkedHashMap<>();
    List<String> missing = new ArrayList<>();
    for (ColumnSpec column : layout.allColumns()) {
      Integer index = positions.get(column.name());
      if (index == null && column.required()) {
        missing.add(column.name());
      }
      indexes.put(column, index);
    }
    if (!missing.isEmpty()) {
      throw new ValidationException(String.format(
          "Sheet '%s' is missing required columns %s (found %s)", sheetName, missing, positions.keySet()));
    }
    return indexes;
  }

  private static Workbook open(byte[] content) {
    try {
      return WorkbookFactory.create(new ByteArrayInputStream(content));
    } catch (EncryptedDocumentException e) {
      throw new ValidationException("Workbook is password protected", e);
    } catch (IOException | IllegalArgumentException | IllegalStateException | POIXMLException e) {
      throw new ValidationException("Not a readable workbook: " + e.getMessage(), e);
    }
  }

  private static void closeQuietly(Workbook workbook, RuntimeException cause) {
    try {
      workbook.close();
    } catch (IOException e) {
      cause.addSuppressed(e);
    }
  }
}
