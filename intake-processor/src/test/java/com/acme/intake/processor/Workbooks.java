package com.acme.intake.processor;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/** Builds small workbooks in memory. A null value leaves the cell out. */
public final class Workbooks {

  private Workbooks() {}

  public static byte[] xlsx(List<String> header, List<?>... rows) {
    return write(new XSSFWorkbook(), header, rows);
  }

  public static byte[] xls(List<String> header, List<?>... rows) {
    return write(new HSSFWorkbook(), header, rows);
  }

  public static List<Object> row(Object... values) {
    return Arrays.asList(values);
  }

  private static byte[] write(Workbook workbook, List<String> header, List<?>... rows) {
    try (workbook; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      CellStyle dateStyle = workbook.createCellStyle();
      dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));

      Sheet sheet = workbook.createSheet("Shipments");
      if (header != null) {
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < header.size(); i++) {
          headerRow.createCell(i).setCellValue(header.get(i));
        }
      }
      for (int r = 0; r < rows.length; r++) {
        Row row = sheet.createRow(r + 1);
        List<?> values = rows[r];
        for (int c = 0; c < values.size(); c++) {
          Object value = values.get(c);
          if (value instanceof String) {
            row.createCell(c).setCellValue((String) value);
          } else if (value instanceof Number) {
            row.createCell(c).setCellValue(((Number) value).doubleValue());
          } else if (value instanceof Boolean) {
            row.createCell(c).setCellValue((Boolean) value);
          } else if (value instanceof LocalDate) {
            var cell = row.createCell(c);
            cell.setCellValue((LocalDate) value);
            cell.setCellStyle(dateStyle);
          }
        }
      }
      workbook.write(out);
      return out.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
