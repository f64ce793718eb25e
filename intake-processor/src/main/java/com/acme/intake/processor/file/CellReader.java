package com.acme.intake.processor.file;

import com.acme.intake.config.ColumnType;
import com.acme.intake.core.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;

/** Converts a POI cell into the Java value for its configured column type. */
final class CellReader {

  private CellReader() {}

  /**
   * @return the typed value, or null for a missing or blank cell
   * @throws ValidationException when the cell cannot hold a value of {@code type}
   */
  static Object read(Cell cell, ColumnType type, int rowNumber, String column) {
    if (cell == null) {
      return null;
    }
    CellType cellType = effectiveType(cell);
    try {
      return switch (type) {
        case TEXT -> text(cell, cellType);
        case NUMBER -> number(cell, cellType);
        case DATE -> {
          LocalDateTime value = dateTime(cell, cellType);
          yield value == null ? null : value.toLocalDate();
        }
        case TIMESTAMP -> dateTime(cell, cellType);
        case BOOLEAN -> bool(cell, cellType);
      };
    } catch (NumberFormatException | DateTimeParseException | IllegalStateException e) {
      throw invalid(cell, type, rowNumber, column);
    }
  }

  static boolean isBlank(Cell cell) {
    if (cell == null) {
      return true;
    }
    CellType cellType = effectiveType(cell);
    return cellType == CellType.BLANK
        || (cellType == CellType.STRING && cell.getStringCellValue().trim().isEmpty());
  }

  /** Header cells that hold no readable text count as empty. */
  static String headerText(Cell cell) {
    try {
      return text(cell, effectiveType(cell));
    } catch (IllegalStateException e) {
      return null;
    }
  }

  static String text(Cell cell, CellType cellType) {
    return switch (cellType) {
      case STRING -> emptyToNull(cell.getStringCellValue());
      case NUMERIC -> DateUtil.isCellDateFormatted(cell)
          ? cell.getLocalDateTimeCellValue().toString()
          : BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
      case BOOLEAN -> String.valueOf(cell.getBooleanCellValue());
      case BLANK -> null;
      default -> throw new IllegalStateException("Unreadable cell type " + cellType);
    };
  }

  private static BigDecimal number(Cell cell, CellType cellType) {
    return switch (cellType) {
      case NUMERIC -> BigDecimal.valueOf(cell.getNumericCellValue());
      case STRING -> {
        String value = emptyToNull(cell.getStringCellValue());
        yield value == null ? null : new BigDecimal(value);
      }
      case BLANK -> null;
      default -> throw new IllegalStateException("Not a number: " + cellType);
    };
  }

  private static LocalDateTime dateTime(Cell cell, CellType cellType) {
    return switch (cellType) {
      case NUMERIC -> cell.getLocalDateTimeCellValue();
      case STRING -> {
        String value = emptyToNull(cell.getStringCellValue());
        if (value == null) {
          yield null;
        }
        yield value.length() == 10
            ? LocalDate.parse(value).atStartOfDay()
            : LocalDateTime.parse(value.replace(' ', 'T'));
      }
      case BLANK -> null;
      default -> throw new IllegalStateException("Not a date: " + cellType);
    };
  }

  private static Boolean bool(Cell cell, CellType cellType) {
    return switch (cellType) {
      case BOOLEAN -> cell.getBooleanCellValue();
      case NUMERIC -> {
        double value = cell.getNumericCellValue();
        if (value == 1d) {
          yield Boolean.TRUE;
        }
        if (value == 0d) {
          yield Boolean.FALSE;
        }
        throw new IllegalStateException("Not a boolean: " + value);
      }
      case STRING -> {
        String value = emptyToNull(cell.getStringCellValue());
        if (value == null) {
          yield null;
        }
        yield switch (value.toLowerCase(Locale.ROOT)) {
          case "true", "yes", "y", "1" -> Boolean.TRUE;
          case "false", "no", "n", "0" -> Boolean.FALSE;
          default -> throw new IllegalStateException("Not a boolean: " + value);
        };
      }
      case BLANK -> null;
      default -> throw new IllegalStateException("Not a boolean: " + cellType);
    };
  }

  /** Formula cells are read through their cached result. */
  private static CellType effectiveType(Cell cell) {
    CellType cellType = cell.getCellType();
    return cellType == CellType.FORMULA ? cell.getCachedFormulaResultType() : cellType;
  }

  private static String emptyToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static ValidationException invalid(Cell cell, ColumnType type, int rowNumber, String column) {
    return new ValidationException(String.format(
        "Row %d, column '%s': value '%s' is not a valid %s",
        rowNumber, column, cell, type.name().toLowerCase(Locale.ROOT)));
  }
}
