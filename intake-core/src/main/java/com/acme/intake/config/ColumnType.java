package com.acme.intake.config;

import com.acme.intake.core.ConfigException;
import java.sql.Types;
import java.util.Locale;

/** Value type of a configured spreadsheet column and the SQL type it is stored as. */
public enum ColumnType {
  TEXT("VARCHAR(4000)", Types.VARCHAR),
  NUMBER("DECIMAL(38,10)", Types.DECIMAL),
  DATE("DATE", Types.DATE),
  TIMESTAMP("TIMESTAMP", Types.TIMESTAMP),
  BOOLEAN("BOOLEAN", Types.BOOLEAN);

  private final String sqlType;
  private final int jdbcType;

  ColumnType(String sqlType, int jdbcType) {
    this.sqlType = sqlType;
    this.jdbcType = jdbcType;
  }

  public String sqlType() {
    return sqlType;
  }

  public int jdbcType() {
    return jdbcType;
  }

  public static ColumnType parse(String value) {
    String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    return switch (v) {
      case "text", "string", "varchar" -> TEXT;
      case "number", "numeric", "decimal", "int", "integer" -> NUMBER;
      case "date" -> DATE;
      case "timestamp", "datetime" -> TIMESTAMP;
      case "boolean", "bool" -> BOOLEAN;
      default -> throw new ConfigException("Unknown column type: '" + value + "'");
    };
  }
}
