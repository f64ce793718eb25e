package com.acme.intake.config;

/** One configured column: normalized name, value type and whether a file must carry it. */
public record ColumnSpec(String name, ColumnType type, boolean required) {

  public ColumnSpec {
    name = SheetLayout.normalizeHeader(name);
  }
}
