package com.acme.intake.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Expected shape of an incoming sheet: the unique-key column plus the other columns that are
 * copied into the target table. Header matching is case-insensitive, see {@link #normalizeHeader}.
 */
@Value
@Builder(toBuilder = true)
public class SheetLayout {

  @Builder.Default
  String uniqueKey = "hawb";

  @Singular
  List<ColumnSpec> columns;

  /** Key column first, then the configured columns in order. */
  public List<ColumnSpec> allColumns() {
    List<ColumnSpec> all = new ArrayList<>(columns.size() + 1);
    all.add(keyColumn());
    all.addAll(columns);
    return Collections.unmodifiableList(all);
  }

  public ColumnSpec keyColumn() {
    return new ColumnSpec(uniqueKey, ColumnType.TEXT, true);
  }

  public String keyColumnName() {
    return normalizeHeader(uniqueKey);
  }

  public Optional<ColumnSpec> column(String name) {
    String normalized = normalizeHeader(name);
    return allColumns().stream().filter(c -> c.name().equals(normalized)).findFirst();
  }

  /** Trims, lower-cases and turns inner whitespace into underscores. */
  public static String normalizeHeader(String header) {
    if (header == null) {
      return "";
    }
    return header.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
  }
}
