package com.acme.intake.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One parsed spreadsheet row. {@code fields} maps configured column names to typed values in
 * column order and may hold nulls for blank cells.
 */
public record IntakeRecord(String uniqueKey, Map<String, Object> fields, UUID sourceJobId) {

  public IntakeRecord {
    Objects.requireNonNull(uniqueKey, "uniqueKey");
    Objects.requireNonNull(sourceJobId, "sourceJobId");
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public Object value(String column) {
    return fields.get(column);
  }
}
