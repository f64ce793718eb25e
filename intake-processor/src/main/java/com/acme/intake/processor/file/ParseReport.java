package com.acme.intake.processor.file;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Row counts and warnings collected while a sheet is iterated. */
public class ParseReport {

  static final int MAX_WARNINGS = 100;

  private int dataRows;
  private int accepted;
  private int dropped;
  private final List<String> warnings = new ArrayList<>();

  void dataRow() {
    dataRows++;
  }

  void accepted() {
    accepted++;
  }

  void dropped(String warning) {
    dropped++;
    warn(warning);
  }

  void warn(String warning) {
    if (warnings.size() < MAX_WARNINGS) {
      warnings.add(warning);
    }
  }

  public int getDataRows() {
    return dataRows;
  }

  public int getAccepted() {
    return accepted;
  }

  public int getDropped() {
    return dropped;
  }

  /** At most {@value #MAX_WARNINGS} warnings are kept. */
  public List<String> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }

  @Override
  public String toString() {
    return "dataRows=" + dataRows + ", accepted=" + accepted + ", dropped=" + dropped;
  }
}
