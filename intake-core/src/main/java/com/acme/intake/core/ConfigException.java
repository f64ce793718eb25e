package com.acme.intake.core;

/** Invalid or missing configuration. Raised at startup only, before any job runs. */
public class ConfigException extends RuntimeException {
  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable e) {
    super(message, e);
  }
}
