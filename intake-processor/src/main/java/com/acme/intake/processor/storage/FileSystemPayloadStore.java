package com.acme.intake.processor.storage;

import com.acme.intake.config.IntakeConfig;
import com.acme.intake.config.StorageConfig;
import com.acme.intake.core.Jsons;
import com.acme.intake.core.PermanentException;
import com.acme.intake.core.TransientException;
import com.acme.intake.spi.PayloadStore;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Payload areas on the local file system under the configured base directory:
 * {@code pending/}, {@code processed/<yyyyMMdd>/} and {@code errors/}.
 */
@Slf4j
@Singleton
public class FileSystemPayloadStore implements PayloadStore {

  static final String TEMP_PREFIX = ".incoming-";
  static final String ERROR_SUFFIX = ".error.json";
  private static final int MAX_NAME_LENGTH = 120;

  private static final DateTimeFormatter RECEIVED =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter DAY =
      DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

  private final Path pending;
  private final Path processed;
  private final Path errors;

  public FileSystemPayloadStore(IntakeConfig config) {
    StorageConfig storage = config.getStorage();
    this.pending = storage.pendingDir().toAbsolutePath().normalize();
    this.processed = storage.processedDir().toAbsolutePath().normalize();
    this.errors = storage.errorsDir().toAbsolutePath().normalize();
  }

  @Override
  public Path admit(byte[] content, String filename, Instant receivedAt) {
    String name = RECEIVED.format(receivedAt) + "_" + UUID.randomUUID().toString().substring(0, 8)
        + "_" + sanitize(filename);
    try {
      Files.createDirectories(pending);
      Path temp = Files.createTempFile(pending, TEMP_PREFIX, ".tmp");
      try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
        ByteBuffer buffer = ByteBuffer.wrap(content);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(true);
      }
      Path target = Files.move(temp, pending.resolve(name), StandardCopyOption.ATOMIC_MOVE);
      log.info("Admitted {} ({} bytes) as {}", filename, content.length, target.getFileName());
      return target;
    } catch (IOException e) {
      throw new TransientException("Failed to write payload " + filename + " to " + pending, e);
    }
  }

  @Override
  public byte[] read(Path payload) {
    try {
      return Files.readAllBytes(payload);
    } catch (IOException e) {
      throw new TransientException("Failed to read payload " + payload, e);
    }
  }

  @Override
  public Optional<Path> locate(String payloadPath) {
    Path path = Path.of(payloadPath);
    if (Files.isRegularFile(path)) {
      return Optional.of(path);
    }
    Path name = path.getFileName();
    if (name == null) {
      return Optional.empty();
    }
    Optional<Path> found = find(processed, 2, name).or(() -> find(errors, 1, name));
    found.ifPresent(p -> log.info("Payload {} found at {}", payloadPath, p));
    return found;
  }

  @Override
  public Path moveToProcessed(Path payload, Instant processedAt) {
    Path source = payload.toAbsolutePath().normalize();
    if (source.startsWith(processed)) {
      return source;
    }
    return move(source, processed.resolve(DAY.format(processedAt)));
  }

  @Override
  public Path moveToErrors(Path payload, Map<String, Object> errorReport) {
    Path source = payload.toAbsolutePath().normalize();
    Path target = source.startsWith(errors) ? source : move(source, errors);
    Path sidecar = target.resolveSibling(target.getFileName() + ERROR_SUFFIX);
    try {
      Path temp = Files.createTempFile(errors, TEMP_PREFIX, ".tmp");
      Files.write(temp, Jsons.toPrettyJson(errorReport).getBytes(StandardCharsets.UTF_8));
      Files.move(temp, sidecar, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new TransientException("Failed to write error report " + sidecar, e);
    }
    return target;
  }

  @Override
  public List<Path> listPending() {
    if (!Files.isDirectory(pending)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(pending)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> !p.getFileName().toString().startsWith(TEMP_PREFIX))
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new TransientException("Failed to list " + pending, e);
    }
  }

  @Override
  public int sweepProcessed(Instant cutoff, Set<Path> retained) {
    if (!Files.isDirectory(processed)) {
      return 0;
    }
    List<Path> expired = new ArrayList<>();
    try (Stream<Path> files = Files.walk(processed, 2)) {
      for (Path file : (Iterable<Path>) files.filter(Files::isRegularFile)::iterator) {
        if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff) && !retained.contains(file)) {
          expired.add(file);
        }
      }
    } catch (IOException e) {
      throw new TransientException("Failed to scan " + processed, e);
    }

    int deleted = 0;
    for (Path file : expired) {
      try {
        Files.deleteIfExists(file);
        deleted++;
      } catch (IOException e) {
        log.warn("Could not delete expired payload {}: {}", file, e.getMessage());
      }
    }
    removeEmptyDayDirectories();
    return deleted;
  }

  @Override
  public void checkWritable() {
    for (Path area : List.of(pending, processed, errors)) {
      try {
        Files.createDirectories(area);
        Files.deleteIfExists(Files.createTempFile(area, TEMP_PREFIX, ".probe"));
      } catch (IOException e) {
        throw new PermanentException("Storage area " + area + " is not writable: " + e.getMessage(), e);
      }
    }
  }

  private Path move(Path source, Path directory) {
    try {
      Files.createDirectories(directory);
      Path target = Files.move(source, uniqueTarget(directory, source.getFileName().toString()),
          StandardCopyOption.ATOMIC_MOVE);
      log.debug("Moved {} to {}", source.getFileName(), target);
      return target;
    } catch (IOException e) {
      throw new TransientException("Failed to move " + source + " to " + directory, e);
    }
  }

  private static Path uniqueTarget(Path directory, String name) {
    Path candidate = directory.resolve(name);
    int dot = name.lastIndexOf('.');
    String base = dot > 0 ? name.substring(0, dot) : name;
    String extension = dot > 0 ? name.substring(dot) : "";
    for (int n = 1; Files.exists(candidate); n++) {
      candidate = directory.resolve(base + "_" + n + extension);
    }
    return candidate;
  }

  private static Optional<Path> find(Path root, int depth, Path name) {
    if (!Files.isDirectory(root)) {
      return Optional.empty();
    }
    try (Stream<Path> files = Files.walk(root, depth)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().equals(name))
          .findFirst();
    } catch (IOException e) {
      throw new TransientException("Failed to search " + root + " for " + name, e);
    }
  }

  private void removeEmptyDayDirectories() {
    try (Stream<Path> dirs = Files.list(processed)) {
      for (Path dir : (Iterable<Path>) dirs.filter(Files::isDirectory).sorted(Comparator.reverseOrder())::iterator) {
        try (Stream<Path> entries = Files.list(dir)) {
          if (entries.findAny().isEmpty()) {
            Files.delete(dir);
            log.debug("Removed empty directory {}", dir);
          }
        }
      }
    } catch (IOException e) {
      log.warn("Could not clean up empty directories under {}: {}", processed, e.getMessage());
    }
  }

  /** Keeps letters, digits, dot, dash and underscore from the last path segment. */
  static String sanitize(String filename) {
    if (filename == null || filename.isBlank()) {
      return "payload";
    }
    String last = filename.substring(Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\')) + 1);
    String cleaned = last.trim().replaceAll("[^A-Za-z0-9._-]", "_");
    if (cleaned.isEmpty() || cleaned.chars().allMatch(c -> c == '.')) {
      return "payload";
    }
    return cleaned.length() > MAX_NAME_LENGTH ? cleaned.substring(cleaned.length() - MAX_NAME_LENGTH) : cleaned;
  }
}
