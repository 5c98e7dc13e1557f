package com.sitecam.timelapse.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

@Slf4j
public class LocalArtifactStore {
  private static final String TEMP_FILE_MARKER = ".tmp";

  @Getter private final Path baseDirectory;

  public LocalArtifactStore(Path baseDirectory) {
    this.baseDirectory = baseDirectory;
  }

  public Path resolve(String relativePath) {
    return baseDirectory.resolve(relativePath);
  }

  public boolean exists(Path path) {
    return Files.isRegularFile(path);
  }

  /** Sibling path for an in-progress write, keeping the extension so encoders can infer format. */
  public Path newTempPath(Path target) {
    String fileName = target.getFileName().toString();
    String extension = FilenameUtils.getExtension(fileName);
    return target.resolveSibling(
        String.format(
            ".%s.%s%s%s",
            FilenameUtils.getBaseName(fileName),
            UUID.randomUUID(),
            TEMP_FILE_MARKER,
            extension.isEmpty() ? "" : "." + extension));
  }

  public void publish(Path tempPath, Path target) {
    try {
      Files.createDirectories(target.getParent());
      Files.move(
          tempPath, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      log.debug("Published {}", target);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to publish " + target, e);
    }
  }

  public void write(Path target, byte[] content) {
    Path tempPath = newTempPath(target);
    try {
      Files.createDirectories(target.getParent());
      Files.write(tempPath, content);
    } catch (IOException e) {
      delete(tempPath);
      throw new UncheckedIOException("Failed to write " + target, e);
    }
    publish(tempPath, target);
  }

  public void prepareParent(Path target) {
    try {
      Files.createDirectories(target.getParent());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create directory for " + target, e);
    }
  }

  public boolean delete(Path path) {
    try {
      return Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Failed to delete {}", path, e);
      return false;
    }
  }

  /** File names directly under {@code relativeDirectory}, skipping in-progress writes. */
  public List<String> list(String relativeDirectory) {
    Path directory = resolve(relativeDirectory);
    if (!Files.isDirectory(directory)) {
      return Collections.emptyList();
    }
    try (Stream<Path> paths = Files.list(directory)) {
      return paths
          .filter(Files::isRegularFile)
          .map(path -> path.getFileName().toString())
          .filter(name -> !name.startsWith("."))
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + directory, e);
    }
  }
}
