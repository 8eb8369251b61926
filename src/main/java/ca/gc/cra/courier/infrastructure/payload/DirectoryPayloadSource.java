package ca.gc.cra.courier.infrastructure.payload;

import ca.gc.cra.courier.application.port.PayloadSource;
import ca.gc.cra.courier.domain.payload.Payload;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads image files from a directory as payloads.
 *
 * <p>Only regular files ending in {@code .jpg}, {@code .jpeg}, or {@code .png} (any case) are read; they are
 * submitted in file-name order and tagged by position.</p>
 *
 * @since 0.1.0
 */
public final class DirectoryPayloadSource implements PayloadSource {
  private static final Logger log = LoggerFactory.getLogger(DirectoryPayloadSource.class);
  private static final Set<String> EXTENSIONS = Set.of("jpg", "jpeg", "png");

  private final Path directory;

  /**
   * Creates a source.
   *
   * @param directory directory to scan (not recursive)
   */
  public DirectoryPayloadSource(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  /**
   * Lists the image files that {@link #load()} would read.
   *
   * @return sorted image paths
   * @throws IOException if the directory is missing or cannot be listed
   */
  public List<Path> imageFiles() throws IOException {
    if (!Files.isDirectory(directory)) {
      throw new NoSuchFileException(directory.toString(), null, "image directory does not exist");
    }
    try (Stream<Path> entries = Files.list(directory)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(DirectoryPayloadSource::isImage)
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .collect(Collectors.toList());
    }
  }

  @Override
  public List<Payload> load() throws IOException {
    List<Path> files = imageFiles();
    List<Payload> payloads = new ArrayList<>(files.size());
    for (Path file : files) {
      byte[] data = Files.readAllBytes(file);
      payloads.add(new Payload(payloads.size(), file.getFileName().toString(), data));
      log.debug("Loaded image {} ({} bytes)", file, data.length);
    }
    if (payloads.isEmpty()) {
      log.warn("No .jpg/.jpeg/.png files found in {}", directory);
    } else {
      log.info("Loaded {} images from {}", payloads.size(), directory);
    }
    return payloads;
  }

  static boolean isImage(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 && EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
  }
}
