package com.shelfscan.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelfscan.exception.QueueException;
import com.shelfscan.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * {@link DurableQueue} backed by a directory. Each entry is an image file {@code <id>.jpg} plus a
 * metadata file {@code <id>.json}. Both are written to a temporary name and moved into place, the
 * metadata last, so a crash mid-write never produces an entry that {@link #drainAll()} returns.
 *
 * <p>All operations are serialized on this instance; one instance should own a directory.
 */
public final class FileSystemDurableQueue implements DurableQueue {
  private static final org.slf4j.Logger log =
      com.shelfscan.logging.LoggingService.getLogger(FileSystemDurableQueue.class);

  private static final String METADATA_SUFFIX = ".json";
  private static final String IMAGE_SUFFIX = ".jpg";

  /** On-disk metadata of one entry. */
  record Metadata(
      String id, Instant enqueuedAt, long sequence, String deviceIdentifier, String imageFile) {}

  private final Path directory;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();
  private long lastSequence;

  public FileSystemDurableQueue(Path directory) {
    this.directory = directory.toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.directory);
    } catch (IOException e) {
      throw new QueueException("Cannot create queue directory " + this.directory, e);
    }
    this.lastSequence = drainAll().stream().mapToLong(QueuedPayload::sequence).max().orElse(0);
    log.debug("Durable queue at {} (next sequence {})", this.directory, lastSequence + 1);
  }

  @Override
  public synchronized QueueHandle enqueue(byte[] imageBytes, String deviceIdentifier) {
    String id = UUID.randomUUID().toString();
    Metadata metadata =
        new Metadata(id, Instant.now(), ++lastSequence, deviceIdentifier, id + IMAGE_SUFFIX);
    Path image = directory.resolve(metadata.imageFile());
    try {
      writeAtomically(image, imageBytes);
      writeAtomically(directory.resolve(id + METADATA_SUFFIX), mapper.writeValueAsBytes(metadata));
    } catch (IOException e) {
      deleteQuietly(image);
      throw new QueueException("Failed to persist queued scan " + id, e);
    }
    log.info("Queued scan {} for later upload ({} bytes)", id, imageBytes.length);
    return new QueueHandle(id);
  }

  @Override
  public synchronized List<QueuedPayload> drainAll() {
    List<QueuedPayload> result = new ArrayList<>();
    try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + METADATA_SUFFIX)) {
      for (Path file : files) {
        try {
          Metadata metadata = mapper.readValue(file.toFile(), Metadata.class);
          byte[] imageBytes = Files.readAllBytes(directory.resolve(metadata.imageFile()));
          result.add(
              new QueuedPayload(
                  new QueueHandle(metadata.id()),
                  imageBytes,
                  metadata.deviceIdentifier(),
                  metadata.enqueuedAt(),
                  metadata.sequence()));
        } catch (IOException | RuntimeException e) {
          log.warn("Skipping unreadable queue entry {}: {}", file.getFileName(), e.toString());
        }
      }
    } catch (IOException e) {
      throw new QueueException("Failed to list queue directory " + directory, e);
    }
    result.sort(QueuedPayload.ENQUEUE_ORDER);
    return result;
  }

  @Override
  public synchronized void remove(QueueHandle handle) {
    if (handle == null) {
      return;
    }
    try {
      // metadata first: once it is gone the entry is no longer visible
      Files.deleteIfExists(directory.resolve(handle.id() + METADATA_SUFFIX));
      Files.deleteIfExists(directory.resolve(handle.id() + IMAGE_SUFFIX));
      log.debug("Removed queued scan {}", handle.id());
    } catch (IOException e) {
      throw new QueueException("Failed to remove queued scan " + handle.id(), e);
    }
  }

  @Override
  public synchronized int size() {
    int count = 0;
    try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + METADATA_SUFFIX)) {
      for (Path ignored : files) {
        count++;
      }
    } catch (IOException e) {
      throw new QueueException("Failed to list queue directory " + directory, e);
    }
    return count;
  }

  public Path directory() {
    return directory;
  }

  private void writeAtomically(Path target, byte[] bytes) throws IOException {
    Path tmp = directory.resolve(target.getFileName() + ".tmp");
    Files.write(tmp, bytes);
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.debug("Could not delete {}: {}", path, e.toString());
    }
  }
}
