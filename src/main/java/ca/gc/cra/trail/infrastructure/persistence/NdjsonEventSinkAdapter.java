package ca.gc.cra.trail.infrastructure.persistence;

import ca.gc.cra.trail.application.errors.SinkWriteException;
import ca.gc.cra.trail.application.port.EventSinkPort;
import ca.gc.cra.trail.domain.events.ActivityEvent;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-based {@link EventSinkPort} that appends one JSON object per line.
 *
 * <p>The file is opened lazily on the first event, in append mode, so a session that never logs leaves no file
 * behind and an open failure is reported through the writer's error path. With compression on, output goes through a
 * sync-flushing {@link GZIPOutputStream}, so every flushed line is readable by {@code zcat} while the session runs.
 * When {@code rollMiB} is positive a new part is started before a line would push the current part past the limit;
 * sizes are measured on uncompressed bytes.</p>
 *
 * <p>Each line and its terminator go out in a single write. After a failed write the stream is dropped and the next
 * event reopens the file; an uncompressed file whose last line was cut short gets a terminating newline first, so the
 * fragment stays on a line of its own.</p>
 *
 * <p>Not thread-safe; owned by the writer thread.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonEventSinkAdapter implements EventSinkPort {
  private static final Logger log = LoggerFactory.getLogger(NdjsonEventSinkAdapter.class);
  private static final int BUFFER_BYTES = 64 * 1024;

  private final Path directory;
  private final String sessionId;
  private final boolean compressed;
  private final long rollBytes;
  private final EventJsonCodec codec;

  private OutputStream out;
  private volatile Path currentFile;
  private long partBytes;
  private int partIndex;
  private boolean closed;

  /**
   * Creates a sink for one session.
   *
   * @param directory log directory; created on first write
   * @param sessionId session id, used as the file name stem
   * @param compressed gzip the output
   * @param rollMiB part size limit in mebibytes; non-positive disables rolling
   * @param codec JSON codec
   */
  public NdjsonEventSinkAdapter(
      Path directory, String sessionId, boolean compressed, int rollMiB, EventJsonCodec codec) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.compressed = compressed;
    this.rollBytes = rollMiB <= 0 ? 0L : rollMiB * 1024L * 1024L;
    this.currentFile = directory.resolve(SessionLogFiles.fileName(sessionId, 0, compressed));
  }

  @Override
  public void persist(ActivityEvent event) {
    Objects.requireNonNull(event, "event");
    if (closed) {
      throw new SinkWriteException("Sink for " + sessionId + " is closed");
    }
    byte[] line = codec.encode(event).getBytes(StandardCharsets.UTF_8);
    byte[] record = Arrays.copyOf(line, line.length + 1);
    record[line.length] = '\n';
    try {
      if (out == null) {
        open();
      } else if (rollBytes > 0 && partBytes > 0 && partBytes + record.length > rollBytes) {
        roll();
      }
      out.write(record);
      partBytes += record.length;
    } catch (IOException ex) {
      discardCurrent(ex);
      throw new SinkWriteException("Failed to append event " + event.eventId() + " to " + currentFile, ex);
    }
  }

  @Override
  public void flush() {
    if (out == null) {
      return;
    }
    try {
      out.flush();
    } catch (IOException ex) {
      throw new SinkWriteException("Failed to flush " + currentFile, ex);
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      closeCurrent();
    } catch (IOException ex) {
      throw new SinkWriteException("Failed to close " + currentFile, ex);
    }
  }

  @Override
  public Optional<Path> location() {
    return Optional.of(currentFile);
  }

  private void open() throws IOException {
    Files.createDirectories(directory);
    currentFile = directory.resolve(SessionLogFiles.fileName(sessionId, partIndex, compressed));
    partBytes = Files.exists(currentFile) ? Files.size(currentFile) : 0L;
    if (!compressed && partBytes > 0 && !endsWithNewline(currentFile)) {
      Files.write(currentFile, new byte[] {'\n'}, StandardOpenOption.APPEND);
      partBytes++;
      log.warn("Activity log {} ended with a partial line; terminated it before appending", currentFile);
    }
    OutputStream file = Files.newOutputStream(
        currentFile, StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    try {
      OutputStream buffered = new BufferedOutputStream(file, BUFFER_BYTES);
      out = compressed ? new GZIPOutputStream(buffered, BUFFER_BYTES, true) : buffered;
    } catch (IOException ex) {
      file.close();
      throw ex;
    }
    log.debug("Opened activity log {}", currentFile);
  }

  private void roll() throws IOException {
    closeCurrent();
    partIndex++;
    open();
    log.info("Rolled activity log for {} to part {}", sessionId, partIndex);
  }

  private static boolean endsWithNewline(Path file) throws IOException {
    try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
      ByteBuffer last = ByteBuffer.allocate(1);
      channel.position(channel.size() - 1);
      channel.read(last);
      return last.get(0) == '\n';
    }
  }

  private void discardCurrent(IOException failure) {
    if (out == null) {
      return;
    }
    OutputStream broken = out;
    out = null;
    try {
      broken.close();
    } catch (IOException closeFailure) {
      failure.addSuppressed(closeFailure);
    }
  }

  private void closeCurrent() throws IOException {
    if (out == null) {
      return;
    }
    try {
      out.flush();
    } finally {
      out.close();
      out = null;
    }
  }
}
