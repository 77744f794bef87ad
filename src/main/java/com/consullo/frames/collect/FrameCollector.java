package com.consullo.frames.collect;

import com.consullo.frames.model.FrameTable;
import com.consullo.frames.parse.DumpParser;
import com.consullo.frames.parse.ParseReport;
import com.consullo.frames.remote.RemoteExecutionException;
import com.consullo.frames.remote.RemoteExecutor;
import com.consullo.frames.remote.TargetNotRespondingException;
import com.consullo.frames.remote.TargetTimeoutException;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically samples frame data from a remote target on a background thread.
 *
 * <p>
 * A session goes through {@link CollectorState}:
 * <ul>
 * <li>{@link #start()} creates a raw capture file and starts one sampling
 * thread. Each tick calls {@link #collectOnce(OutputStream)} and then waits for
 * the configured period, measured from the end of the sample.</li>
 * <li>{@link #stop()} signals the loop, waits for it to finish and close the raw
 * file, then reports any fault that ended the loop.</li>
 * <li>{@link #processFrames(Path)} parses the raw file into a
 * {@link FrameTable} and deletes it.</li>
 * <li>{@link #writeFrames(Path, List)} exports the table.</li>
 * </ul>
 * </p>
 *
 * <p>
 * The raw file is written only by the sampling thread while running and read
 * only by the caller afterwards; the state checks keep the two apart.
 * </p>
 */
public abstract class FrameCollector {

  private static final Logger LOGGER = LoggerFactory.getLogger(FrameCollector.class);

  protected final RemoteExecutor executor;
  protected final FrameCollectorConfig config;

  private final String name;
  private final List<String> header;
  private final AtomicReference<CollectorState> state = new AtomicReference<>(CollectorState.IDLE);

  private Path rawFile;
  private CountDownLatch stopSignal;
  private CompletableFuture<Void> completion;
  private FrameTable frames;
  private int unresponsiveCount;

  protected FrameCollector(RemoteExecutor executor, FrameCollectorConfig config, List<String> header) {
    if (executor == null || config == null || header == null) {
      throw new IllegalArgumentException("executor/config/header must not be null.");
    }
    if (config.target() == null || config.target().isBlank()) {
      throw new IllegalArgumentException("target must not be blank.");
    }
    if (config.period() == null || config.period().isNegative()) {
      throw new IllegalArgumentException("period must be zero or positive.");
    }
    this.executor = executor;
    this.config = config;
    this.header = List.copyOf(header);
    this.name = getClass().getSimpleName() + "-" + config.target();
  }

  /**
   * Takes one sample from the target and appends its raw text to the sink.
   *
   * @param sink raw capture file, open for append
   * @throws RemoteExecutionException if the target cannot be queried
   * @throws IOException if the sink cannot be written
   */
  protected abstract void collectOnce(OutputStream sink) throws RemoteExecutionException, IOException;

  /**
   * Resets the frame counters kept by the target.
   *
   * @throws RemoteExecutionException if the target cannot be queried
   */
  public abstract void clear() throws RemoteExecutionException;

  /**
   * Creates a parser holding fresh per-session state.
   *
   * @return parser for this collector's raw format
   */
  protected abstract DumpParser newParser();

  /**
   * Starts the sampling loop.
   *
   * @throws IOException if the raw capture file cannot be created
   * @throws IllegalStateException if the collector is running or holds an unreset session
   */
  public void start() throws IOException {
    if (!state.compareAndSet(CollectorState.IDLE, CollectorState.RUNNING)) {
      CollectorState current = state.get();
      if (current == CollectorState.RUNNING) {
        throw new IllegalStateException(name + " is already running");
      }
      throw new IllegalStateException(name + " must be reset before it is started again (state " + current + ")");
    }

    final Path file;
    try {
      file = Files.createTempFile("frames-", ".raw");
    } catch (IOException e) {
      state.set(CollectorState.IDLE);
      throw e;
    }
    LOGGER.debug("{}: raw file {}", name, file);

    this.rawFile = file;
    this.frames = null;
    this.unresponsiveCount = 0;
    this.stopSignal = new CountDownLatch(1);
    this.completion = new CompletableFuture<>();

    final CountDownLatch signal = this.stopSignal;
    final CompletableFuture<Void> done = this.completion;
    Thread worker = new Thread(() -> runLoop(file, signal, done), name);
    worker.setDaemon(true);
    worker.start();
  }

  /**
   * Stops the sampling loop and waits until it has exited and closed the raw file.
   *
   * @throws TargetNotRespondingException if the target stopped responding during the session
   * @throws TargetTimeoutException if a command timed out during the session
   * @throws CollectorThreadException if the loop ended on any other failure, including a command that
   *     failed without losing the target
   * @throws InterruptedException if interrupted while waiting; the collector stays running
   * @throws IllegalStateException if the collector is not running
   */
  public void stop() throws RemoteExecutionException, InterruptedException {
    if (state.get() != CollectorState.RUNNING) {
      throw new IllegalStateException("Attempting to stop " + name + " while it is not running (state "
          + state.get() + ")");
    }
    stopSignal.countDown();

    Throwable fault = null;
    try {
      completion.get();
    } catch (ExecutionException e) {
      fault = e.getCause();
    }
    state.set(CollectorState.STOPPED);

    if (fault instanceof TargetNotRespondingException || fault instanceof TargetTimeoutException) {
      throw (RemoteExecutionException) fault;
    }
    if (fault instanceof CollectorThreadException) {
      throw (CollectorThreadException) fault;
    }
    if (fault != null) {
      throw new CollectorThreadException(name, fault);
    }
  }

  /**
   * Parses the raw capture into the frame table and deletes the raw file.
   *
   * @param rawCopy where to keep a copy of the raw capture, or null to discard it
   * @return what the parser accepted and dropped
   * @throws IOException if the raw file cannot be read, copied or deleted
   * @throws IllegalStateException if the collector has not been run and stopped
   */
  public ParseReport processFrames(Path rawCopy) throws IOException {
    CollectorState current = state.get();
    if (current == CollectorState.IDLE) {
      throw new IllegalStateException("Attempting to process frames before running the collector");
    }
    if (current == CollectorState.RUNNING) {
      throw new IllegalStateException("Attempting to process frames while " + name + " is still running");
    }
    if (current == CollectorState.PROCESSED) {
      throw new IllegalStateException("Frames of " + name + " were already processed");
    }

    FrameTable table = new FrameTable(header);
    ParseReport report;
    try (Reader in = new InputStreamReader(Files.newInputStream(rawFile), Charset.defaultCharset())) {
      report = newParser().parse(in, table);
    }
    unresponsiveCount = report.unresponsiveCount();
    logUnresponsive();

    if (rawCopy != null) {
      Files.copy(rawFile, rawCopy, StandardCopyOption.REPLACE_EXISTING);
    }
    Files.delete(rawFile);
    rawFile = null;

    frames = table;
    state.set(CollectorState.PROCESSED);
    LOGGER.debug("{}: {} frames accepted, {} dropped", name, report.acceptedFrames(), report.droppedFrames());
    return report;
  }

  /**
   * Writes the processed frames as CSV.
   *
   * @param outfile destination file
   * @param columns columns to export in order, or null for all
   * @throws IOException if the file cannot be written
   * @throws IllegalArgumentException if a column is not in the header
   * @throws IllegalStateException if frames have not been processed
   */
  public void writeFrames(Path outfile, List<String> columns) throws IOException {
    frames().write(outfile, columns);
  }

  /**
   * Discards the session so the collector can be started again.
   *
   * @throws IOException if an unprocessed raw file cannot be deleted
   * @throws IllegalStateException if the collector is running
   */
  public void reset() throws IOException {
    if (state.get() == CollectorState.RUNNING) {
      throw new IllegalStateException("Attempting to reset " + name + " while it is running");
    }
    if (rawFile != null) {
      Files.deleteIfExists(rawFile);
      rawFile = null;
    }
    frames = null;
    unresponsiveCount = 0;
    state.set(CollectorState.IDLE);
  }

  public FrameTable frames() {
    if (state.get() != CollectorState.PROCESSED) {
      throw new IllegalStateException("Frames of " + name + " have not been processed");
    }
    return frames;
  }

  public List<String> header() {
    return header;
  }

  public String name() {
    return name;
  }

  public CollectorState state() {
    return state.get();
  }

  /**
   * Raw capture file of the current session, or null when there is none.
   *
   * @return raw file path
   */
  public Path rawFile() {
    return rawFile;
  }

  /**
   * Unresponsive markers found by the last {@link #processFrames(Path)}.
   *
   * @return marker count
   */
  public int unresponsiveCount() {
    return unresponsiveCount;
  }

  private void runLoop(Path file, CountDownLatch signal, CompletableFuture<Void> done) {
    LOGGER.debug("{}: frame data collection started", name);
    long periodMillis = config.period().toMillis();
    Throwable fault = null;
    try (OutputStream sink = new BufferedOutputStream(Files.newOutputStream(file, StandardOpenOption.APPEND))) {
      while (signal.getCount() > 0) {
        collectOnce(sink);
        sink.flush();
        if (signal.await(periodMillis, TimeUnit.MILLISECONDS)) {
          break;
        }
      }
    } catch (TargetNotRespondingException | TargetTimeoutException e) {
      LOGGER.warn("{}: target failed during collection: {}", name, e.getMessage());
      fault = e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      fault = new CollectorThreadException(name, e);
    } catch (Throwable t) {
      LOGGER.warn("Exception on collector thread: {}({})", t.getClass().getSimpleName(), t.getMessage());
      fault = new CollectorThreadException(name, t);
    } finally {
      // Completed on every exit path; stop() waits on it without a timeout.
      LOGGER.debug("{}: frame data collection stopped", name);
      if (fault == null) {
        done.complete(null);
      } else {
        done.completeExceptionally(fault);
      }
    }
  }

  private void logUnresponsive() {
    if (unresponsiveCount == 0) {
      return;
    }
    if (unresponsiveCount > config.unresponsiveWarningThreshold()) {
      LOGGER.warn("{} was unresponsive {} times.", name, unresponsiveCount);
    } else {
      LOGGER.debug("{} was unresponsive {} times.", name, unresponsiveCount);
    }
  }
}
