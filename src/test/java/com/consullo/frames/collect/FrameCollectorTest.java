package com.consullo.frames.collect;

import com.consullo.frames.parse.ParseReport;
import com.consullo.frames.parse.SurfaceFlingerDumpParser;
import com.consullo.frames.remote.RemoteExecutionException;
import com.consullo.frames.remote.RemoteExecutor;
import com.consullo.frames.remote.TargetNotRespondingException;
import com.consullo.frames.remote.TargetTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Lifecycle and fault handling tests for the SurfaceFlinger collector.
 *
 * @since 1.0
 */
public class FrameCollectorTest {

  private static final String VIEW = "SurfaceView - com.example/com.example.MainActivity#0";
  private static final String LATENCY = "16666666\r\n100\t200\t150\r\n200\t300\t250\r\n0\t0\t0\r\n";
  private static final Duration PERIOD = Duration.ofMillis(5);

  @TempDir
  Path dir;

  /**
   * Fake device that lists {@link #VIEW} and answers every latency query with the given dump.
   */
  private static RemoteExecutor device(String latency, CountDownLatch ticks, AtomicInteger latencyCalls) {
    return command -> {
      if (command.equals(SurfaceFlingerFrameCollector.LIST_COMMAND)) {
        return "StatusBar\r\n" + VIEW + "\r\nNavigationBar\r\n";
      }
      if (command.equals(String.format(SurfaceFlingerFrameCollector.LATENCY_COMMAND, VIEW))) {
        latencyCalls.incrementAndGet();
        ticks.countDown();
        return latency;
      }
      throw new RemoteExecutionException("unexpected command " + command);
    };
  }

  private static SurfaceFlingerFrameCollector collector(RemoteExecutor executor) {
    return new SurfaceFlingerFrameCollector(executor, FrameCollectorConfig.of(VIEW, PERIOD));
  }

  @Test
  @DisplayName("Should collect, stop and process a session, dropping repeated frames")
  void session_FullLifecycle_FramesDeduplicated() throws Exception {
    final CountDownLatch ticks = new CountDownLatch(3);
    final AtomicInteger calls = new AtomicInteger();
    final SurfaceFlingerFrameCollector collector = collector(device(LATENCY, ticks, calls));

    collector.start();
    assertThat(collector.state()).isEqualTo(CollectorState.RUNNING);
    assertThat(ticks.await(5, TimeUnit.SECONDS)).isTrue();
    collector.stop();

    assertThat(collector.state()).isEqualTo(CollectorState.STOPPED);
    final Path raw = collector.rawFile();
    assertThat(raw).exists();

    final ParseReport report = collector.processFrames(null);

    assertThat(collector.state()).isEqualTo(CollectorState.PROCESSED);
    assertThat(raw).doesNotExist();
    assertThat(collector.rawFile()).isNull();
    assertThat(collector.frames().size()).isEqualTo(2);
    assertThat(collector.frames().row(1)).containsExactly(200, 300, 250);
    assertThat(report.acceptedFrames()).isEqualTo(2);
    assertThat(calls.get()).isGreaterThanOrEqualTo(3);
  }

  @Test
  @DisplayName("Should keep a copy of the raw capture when asked")
  void processFrames_RawCopy_Kept() throws Exception {
    final CountDownLatch ticks = new CountDownLatch(1);
    final SurfaceFlingerFrameCollector collector = collector(device(LATENCY, ticks, new AtomicInteger()));
    final Path copy = dir.resolve("session.raw");

    collector.start();
    assertThat(ticks.await(5, TimeUnit.SECONDS)).isTrue();
    collector.stop();
    collector.processFrames(copy);

    assertThat(copy).exists();
    assertThat(Files.readString(copy)).contains("100\t200\t150");
  }

  @Test
  @DisplayName("Should export processed frames with the requested columns")
  void writeFrames_Processed_WritesCsv() throws Exception {
    final CountDownLatch ticks = new CountDownLatch(1);
    final SurfaceFlingerFrameCollector collector = collector(device(LATENCY, ticks, new AtomicInteger()));
    final Path csv = dir.resolve("frames.csv");

    collector.start();
    assertThat(ticks.await(5, TimeUnit.SECONDS)).isTrue();
    collector.stop();
    collector.processFrames(null);
    collector.writeFrames(csv, List.of("frame_ready_time"));

    assertThat(Files.readString(csv)).isEqualTo("frame_ready_time\n150\n250\n");
  }

  @Test
  @DisplayName("Should count unresponsive markers across all ticks")
  void processFrames_UnresponsiveMarkers_Counted() throws Exception {
    final CountDownLatch ticks = new CountDownLatch(2);
    final AtomicInteger calls = new AtomicInteger();
    final String dump = SurfaceFlingerDumpParser.UNRESPONSIVE_MARKER + "\n" + LATENCY;
    final SurfaceFlingerFrameCollector collector = collector(device(dump, ticks, calls));

    collector.start();
    assertThat(ticks.await(5, TimeUnit.SECONDS)).isTrue();
    collector.stop();
    final ParseReport report = collector.processFrames(null);

    assertThat(collector.unresponsiveCount()).isEqualTo(calls.get());
    assertThat(report.unresponsiveCount()).isEqualTo(calls.get());
    assertThat(collector.frames().size()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should write nothing when the view is not listed")
  void collectOnce_ViewAbsent_NoFrames() throws Exception {
    final CountDownLatch listings = new CountDownLatch(2);
    final AtomicInteger latencyCalls = new AtomicInteger();
    final RemoteExecutor executor = command -> {
      if (command.equals(SurfaceFlingerFrameCollector.LIST_COMMAND)) {
        listings.countDown();
        return "StatusBar\n";
      }
      latencyCalls.incrementAndGet();
      return LATENCY;
    };
    final SurfaceFlingerFrameCollector collector = collector(executor);

    collector.start();
    assertThat(listings.await(5, TimeUnit.SECONDS)).isTrue();
    collector.stop();
    collector.processFrames(null);

    assertThat(collector.frames().isEmpty()).isTrue();
    assertThat(latencyCalls.get()).isZero();
  }

  @Test
  @DisplayName("Should reject stop before start")
  void stop_NotStarted_Fails() {
    final SurfaceFlingerFrameCollector collector = collector(command -> "");

    assertThatThrownBy(collector::stop).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should reject processing before the collector has run")
  void processFrames_NotRun_Fails() {
    final SurfaceFlingerFrameCollector collector = collector(command -> "");

    assertThatThrownBy(() -> collector.processFrames(null))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("before running the collector");
    assertThatThrownBy(() -> collector.writeFrames(dir.resolve("x.csv"), null))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should reject processing while the loop is still appending")
  void processFrames_WhileRunning_Fails() throws Exception {
    final CountDownLatch ticks = new CountDownLatch(1);
    final SurfaceFlingerFrameCollector collector = collector(device(LATENCY, ticks, new AtomicInteger()));

    collector.start();
    try {
      assertThat(ticks.await(5, TimeUnit.SECONDS)).isTrue();
      assertThatThrownBy(() -> collector.processFrames(null))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("still running");
      assertThat(collector.rawFile()).exists();
    } finally {
      collector.stop();
    }
  }

  @Test
  @DisplayName("Should reject a second start while running")
  void start_AlreadyRunning_Fails() throws Exception {
    final SurfaceFlingerFrameCollector collector = collector(device(LATENCY, new CountDownLatch(1), new AtomicInteger()));

    collector.start();
    try {
      assertThatThrownBy(collector::start)
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("already running");
    } finally {
      collector.stop();
    }
  }

  @Test
  @DisplayName("Should run a fresh session after reset")
  void reset_AfterProcessing_AllowsNewSession() throws Exception {
    final SurfaceFlingerFrameCollector collector = collector(device(LATENCY, new CountDownLatch(0), new AtomicInteger()));

    collector.start();
    collector.stop();
    collector.processFrames(null);
    assertThatThrownBy(collector::start).isInstanceOf(IllegalStateException.class);

    collector.reset();
    assertThat(collector.state()).isEqualTo(CollectorState.IDLE);
    collector.start();
    collector.stop();
    collector.processFrames(null);

    assertThat(collector.state()).isEqualTo(CollectorState.PROCESSED);
  }

  @Test
  @DisplayName("Should report a target that stopped responding from stop")
  void stop_TargetNotResponding_Rethrown() throws Exception {
    final SurfaceFlingerFrameCollector collector = collector(command -> {
      throw new TargetNotRespondingException("device offline");
    });

    collector.start();

    assertThatThrownBy(collector::stop)
        .isInstanceOf(TargetNotRespondingException.class)
        .hasMessage("device offline");
    assertThat(collector.state()).isEqualTo(CollectorState.STOPPED);
    collector.processFrames(null);
    assertThat(collector.frames().isEmpty()).isTrue();
  }

  @Test
  @DisplayName("Should report a command timeout from stop")
  void stop_Timeout_Rethrown() throws Exception {
    final SurfaceFlingerFrameCollector collector = collector(command -> {
      throw new TargetTimeoutException(command, Duration.ofSeconds(1));
    });

    collector.start();

    assertThatThrownBy(collector::stop).isInstanceOf(TargetTimeoutException.class);
  }

  @Test
  @DisplayName("Should wrap unexpected loop failures with the collector name")
  void stop_InternalFault_Wrapped() throws Exception {
    final SurfaceFlingerFrameCollector collector = collector(command -> {
      throw new IllegalStateException("boom");
    });

    collector.start();

    assertThatThrownBy(collector::stop)
        .isInstanceOf(CollectorThreadException.class)
        .hasCauseInstanceOf(IllegalStateException.class)
        .hasMessageContaining(collector.name())
        .hasMessageContaining("boom");
  }

  @Test
  @DisplayName("Should wrap a failed command that did not lose the target")
  void stop_CommandFailed_Wrapped() throws Exception {
    final SurfaceFlingerFrameCollector collector = collector(command -> {
      throw new RemoteExecutionException("Command exited with status 1: " + command);
    });

    collector.start();

    assertThatThrownBy(collector::stop)
        .isInstanceOf(CollectorThreadException.class)
        .hasCauseExactlyInstanceOf(RemoteExecutionException.class)
        .hasMessageContaining(collector.name())
        .hasMessageContaining("exited with status 1");
    assertThat(collector.state()).isEqualTo(CollectorState.STOPPED);
  }

  @Test
  @DisplayName("Should report an error thrown on the collector thread instead of hanging")
  void stop_ErrorOnLoop_Wrapped() throws Exception {
    final SurfaceFlingerFrameCollector collector = collector(command -> {
      throw new AssertionError("boom");
    });

    collector.start();

    final CompletableFuture<Throwable> stopped = CompletableFuture.supplyAsync(() -> {
      try {
        collector.stop();
        return null;
      } catch (Throwable t) {
        return t;
      }
    });
    assertThat(stopped.get(5, TimeUnit.SECONDS))
        .isInstanceOf(CollectorThreadException.class)
        .hasCauseInstanceOf(AssertionError.class)
        .hasMessageContaining(collector.name());
    assertThat(collector.state()).isEqualTo(CollectorState.STOPPED);
  }

  @Test
  @DisplayName("Should ask SurfaceFlinger to clear its latency buffers")
  void clear_SendsClearCommand() throws Exception {
    final AtomicInteger clears = new AtomicInteger();
    final SurfaceFlingerFrameCollector collector = collector(command -> {
      if (command.equals(SurfaceFlingerFrameCollector.CLEAR_COMMAND)) {
        clears.incrementAndGet();
      }
      return "";
    });

    collector.clear();

    assertThat(clears.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should reject a header that does not name three columns")
  void constructor_WrongHeader_Fails() {
    assertThatThrownBy(() -> new SurfaceFlingerFrameCollector(command -> "",
        FrameCollectorConfig.of(VIEW, PERIOD), List.of("a", "b")))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
