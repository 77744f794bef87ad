package com.consullo.frames.collect;

import com.consullo.frames.parse.GfxinfoColumns;
import com.consullo.frames.remote.PtyShellExecutor;
import com.consullo.frames.remote.RemoteExecutor;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Tests for the collector factory defaults.
 *
 * @since 1.0
 */
public class FrameCollectorsTest {

  @Test
  @DisplayName("Should apply the default period when none is given")
  void surfaceFlinger_NullPeriod_UsesDefault() {
    final SurfaceFlingerFrameCollector collector = FrameCollectors.surfaceFlinger(command -> "", "StatusBar", null);

    assertThat(collector.config.period()).isEqualTo(FrameCollectors.DEFAULT_PERIOD);
    assertThat(collector.config.unresponsiveWarningThreshold())
        .isEqualTo(FrameCollectorConfig.DEFAULT_UNRESPONSIVE_WARNING_THRESHOLD);
    assertThat(collector.name()).isEqualTo("SurfaceFlingerFrameCollector-StatusBar");
    assertThat(collector.state()).isEqualTo(CollectorState.IDLE);
  }

  @Test
  @DisplayName("Should query the column header for gfxinfo collectors")
  void gfxinfo_QueriesHeader() throws Exception {
    final RemoteExecutor executor = mock(RemoteExecutor.class);
    when(executor.execute(GfxinfoColumns.LIST_COLUMNS_COMMAND)).thenReturn("---PROFILEDATA---\nFlags,Vsync,\n");

    final GfxinfoFrameCollector collector = FrameCollectors.gfxinfo(executor, "com.example.app", Duration.ofSeconds(1));

    assertThat(collector.header()).containsExactly("Flags", "Vsync");
    assertThat(collector.config.period()).isEqualTo(Duration.ofSeconds(1));
  }

  @Test
  @DisplayName("Should build an adb executor and reject a blank adb path")
  void adbExecutor_Defaults() {
    assertThat(FrameCollectors.adbExecutor("adb", "emulator-5554", null)).isInstanceOf(PtyShellExecutor.class);
    assertThatThrownBy(() -> FrameCollectors.adbExecutor(" ", null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
