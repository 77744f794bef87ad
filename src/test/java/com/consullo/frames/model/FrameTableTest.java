package com.consullo.frames.model;

import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for frame table storage and CSV export.
 *
 * @since 1.0
 */
public class FrameTableTest {

  @TempDir
  Path dir;

  private static FrameTable abc() {
    final FrameTable table = new FrameTable(List.of("A", "B", "C"));
    table.add(new long[] { 1, 2, 3 });
    table.add(new long[] { 4, 5, 6 });
    return table;
  }

  @Test
  @DisplayName("Should export only the requested column")
  void write_SingleColumn_Projected() throws Exception {
    final StringWriter out = new StringWriter();

    abc().write(out, List.of("B"));

    assertThat(out.toString()).isEqualTo("B\n2\n5\n");
  }

  @Test
  @DisplayName("Should export columns in the requested order")
  void write_ReorderedColumns_Projected() throws Exception {
    final StringWriter out = new StringWriter();

    abc().write(out, List.of("C", "A"));

    assertThat(out.toString()).isEqualTo("C,A\n3,1\n6,4\n");
  }

  @Test
  @DisplayName("Should export the whole table to a file when no columns are given")
  void write_AllColumns_ToFile() throws Exception {
    final Path csv = dir.resolve("frames.csv");

    abc().write(csv, null);

    assertThat(Files.readString(csv)).isEqualTo("A,B,C\n1,2,3\n4,5,6\n");
  }

  @Test
  @DisplayName("Should reject a column that is not in the header")
  void write_UnknownColumn_Fails() {
    final FrameTable table = new FrameTable(List.of("A", "C"));
    table.add(new long[] { 1, 3 });

    assertThatThrownBy(() -> table.write(new StringWriter(), List.of("B")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("\"B\"")
        .hasMessageContaining("[A, C]");
  }

  @Test
  @DisplayName("Should reject rows whose width differs from the header")
  void add_WrongWidth_Fails() {
    final FrameTable table = new FrameTable(List.of("A", "B"));

    assertThatThrownBy(() -> table.add(new long[] { 1, 2, 3 }))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(table.isEmpty()).isTrue();
  }
}
