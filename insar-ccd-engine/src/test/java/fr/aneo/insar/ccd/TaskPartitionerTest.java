/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package fr.aneo.insar.ccd;

import fr.aneo.insar.ccd.domain.ArrayDescriptor;
import fr.aneo.insar.ccd.domain.ArrayUri;
import fr.aneo.insar.ccd.domain.BandPair;
import fr.aneo.insar.ccd.domain.DataType;
import fr.aneo.insar.ccd.domain.Dimension;
import fr.aneo.insar.ccd.domain.Range;
import fr.aneo.insar.ccd.domain.StoreConfig;
import fr.aneo.insar.ccd.domain.TaskDescriptor;
import fr.aneo.insar.ccd.domain.TileCoordinate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class TaskPartitionerTest {
  private static final ArrayUri INPUT = ArrayUri.from("mem://stack");

  private static ArrayDescriptor changeMap(long height, long width, long tileHeight, long tileWidth) {
    return SchemaPlanner.derive(ArrayDescriptor.stack(INPUT, 2, height, width, tileHeight, tileWidth), ArrayUri.from("mem://change"));
  }

  @Test
  @DisplayName("should produce one task per tile of a grid of two by two tiles")
  void should_produce_four_tasks_for_two_by_two_grid() {
    // Given
    var partitioner = new TaskPartitioner(EdgeTilePolicy.TRUNCATE);

    // When
    var tasks = partitioner.partition(INPUT, changeMap(100, 100, 50, 50), BandPair.of(0, 1), 7, StoreConfig.empty()).toList();

    // Then
    assertThat(tasks).extracting(TaskDescriptor::coordinate)
                     .containsExactlyInAnyOrder(TileCoordinate.of(0, 0), TileCoordinate.of(0, 1),
                                                TileCoordinate.of(1, 0), TileCoordinate.of(1, 1));
    assertThat(tasks).allSatisfy(task -> {
      assertThat(task.input()).isEqualTo(INPUT);
      assertThat(task.output()).isEqualTo(ArrayUri.from("mem://change"));
      assertThat(task.windowSize()).isEqualTo(7);
      assertThat(task.tileHeight()).isEqualTo(50);
      assertThat(task.tileWidth()).isEqualTo(50);
    });
  }

  @Test
  @DisplayName("should align tiles on the native tiles of the array")
  void should_align_tiles_on_native_tiles() {
    // Given
    var partitioner = new TaskPartitioner(EdgeTilePolicy.TRUNCATE);

    // When
    var tasks = partitioner.partition(INPUT, changeMap(40, 60, 20, 30), BandPair.of(1, 0), 5, StoreConfig.empty()).toList();

    // Then
    assertThat(tasks).extracting(TaskDescriptor::coordinate, TaskDescriptor::rows, TaskDescriptor::columns)
                     .containsExactly(
                       tuple(TileCoordinate.of(0, 0), Range.of(0, 20), Range.of(0, 30)),
                       tuple(TileCoordinate.of(1, 0), Range.of(0, 20), Range.of(30, 60)),
                       tuple(TileCoordinate.of(0, 1), Range.of(20, 40), Range.of(0, 30)),
                       tuple(TileCoordinate.of(1, 1), Range.of(20, 40), Range.of(30, 60)));
  }

  @Test
  @DisplayName("should leave out trailing partial tiles when truncating")
  void should_leave_out_partial_tiles_when_truncating() {
    // Given
    var partitioner = new TaskPartitioner(EdgeTilePolicy.TRUNCATE);

    // When
    var grid = partitioner.gridOf(changeMap(105, 120, 50, 50));
    var tasks = partitioner.partition(INPUT, changeMap(105, 120, 50, 50), BandPair.of(0, 1), 7, StoreConfig.empty()).toList();

    // Then
    assertThat(grid).isEqualTo(new TaskPartitioner.Grid(2, 2));
    assertThat(tasks).hasSize(4)
                     .allSatisfy(task -> assertThat(task.tileHeight()).isEqualTo(50));
  }

  @Test
  @DisplayName("should clip trailing tiles to the array extent when clipping")
  void should_clip_partial_tiles_when_clipping() {
    // Given
    var partitioner = new TaskPartitioner(EdgeTilePolicy.CLIP);

    // When
    var tasks = partitioner.partition(INPUT, changeMap(105, 120, 50, 50), BandPair.of(0, 1), 7, StoreConfig.empty()).toList();

    // Then
    assertThat(tasks).hasSize(9);
    var corner = tasks.stream().filter(task -> task.coordinate().equals(TileCoordinate.of(2, 2))).findFirst().orElseThrow();
    assertThat(corner.rows()).isEqualTo(Range.of(100, 105));
    assertThat(corner.columns()).isEqualTo(Range.of(100, 120));
    assertThat(tasks.stream().mapToLong(task -> (long) task.tileHeight() * task.tileWidth()).sum()).isEqualTo(105L * 120);
  }

  @Test
  @DisplayName("should offset tiles by the start of each dimension")
  void should_offset_tiles_by_dimension_start() {
    // Given
    var output = ArrayDescriptor.dense(ArrayUri.from("mem://change"),
                                       List.of(new Dimension(Dimension.Y, 10, 29, 10), new Dimension(Dimension.X, 5, 14, 10)),
                                       ArrayDescriptor.CHANGE_ATTRIBUTE,
                                       DataType.FLOAT32);

    // When
    var tasks = new TaskPartitioner(EdgeTilePolicy.TRUNCATE).partition(INPUT, output, BandPair.of(0, 1), 3, StoreConfig.empty()).toList();

    // Then
    assertThat(tasks).extracting(TaskDescriptor::rows, TaskDescriptor::columns)
                     .containsExactly(tuple(Range.of(10, 20), Range.of(5, 15)),
                                      tuple(Range.of(20, 30), Range.of(5, 15)));
  }

  @Test
  @DisplayName("should produce no task when the array is smaller than a tile and truncating")
  void should_produce_no_task_for_array_smaller_than_tile() {
    var tasks = new TaskPartitioner(EdgeTilePolicy.TRUNCATE).partition(INPUT, changeMap(30, 30, 50, 50), BandPair.of(0, 1), 7, StoreConfig.empty());

    assertThat(tasks).isEmpty();
  }
}
