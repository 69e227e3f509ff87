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
import fr.aneo.insar.ccd.domain.Dimension;
import fr.aneo.insar.ccd.domain.Range;
import fr.aneo.insar.ccd.domain.StoreConfig;
import fr.aneo.insar.ccd.domain.TaskDescriptor;
import fr.aneo.insar.ccd.domain.TileCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.LongStream;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Splits the spatial plane of a change map into independent tile tasks aligned on the native
 * tiles of the array.
 * <p>
 * Tile {@code (tx, ty)} covers rows {@code [ty * tileHeight, (ty + 1) * tileHeight)} and
 * columns {@code [tx * tileWidth, (tx + 1) * tileWidth)}, offset by the start of each dimension.
 * Tasks never overlap, so the order in which they are produced or executed does not matter.
 * How a trailing partial tile is handled is decided by the {@link EdgeTilePolicy}.
 */
public final class TaskPartitioner {
  private static final Logger logger = LoggerFactory.getLogger(TaskPartitioner.class);

  private final EdgeTilePolicy edgeTilePolicy;

  public TaskPartitioner(EdgeTilePolicy edgeTilePolicy) {
    this.edgeTilePolicy = requireNonNull(edgeTilePolicy, "edgeTilePolicy must not be null");
  }

  /**
   * Size of the partition grid.
   *
   * @param tilesX number of tiles along the columns
   * @param tilesY number of tiles along the rows
   */
  public record Grid(long tilesX, long tilesY) {
    public long size() {
      return tilesX * tilesY;
    }
  }

  public Grid gridOf(ArrayDescriptor output) {
    var rows = output.rows();
    var columns = output.columns();
    return new Grid(edgeTilePolicy.tileCount(columns.extent(), columns.tileExtent()),
                    edgeTilePolicy.tileCount(rows.extent(), rows.tileExtent()));
  }

  /**
   * Enumerates the tile coordinates of the grid, row of tiles by row of tiles.
   */
  public Stream<TileCoordinate> coordinates(ArrayDescriptor output) {
    var grid = gridOf(output);
    return LongStream.range(0, grid.tilesY())
                     .boxed()
                     .flatMap(ty -> LongStream.range(0, grid.tilesX()).mapToObj(tx -> TileCoordinate.of(tx, ty)));
  }

  /**
   * Lazily produces one task per tile of {@code output}.
   *
   * @param input       the stack the tasks read from
   * @param output      the change map the tasks write to; its spatial geometry drives the grid
   * @param bands       the compared bands
   * @param windowSize  edge length of the estimation windows
   * @param storeConfig settings forwarded to the store
   * @return the tasks; each one is produced when the stream is consumed
   */
  public Stream<TaskDescriptor> partition(ArrayUri input,
                                          ArrayDescriptor output,
                                          BandPair bands,
                                          int windowSize,
                                          StoreConfig storeConfig) {
    requireNonNull(input, "input must not be null");
    requireNonNull(output, "output must not be null");
    requireNonNull(bands, "bands must not be null");
    requireNonNull(storeConfig, "storeConfig must not be null");

    var rows = output.rows();
    var columns = output.columns();
    warnAboutExcludedCells(output.uri(), rows, columns);

    return coordinates(output).map(coordinate -> new TaskDescriptor(
      input,
      output.uri(),
      bands,
      coordinate,
      slice(rows, coordinate.tileY()),
      slice(columns, coordinate.tileX()),
      windowSize,
      storeConfig));
  }

  private static Range slice(Dimension dimension, long tileIndex) {
    long start = dimension.start() + tileIndex * dimension.tileExtent();
    long end = Math.min(start + dimension.tileExtent(), dimension.end() + 1);
    return Range.of(start, end);
  }

  private void warnAboutExcludedCells(ArrayUri output, Dimension rows, Dimension columns) {
    if (edgeTilePolicy != EdgeTilePolicy.TRUNCATE) return;

    long excludedRows = rows.extent() % rows.tileExtent();
    long excludedColumns = columns.extent() % columns.tileExtent();
    if (excludedRows > 0 || excludedColumns > 0) {
      logger.warn("Extent of {} is not a multiple of its tile extent: the last {} rows and {} columns are not computed",
        output.asString(), excludedRows, excludedColumns);
    }
  }
}
