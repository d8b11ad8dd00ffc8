/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.deduce.gen;

import static com.google.common.base.Preconditions.checkArgument;
import static us.blanshard.deduce.core.Cells.BOARD_SIZE;
import static us.blanshard.deduce.core.Cells.ROW_COL_SEC_SIZE;
import static us.blanshard.deduce.core.Cells.cellToColumn;
import static us.blanshard.deduce.core.Cells.cellToRow;
import static us.blanshard.deduce.core.Cells.rowColumnToCell;

import us.blanshard.deduce.core.Grid;

import com.google.common.collect.ImmutableMap;

import java.util.Random;

/**
 * Symmetries for the clues in generated puzzles.
 *
 * @author Luke Blanshard
 */
public enum Symmetry {

  /** No pattern to the clues. */
  NONE {
    @Override public int[] partners(int cell) {
      return new int[0];
    }
    @Override public String getName() {
      return "none";
    }
  },

  /** The clues look the same after a quarter turn. */
  ROTATE90 {
    @Override public int[] partners(int cell) {
      int row = cellToRow(cell);
      int col = cellToColumn(cell);
      return new int[] {
        rowColumnToCell(LAST - row, LAST - col),
        rowColumnToCell(LAST - col, row),
        rowColumnToCell(col, LAST - row),
      };
    }
    @Override public String getName() {
      return "rotate90";
    }
  },

  /** The classic Sudoku half-turn symmetry. */
  ROTATE180 {
    @Override public int[] partners(int cell) {
      return new int[] {rowColumnToCell(LAST - cellToRow(cell), LAST - cellToColumn(cell))};
    }
    @Override public String getName() {
      return "rotate180";
    }
  },

  /** A left-right mirror symmetry. */
  MIRROR {
    @Override public int[] partners(int cell) {
      return new int[] {rowColumnToCell(cellToRow(cell), LAST - cellToColumn(cell))};
    }
    @Override public String getName() {
      return "mirror";
    }
  },

  /** A top-bottom mirror symmetry. */
  FLIP {
    @Override public int[] partners(int cell) {
      return new int[] {rowColumnToCell(LAST - cellToRow(cell), cellToColumn(cell))};
    }
    @Override public String getName() {
      return "flip";
    }
  },

  /**
   * One of the other symmetries, apart from NONE, chosen at random when a
   * puzzle is generated.
   */
  RANDOM {
    @Override public int[] partners(int cell) {
      throw new UnsupportedOperationException("Resolve RANDOM to a concrete symmetry first");
    }
    @Override public String getName() {
      return "random";
    }
  };

  private static final int LAST = ROW_COL_SEC_SIZE - 1;

  private static final Symmetry[] CONCRETE = {ROTATE90, ROTATE180, MIRROR, FLIP};
  private static final ImmutableMap<String, Symmetry> names;
  static {
    ImmutableMap.Builder<String, Symmetry> builder = ImmutableMap.builder();
    for (Symmetry s : values())
      builder.put(s.getName(), s);
    names = builder.build();
  }

  /**
   * Chooses one of the symmetries that actually constrain the clues, at
   * random.
   */
  public static Symmetry choose(Random random) {
    return CONCRETE[random.nextInt(CONCRETE.length)];
  }

  /**
   * Returns the symmetry whose {@linkplain #getName() name} is given.
   *
   * @param name   the name as returned by {@link #getName()}
   * @return   the corresponding Symmetry
   * @throws IllegalArgumentException   if the name doesn't match a Symmetry
   */
  public static Symmetry byName(String name) {
    checkArgument(names.containsKey(name), "No symmetry named %s", name);
    return names.get(name);
  }

  /**
   * Returns this symmetry, or for RANDOM one chosen by {@link #choose}.
   */
  public Symmetry resolve(Random random) {
    return this == RANDOM ? choose(random) : this;
  }

  /**
   * Returns the cells whose clues must match the given cell's clue under this
   * symmetry.  A cell that maps onto itself may appear among its own
   * partners.
   *
   * @throws UnsupportedOperationException   for RANDOM
   */
  public abstract int[] partners(int cell);

  /**
   * Returns a human-readable English name for this symmetry.
   */
  public abstract String getName();

  /**
   * Tells whether this symmetry describes the layout of clues in the given
   * grid.
   */
  public boolean describes(Grid grid) {
    for (int cell = 0; cell < BOARD_SIZE; ++cell) {
      boolean hasClue = grid.isSet(cell);
      for (int partner : partners(cell))
        if (hasClue != grid.isSet(partner))
          return false;
    }
    return true;
  }
}
