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
package us.blanshard.deduce.core;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static us.blanshard.deduce.core.Cells.BOARD_SIZE;
import static us.blanshard.deduce.core.Cells.ROW_COL_SEC_SIZE;

import java.util.Arrays;

import javax.annotation.concurrent.Immutable;

/**
 * An immutable Sudoku grid: 81 values, each 1-9 or 0 for a blank cell.  The
 * nested Builder class is a mutable version of the grid.  It accepts any value
 * at any cell: it does not enforce the constraints of the game.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Grid {

  private final byte[] squares;

  private Grid(byte[] squares) {
    this.squares = squares;
  }

  public static final Grid BLANK = new Grid(new byte[BOARD_SIZE]);

  /** Returns a new Builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns a mutable version of this grid. */
  public Builder toBuilder() {
    return new Builder(this);
  }

  /**
   * Makes a grid from the given array of 81 values.
   *
   * @throws IllegalArgumentException if the array is the wrong size or holds a
   *     value outside 0-9
   */
  public static Grid of(int[] values) {
    checkArgument(values.length == BOARD_SIZE, "A grid needs %s values, got %s",
                  BOARD_SIZE, values.length);
    Builder builder = builder();
    for (int cell = 0; cell < BOARD_SIZE; ++cell)
      builder.put(cell, values[cell]);
    return builder.build();
  }

  /** Possible states for a Sudoku grid. */
  public enum State {
    INCOMPLETE,  // Not all filled in, but nothing that is filled in breaks the rules.
    BROKEN,      // Something that's filled in breaks the rules.
    SOLVED;      // Completely filled in, no rule violations.
  }

  public State getState() {
    if (isBroken())
      return State.BROKEN;
    return size() < BOARD_SIZE ? State.INCOMPLETE : State.SOLVED;
  }

  /**
   * Tells whether every row, column and section holds each of 1-9 exactly
   * once.
   */
  public boolean isSolved() {
    return getState() == State.SOLVED;
  }

  /** Tells whether some unit holds the same value twice. */
  private boolean isBroken() {
    for (Unit unit : Unit.values()) {
      for (int index = 0; index < ROW_COL_SEC_SIZE; ++index) {
        int bits = 0;
        for (int offset = 0; offset < ROW_COL_SEC_SIZE; ++offset) {
          int value = squares[unit.cell(index, offset)];
          if (value == 0) continue;
          int bit = 1 << value;
          if ((bits & bit) != 0)
            return true;
          bits |= bit;
        }
      }
    }
    return false;
  }

  /** Returns the value at the given cell, 0 if blank. */
  public int get(int cell) {
    checkElementIndex(cell, BOARD_SIZE);
    return squares[cell];
  }

  /** Tells whether the given cell has a value. */
  public boolean isSet(int cell) {
    return get(cell) != 0;
  }

  /** Returns the number of cells filled in. */
  public int size() {
    int answer = 0;
    for (byte square : squares) {
      if (square > 0) ++answer;
    }
    return answer;
  }

  /** Returns a fresh array of the 81 values. */
  public int[] toArray() {
    int[] answer = new int[BOARD_SIZE];
    for (int cell = 0; cell < BOARD_SIZE; ++cell)
      answer[cell] = squares[cell];
    return answer;
  }

  public static final class Builder {
    private Grid grid;
    private boolean built;

    private Builder() {
      this(BLANK);
    }

    private Builder(Grid grid) {
      this.grid = grid;
      this.built = true;
    }

    private Grid grid() {
      if (built) {
        Grid grid = new Grid(this.grid.squares.clone());
        this.grid = grid;
        this.built = false;
      }
      return this.grid;
    }

    /** Returns an immutable snapshot of this grid. */
    public Grid build() {
      built = true;
      return grid;
    }

    /** Resets the grid to empty. */
    public Builder clear() {
      this.grid = BLANK;
      this.built = true;
      return this;
    }

    /** Returns the value at the given cell, 0 if blank. */
    public int get(int cell) {
      return grid.get(cell);
    }

    /** Sets the value for the given cell; 0 erases it. */
    public Builder put(int cell, int value) {
      checkElementIndex(cell, BOARD_SIZE);
      checkArgument(value >= 0 && value <= ROW_COL_SEC_SIZE, "Bad value %s", value);
      grid().squares[cell] = (byte) value;
      return this;
    }

    /** Erases the given cell. */
    public Builder remove(int cell) {
      return put(cell, 0);
    }

    /** Returns the number of cells filled in. */
    public int size() {
      return grid.size();
    }
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Grid)) return false;
    Grid that = (Grid) object;
    return Arrays.equals(this.squares, that.squares);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(squares);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int cell = 0; cell < BOARD_SIZE; ++cell) {
      if (squares[cell] > 0) sb.append(' ').append(squares[cell]);
      else sb.append(" .");
      int column = Cells.cellToColumn(cell);
      if (column == 2 || column == 5)
        sb.append(" |");
      if (column == 8) {
        sb.append('\n');
        int row = Cells.cellToRow(cell);
        if (row == 2 || row == 5)
          sb.append("-------+-------+-------\n");
      }
    }
    return sb.toString();
  }

  /**
   * Generates a string of 81 characters with dots for blank cells and digits
   * for set ones.
   */
  public String toFlatString() {
    StringBuilder sb = new StringBuilder();
    for (byte square : squares)
      sb.append(square == 0 ? '.' : (char) ('0' + square));
    return sb.toString();
  }

  /**
   * Ignores all characters except digits and periods, requires there to be 81
   * total.
   */
  public static Grid fromString(String s) {
    Builder builder = new Builder();
    int index = 0;
    for (char c : s.toCharArray()) {
      if (c >= '1' && c <= '9') {
        checkArgument(index < BOARD_SIZE, "Grid.fromString requires 81 cells, got more in %s", s);
        builder.put(index++, c - '0');
      } else if (c == '0' || c == '.') {
        ++index;
      }
    }
    if (index != BOARD_SIZE) {
      throw new IllegalArgumentException(
          String.format("Grid.fromString requires 81 cells, got %d in %s", index, s));
    }
    return builder.build();
  }
}
