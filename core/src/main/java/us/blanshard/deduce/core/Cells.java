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

/**
 * The geometry of a Sudoku grid, expressed as arithmetic on cell indices.
 * Cells are numbered 0 through 80 reading across the rows; rows, columns and
 * sections (the 3x3 boxes) are numbered 0 through 8; value indices are one
 * less than the values they stand for.
 *
 * <p> Everything that scans the grid goes through these functions, so the
 * board, the deduction techniques and the generator all agree on where a cell
 * lives.
 *
 * @author Luke Blanshard
 */
public final class Cells {

  /** The width of a section. */
  public static final int GRID_SIZE = 3;

  /** The number of cells in a row, column or section; also the number of values. */
  public static final int ROW_COL_SEC_SIZE = GRID_SIZE * GRID_SIZE;

  /** The number of cells in a horizontal band of three sections. */
  public static final int SEC_GROUP_SIZE = ROW_COL_SEC_SIZE * GRID_SIZE;

  /** The number of cells. */
  public static final int BOARD_SIZE = ROW_COL_SEC_SIZE * ROW_COL_SEC_SIZE;

  /** The number of (cell, value) pairs. */
  public static final int POSSIBILITY_SIZE = BOARD_SIZE * ROW_COL_SEC_SIZE;

  /**
   * Given a value index (0-8) and a cell (0-80), calculates the offset into a
   * possibility table (0-728).
   */
  public static int possibilityIndex(int valueIndex, int cell) {
    return valueIndex + ROW_COL_SEC_SIZE * cell;
  }

  /** Returns the row (0-8) of the given cell. */
  public static int cellToRow(int cell) {
    return cell / ROW_COL_SEC_SIZE;
  }

  /** Returns the column (0-8) of the given cell. */
  public static int cellToColumn(int cell) {
    return cell % ROW_COL_SEC_SIZE;
  }

  /** Returns the section (0-8) of the given cell. */
  public static int cellToSection(int cell) {
    return cell / SEC_GROUP_SIZE * GRID_SIZE + cellToColumn(cell) / GRID_SIZE;
  }

  /** Returns the upper left cell of the section containing the given cell. */
  public static int cellToSectionStartCell(int cell) {
    return cell / SEC_GROUP_SIZE * SEC_GROUP_SIZE + cellToColumn(cell) / GRID_SIZE * GRID_SIZE;
  }

  /** Returns the cell at the given row and column. */
  public static int rowColumnToCell(int row, int column) {
    return row * ROW_COL_SEC_SIZE + column;
  }

  /** Returns the upper left cell of the given section. */
  public static int sectionToFirstCell(int section) {
    return section % GRID_SIZE * GRID_SIZE + section / GRID_SIZE * SEC_GROUP_SIZE;
  }

  /**
   * Returns the cell at the given offset (0-8) within the given section,
   * reading across the section's rows.
   */
  public static int sectionToCell(int section, int offset) {
    return sectionToFirstCell(section)
        + offset / GRID_SIZE * ROW_COL_SEC_SIZE
        + offset % GRID_SIZE;
  }

  // Static methods only.
  private Cells() {}
}
