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

import static us.blanshard.deduce.core.Cells.cellToColumn;
import static us.blanshard.deduce.core.Cells.cellToRow;
import static us.blanshard.deduce.core.Cells.cellToSection;
import static us.blanshard.deduce.core.Cells.rowColumnToCell;
import static us.blanshard.deduce.core.Cells.sectionToCell;

/**
 * The three kinds of unit on a Sudoku grid.  Each kind has nine units, each
 * unit nine cells; a unit's cells are addressed by offset 0-8.
 *
 * @author Luke Blanshard
 */
public enum Unit {
  ROW {
    @Override public int indexOf(int cell) {
      return cellToRow(cell);
    }
    @Override public int cell(int unitIndex, int offset) {
      return rowColumnToCell(unitIndex, offset);
    }
  },
  COLUMN {
    @Override public int indexOf(int cell) {
      return cellToColumn(cell);
    }
    @Override public int cell(int unitIndex, int offset) {
      return rowColumnToCell(offset, unitIndex);
    }
  },
  SECTION {
    @Override public int indexOf(int cell) {
      return cellToSection(cell);
    }
    @Override public int cell(int unitIndex, int offset) {
      return sectionToCell(unitIndex, offset);
    }
  };

  /** Returns the index (0-8) of the unit of this kind containing the given cell. */
  public abstract int indexOf(int cell);

  /** Returns the cell at the given offset within the given unit of this kind. */
  public abstract int cell(int unitIndex, int offset);

  /** Tells whether the two cells lie in the same unit of this kind. */
  public boolean shares(int cell1, int cell2) {
    return indexOf(cell1) == indexOf(cell2);
  }
}
