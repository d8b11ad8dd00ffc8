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
package us.blanshard.deduce.solve;

import static us.blanshard.deduce.core.Cells.BOARD_SIZE;
import static us.blanshard.deduce.core.Cells.ROW_COL_SEC_SIZE;

import us.blanshard.deduce.core.Unit;
import us.blanshard.deduce.history.LogType;

/**
 * The logical deduction techniques, in the order they are tried.  Each one
 * looks for a single opportunity to apply itself; if it finds one it makes
 * that one change to the board, stamped with the current round, records it,
 * and reports success without looking further.
 *
 * @author Luke Blanshard
 */
public enum Technique {

  /** A cell with only one possible value gets that value. */
  SINGLE {
    @Override public boolean apply(Board board, int round) {
      for (int position = 0; position < BOARD_SIZE; ++position) {
        if (board.getSolutionValue(position) != 0) continue;
        int count = 0;
        int lastValue = 0;
        for (int valueIndex = 0; valueIndex < ROW_COL_SEC_SIZE; ++valueIndex) {
          if (board.isPossible(valueIndex, position)) {
            ++count;
            lastValue = valueIndex + 1;
          }
        }
        if (count == 1) {
          board.mark(position, round, lastValue);
          board.log(round, LogType.SINGLE, lastValue, position);
          return true;
        }
      }
      return false;
    }
  },

  HIDDEN_SINGLE_SECTION {
    @Override public boolean apply(Board board, int round) {
      return hiddenSingle(board, round, Unit.SECTION, LogType.HIDDEN_SINGLE_SECTION);
    }
  },

  HIDDEN_SINGLE_ROW {
    @Override public boolean apply(Board board, int round) {
      return hiddenSingle(board, round, Unit.ROW, LogType.HIDDEN_SINGLE_ROW);
    }
  },

  HIDDEN_SINGLE_COLUMN {
    @Override public boolean apply(Board board, int round) {
      return hiddenSingle(board, round, Unit.COLUMN, LogType.HIDDEN_SINGLE_COLUMN);
    }
  },

  /**
   * Two cells in a unit with the same two possible values: no other cell of
   * the unit can have either value.
   */
  NAKED_PAIR {
    @Override public boolean apply(Board board, int round) {
      for (int position = 0; position < BOARD_SIZE; ++position) {
        if (board.countPossibilities(position) != 2) continue;
        for (int position2 = position + 1; position2 < BOARD_SIZE; ++position2) {
          if (board.countPossibilities(position2) != 2
              || !samePossibilities(board, position, position2))
            continue;
          for (Unit unit : Unit.values()) {
            if (unit.shares(position, position2)
                && removeNakedPair(board, round, unit, position, position2)) {
              board.log(round, nakedPairType(unit), position);
              return true;
            }
          }
        }
      }
      return false;
    }
  },

  /**
   * A value whose possible cells within a section all lie in one row: it can't
   * go anywhere else in that row.
   */
  POINTING_ROW {
    @Override public boolean apply(Board board, int round) {
      return pointing(board, round, Unit.ROW, LogType.POINTING_PAIR_TRIPLE_ROW);
    }
  },

  POINTING_COLUMN {
    @Override public boolean apply(Board board, int round) {
      return pointing(board, round, Unit.COLUMN, LogType.POINTING_PAIR_TRIPLE_COLUMN);
    }
  },

  /**
   * A value whose possible cells within a row all lie in one section: it can't
   * go anywhere else in that section.
   */
  ROW_BOX {
    @Override public boolean apply(Board board, int round) {
      return boxLine(board, round, Unit.ROW, LogType.ROW_BOX);
    }
  },

  COLUMN_BOX {
    @Override public boolean apply(Board board, int round) {
      return boxLine(board, round, Unit.COLUMN, LogType.COLUMN_BOX);
    }
  },

  /**
   * Two values confined to the same two cells of a unit: those cells can't
   * hold any other value.
   */
  HIDDEN_PAIR_ROW {
    @Override public boolean apply(Board board, int round) {
      return hiddenPair(board, round, Unit.ROW, LogType.HIDDEN_PAIR_ROW);
    }
  },

  HIDDEN_PAIR_COLUMN {
    @Override public boolean apply(Board board, int round) {
      return hiddenPair(board, round, Unit.COLUMN, LogType.HIDDEN_PAIR_COLUMN);
    }
  },

  HIDDEN_PAIR_SECTION {
    @Override public boolean apply(Board board, int round) {
      return hiddenPair(board, round, Unit.SECTION, LogType.HIDDEN_PAIR_SECTION);
    }
  };

  /**
   * Makes at most one deduction on the given board at the given round,
   * returns true if it made one.
   */
  public abstract boolean apply(Board board, int round);

  private static final int NONE = -1;

  /** Marks a value that has just one possible cell in some unit of the given kind. */
  private static boolean hiddenSingle(Board board, int round, Unit unit, LogType type) {
    for (int unitIndex = 0; unitIndex < ROW_COL_SEC_SIZE; ++unitIndex) {
      for (int valueIndex = 0; valueIndex < ROW_COL_SEC_SIZE; ++valueIndex) {
        int count = 0;
        int lastPosition = 0;
        for (int offset = 0; offset < ROW_COL_SEC_SIZE; ++offset) {
          int position = unit.cell(unitIndex, offset);
          if (board.isPossible(valueIndex, position)) {
            ++count;
            lastPosition = position;
          }
        }
        if (count == 1) {
          int value = valueIndex + 1;
          board.log(round, type, value, lastPosition);
          board.mark(lastPosition, round, value);
          return true;
        }
      }
    }
    return false;
  }

  private static boolean samePossibilities(Board board, int position1, int position2) {
    for (int valueIndex = 0; valueIndex < ROW_COL_SEC_SIZE; ++valueIndex) {
      if (board.isPossible(valueIndex, position1) != board.isPossible(valueIndex, position2))
        return false;
    }
    return true;
  }

  /**
   * Eliminates the pair's values from the other cells of the given position's
   * unit of the given kind.
   */
  private static boolean removeNakedPair(
      Board board, int round, Unit unit, int position1, int position2) {
    boolean doneSomething = false;
    int unitIndex = unit.indexOf(position1);
    for (int offset = 0; offset < ROW_COL_SEC_SIZE; ++offset) {
      int position3 = unit.cell(unitIndex, offset);
      if (position3 == position1 || position3 == position2) continue;
      for (int valueIndex = 0; valueIndex < ROW_COL_SEC_SIZE; ++valueIndex) {
        if (board.isPossible(valueIndex, position1)
            && board.eliminate(valueIndex, position3, round))
          doneSomething = true;
      }
    }
    return doneSomething;
  }

  private static LogType nakedPairType(Unit unit) {
    switch (unit) {
      case ROW: return LogType.NAKED_PAIR_ROW;
      case COLUMN: return LogType.NAKED_PAIR_COLUMN;
      case SECTION: return LogType.NAKED_PAIR_SECTION;
      default: throw new AssertionError(unit);
    }
  }

  /**
   * Looks for a section whose possible cells for some value all lie in one
   * line of the given kind, and eliminates the value from the rest of that
   * line.
   */
  private static boolean pointing(Board board, int round, Unit line, LogType type) {
    for (int valueIndex = 0; valueIndex < ROW_COL_SEC_SIZE; ++valueIndex) {
      for (int section = 0; section < ROW_COL_SEC_SIZE; ++section) {
        int lineIndex = NONE;
        boolean inOneLine = true;
        for (int offset = 0; offset < ROW_COL_SEC_SIZE && inOneLine; ++offset) {
          int position = Unit.SECTION.cell(section, offset);
          if (!board.isPossible(valueIndex, position)) continue;
          int index = line.indexOf(position);
          if (lineIndex == NONE) lineIndex = index;
          else if (lineIndex != index) inOneLine = false;
        }
        if (!inOneLine || lineIndex == NONE) continue;

        boolean doneSomething = false;
        for (int offset = 0; offset < ROW_COL_SEC_SIZE; ++offset) {
          int position = line.cell(lineIndex, offset);
          if (Unit.SECTION.indexOf(position) != section
              && board.eliminate(valueIndex, position, round))
            doneSomething = true;
        }
        if (doneSomething) {
          board.log(round, type, valueIndex + 1, line.cell(lineIndex, 0));
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Looks for a line of the given kind whose possible cells for some value all
   * lie in one section, and eliminates the value from the rest of that
   * section.
   */
  private static boolean boxLine(Board board, int round, Unit line, LogType type) {
    for (int valueIndex = 0; valueIndex < ROW_COL_SEC_SIZE; ++valueIndex) {
      for (int lineIndex = 0; lineIndex < ROW_COL_SEC_SIZE; ++lineIndex) {
        int section = NONE;
        boolean inOneSection = true;
        for (int offset = 0; offset < ROW_COL_SEC_SIZE && inOneSection; ++offset) {
          int position = line.cell(lineIndex, offset);
          if (!board.isPossible(valueIndex, position)) continue;
          int index = Unit.SECTION.indexOf(position);
          if (section == NONE) section = index;
          else if (section != index) inOneSection = false;
        }
        if (!inOneSection || section == NONE) continue;

        boolean doneSomething = false;
        for (int offset = 0; offset < ROW_COL_SEC_SIZE; ++offset) {
          int position = Unit.SECTION.cell(section, offset);
          if (line.indexOf(position) != lineIndex
              && board.eliminate(valueIndex, position, round))
            doneSomething = true;
        }
        if (doneSomething) {
          board.log(round, type, valueIndex + 1, line.cell(lineIndex, 0));
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Looks for two values whose possible cells in some unit of the given kind
   * are the same two cells, and eliminates every other value from those cells.
   */
  private static boolean hiddenPair(Board board, int round, Unit unit, LogType type) {
    int[] cells = new int[2];
    int[] cells2 = new int[2];
    for (int unitIndex = 0; unitIndex < ROW_COL_SEC_SIZE; ++unitIndex) {
      for (int valueIndex = 0; valueIndex < ROW_COL_SEC_SIZE; ++valueIndex) {
        if (possibleCells(board, unit, unitIndex, valueIndex, cells) != 2) continue;
        for (int valueIndex2 = valueIndex + 1; valueIndex2 < ROW_COL_SEC_SIZE; ++valueIndex2) {
          if (possibleCells(board, unit, unitIndex, valueIndex2, cells2) != 2
              || cells[0] != cells2[0] || cells[1] != cells2[1])
            continue;
          boolean doneSomething = false;
          for (int valueIndex3 = 0; valueIndex3 < ROW_COL_SEC_SIZE; ++valueIndex3) {
            if (valueIndex3 == valueIndex || valueIndex3 == valueIndex2) continue;
            if (board.eliminate(valueIndex3, cells[0], round))
              doneSomething = true;
            if (board.eliminate(valueIndex3, cells[1], round))
              doneSomething = true;
          }
          if (doneSomething) {
            board.log(round, type, valueIndex + 1, cells[0]);
            return true;
          }
        }
      }
    }
    return false;
  }

  /**
   * Counts the cells of the given unit where the given value is possible,
   * filling the first two of them into {@code cells}.
   */
  private static int possibleCells(
      Board board, Unit unit, int unitIndex, int valueIndex, int[] cells) {
    int count = 0;
    for (int offset = 0; offset < ROW_COL_SEC_SIZE; ++offset) {
      int position = unit.cell(unitIndex, offset);
      if (board.isPossible(valueIndex, position)) {
        if (count < 2) cells[count] = position;
        ++count;
      }
    }
    return count;
  }
}
