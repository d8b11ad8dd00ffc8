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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static us.blanshard.deduce.core.Cells.BOARD_SIZE;
import static us.blanshard.deduce.core.Cells.POSSIBILITY_SIZE;
import static us.blanshard.deduce.core.Cells.ROW_COL_SEC_SIZE;
import static us.blanshard.deduce.core.Cells.possibilityIndex;

import us.blanshard.deduce.core.Grid;
import us.blanshard.deduce.core.Unit;
import us.blanshard.deduce.history.History;
import us.blanshard.deduce.history.LogItem;
import us.blanshard.deduce.history.LogType;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * The mutable state of one solving session: the puzzle's givens, the solution
 * being worked out, and the table of which values remain possible in which
 * cells.
 *
 * <p> Every change is stamped with the round that made it.  A solution entry
 * records the round it was assigned at; a possibility entry is 0 while the
 * value is still possible in the cell and otherwise holds the round that
 * eliminated it.  Stamps are written once, so rolling back a round undoes
 * exactly that round's work and nothing else.  Round 1 belongs to the givens.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Board {
  private static final Logger logger = Logger.getLogger(Board.class.getName());

  /** The round at which the givens are marked. */
  public static final int GIVEN_ROUND = 1;

  private final int[] puzzle = new int[BOARD_SIZE];
  private final int[] solution = new int[BOARD_SIZE];
  private final int[] solutionRound = new int[BOARD_SIZE];
  private final int[] possibilities = new int[POSSIBILITY_SIZE];
  private final History history;

  public Board(History history) {
    this.history = checkNotNull(history);
  }

  public History getHistory() {
    return history;
  }

  /**
   * Replaces the puzzle with the given one and resets the board to it.
   * Returns false if the givens contradict one another.
   */
  public boolean setPuzzle(Grid grid) {
    for (int cell = 0; cell < BOARD_SIZE; ++cell)
      puzzle[cell] = grid.get(cell);
    return reset();
  }

  /** Empties the puzzle and resets the board. */
  public void clearPuzzle() {
    Arrays.fill(puzzle, 0);
    reset();
  }

  /**
   * Resets the board to its initial state with only the givens: clears the
   * solution and the history, and marks each given at round 1.  Returns false
   * if some given is ruled out by an earlier one, in which case the board is
   * left partly marked.
   */
  public boolean reset() {
    Arrays.fill(solution, 0);
    Arrays.fill(solutionRound, 0);
    Arrays.fill(possibilities, 0);
    history.clear();

    for (int position = 0; position < BOARD_SIZE; ++position) {
      int value = puzzle[position];
      if (value > 0) {
        if (possibilities[possibilityIndex(value - 1, position)] != 0) {
          logger.fine("Given " + value + " at " + position + " conflicts with an earlier given");
          return false;
        }
        mark(position, GIVEN_ROUND, value);
        log(GIVEN_ROUND, LogType.GIVEN, value, position);
      }
    }
    return true;
  }

  /**
   * Assigns the given value to the given cell, and eliminates it from the
   * rest of the cell's row, column and section, all at the given round.
   *
   * @throws IllegalStateException if the cell is already assigned or the value
   *     is no longer possible there; the caller has lost track of the board
   */
  public void mark(int position, int round, int value) {
    checkElementIndex(position, BOARD_SIZE);
    checkArgument(value >= 1 && value <= ROW_COL_SEC_SIZE, "Bad value %s", value);
    if (logger.isLoggable(Level.FINEST))
      logger.finest("Mark position " + position + ", round " + round + ", value " + value);
    checkState(solution[position] == 0, "Marking position %s that already has been marked",
               position);
    checkState(solutionRound[position] == 0, "Marking position %s that was marked in round %s",
               position, solutionRound[position]);
    int valueIndex = value - 1;
    checkState(possibilities[possibilityIndex(valueIndex, position)] == 0,
               "Marking impossible value %s at position %s", value, position);

    solution[position] = value;
    solutionRound[position] = round;

    for (Unit unit : Unit.values()) {
      int unitIndex = unit.indexOf(position);
      for (int offset = 0; offset < ROW_COL_SEC_SIZE; ++offset)
        eliminate(valueIndex, unit.cell(unitIndex, offset), round);
    }

    // The cell itself is determined; no other value is possible here.
    for (int index = 0; index < ROW_COL_SEC_SIZE; ++index)
      eliminate(index, position, round);
  }

  /**
   * Stamps the given value index as impossible at the given cell, unless it
   * already is.  Returns true if this call eliminated it.
   */
  boolean eliminate(int valueIndex, int position, int round) {
    int index = possibilityIndex(valueIndex, position);
    if (possibilities[index] != 0)
      return false;
    possibilities[index] = round;
    return true;
  }

  /**
   * Undoes everything done at the given round: assignments, eliminations and
   * the trailing solve instructions.
   */
  public void rollback(int round) {
    if (logger.isLoggable(Level.FINEST))
      logger.finest("Roll back round " + round);
    if (history.isEnabled())
      history.add(LogItem.rollback(round));

    for (int i = 0; i < BOARD_SIZE; ++i) {
      if (solutionRound[i] == round) {
        solutionRound[i] = 0;
        solution[i] = 0;
      }
    }
    for (int i = 0; i < POSSIBILITY_SIZE; ++i) {
      if (possibilities[i] == round)
        possibilities[i] = 0;
    }
    history.rollback(round);
  }

  /** Records a step, if anyone is listening. */
  void log(int round, LogType type, int value, int position) {
    if (history.isEnabled())
      history.add(LogItem.of(round, type, value, position));
  }

  /** Records a step that has no value, if anyone is listening. */
  void log(int round, LogType type, int position) {
    if (history.isEnabled())
      history.add(LogItem.atPosition(round, type, position));
  }

  /** Tells whether every cell has been assigned. */
  public boolean isSolved() {
    for (int i = 0; i < BOARD_SIZE; ++i) {
      if (solution[i] == 0)
        return false;
    }
    return true;
  }

  /** Tells whether some unassigned cell has no possible values left. */
  public boolean isImpossible() {
    for (int position = 0; position < BOARD_SIZE; ++position) {
      if (solution[position] == 0 && countPossibilities(position) == 0)
        return true;
    }
    return false;
  }

  /** Tells whether the value with the given index is still possible at the given cell. */
  public boolean isPossible(int valueIndex, int position) {
    return possibilities[possibilityIndex(valueIndex, position)] == 0;
  }

  /** Counts the values still possible at the given cell. */
  public int countPossibilities(int position) {
    int count = 0;
    for (int valueIndex = 0; valueIndex < ROW_COL_SEC_SIZE; ++valueIndex) {
      if (isPossible(valueIndex, position))
        ++count;
    }
    return count;
  }

  /**
   * Returns the round that eliminated the given value index at the given cell,
   * or 0 if it is still possible.
   */
  public int getPossibilityRound(int valueIndex, int position) {
    return possibilities[possibilityIndex(valueIndex, position)];
  }

  /** Returns the given at the given cell, 0 if blank. */
  public int getPuzzleValue(int position) {
    return puzzle[position];
  }

  /** Sets the given at the given cell without resetting the board. */
  public void setPuzzleValue(int position, int value) {
    checkElementIndex(position, BOARD_SIZE);
    checkArgument(value >= 0 && value <= ROW_COL_SEC_SIZE, "Bad value %s", value);
    puzzle[position] = value;
  }

  /** Returns the value assigned to the given cell so far, 0 if none. */
  public int getSolutionValue(int position) {
    return solution[position];
  }

  /** Returns the round at which the given cell was assigned, 0 if it wasn't. */
  public int getSolutionRound(int position) {
    return solutionRound[position];
  }

  /** Returns the number of givens in the puzzle. */
  public int getGivenCount() {
    int count = 0;
    for (int value : puzzle) {
      if (value != 0) ++count;
    }
    return count;
  }

  public Grid getPuzzle() {
    return Grid.of(puzzle);
  }

  public Grid getSolution() {
    return Grid.of(solution);
  }

  /** Copies the solution so far into the puzzle. */
  public void solutionToPuzzle() {
    System.arraycopy(solution, 0, puzzle, 0, BOARD_SIZE);
  }

  /**
   * Captures the solution, assignment rounds, possibility stamps and solve
   * instructions, for comparing whole board states.
   */
  public Snapshot snapshot() {
    return new Snapshot(this);
  }

  /** A frozen copy of a board's derived state. */
  public static final class Snapshot {
    private final int[] solution;
    private final int[] solutionRound;
    private final int[] possibilities;
    private final List<LogItem> instructions;

    private Snapshot(Board board) {
      this.solution = board.solution.clone();
      this.solutionRound = board.solutionRound.clone();
      this.possibilities = board.possibilities.clone();
      this.instructions = board.history.getSolveInstructions();
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (!(o instanceof Snapshot)) return false;
      Snapshot that = (Snapshot) o;
      return Arrays.equals(this.solution, that.solution)
          && Arrays.equals(this.solutionRound, that.solutionRound)
          && Arrays.equals(this.possibilities, that.possibilities)
          && this.instructions.equals(that.instructions);
    }

    @Override public int hashCode() {
      return Arrays.hashCode(possibilities);
    }
  }
}
