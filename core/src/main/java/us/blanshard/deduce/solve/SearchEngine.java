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

import static com.google.common.base.Preconditions.checkNotNull;
import static us.blanshard.deduce.core.Cells.BOARD_SIZE;
import static us.blanshard.deduce.core.Cells.ROW_COL_SEC_SIZE;

import us.blanshard.deduce.history.LogType;

import com.google.common.primitives.Ints;

import java.util.Collections;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * A depth-first, randomized solver working on a {@link Board}.  It deduces
 * as far as the techniques allow, then guesses at the cell with the fewest
 * possibilities and carries on; a guess that leads to a contradiction is
 * rolled back and the next candidate tried.
 *
 * <p> Rounds come in pairs below the givens' round: deductions made at an
 * even round, the guess that started it at the odd round just before.  The
 * cells and values are tried in an order shuffled by the random number
 * generator, so different generators find different solutions to puzzles
 * that have more than one.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class SearchEngine {
  private static final Logger logger = Logger.getLogger(SearchEngine.class.getName());

  /** The round at which solving starts, right after the givens. */
  public static final int FIRST_SOLVE_ROUND = Board.GIVEN_ROUND + 1;

  private final Board board;
  private final Propagator propagator;
  private final Random random;
  private final int[] cellOrder = new int[BOARD_SIZE];
  private final int[] valueOrder = new int[ROW_COL_SEC_SIZE];
  private int lastSolveRound;

  public SearchEngine(Board board, Random random) {
    this.board = checkNotNull(board);
    this.propagator = new Propagator(board);
    this.random = checkNotNull(random);
    for (int i = 0; i < BOARD_SIZE; ++i)
      cellOrder[i] = i;
    for (int i = 0; i < ROW_COL_SEC_SIZE; ++i)
      valueOrder[i] = i;
  }

  public Board getBoard() {
    return board;
  }

  public Propagator getPropagator() {
    return propagator;
  }

  /** Reorders the cells and values that guessing tries. */
  public void shuffle() {
    Collections.shuffle(Ints.asList(cellOrder), random);
    Collections.shuffle(Ints.asList(valueOrder), random);
  }

  /** Returns a copy of the order in which guessing scans the cells. */
  public int[] getCellOrder() {
    return cellOrder.clone();
  }

  /** The round most recently started by {@link #solveRound}. */
  public int getLastSolveRound() {
    return lastSolveRound;
  }

  /**
   * Resets the board to its givens and solves it.  Returns false if the givens
   * contradict one another or the puzzle has no solution.  When there are
   * several solutions, finds one of them.
   */
  public boolean solve() {
    if (!board.reset())
      return false;
    shuffle();
    return solveRound(FIRST_SOLVE_ROUND);
  }

  /**
   * Deduces what it can at the given round, then guesses its way through
   * whatever is left, using the next two rounds for each guess and the
   * deductions that follow it.  Returns true once the board is solved; on
   * false, the work of the later rounds has been rolled back but this round's
   * deductions remain.
   */
  public boolean solveRound(int round) {
    lastSolveRound = round;

    while (propagator.singleSolveMove(round)) {
      if (board.isSolved())
        return true;
      if (board.isImpossible())
        return false;
    }
    if (board.isSolved())
      return true;

    int guessRound = round + 1;
    int nextRound = round + 2;
    for (int guessNumber = 0; guess(guessRound, guessNumber); ++guessNumber) {
      if (!board.isImpossible() && solveRound(nextRound))
        return true;
      if (logger.isLoggable(Level.FINE))
        logger.fine("Guess " + guessNumber + " at round " + guessRound + " failed");
      board.rollback(nextRound);
      board.rollback(guessRound);
    }
    return false;
  }

  /**
   * Assigns the given guess number's candidate to the unassigned cell with
   * the fewest possibilities, at the given round.  Candidates are counted in
   * shuffled value order.  Returns false when the cell has no such candidate,
   * or there is no unassigned cell.
   */
  public boolean guess(int round, int guessNumber) {
    int position = findPositionWithFewestPossibilities();
    if (position < 0)
      return false;
    int candidate = 0;
    for (int valueIndex : valueOrder) {
      if (board.isPossible(valueIndex, position)) {
        if (candidate == guessNumber) {
          int value = valueIndex + 1;
          board.log(round, LogType.GUESS, value, position);
          board.mark(position, round, value);
          return true;
        }
        ++candidate;
      }
    }
    return false;
  }

  /**
   * Returns the unassigned cell with the fewest possible values, the first
   * such in shuffled order, or -1 if every cell is assigned.
   */
  public int findPositionWithFewestPossibilities() {
    int minPossibilities = ROW_COL_SEC_SIZE + 1;
    int best = -1;
    for (int position : cellOrder) {
      if (board.getSolutionValue(position) != 0) continue;
      int count = board.countPossibilities(position);
      if (count < minPossibilities) {
        minPossibilities = count;
        best = position;
      }
    }
    return best;
  }

  /**
   * Rolls back the deduction rounds of the last solve, leaving only the
   * givens and the guesses.
   */
  public void rollbackNonGuesses() {
    for (int round = FIRST_SOLVE_ROUND; round <= lastSolveRound; round += 2)
      board.rollback(round);
  }
}
