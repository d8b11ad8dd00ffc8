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

import us.blanshard.deduce.history.History;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Counts the solutions to the puzzle on a board by exhaustive search.  The
 * search walks every branch, rolling each one back as it goes, so the board
 * ends up exactly as a reset leaves it.
 *
 * @author Luke Blanshard
 */
public final class SolutionCounter {
  private static final Logger logger = Logger.getLogger(SolutionCounter.class.getName());

  /** The most a limited count reports. */
  public static final int LIMIT = 2;

  private final SearchEngine engine;
  private final Board board;

  public SolutionCounter(SearchEngine engine) {
    this.engine = checkNotNull(engine);
    this.board = engine.getBoard();
  }

  /**
   * Resets the board and counts the solutions to its puzzle.  If {@code
   * limitToTwo} is set, stops as soon as a second solution turns up and
   * reports 2.  Nothing is recorded while counting; the history's settings are
   * restored afterwards, but whatever it held before is gone.  Puzzles whose
   * givens contradict one another have no solutions.
   */
  public int countSolutions(boolean limitToTwo) {
    History history = board.getHistory();
    boolean recordHistory = history.isRecordHistory();
    boolean logHistory = history.isLogHistory();
    history.setRecordHistory(false);
    history.setLogHistory(false);
    try {
      if (!board.reset())
        return 0;
      int count = countSolutionsRound(SearchEngine.FIRST_SOLVE_ROUND, limitToTwo);
      if (logger.isLoggable(Level.FINE))
        logger.fine("Counted " + count + (limitToTwo ? " limited" : "") + " solutions");
      return count;
    } finally {
      history.setRecordHistory(recordHistory);
      history.setLogHistory(logHistory);
    }
  }

  /**
   * Counts the solutions reachable from the board's current state, deducing
   * at the given round and guessing at the next.  Rolls back the given round
   * before returning, which also undoes the guess that led here.  Callers
   * outside a count must reset the board first.
   */
  public int countSolutionsRound(int round, boolean limitToTwo) {
    Propagator propagator = engine.getPropagator();
    while (propagator.singleSolveMove(round)) {
      if (board.isSolved()) {
        board.rollback(round);
        return 1;
      }
      if (board.isImpossible()) {
        board.rollback(round);
        return 0;
      }
    }
    if (board.isSolved()) {
      board.rollback(round);
      return 1;
    }

    int solutions = 0;
    int nextRound = round + 1;
    for (int guessNumber = 0; engine.guess(nextRound, guessNumber); ++guessNumber) {
      solutions += countSolutionsRound(nextRound, limitToTwo);
      if (limitToTwo && solutions >= LIMIT) {
        board.rollback(round);
        return LIMIT;
      }
    }
    board.rollback(round);
    return solutions;
  }
}
