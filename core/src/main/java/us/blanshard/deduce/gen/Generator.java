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

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.deduce.core.Grid;
import us.blanshard.deduce.history.History;
import us.blanshard.deduce.solve.Board;
import us.blanshard.deduce.solve.SearchEngine;
import us.blanshard.deduce.solve.SolutionCounter;

import java.util.Random;
import java.util.logging.Logger;

/**
 * Generates puzzles with unique solutions.  Solves an empty board to get a
 * random filled grid, then takes clues away one at a time (along with their
 * symmetric partners), putting back any whose removal lets in a second
 * solution.  The result is minimal: no remaining clue, or clue group, can be
 * removed.
 *
 * @author Luke Blanshard
 */
public final class Generator {
  private static final Logger logger = Logger.getLogger(Generator.class.getName());

  private final SearchEngine engine;
  private final SolutionCounter counter;
  private final Random random;

  public Generator(SearchEngine engine, SolutionCounter counter, Random random) {
    this.engine = checkNotNull(engine);
    this.counter = checkNotNull(counter);
    this.random = checkNotNull(random);
  }

  /**
   * Generates a new puzzle on the board with the given symmetry, and returns
   * it.  The board is left reset to the new puzzle.  History is neither
   * recorded nor logged while generating.
   */
  public Grid generate(Symmetry symmetry) {
    Board board = engine.getBoard();
    symmetry = symmetry.resolve(random);
    logger.fine("Symmetry: " + symmetry.getName());

    History history = board.getHistory();
    boolean recordHistory = history.isRecordHistory();
    boolean logHistory = history.isLogHistory();
    history.setRecordHistory(false);
    history.setLogHistory(false);
    try {
      board.clearPuzzle();
      engine.shuffle();
      engine.solve();

      // Without symmetry, the cells filled by deduction can't be needed.
      if (symmetry == Symmetry.NONE)
        engine.rollbackNonGuesses();

      board.solutionToPuzzle();
      engine.shuffle();

      for (int position : engine.getCellOrder()) {
        if (board.getPuzzleValue(position) == 0) continue;
        int[] partners = symmetry.partners(position);
        int savedValue = board.getPuzzleValue(position);
        board.setPuzzleValue(position, 0);
        int[] savedPartners = new int[partners.length];
        for (int i = 0; i < partners.length; ++i) {
          savedPartners[i] = board.getPuzzleValue(partners[i]);
          board.setPuzzleValue(partners[i], 0);
        }

        board.reset();
        if (counter.countSolutionsRound(SearchEngine.FIRST_SOLVE_ROUND, true) > 1) {
          board.setPuzzleValue(position, savedValue);
          for (int i = 0; i < partners.length; ++i) {
            if (savedPartners[i] != 0)
              board.setPuzzleValue(partners[i], savedPartners[i]);
          }
        }
      }

      board.reset();
      logger.fine("Generated puzzle with " + board.getGivenCount() + " givens");
      return board.getPuzzle();
    } finally {
      history.setRecordHistory(recordHistory);
      history.setLogHistory(logHistory);
    }
  }

  /** Generates a new puzzle with no symmetry. */
  public Grid generate() {
    return generate(Symmetry.NONE);
  }
}
