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
package us.blanshard.deduce;

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.deduce.core.Grid;
import us.blanshard.deduce.gen.Generator;
import us.blanshard.deduce.gen.Symmetry;
import us.blanshard.deduce.history.Difficulty;
import us.blanshard.deduce.history.History;
import us.blanshard.deduce.history.LogItem;
import us.blanshard.deduce.history.SolveStats;
import us.blanshard.deduce.solve.Board;
import us.blanshard.deduce.solve.SearchEngine;
import us.blanshard.deduce.solve.SolutionCounter;

import com.google.common.collect.ImmutableList;

import java.util.Random;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * A Sudoku solving and generating session.  Holds one puzzle at a time; solves
 * it, counts its solutions, rates it, or replaces it with a freshly generated
 * one.
 *
 * <p> History recording and logging are off to start with.  Turn recording on
 * before calling {@link #solve} to get the solve instructions, the difficulty
 * and the statistics; those describe the most recent solve, and counting
 * solutions or setting a new puzzle discards them.
 *
 * <p> All randomness comes from the {@link Random} given at construction, so a
 * seeded one makes a session reproducible.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Deducer {
  private final History history = new History();
  private final Board board = new Board(history);
  private final SearchEngine engine;
  private final SolutionCounter counter;
  private final Generator generator;

  public Deducer() {
    this(new Random());
  }

  public Deducer(Random random) {
    checkNotNull(random);
    this.engine = new SearchEngine(board, random);
    this.counter = new SolutionCounter(engine);
    this.generator = new Generator(engine, counter, random);
  }

  /**
   * Sets the puzzle to solve.  Returns false if its givens contradict one
   * another, in which case the puzzle has no solution.
   */
  public boolean setPuzzle(Grid puzzle) {
    return board.setPuzzle(checkNotNull(puzzle));
  }

  /**
   * Sets the puzzle from an array of 81 values, 0 for blank.
   *
   * @throws IllegalArgumentException if the array is the wrong size or holds a
   *     value outside 0-9
   */
  public boolean setPuzzle(int[] puzzle) {
    return setPuzzle(Grid.of(puzzle));
  }

  public Grid getPuzzle() {
    return board.getPuzzle();
  }

  /** Returns the solution as far as it has been worked out. */
  public Grid getSolution() {
    return board.getSolution();
  }

  /** Generates a new puzzle with no symmetry, and makes it the current one. */
  public Grid generatePuzzle() {
    return generator.generate();
  }

  /** Generates a new puzzle with the given symmetry, and makes it the current one. */
  public Grid generatePuzzle(Symmetry symmetry) {
    return generator.generate(checkNotNull(symmetry));
  }

  /**
   * Solves the current puzzle.  Returns false if it has no solution; when it
   * has several, finds one of them.
   */
  public boolean solve() {
    return engine.solve();
  }

  public boolean isSolved() {
    return board.isSolved();
  }

  public boolean hasNoSolution() {
    return countSolutionsLimited() == 0;
  }

  public boolean hasUniqueSolution() {
    return countSolutionsLimited() == 1;
  }

  public boolean hasMultipleSolutions() {
    return countSolutionsLimited() > 1;
  }

  /** Counts every solution.  May take a very long time for sparse puzzles. */
  public int countTotalSolutions() {
    return counter.countSolutions(false);
  }

  /** Counts solutions up to {@link SolutionCounter#LIMIT}. */
  public int countSolutionsLimited() {
    return counter.countSolutions(true);
  }

  /**
   * Rates the most recently solved puzzle by the hardest step its solution
   * needed.  UNKNOWN unless history was being recorded during the solve.
   */
  public Difficulty getDifficulty() {
    return Difficulty.classify(getSolveInstructions());
  }

  /** Every step recorded, including abandoned guesses and their rollbacks. */
  public ImmutableList<LogItem> getSolveHistory() {
    return history.getSolveHistory();
  }

  /** The steps that lead to the solution; empty unless the board is solved. */
  public ImmutableList<LogItem> getSolveInstructions() {
    return board.isSolved() ? history.getSolveInstructions() : ImmutableList.<LogItem>of();
  }

  /** Summarizes the most recent solve. */
  public SolveStats getStats() {
    return SolveStats.of(history, board.getGivenCount());
  }

  public void setRecordHistory(boolean recordHistory) {
    history.setRecordHistory(recordHistory);
  }

  public void setLogHistory(boolean logHistory) {
    history.setLogHistory(logHistory);
  }
}
