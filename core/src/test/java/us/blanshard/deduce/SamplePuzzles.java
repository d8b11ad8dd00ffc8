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

import us.blanshard.deduce.core.Grid;

/**
 * Puzzles with known properties, shared among tests.
 */
public class SamplePuzzles {

  /** The "Easter Monster": unique solution, needs guessing. */
  public static final Grid EASTER_MONSTER = Grid.fromString(
      "1.......2.9.4...5...6...7...5.9.3.......7.......85..4.7.....6...3...9.8...2.....1");
  public static final Grid EASTER_MONSTER_SOLUTION = Grid.fromString(
      "174385962293467158586192734451923876928674315367851249719548623635219487842736591");

  /**
   * Solved by singles and hidden singles alone: 24 givens, 39 singles, 18
   * hidden singles.
   */
  public static final Grid LOGICAL = Grid.fromString(
      ".9..74....2....6.375...........9..545.3.4.......58.....45....8....1.2.3.......92.");
  public static final Grid LOGICAL_SOLUTION = Grid.fromString(
      "396874512428915673751326849812697354563241798974583261245739186689152437137468925");

  /** Unique solution. */
  public static final Grid UNIQUE = Grid.fromString(
      ".6.5.4.3.1...9...8.........9...5...6.4.6.2.7.7...4...5.........4...8...1.5.2.3.4.");
  public static final Grid UNIQUE_SOLUTION = Grid.fromString(
      "869574132124396758375128694932857416541632879786941325217469583493785261658213947");

  /** Two givens in the same unit share a value. */
  public static final Grid BROKEN = Grid.fromString(
      "...8.9..6.23.........6.8...7....1..2...45...9......6......7......1.46.....3......");

  /** No solution, though no two givens clash. */
  public static final Grid NO_SOLUTION = Grid.fromString(
      "1....6....59.....82....8....45...3....3...7....6..3.54...325..6........17389.....");

  /** No solution, found only after a lot of searching. */
  public static final Grid NO_SOLUTION_SLOW = Grid.fromString(
      "..9..87....65..3...............3..69.........23..7...............8..36....41..2..");

  /** Many solutions. */
  public static final Grid MULTIPLE = Grid.fromString(
      ".....6....59.....82....8....45........3........6..3.54...325..6..................");

  /** The Easter Monster's solution with a swappable rectangle blanked: two solutions. */
  public static final Grid TWO_SOLUTIONS = Grid.fromString(
      "17..8596229..67158586192734451923876928674315367851249719548623635219487842736591");

  /** Two independent swappable rectangles blanked: four solutions. */
  public static final Grid FOUR_SOLUTIONS = Grid.fromString(
      "17..8596229..6715858619273445192387692867.3.536785.2.9719548623635219487842736591");

  /** Tells whether the given solution is solved and agrees with the puzzle's givens. */
  public static boolean solves(Grid solution, Grid puzzle) {
    if (!solution.isSolved()) return false;
    for (int cell = 0; cell < 81; ++cell) {
      if (puzzle.isSet(cell) && puzzle.get(cell) != solution.get(cell))
        return false;
    }
    return true;
  }

  private SamplePuzzles() {}
}
