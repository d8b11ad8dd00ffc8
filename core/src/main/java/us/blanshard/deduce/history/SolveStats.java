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
package us.blanshard.deduce.history;

import static us.blanshard.deduce.history.LogType.COLUMN_BOX;
import static us.blanshard.deduce.history.LogType.GUESS;
import static us.blanshard.deduce.history.LogType.HIDDEN_PAIR_COLUMN;
import static us.blanshard.deduce.history.LogType.HIDDEN_PAIR_ROW;
import static us.blanshard.deduce.history.LogType.HIDDEN_PAIR_SECTION;
import static us.blanshard.deduce.history.LogType.HIDDEN_SINGLE_COLUMN;
import static us.blanshard.deduce.history.LogType.HIDDEN_SINGLE_ROW;
import static us.blanshard.deduce.history.LogType.HIDDEN_SINGLE_SECTION;
import static us.blanshard.deduce.history.LogType.NAKED_PAIR_COLUMN;
import static us.blanshard.deduce.history.LogType.NAKED_PAIR_ROW;
import static us.blanshard.deduce.history.LogType.NAKED_PAIR_SECTION;
import static us.blanshard.deduce.history.LogType.POINTING_PAIR_TRIPLE_COLUMN;
import static us.blanshard.deduce.history.LogType.POINTING_PAIR_TRIPLE_ROW;
import static us.blanshard.deduce.history.LogType.ROLLBACK;
import static us.blanshard.deduce.history.LogType.ROW_BOX;
import static us.blanshard.deduce.history.LogType.SINGLE;

import com.google.common.base.MoreObjects;

import javax.annotation.concurrent.Immutable;

/**
 * A summary of the steps it took to solve a puzzle.  Everything but the
 * backtrack count comes from the solve instructions; backtracks are counted
 * over the full solve history, since their branches are gone from the
 * instructions.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class SolveStats {
  public final Difficulty difficulty;
  public final int givenCount;
  public final int singleCount;
  public final int hiddenSingleCount;
  public final int nakedPairCount;
  public final int hiddenPairCount;
  public final int pointingPairTripleCount;
  public final int boxLineReductionCount;
  public final int guessCount;
  public final int backtrackCount;

  private SolveStats(History history, int givenCount) {
    this.difficulty = Difficulty.classify(history.getSolveInstructions());
    this.givenCount = givenCount;
    this.singleCount = history.countInstructions(SINGLE);
    this.hiddenSingleCount = history.countInstructions(
        HIDDEN_SINGLE_ROW, HIDDEN_SINGLE_COLUMN, HIDDEN_SINGLE_SECTION);
    this.nakedPairCount = history.countInstructions(
        NAKED_PAIR_ROW, NAKED_PAIR_COLUMN, NAKED_PAIR_SECTION);
    this.hiddenPairCount = history.countInstructions(
        HIDDEN_PAIR_ROW, HIDDEN_PAIR_COLUMN, HIDDEN_PAIR_SECTION);
    this.pointingPairTripleCount = history.countInstructions(
        POINTING_PAIR_TRIPLE_ROW, POINTING_PAIR_TRIPLE_COLUMN);
    this.boxLineReductionCount = history.countInstructions(ROW_BOX, COLUMN_BOX);
    this.guessCount = history.countInstructions(GUESS);
    this.backtrackCount = history.countHistory(ROLLBACK);
  }

  /** Summarizes the given history of a puzzle with the given number of givens. */
  public static SolveStats of(History history, int givenCount) {
    return new SolveStats(history, givenCount);
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("difficulty", difficulty)
        .add("givens", givenCount)
        .add("singles", singleCount)
        .add("hiddenSingles", hiddenSingleCount)
        .add("nakedPairs", nakedPairCount)
        .add("hiddenPairs", hiddenPairCount)
        .add("pointingPairTriples", pointingPairTripleCount)
        .add("boxLineReductions", boxLineReductionCount)
        .add("guesses", guessCount)
        .add("backtracks", backtrackCount)
        .toString();
  }
}
