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

/**
 * How hard a puzzle is, judged by the hardest step needed to solve it.
 *
 * @author Luke Blanshard
 */
public enum Difficulty {
  /** Nothing was recorded, or nothing needed solving. */
  UNKNOWN,
  /** Only cells with a single possibility. */
  SIMPLE,
  /** Hidden singles. */
  EASY,
  /** Pairs, pointing pairs and triples, and box/line reductions. */
  MEDIUM,
  /** Guessing was required. */
  EXPERT;

  /**
   * Classifies the given solve instructions by the hardest step among them.
   */
  public static Difficulty classify(Iterable<LogItem> instructions) {
    Difficulty answer = UNKNOWN;
    for (LogItem item : instructions) {
      Difficulty d = of(item.getType());
      if (d.compareTo(answer) > 0)
        answer = d;
    }
    return answer;
  }

  /** Returns the difficulty that a step of the given type implies. */
  public static Difficulty of(LogType type) {
    switch (type) {
      case GUESS:
        return EXPERT;
      case ROW_BOX:
      case COLUMN_BOX:
      case POINTING_PAIR_TRIPLE_ROW:
      case POINTING_PAIR_TRIPLE_COLUMN:
      case HIDDEN_PAIR_ROW:
      case HIDDEN_PAIR_COLUMN:
      case HIDDEN_PAIR_SECTION:
      case NAKED_PAIR_ROW:
      case NAKED_PAIR_COLUMN:
      case NAKED_PAIR_SECTION:
        return MEDIUM;
      case HIDDEN_SINGLE_ROW:
      case HIDDEN_SINGLE_COLUMN:
      case HIDDEN_SINGLE_SECTION:
        return EASY;
      case SINGLE:
        return SIMPLE;
      case GIVEN:
      case ROLLBACK:
        return UNKNOWN;
      default:
        throw new AssertionError(type);
    }
  }
}
