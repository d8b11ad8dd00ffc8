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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies the deduction techniques to a board, one move at a time.
 *
 * @author Luke Blanshard
 */
public final class Propagator {
  private static final Logger logger = Logger.getLogger(Propagator.class.getName());

  private final Board board;

  public Propagator(Board board) {
    this.board = checkNotNull(board);
  }

  /**
   * Makes the first deduction available, trying the techniques in order.
   * Returns false if none of them applies.
   */
  public boolean singleSolveMove(int round) {
    for (Technique technique : Technique.values()) {
      if (technique.apply(board, round)) {
        if (logger.isLoggable(Level.FINEST))
          logger.finest("Round " + round + ": " + technique);
        return true;
      }
    }
    return false;
  }

  /**
   * Makes deductions until none applies, the board is solved, or it turns out
   * to be impossible.  Returns the number of moves made.
   */
  public int propagate(int round) {
    int moves = 0;
    while (!board.isSolved() && !board.isImpossible() && singleSolveMove(round))
      ++moves;
    return moves;
  }
}
