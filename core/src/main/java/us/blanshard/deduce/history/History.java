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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Records the steps taken while solving a puzzle.  Keeps two lists: the solve
 * history, which holds every step including those on branches that were later
 * rolled back, and the solve instructions, which hold only the steps that
 * still stand.
 *
 * <p> Nothing is kept unless recording is turned on; logging, when turned on,
 * writes each step to the logger as it happens.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class History {
  private static final Logger logger = Logger.getLogger(History.class.getName());

  private final List<LogItem> solveHistory = Lists.newArrayList();
  private final List<LogItem> solveInstructions = Lists.newArrayList();
  private boolean recordHistory;
  private boolean logHistory;

  public boolean isRecordHistory() {
    return recordHistory;
  }

  public void setRecordHistory(boolean recordHistory) {
    this.recordHistory = recordHistory;
  }

  public boolean isLogHistory() {
    return logHistory;
  }

  public void setLogHistory(boolean logHistory) {
    this.logHistory = logHistory;
  }

  /**
   * Tells whether items given to {@link #add} go anywhere.  Callers check this
   * before building an item.
   */
  public boolean isEnabled() {
    return recordHistory || logHistory;
  }

  public void add(LogItem item) {
    if (logHistory)
      logger.info(item.getDescription());
    if (recordHistory) {
      solveHistory.add(item);
      solveInstructions.add(item);
    }
  }

  /**
   * Removes the trailing solve instructions made at the given round.  The
   * solve history is left alone.
   */
  public void rollback(int round) {
    int size = solveInstructions.size();
    while (size > 0 && solveInstructions.get(size - 1).getRound() == round)
      solveInstructions.remove(--size);
  }

  /** Forgets everything recorded so far. */
  public void clear() {
    solveHistory.clear();
    solveInstructions.clear();
  }

  /** Every step recorded, including those of abandoned branches. */
  public ImmutableList<LogItem> getSolveHistory() {
    return ImmutableList.copyOf(solveHistory);
  }

  /** The steps that lead to the current state of the board. */
  public ImmutableList<LogItem> getSolveInstructions() {
    return ImmutableList.copyOf(solveInstructions);
  }

  /** Counts the items of the given types in the solve instructions. */
  public int countInstructions(LogType... types) {
    return count(solveInstructions, types);
  }

  /** Counts the items of the given types in the solve history. */
  public int countHistory(LogType... types) {
    return count(solveHistory, types);
  }

  /** Counts the items in the given list whose type is one of those given. */
  public static int count(List<LogItem> items, LogType... types) {
    List<LogType> wanted = Arrays.asList(types);
    int count = 0;
    for (LogItem item : items) {
      if (wanted.contains(item.getType()))
        ++count;
    }
    return count;
  }
}
