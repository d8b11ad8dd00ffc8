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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static us.blanshard.deduce.core.Cells.BOARD_SIZE;
import static us.blanshard.deduce.core.Cells.ROW_COL_SEC_SIZE;

import us.blanshard.deduce.core.Cells;

import com.google.common.base.Objects;

import java.util.OptionalInt;

import javax.annotation.concurrent.Immutable;

/**
 * One step taken while solving a puzzle.  The round lets the steps of a
 * failed branch be backed out; the value and position are absent for steps
 * that don't have one (a rollback has neither, a naked pair has no single
 * value).
 *
 * @author Luke Blanshard
 */
@Immutable
public final class LogItem {
  private static final int ABSENT = -1;

  private final int round;
  private final LogType type;
  private final int value;
  private final int position;

  private LogItem(int round, LogType type, int value, int position) {
    this.round = round;
    this.type = checkNotNull(type);
    this.value = value;
    this.position = position;
  }

  /** Makes an item carrying both a value (1-9) and a position (0-80). */
  public static LogItem of(int round, LogType type, int value, int position) {
    checkArgument(value >= 1 && value <= ROW_COL_SEC_SIZE, "Bad value %s", value);
    checkElementIndex(position, BOARD_SIZE);
    return new LogItem(round, type, value, position);
  }

  /** Makes an item with a position but no value. */
  public static LogItem atPosition(int round, LogType type, int position) {
    checkElementIndex(position, BOARD_SIZE);
    return new LogItem(round, type, ABSENT, position);
  }

  /** Makes the item recording the rollback of the given round. */
  public static LogItem rollback(int round) {
    return new LogItem(round, LogType.ROLLBACK, ABSENT, ABSENT);
  }

  /** Makes an item from possibly-absent fields, as read back from storage. */
  static LogItem restore(int round, LogType type, OptionalInt value, OptionalInt position) {
    return new LogItem(round, type, value.orElse(ABSENT), position.orElse(ABSENT));
  }

  /** The round at which this step was taken. */
  public int getRound() {
    return round;
  }

  public LogType getType() {
    return type;
  }

  /** The value set or acted on by this step. */
  public OptionalInt getValue() {
    return value == ABSENT ? OptionalInt.empty() : OptionalInt.of(value);
  }

  /** The cell (0-80) this step concerns. */
  public OptionalInt getPosition() {
    return position == ABSENT ? OptionalInt.empty() : OptionalInt.of(position);
  }

  /** The row (1-9) this step concerns. */
  public OptionalInt getRow() {
    return position == ABSENT ? OptionalInt.empty() : OptionalInt.of(Cells.cellToRow(position) + 1);
  }

  /** The column (1-9) this step concerns. */
  public OptionalInt getColumn() {
    return position == ABSENT
        ? OptionalInt.empty() : OptionalInt.of(Cells.cellToColumn(position) + 1);
  }

  /**
   * Describes this step, for instance "Round: 3 - Mark guess (start round)
   * (Row: 1 - Column: 5 - Value: 7)".
   */
  public String getDescription() {
    StringBuilder sb = new StringBuilder();
    sb.append("Round: ").append(round);
    sb.append(" - ");
    sb.append(type.getDescription());
    if (value != ABSENT || position != ABSENT) {
      sb.append(" (");
      if (position != ABSENT) {
        sb.append("Row: ").append(getRow().getAsInt())
            .append(" - Column: ").append(getColumn().getAsInt());
      }
      if (value != ABSENT) {
        if (position != ABSENT) sb.append(" - ");
        sb.append("Value: ").append(value);
      }
      sb.append(")");
    }
    return sb.toString();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof LogItem)) return false;
    LogItem that = (LogItem) o;
    return this.round == that.round
        && this.type == that.type
        && this.value == that.value
        && this.position == that.position;
  }

  @Override public int hashCode() {
    return Objects.hashCode(round, type, value, position);
  }

  @Override public String toString() {
    return getDescription();
  }
}
