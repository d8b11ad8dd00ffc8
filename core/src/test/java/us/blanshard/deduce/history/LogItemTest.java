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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import org.junit.Test;

import java.util.OptionalInt;

public class LogItemTest {

  @Test public void valueAndPosition() {
    LogItem item = LogItem.of(3, LogType.GUESS, 7, 22);
    assertEquals(3, item.getRound());
    assertEquals(LogType.GUESS, item.getType());
    assertEquals(OptionalInt.of(7), item.getValue());
    assertEquals(OptionalInt.of(22), item.getPosition());
    assertEquals(OptionalInt.of(3), item.getRow());
    assertEquals(OptionalInt.of(5), item.getColumn());
    assertEquals("Round: 3 - Mark guess (start round) (Row: 3 - Column: 5 - Value: 7)",
                 item.getDescription());
  }

  @Test public void positionOnly() {
    LogItem item = LogItem.atPosition(4, LogType.NAKED_PAIR_ROW, 0);
    assertFalse(item.getValue().isPresent());
    assertEquals(OptionalInt.of(1), item.getRow());
    assertEquals("Round: 4 - Remove possibilities for naked pair in row (Row: 1 - Column: 1)",
                 item.getDescription());
  }

  @Test public void rollback() {
    LogItem item = LogItem.rollback(6);
    assertEquals(LogType.ROLLBACK, item.getType());
    assertFalse(item.getValue().isPresent());
    assertFalse(item.getPosition().isPresent());
    assertFalse(item.getRow().isPresent());
    assertFalse(item.getColumn().isPresent());
    assertEquals("Round: 6 - Roll back round", item.getDescription());
    assertEquals(item.getDescription(), item.toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void badValue() {
    LogItem.of(2, LogType.SINGLE, 10, 0);
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void badPosition() {
    LogItem.of(2, LogType.SINGLE, 1, 81);
  }

  @Test public void equality() {
    assertEquals(LogItem.of(2, LogType.SINGLE, 1, 5), LogItem.of(2, LogType.SINGLE, 1, 5));
    assertEquals(LogItem.of(2, LogType.SINGLE, 1, 5).hashCode(),
                 LogItem.of(2, LogType.SINGLE, 1, 5).hashCode());
    assertFalse(LogItem.of(2, LogType.SINGLE, 1, 5).equals(LogItem.of(4, LogType.SINGLE, 1, 5)));
    assertFalse(LogItem.atPosition(2, LogType.NAKED_PAIR_ROW, 5)
                .equals(LogItem.atPosition(2, LogType.NAKED_PAIR_COLUMN, 5)));
  }
}
