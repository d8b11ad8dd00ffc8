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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonParseException;

import org.junit.Test;

import java.util.List;

public class HistoryJsonTest {

  private static final List<LogItem> ITEMS = ImmutableList.of(
      LogItem.of(1, LogType.GIVEN, 5, 0),
      LogItem.atPosition(2, LogType.NAKED_PAIR_SECTION, 30),
      LogItem.of(3, LogType.GUESS, 9, 80),
      LogItem.rollback(3));

  @Test public void jsonValues() {
    assertEquals("1,GIVEN,5,0", HistoryJson.toJsonValue(ITEMS.get(0)));
    assertEquals("2,NAKED_PAIR_SECTION,,30", HistoryJson.toJsonValue(ITEMS.get(1)));
    assertEquals("3,ROLLBACK,,", HistoryJson.toJsonValue(ITEMS.get(3)));
    for (LogItem item : ITEMS)
      assertEquals(item, HistoryJson.fromJsonValue(HistoryJson.toJsonValue(item)));
  }

  @Test public void gson() {
    String json = HistoryJson.GSON.toJson(ITEMS, HistoryJson.HISTORY_TYPE);
    assertEquals("[\"1,GIVEN,5,0\",\"2,NAKED_PAIR_SECTION,,30\",\"3,GUESS,9,80\",\"3,ROLLBACK,,\"]",
                 json);
    List<LogItem> back = HistoryJson.GSON.fromJson(json, HistoryJson.HISTORY_TYPE);
    assertEquals(ITEMS, back);
    assertEquals(ITEMS, HistoryJson.toHistory(HistoryJson.toJsonArray(ITEMS).toString()));
  }

  @Test public void malformed() {
    for (String bad : new String[] {"1,GIVEN,5", "x,GIVEN,5,0", "1,NOPE,5,0", "1,GIVEN,5,0,1"}) {
      try {
        HistoryJson.fromJsonValue(bad);
        throw new AssertionError("Parsed " + bad);
      } catch (JsonParseException expected) {
        assertThat(expected.getMessage()).contains(bad);
      }
    }
  }
}
