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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.google.common.reflect.TypeToken;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.List;
import java.util.OptionalInt;

/**
 * Static methods that convert solve histories to and from json.  Each
 * {@link LogItem} becomes a single string, "round,TYPE,value,position", with
 * the value and position left empty when absent.
 *
 * @author Luke Blanshard
 */
public class HistoryJson {
  public static final Splitter SPLITTER = Splitter.on(',');
  public static final Joiner JOINER = Joiner.on(',');

  /** A Type to use with {@link Gson} for lists of log items. */
  @SuppressWarnings("serial")
  public static final Type HISTORY_TYPE = new TypeToken<List<LogItem>>(){}.getType();

  /** A convenience for reading/writing histories. */
  public static final Gson GSON = registerHistory(new GsonBuilder()).create();

  /**
   * Registers a type adapter in the given builder so that log items, and lists
   * of them, can be serialized and deserialized.
   */
  public static GsonBuilder registerHistory(GsonBuilder builder) {
    builder.registerTypeAdapter(LogItem.class, new TypeAdapter<LogItem>() {
      @Override public void write(JsonWriter out, LogItem value) throws IOException {
        out.value(toJsonValue(value));
      }
      @Override public LogItem read(JsonReader in) throws IOException {
        return fromJsonValue(in.nextString());
      }
    });
    return builder;
  }

  /** Renders the item as a string, reversed by {@link #fromJsonValue}. */
  public static String toJsonValue(LogItem item) {
    return JOINER.join(item.getRound(), item.getType().name(),
                       toField(item.getValue()), toField(item.getPosition()));
  }

  /**
   * Reads an item written by {@link #toJsonValue}.
   *
   * @throws JsonParseException if the string is not a well-formed item
   */
  public static LogItem fromJsonValue(String value) {
    List<String> fields = SPLITTER.splitToList(value);
    if (fields.size() != 4)
      throw new JsonParseException("Malformed log item: " + value);
    try {
      return LogItem.restore(Integer.parseInt(fields.get(0)),
                             LogType.valueOf(fields.get(1)),
                             fromField(fields.get(2)),
                             fromField(fields.get(3)));
    } catch (IllegalArgumentException e) {
      throw new JsonParseException("Malformed log item: " + value, e);
    }
  }

  /** Converts the given items to a json array of strings. */
  public static JsonArray toJsonArray(List<LogItem> items) {
    JsonArray array = new JsonArray();
    for (LogItem item : items)
      array.add(new JsonPrimitive(toJsonValue(item)));
    return array;
  }

  /** Parses a json array written by {@link #toJsonArray}. */
  public static List<LogItem> toHistory(String json) {
    JsonArray array = JsonParser.parseString(json).getAsJsonArray();
    List<LogItem> items = Lists.newArrayList();
    for (int i = 0; i < array.size(); ++i)
      items.add(fromJsonValue(array.get(i).getAsString()));
    return items;
  }

  private static String toField(OptionalInt field) {
    return field.isPresent() ? Integer.toString(field.getAsInt()) : "";
  }

  private static OptionalInt fromField(String field) {
    return field.isEmpty() ? OptionalInt.empty() : OptionalInt.of(Integer.parseInt(field));
  }

  // Static methods only.
  private HistoryJson() {}
}
