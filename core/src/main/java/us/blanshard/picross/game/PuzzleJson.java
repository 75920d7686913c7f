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
package us.blanshard.picross.game;

import us.blanshard.picross.core.Constraint;
import us.blanshard.picross.core.ConstraintEntry;
import us.blanshard.picross.core.ConstraintGroup;
import us.blanshard.picross.core.Puzzle;

import com.google.common.collect.Lists;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Static methods that convert puzzle definitions to and from json.  A puzzle
 * looks like this:
 *
 * <pre>
 *   {"rows": [[[2, "FULL"]], []], "columns": [[[1, "FULL"]], [[1, "FULL"]]]}
 * </pre>
 *
 * <p>Each entry is a two-element array of run size and value; values are
 * converted with Gson's own handling of the value class, so enums appear by
 * name.
 */
public class PuzzleJson {
  private static final Logger logger = Logger.getLogger(PuzzleJson.class.getName());

  private static final Gson GSON = new Gson();

  private PuzzleJson() {}

  /** Renders the given puzzle as json. */
  public static <V> String toJson(Puzzle<V> puzzle, Class<V> valueClass) {
    JsonObject object = new JsonObject();
    object.add("rows", groupToJson(puzzle.getRowConstraints(), valueClass));
    object.add("columns", groupToJson(puzzle.getColumnConstraints(), valueClass));
    return GSON.toJson(object);
  }

  /**
   * Parses a puzzle from json.  Throws JsonParseException for malformed json,
   * IllegalArgumentException for well-formed json describing a bad puzzle.
   */
  public static <V> Puzzle<V> fromJson(String json, Class<V> valueClass) {
    try {
      JsonObject object = JsonParser.parseString(json).getAsJsonObject();
      return Puzzle.of(groupFromJson(member(object, "rows"), valueClass),
                       groupFromJson(member(object, "columns"), valueClass));
    } catch (IllegalStateException | NumberFormatException e) {
      // Thrown by the getAs* methods when the json has the wrong shape or type.
      logger.log(Level.WARNING, "Malformed puzzle json", e);
      throw new JsonParseException("Malformed puzzle: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Unable to read puzzle json", e);
      throw e;
    }
  }

  private static JsonArray member(JsonObject object, String name) {
    JsonElement element = object.get(name);
    if (element == null)
      throw new JsonParseException("Puzzle has no \"" + name + "\" member");
    return element.getAsJsonArray();
  }

  /** Reads a run size, which must be a whole number that fits in an int. */
  private static int runSize(JsonElement element) {
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber())
      throw new JsonParseException("Run size must be a number: " + element);
    BigDecimal size = element.getAsBigDecimal();
    try {
      return size.intValueExact();
    } catch (ArithmeticException e) {
      throw new JsonParseException("Run size must be a whole number in int range: " + element, e);
    }
  }

  private static <V> JsonArray groupToJson(ConstraintGroup<V> group, Class<V> valueClass) {
    JsonArray array = new JsonArray();
    for (Constraint<V> constraint : group) {
      JsonArray entries = new JsonArray();
      for (ConstraintEntry<V> entry : constraint) {
        JsonArray pair = new JsonArray();
        pair.add(new JsonPrimitive(entry.size));
        pair.add(GSON.toJsonTree(entry.value, valueClass));
        entries.add(pair);
      }
      array.add(entries);
    }
    return array;
  }

  private static <V> ConstraintGroup<V> groupFromJson(JsonArray array, Class<V> valueClass) {
    List<Constraint<V>> constraints = Lists.newArrayList();
    for (JsonElement line : array) {
      Constraint.Builder<V> builder = Constraint.builder();
      for (JsonElement element : line.getAsJsonArray()) {
        JsonArray pair = element.getAsJsonArray();
        if (pair.size() != 2)
          throw new JsonParseException("Constraint entry must be [size, value]: " + pair);
        V value = GSON.fromJson(pair.get(1), valueClass);
        if (value == null)
          throw new JsonParseException("Unrecognized value in constraint entry: " + pair);
        builder.add(runSize(pair.get(0)), value);
      }
      constraints.add(builder.build());
    }
    return ConstraintGroup.copyOf(constraints);
  }
}
