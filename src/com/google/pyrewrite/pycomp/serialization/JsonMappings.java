/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.pyrewrite.pycomp.serialization;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.CharStreams;
import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Reads and writes the mapping form of a tree as JSON. Integral numbers are read as {@code Long}
 * and all other numbers as {@code Double}, so an integer constant survives a round trip as an
 * integer.
 *
 * <p>Non-finite floats are written as the bare words {@code NaN}, {@code Infinity} and {@code
 * -Infinity}, the way Python's {@code json} module writes them, and are read back as {@code
 * Double}. Apart from those words the reader accepts strict JSON only.
 */
public final class JsonMappings {

  private static final ImmutableSet<String> NON_FINITE =
      ImmutableSet.of("NaN", "Infinity", "-Infinity");
  private static final ImmutableSet<String> KEYWORDS = ImmutableSet.of("true", "false", "null");

  private final JsonReader reader;

  /** For each string token of the input in order, whether it is a bare non-finite word. */
  private final Deque<Boolean> bareStrings;

  private JsonMappings(String json) {
    this.bareStrings = scanStringTokens(json);
    this.reader = new JsonReader(new StringReader(json));
    // Lenient mode is needed for the non-finite words; everything else it would let through is
    // rejected by scanStringTokens.
    reader.setLenient(true);
  }

  /**
   * Reads one JSON object and closes {@code in}.
   *
   * @throws JsonParseException if the text is not a single JSON object
   */
  public static Map<String, Object> read(Reader in) throws IOException {
    String json;
    try (Reader input = in) {
      json = CharStreams.toString(input);
    }
    try {
      JsonMappings mappings = new JsonMappings(json);
      try (JsonReader reader = mappings.reader) {
        if (reader.peek() != JsonToken.BEGIN_OBJECT) {
          throw new JsonParseException("Expected a JSON object but found " + reader.peek());
        }
        Map<String, Object> result = mappings.readObject();
        if (reader.peek() != JsonToken.END_DOCUMENT) {
          throw new JsonParseException("Unexpected content after the JSON object");
        }
        return result;
      }
    } catch (IllegalStateException | NumberFormatException e) {
      throw new JsonParseException(e.getMessage(), e);
    }
  }

  public static Map<String, Object> fromJson(String json) {
    try {
      return read(new StringReader(json));
    } catch (IOException e) {
      throw new JsonParseException(e);
    }
  }

  private Map<String, Object> readObject() throws IOException {
    Map<String, Object> result = new LinkedHashMap<>();
    reader.beginObject();
    while (reader.hasNext()) {
      // Names are quoted strings; bare words before a colon were rejected by the scan.
      bareStrings.removeFirst();
      String key = reader.nextName();
      if (result.containsKey(key)) {
        throw new JsonParseException("Duplicate key '" + key + "' at " + reader.getPath());
      }
      result.put(key, readValue());
    }
    reader.endObject();
    return result;
  }

  private @Nullable Object readValue() throws IOException {
    switch (reader.peek()) {
      case BEGIN_OBJECT:
        return readObject();
      case BEGIN_ARRAY:
        List<Object> list = new ArrayList<>();
        reader.beginArray();
        while (reader.hasNext()) {
          list.add(readValue());
        }
        reader.endArray();
        return list;
      case STRING:
        return bareStrings.removeFirst() ? reader.nextDouble() : reader.nextString();
      case NUMBER:
        return parseNumber(reader.nextString());
      case BOOLEAN:
        return reader.nextBoolean();
      case NULL:
        reader.nextNull();
        return null;
      default:
        throw new JsonParseException("Unexpected " + reader.peek() + " at " + reader.getPath());
    }
  }

  private static Object parseNumber(String text) {
    if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
      try {
        return Long.parseLong(text);
      } catch (NumberFormatException e) {
        throw new JsonParseException("Integer out of range: " + text, e);
      }
    }
    return Double.parseDouble(text);
  }

  /**
   * Lists the string tokens of {@code json} in document order, marking the bare non-finite words.
   * Rejects what a lenient {@link JsonReader} would accept beyond strict JSON and those words:
   * unquoted or single-quoted strings, comments, other separators and empty array or object
   * slots.
   */
  private static Deque<Boolean> scanStringTokens(String json) {
    Deque<Boolean> tokens = new ArrayDeque<>();
    // The last structural character, or 'v' after a value.
    char previous = 0;
    int i = 0;
    while (i < json.length()) {
      char c = json.charAt(i);
      if (c == '"') {
        i = skipString(json, i);
        tokens.add(false);
        previous = 'v';
      } else if (Character.isLetter(c) || (c == '-' && json.startsWith("Infinity", i + 1))) {
        int start = i;
        i = skipWord(json, i + 1);
        String word = json.substring(start, i);
        if (NON_FINITE.contains(word)) {
          tokens.add(true);
        } else if (!KEYWORDS.contains(word)) {
          throw new JsonParseException("Unexpected '" + word + "' at offset " + start);
        }
        int next = i;
        while (next < json.length() && CharMatcher.whitespace().matches(json.charAt(next))) {
          next++;
        }
        if (next < json.length() && json.charAt(next) == ':') {
          throw new JsonParseException("Expected a name at offset " + start);
        }
        previous = 'v';
      } else if (c == '-' || (c >= '0' && c <= '9')) {
        i++;
        while (i < json.length() && isNumberChar(json.charAt(i))) {
          i++;
        }
        previous = 'v';
      } else if (c == ',' || c == ']' || c == '}') {
        boolean emptySlot =
            previous == ','
                || (c == ',' && (previous == '[' || previous == '{' || previous == ':'));
        if (emptySlot) {
          throw new JsonParseException("Unexpected '" + c + "' at offset " + i);
        }
        previous = c;
        i++;
      } else if (c == '[' || c == '{' || c == ':') {
        previous = c;
        i++;
      } else if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
        i++;
      } else {
        throw new JsonParseException("Unexpected '" + c + "' at offset " + i);
      }
    }
    return tokens;
  }

  private static int skipString(String json, int start) {
    int i = start + 1;
    while (i < json.length()) {
      char c = json.charAt(i);
      if (c == '\\') {
        i += 2;
      } else if (c == '"') {
        return i + 1;
      } else {
        i++;
      }
    }
    throw new JsonParseException("Unterminated string at offset " + start);
  }

  private static int skipWord(String json, int start) {
    int i = start;
    while (i < json.length() && Character.isLetter(json.charAt(i))) {
      i++;
    }
    return i;
  }

  private static boolean isNumberChar(char c) {
    return (c >= '0' && c <= '9') || c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-';
  }

  // ==========================================================================
  // Writing

  /** Writes {@code mapping} as JSON, indented by two spaces when {@code pretty} is set. */
  public static void write(Map<String, ?> mapping, Writer out, boolean pretty) throws IOException {
    JsonWriter writer = new JsonWriter(out);
    writer.setSerializeNulls(true);
    if (pretty) {
      writer.setIndent("  ");
    }
    writeValue(writer, mapping);
    writer.flush();
  }

  public static String toJson(Map<String, ?> mapping) {
    StringWriter out = new StringWriter();
    try {
      write(mapping, out, false);
    } catch (IOException e) {
      throw new IllegalStateException("Should not happen", e);
    }
    return out.toString();
  }

  private static void writeValue(JsonWriter writer, @Nullable Object value) throws IOException {
    if (value == null) {
      writer.nullValue();
    } else if (value instanceof Map) {
      writer.beginObject();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        writer.name(String.valueOf(entry.getKey()));
        writeValue(writer, entry.getValue());
      }
      writer.endObject();
    } else if (value instanceof List) {
      writer.beginArray();
      for (Object element : (List<?>) value) {
        writeValue(writer, element);
      }
      writer.endArray();
    } else if (value instanceof String) {
      writer.value((String) value);
    } else if (value instanceof Boolean) {
      writer.value((Boolean) value);
    } else if (value instanceof Long || value instanceof Integer) {
      writer.value(((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      writeDouble(writer, ((Number) value).doubleValue());
    } else {
      throw new IllegalArgumentException("Cannot write " + value.getClass().getName());
    }
  }

  private static void writeDouble(JsonWriter writer, double value) throws IOException {
    // JsonWriter prints 1.0 as 1.0, which reads back as a Double.
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      writer.setLenient(true);
    }
    writer.value(value);
  }
}
