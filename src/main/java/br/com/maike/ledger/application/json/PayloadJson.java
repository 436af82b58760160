package br.com.maike.ledger.application.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes raw document payloads as JSON using the Jackson streaming API.
 *
 * <p>Parsing tolerates single-quoted strings, which the legacy cache produced when payloads were stored
 * as Python-style literals.</p>
 *
 * @since 0.1.0
 */
public final class PayloadJson {
  private final JsonFactory factory = JsonFactory.builder()
      .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
      .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
      .build();

  /**
   * Parses a JSON document into maps, lists and primitives.
   *
   * @param json JSON text; never {@code null}
   * @return parsed object graph; an empty map for an empty document
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return Map.of();
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a payload that must describe one object. A list holding exactly one object is unwrapped.
   *
   * @param json JSON text, may be {@code null}
   * @return key/value payload; empty when the text is blank, unparseable or not an object
   */
  public Optional<Map<String, Object>> parseObject(String json) {
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    Object parsed;
    try {
      parsed = parse(json);
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
    if (parsed instanceof List<?> list && list.size() == 1) {
      parsed = list.get(0);
    }
    if (parsed instanceof Map<?, ?> map) {
      Map<String, Object> object = new LinkedHashMap<>();
      map.forEach((key, value) -> object.put(String.valueOf(key), value));
      return Optional.of(object);
    }
    return Optional.empty();
  }

  /**
   * Serializes a payload. Temporal values are written as ISO text, unknown types through {@code toString()}.
   *
   * @param payload key/value payload, may be {@code null}
   * @return JSON text, or {@code null} when {@code payload} is {@code null} or empty
   */
  public String write(Map<String, ?> payload) {
    if (payload == null || payload.isEmpty()) {
      return null;
    }
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      writeValue(generator, payload);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to serialize payload", ex);
    }
    return out.toString();
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }

  private void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        generator.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      generator.writeStartArray();
      for (Object item : items) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else if (value instanceof String text) {
      generator.writeString(text);
    } else if (value instanceof Boolean flag) {
      generator.writeBoolean(flag);
    } else if (value instanceof BigDecimal decimal) {
      generator.writeNumber(decimal);
    } else if (value instanceof BigInteger integer) {
      generator.writeNumber(integer);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof Number number) {
      generator.writeNumber(number.doubleValue());
    } else if (value instanceof java.sql.Timestamp timestamp) {
      generator.writeString(timestamp.toLocalDateTime().toString());
    } else if (value instanceof java.sql.Date sqlDate) {
      generator.writeString(sqlDate.toLocalDate().toString());
    } else if (value instanceof java.util.Date date) {
      generator.writeString(date.toInstant().toString());
    } else if (value instanceof TemporalAccessor temporal) {
      generator.writeString(temporal.toString());
    } else {
      generator.writeString(value.toString());
    }
  }
}
