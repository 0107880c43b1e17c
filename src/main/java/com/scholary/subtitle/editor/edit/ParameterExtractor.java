package com.scholary.subtitle.editor.edit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the oracle's raw parameter text into a typed {@link EditParameters} bag.
 *
 * <p>The oracle is a language model, so its output is untrusted free text. Parsing degrades in
 * steps rather than failing:
 *
 * <ol>
 *   <li>parse the whole text as a JSON object;
 *   <li>otherwise parse the first brace-delimited substring (models like to wrap JSON in prose or
 *       code fences);
 *   <li>otherwise use an empty bag.
 * </ol>
 *
 * <p>Only values of the wrong shape inside a well-formed object are rejected, with {@link
 * EditCompileException}.
 */
@Component
public class ParameterExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParameterExtractor.class);

  // First {...} without nested closing braces, same as the extraction prompt's flat schema.
  private static final Pattern BRACE_OBJECT = Pattern.compile("\\{[^}]+\\}");

  private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d{1,9}");

  private final ObjectMapper objectMapper;

  public ParameterExtractor(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Extract parameters from raw oracle output.
   *
   * @param raw the oracle's parameter text, may be null
   * @return the typed bag; empty if nothing usable was found
   * @throws EditCompileException if a recognized key carries a value of an unusable type
   */
  public EditParameters extract(String raw) {
    Optional<JsonNode> object = parseObject(raw);
    if (object.isEmpty()) {
      LOGGER.debug("No parameter object found in oracle output, using empty parameters");
      return EditParameters.empty();
    }
    return fromJson(object.get());
  }

  /**
   * Build a bag from an already-parsed JSON object.
   *
   * @param node a JSON object node
   * @return the typed bag
   * @throws EditCompileException if a recognized key carries a value of an unusable type
   */
  public EditParameters fromJson(JsonNode node) {
    return EditParameters.builder()
        .text(field(node, "text", this::asString))
        .startTime(field(node, "start_time", this::asString))
        .endTime(field(node, "end_time", this::asString))
        .fontFamily(field(node, "font_family", this::asString))
        .fontSize(field(node, "font_size", this::asFontSize))
        .fontColor(field(node, "font_color", this::asString))
        .position(field(node, "position", this::asString))
        .backgroundColor(field(node, "background_color", this::asString))
        .bold(field(node, "bold", value -> asBoolean("bold", value)))
        .italic(field(node, "italic", value -> asBoolean("italic", value)))
        .subtitleIndex(field(node, "subtitle_index", value -> asInteger("subtitle_index", value)))
        .build();
  }

  private Optional<JsonNode> parseObject(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }

    Optional<JsonNode> direct = readObject(raw.trim());
    if (direct.isPresent()) {
      return direct;
    }

    Matcher matcher = BRACE_OBJECT.matcher(raw);
    if (matcher.find()) {
      Optional<JsonNode> salvaged = readObject(matcher.group());
      if (salvaged.isPresent()) {
        LOGGER.debug("Salvaged parameter object from surrounding text");
      }
      return salvaged;
    }
    return Optional.empty();
  }

  private Optional<JsonNode> readObject(String candidate) {
    try {
      JsonNode node = objectMapper.readTree(candidate);
      if (node != null && node.isObject()) {
        return Optional.of(node);
      }
      return Optional.empty();
    } catch (JsonProcessingException e) {
      LOGGER.debug("Not a JSON object: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }

  private <T> ParamField<T> field(JsonNode node, String key, Function<JsonNode, T> converter) {
    if (!node.has(key)) {
      return ParamField.absent();
    }
    JsonNode value = node.get(key);
    if (value.isNull()) {
      return ParamField.explicitNull();
    }
    return ParamField.of(converter.apply(value));
  }

  private String asString(JsonNode value) {
    if (value.isContainerNode()) {
      throw new EditCompileException("Expected a plain value but got: " + value);
    }
    return value.asText();
  }

  private Integer asFontSize(JsonNode value) {
    if (value.isTextual()) {
      String text = value.asText().trim().toLowerCase(Locale.ROOT);
      if (text.endsWith("px")) {
        text = text.substring(0, text.length() - 2).trim();
      }
      if (INTEGER_TEXT.matcher(text).matches()) {
        return Integer.parseInt(text);
      }
      throw new EditCompileException("font_size must be an integer, got: " + value.asText());
    }
    return asInteger("font_size", value);
  }

  private Integer asInteger(String key, JsonNode value) {
    if (value.isIntegralNumber() && value.canConvertToInt()) {
      return value.intValue();
    }
    if (value.isFloatingPointNumber() && value.doubleValue() == Math.rint(value.doubleValue())) {
      return (int) value.doubleValue();
    }
    if (value.isTextual() && INTEGER_TEXT.matcher(value.asText().trim()).matches()) {
      return Integer.parseInt(value.asText().trim());
    }
    throw new EditCompileException(key + " must be an integer, got: " + value);
  }

  private Boolean asBoolean(String key, JsonNode value) {
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    if (value.isTextual()) {
      String text = value.asText().trim().toLowerCase(Locale.ROOT);
      if (text.equals("true")) {
        return Boolean.TRUE;
      }
      if (text.equals("false")) {
        return Boolean.FALSE;
      }
    }
    throw new EditCompileException(key + " must be true or false, got: " + value);
  }
}
