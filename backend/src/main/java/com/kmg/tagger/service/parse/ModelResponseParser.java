package com.kmg.tagger.service.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.tagger.model.VehicleMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads a model answer into {@link VehicleMetadata}. JSON is preferred; answers that are not
 * JSON even after repair are read line by line ({@code make: Porsche}).
 */
@Component
public class ModelResponseParser {
    private static final Logger log = LoggerFactory.getLogger(ModelResponseParser.class);
    static final int MAX_PLAUSIBLE_NUMBERS = 10;
    static final int KEPT_NUMBERS = 5;

    private final ObjectMapper objectMapper;

    public ModelResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public VehicleMetadata parse(String response) {
        if (response == null || response.isBlank()) {
            throw new UnusableResponseException("Empty response from model");
        }

        String json = ResponseRepair.extractJson(response);
        if (json != null) {
            ResponseRepair.Repaired repaired = ResponseRepair.quoteArrayNumbers(json);
            if (repaired.leadingZerosFixed()) {
                log.debug("Fixed JSON leading zeros in model response");
            }
            try {
                JsonNode data = objectMapper.readTree(repaired.json());
                if (data != null && data.isObject()) {
                    return fromJson(data, response);
                }
            } catch (JsonProcessingException e) {
                log.debug("Model response is not valid JSON, falling back to text: {}", e.getOriginalMessage());
            }
        }
        VehicleMetadata metadata = fromText(response);
        if (metadata.isEmpty()) {
            throw new UnusableResponseException("No recognisable fields in model response");
        }
        return metadata;
    }

    private VehicleMetadata fromJson(JsonNode data, String raw) {
        boolean people = isTrue(data.get("people_detected"));
        if (isFalse(data.get("car_detected"))) {
            return new VehicleMetadata(false, people, null, null, null, null, null, null,
                    List.of(), List.of(), raw);
        }

        JsonNode numbersNode = data.has("numbers") ? data.get("numbers") : data.get("number");
        List<String> numbers = digitsOnly(asList(numbersNode));
        if (numbers.size() > MAX_PLAUSIBLE_NUMBERS) {
            log.warn("Detected likely hallucination: {} numbers, truncating to unique values", numbers.size());
            numbers = numbers.stream().distinct().limit(KEPT_NUMBERS).toList();
        }

        JsonNode fuzzyNode = data.has("fuzzy_numbers") ? data.get("fuzzy_numbers") : data.get("possible_numbers");
        List<String> fuzzy = asList(fuzzyNode).stream().filter(s -> !s.isEmpty()).toList();

        return new VehicleMetadata(
                true,
                people,
                text(data.get("make")),
                text(data.get("model")),
                color(data.get("color")),
                text(data.get("class")),
                text(data.get("subcategory")),
                text(data.get("engine")),
                numbers,
                fuzzy,
                raw
        );
    }

    private VehicleMetadata fromText(String raw) {
        String make = null;
        String model = null;
        String color = null;
        String racingClass = null;
        Set<String> numbers = new LinkedHashSet<>();

        for (String rawLine : raw.toLowerCase(Locale.ROOT).split("\n")) {
            String line = rawLine.trim();
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String value = line.substring(colon + 1).trim();
            if (line.contains("make:") || line.contains("manufacturer:")) {
                make = titleCase(value);
            } else if (line.contains("model:")) {
                model = value;
            } else if (line.contains("color:") || line.contains("colour:")) {
                color = titleCase(value);
            } else if (line.contains("class:")) {
                racingClass = value.toUpperCase(Locale.ROOT);
            } else if (line.contains("number:") || line.contains("num:")) {
                for (String token : value.replace(',', ' ').split("\\s+")) {
                    if (isDigits(token)) {
                        numbers.add(token);
                    }
                }
            }
        }
        return new VehicleMetadata(true, false, blankToNull(make), blankToNull(model), blankToNull(color),
                blankToNull(racingClass), null, null, new ArrayList<>(numbers), List.of(), raw);
    }

    private static boolean isTrue(JsonNode node) {
        return node != null && (node.isBoolean() ? node.booleanValue() : "true".equalsIgnoreCase(node.asText()));
    }

    private static boolean isFalse(JsonNode node) {
        return node != null && (node.isBoolean() ? !node.booleanValue() : "false".equalsIgnoreCase(node.asText()));
    }

    private static List<String> asList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            node.forEach(element -> {
                if (!element.isNull()) {
                    values.add(element.asText().trim());
                }
            });
            return values;
        }
        return List.of(node.asText().trim());
    }

    private static List<String> digitsOnly(List<String> values) {
        return values.stream().filter(ModelResponseParser::isDigits).toList();
    }

    private static boolean isDigits(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return blankToNull(node.asText().trim());
    }

    private static String color(JsonNode node) {
        if (node != null && node.isArray()) {
            String joined = asList(node).stream()
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.joining(" and "));
            return blankToNull(joined);
        }
        return text(node);
    }

    private static String titleCase(String value) {
        return Stream.of(value.split(" "))
                .map(word -> word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public static class UnusableResponseException extends RuntimeException {
        public UnusableResponseException(String message) {
            super(message);
        }
    }
}
