package com.kmg.tagger.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fields read from one model response.
 */
public record VehicleMetadata(
        boolean carDetected,
        boolean peopleDetected,
        String make,
        String model,
        String color,
        String racingClass,
        String subcategory,
        String engine,
        List<String> numbers,
        List<String> fuzzyNumbers,
        String rawResponse
) {
    public VehicleMetadata {
        numbers = numbers == null ? List.of() : List.copyOf(numbers);
        fuzzyNumbers = fuzzyNumbers == null ? List.of() : List.copyOf(fuzzyNumbers);
    }

    public boolean isEmpty() {
        return make == null && model == null && color == null && racingClass == null
                && subcategory == null && engine == null && numbers.isEmpty() && fuzzyNumbers.isEmpty()
                && !peopleDetected;
    }

    /**
     * Fields as stored in the progress file, non-empty values only.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("car_detected", carDetected);
        map.put("people_detected", peopleDetected);
        putIfPresent(map, "make", make);
        putIfPresent(map, "model", model);
        putIfPresent(map, "color", color);
        putIfPresent(map, "class", racingClass);
        putIfPresent(map, "subcategory", subcategory);
        putIfPresent(map, "engine", engine);
        if (!numbers.isEmpty()) {
            map.put("numbers", numbers);
        }
        if (!fuzzyNumbers.isEmpty()) {
            map.put("fuzzy_numbers", fuzzyNumbers);
        }
        return map;
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (value != null && !value.isBlank()) {
            map.put(key, value);
        }
    }
}
