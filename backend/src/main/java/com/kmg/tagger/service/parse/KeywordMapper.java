package com.kmg.tagger.service.parse;

import com.kmg.tagger.model.VehicleMetadata;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns parsed metadata into {@code Category:Value} keywords.
 */
@Component
public class KeywordMapper {
    public static final String NO_SUBJECT = "NoSubject";
    public static final String CLASSIFIED = "Classified";

    /**
     * Keywords for one image. A photo with neither a car nor people is tagged {@value #NO_SUBJECT}.
     */
    public List<String> keywordsFor(VehicleMetadata metadata, boolean fuzzyNumbers) {
        if (!metadata.carDetected() && !metadata.peopleDetected()) {
            return List.of(NO_SUBJECT);
        }
        return toKeywords(metadata, fuzzyNumbers);
    }

    public List<String> toKeywords(VehicleMetadata metadata, boolean fuzzyNumbers) {
        List<String> keywords = new ArrayList<>();
        add(keywords, "Make", metadata.make());
        if (metadata.model() != null) {
            add(keywords, "Model", metadata.model().replace(" ", "").replace("-", ""));
        }
        add(keywords, "Color", metadata.color());
        add(keywords, "Class", metadata.racingClass());
        add(keywords, "Subcategory", metadata.subcategory());
        add(keywords, "Engine", metadata.engine());

        for (String number : metadata.numbers()) {
            keywords.add("Num:" + number);
        }
        if (fuzzyNumbers) {
            for (String number : metadata.fuzzyNumbers()) {
                if (!metadata.numbers().contains(number)) {
                    keywords.add("Num:" + number + "?");
                }
            }
        }
        if (metadata.peopleDetected()) {
            keywords.add("People:People");
        }
        return keywords;
    }

    /**
     * What gets written to the file: never empty, so a processed image is always marked.
     */
    public static List<String> forWriting(List<String> keywords) {
        return keywords.isEmpty() ? List.of(CLASSIFIED) : keywords;
    }

    private static void add(List<String> keywords, String category, String value) {
        if (value != null && !value.isBlank()) {
            keywords.add(category + ":" + value);
        }
    }
}
