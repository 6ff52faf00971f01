package com.kmg.tagger.service;

import com.kmg.tagger.model.Profile;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/**
 * Vision prompts per profile, loaded from {@code prompts/<profile>.txt} on the classpath.
 */
@Service
public class PromptCatalog {
    private static final String PLACEHOLDER = "{fuzzy_instruction}";

    private final Map<Profile, String> templates = new EnumMap<>(Profile.class);
    private final String fuzzyInstruction;

    public PromptCatalog() {
        for (Profile profile : Profile.values()) {
            templates.put(profile, load("prompts/" + profile.id() + ".txt"));
        }
        this.fuzzyInstruction = load("prompts/fuzzy-numbers.txt").stripTrailing();
    }

    public String promptFor(Profile profile, boolean fuzzyNumbers) {
        String template = templates.get(profile == null ? Profile.RACING_PORSCHE : profile);
        return template.replace(PLACEHOLDER, fuzzyNumbers ? fuzzyInstruction : "");
    }

    private static String load(String location) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Missing prompt resource " + location, e);
        }
    }
}
