package com.cityvibe.enrichment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rule-based tagger: a keyword found as a whole word in the text adds its tag.
 *
 * The built-in vocabulary can be extended with {@code cityvibe.tagging.vocabulary}, a
 * comma separated list of {@code keyword:tag} pairs. Configured pairs override built-in
 * ones for the same keyword.
 */
@Component
public class KeywordTaggingClient implements TaggingClient {

    private static final Logger log = LoggerFactory.getLogger(KeywordTaggingClient.class);

    static final Map<String, String> DEFAULT_VOCABULARY = defaultVocabulary();

    private final Map<Pattern, String> rules;

    public KeywordTaggingClient(@Value("${cityvibe.tagging.vocabulary:}") String vocabulary) {
        Map<String, String> merged = new LinkedHashMap<>(DEFAULT_VOCABULARY);
        merged.putAll(parseVocabulary(vocabulary));

        this.rules = new LinkedHashMap<>();
        merged.forEach((keyword, tag) -> rules.put(
            Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
            tag));
        log.info("Keyword tagger loaded with {} keywords", rules.size());
    }

    @Override
    public Mono<List<String>> extractTags(String text) {
        return Mono.fromCallable(() -> tag(text));
    }

    List<String> tag(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> tags = new LinkedHashSet<>();
        rules.forEach((pattern, tag) -> {
            if (pattern.matcher(text).find()) {
                tags.add(tag);
            }
        });
        return new ArrayList<>(tags);
    }

    static Map<String, String> parseVocabulary(String vocabulary) {
        Map<String, String> parsed = new LinkedHashMap<>();
        if (vocabulary == null || vocabulary.isBlank()) {
            return parsed;
        }
        for (String entry : vocabulary.split(",")) {
            int colon = entry.indexOf(':');
            if (colon <= 0 || colon == entry.length() - 1) {
                throw new IllegalArgumentException("Invalid tagging vocabulary entry: '" + entry.trim() + "'");
            }
            parsed.put(
                entry.substring(0, colon).trim().toLowerCase(Locale.ROOT),
                entry.substring(colon + 1).trim().toLowerCase(Locale.ROOT));
        }
        return parsed;
    }

    private static Map<String, String> defaultVocabulary() {
        Map<String, String> vocabulary = new LinkedHashMap<>();
        vocabulary.put("jazz", "music");
        vocabulary.put("concert", "music");
        vocabulary.put("live music", "music");
        vocabulary.put("dj", "music");
        vocabulary.put("orchestra", "music");
        vocabulary.put("techno", "electronic");
        vocabulary.put("comedy", "comedy");
        vocabulary.put("stand-up", "comedy");
        vocabulary.put("theater", "theater");
        vocabulary.put("theatre", "theater");
        vocabulary.put("opera", "theater");
        vocabulary.put("exhibition", "art");
        vocabulary.put("gallery", "art");
        vocabulary.put("vernissage", "art");
        vocabulary.put("film", "film");
        vocabulary.put("cinema", "film");
        vocabulary.put("screening", "film");
        vocabulary.put("workshop", "workshop");
        vocabulary.put("lecture", "talk");
        vocabulary.put("talk", "talk");
        vocabulary.put("reading", "literature");
        vocabulary.put("festival", "festival");
        vocabulary.put("market", "market");
        vocabulary.put("kids", "family");
        vocabulary.put("family", "family");
        vocabulary.put("free entry", "free");
        return vocabulary;
    }
}
