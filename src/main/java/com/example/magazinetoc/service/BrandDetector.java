package com.example.magazinetoc.service;

import com.example.magazinetoc.model.Brand;
import com.example.magazinetoc.model.PageText;
import com.example.magazinetoc.model.SourceDocument;
import com.example.magazinetoc.parser.BrandVocabulary;
import com.example.magazinetoc.util.TocTextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classifies a document as one of the supported brands: explicit hint, then filename,
 * then page-1 content. Anything ambiguous ends as {@link Brand#UNKNOWN}.
 */
@Service
public class BrandDetector {

    private static final Logger logger = LoggerFactory.getLogger(BrandDetector.class);

    private static final List<Brand> CANDIDATES = List.of(Brand.NEW_YORKER, Brand.ATLANTIC, Brand.HARPERS);
    private static final int MASTHEAD_WEIGHT = 10;
    private static final int MIN_CONTENT_SCORE = 2;

    /**
     * @param brandHint explicit brand, or {@code null} for auto-detection
     */
    public Brand detect(SourceDocument document, PageText pageText, Brand brandHint) {
        if (brandHint != null && brandHint != Brand.UNKNOWN) {
            logger.debug("Brand for {} given explicitly: {}", document.getFileName(), brandHint.getCode());
            return brandHint;
        }

        Optional<Brand> byName = detectFromFilename(document.getFileName());
        if (byName.isPresent()) {
            logger.debug("Brand for {} detected from filename: {}", document.getFileName(), byName.get().getCode());
            return byName.get();
        }

        Optional<Brand> byContent = detectFromContent(pageText == null ? "" : pageText.getFirstPageText());
        if (byContent.isPresent()) {
            logger.debug("Brand for {} detected from page 1: {}", document.getFileName(), byContent.get().getCode());
            return byContent.get();
        }

        logger.warn("Could not determine the brand of {}", document.getFileName());
        return Brand.UNKNOWN;
    }

    public Optional<Brand> detectFromFilename(String fileName) {
        if (fileName == null) return Optional.empty();
        String name = fileName.toLowerCase(Locale.ROOT);
        List<Brand> matches = CANDIDATES.stream()
                .filter(b -> BrandVocabulary.filenameTokens(b).stream().anyMatch(name::contains))
                .collect(Collectors.toList());
        return matches.size() == 1 ? Optional.of(matches.get(0)) : Optional.empty();
    }

    public Optional<Brand> detectFromContent(String firstPageText) {
        String text = TocTextUtils.normalize(firstPageText);
        if (text.isBlank()) return Optional.empty();

        Map<Brand, Integer> scores = scoreContent(text);
        int best = scores.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        if (best < MIN_CONTENT_SCORE) {
            return Optional.empty();
        }
        List<Brand> leaders = scores.entrySet().stream()
                .filter(e -> e.getValue() == best)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        if (leaders.size() != 1) {
            logger.debug("Ambiguous content signals: {}", scores);
            return Optional.empty();
        }
        return Optional.of(leaders.get(0));
    }

    Map<Brand, Integer> scoreContent(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        String upper = text.toUpperCase(Locale.ROOT);
        Map<Brand, Integer> scores = new EnumMap<>(Brand.class);
        for (Brand brand : CANDIDATES) {
            int score = 0;
            for (String masthead : BrandVocabulary.mastheads(brand)) {
                if (lower.contains(masthead)) {
                    score += MASTHEAD_WEIGHT;
                    break;
                }
            }
            for (String heading : BrandVocabulary.exclusiveHeadings(brand)) {
                if (containsWord(upper, heading)) {
                    score++;
                }
            }
            scores.put(brand, score);
        }
        return scores;
    }

    private static boolean containsWord(String haystack, String phrase) {
        return Pattern.compile("(?<![A-Z])" + Pattern.quote(phrase) + "(?![A-Z])").matcher(haystack).find();
    }
}
