package com.example.magazinetoc.parser;

import com.example.magazinetoc.model.PageRecord;
import com.example.magazinetoc.model.PageText;
import com.example.magazinetoc.util.TocTextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds the contents page of a Harper's issue. The Index and Findings pages also
 * carry many numbers, so pages mentioning them are skipped.
 */
public class HarpersTocLocator {

    private static final Logger logger = LoggerFactory.getLogger(HarpersTocLocator.class);

    public static final int FALLBACK_PAGE = 3;
    static final int LAST_CANDIDATE_PAGE = 7;
    static final int MIN_NUMBERS = 6;

    static final Pattern INDEX_OR_FINDINGS = Pattern.compile(
            "(?i)(HARPER'?S\\s+INDEX|FINDINGS|H\\s*A\\s*R\\s*P\\s*E\\s*R\\s*'\\s*S\\s*I\\s*N\\s*D\\s*E\\s*X"
                    + "|F\\s*I\\s*N\\s*D\\s*I\\s*N\\s*G\\s*S)");

    public int locate(PageText pageText) {
        for (int p = 1; p <= LAST_CANDIDATE_PAGE; p++) {
            Optional<PageRecord> page = pageText.getPage(p);
            if (page.isEmpty()) continue;
            String text = TocTextUtils.normalize(page.get().getText());
            if (!text.toLowerCase(Locale.ROOT).contains("contents")) continue;
            if (INDEX_OR_FINDINGS.matcher(text).find()) continue;
            if (TocTextUtils.countStandaloneNumbers(text) >= MIN_NUMBERS) {
                logger.debug("[harpers] contents candidate: page {}", p);
                return p;
            }
        }
        logger.debug("[harpers] no contents page found, falling back to page {}", FALLBACK_PAGE);
        return FALLBACK_PAGE;
    }
}
