package com.example.magazinetoc.parser;

/**
 * Brand-specific handling for item lines the generic patterns get wrong.
 * Rules run before the pattern list.
 */
public interface LineRule {

    /**
     * @return {@code true} if the line was consumed (entries may have been added to the context)
     */
    boolean apply(String line, ParseContext context);
}
