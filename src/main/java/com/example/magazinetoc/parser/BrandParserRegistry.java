package com.example.magazinetoc.parser;

import com.example.magazinetoc.model.Brand;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class BrandParserRegistry {

    private final Map<Brand, BrandParser> parsers = new EnumMap<>(Brand.class);
    private final BrandParser unresolved;

    public BrandParserRegistry(List<BrandParser> brandParsers) {
        BrandParser fallback = null;
        for (BrandParser parser : brandParsers) {
            if (parsers.put(parser.getBrand(), parser) != null) {
                throw new IllegalStateException("Duplicate parser for brand " + parser.getBrand());
            }
            if (parser.getBrand() == Brand.UNKNOWN) {
                fallback = parser;
            }
        }
        this.unresolved = fallback != null ? fallback : new UnresolvedBrandParser();
    }

    /** The parser for {@code brand}; unknown or unregistered brands get the unresolved parser. */
    public BrandParser forBrand(Brand brand) {
        if (brand == null) return unresolved;
        return parsers.getOrDefault(brand, unresolved);
    }
}
