package com.example.magazinetoc.service;

import com.example.magazinetoc.exception.ExtractionFailureException;
import com.example.magazinetoc.model.Brand;
import com.example.magazinetoc.model.DocumentOutcome;
import com.example.magazinetoc.model.PageText;
import com.example.magazinetoc.model.ParseResult;
import com.example.magazinetoc.model.RenderedReport;
import com.example.magazinetoc.model.ReportFormat;
import com.example.magazinetoc.model.SourceDocument;
import com.example.magazinetoc.model.TocOptions;
import com.example.magazinetoc.parser.BrandParser;
import com.example.magazinetoc.parser.BrandParserRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one document through text extraction, brand detection, parsing and rendering.
 * Extraction failures and unresolved brands end the document, not the run.
 */
@Service
public class MagazineTocService {

    private static final Logger logger = LoggerFactory.getLogger(MagazineTocService.class);

    private final PageTextProvider pageTextProvider;
    private final BrandDetector brandDetector;
    private final BrandParserRegistry parserRegistry;
    private final ReportRenderer renderer;

    public MagazineTocService(PageTextProvider pageTextProvider, BrandDetector brandDetector,
                              BrandParserRegistry parserRegistry, ReportRenderer renderer) {
        this.pageTextProvider = pageTextProvider;
        this.brandDetector = brandDetector;
        this.parserRegistry = parserRegistry;
        this.renderer = renderer;
    }

    /**
     * @param brandHint explicit brand, or {@code null} to detect it
     */
    public DocumentOutcome process(SourceDocument document, Brand brandHint, TocOptions options, ReportFormat format) {
        logger.info("Processing {}", document.getPath());

        PageText pageText;
        try {
            pageText = pageTextProvider.getText(document);
        } catch (ExtractionFailureException e) {
            logger.error("Extraction failed for {}: {}", document.getFileName(), e.getMessage());
            return DocumentOutcome.failed(document.getPath(), e.getMessage());
        }

        Brand brand = brandDetector.detect(document, pageText, brandHint);
        BrandParser parser = parserRegistry.forBrand(brand);
        ParseResult result = parser.parse(pageText, options);
        if (result.getDiagnostics().isBrandUnresolved()) {
            logger.warn("Skipping {}: brand unresolved", document.getFileName());
            return DocumentOutcome.unresolved(document.getPath(), result);
        }

        logger.info("{}: {} headings, {} items ({})", document.getFileName(),
                result.getHeadings().size(), result.getItems().size(), brand.getDisplayName());
        RenderedReport report = renderer.render(result, format, options);
        return DocumentOutcome.success(document.getPath(), result, report);
    }
}
