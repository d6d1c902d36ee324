package com.example.magazinetoc.ocr.impl;

import com.example.magazinetoc.ocr.OcrEngine;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.File;

@Component
public class TesseractEngine implements OcrEngine {

    private static final Logger logger = LoggerFactory.getLogger(TesseractEngine.class);

    private final Tesseract tesseract;

    public TesseractEngine(@Value("${magtoc.ocr.datapath:}") String configuredDatapath,
                           @Value("${magtoc.ocr.language:eng}") String language) {
        this.tesseract = new Tesseract();
        String datapath = resolveDatapath(configuredDatapath);
        this.tesseract.setDatapath(datapath);
        this.tesseract.setLanguage(language);
        // 6 = single uniform block; ToC pages read better than with full auto segmentation
        this.tesseract.setPageSegMode(6);
        logger.debug("Tesseract datapath={}, language={}", datapath, language);
    }

    static String resolveDatapath(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String datapath = System.getenv("TESSDATA_PREFIX");
        if (datapath == null) {
            if (new File("tessdata").exists()) {
                datapath = new File("tessdata").getAbsolutePath();
            } else if (new File("src/main/resources/tessdata").exists()) {
                datapath = new File("src/main/resources/tessdata").getAbsolutePath();
            } else {
                datapath = "tessdata";
            }
        }
        return datapath;
    }

    @Override
    public String doOCR(BufferedImage image) throws TesseractException {
        return tesseract.doOCR(image);
    }

    @Override
    public String getName() {
        return "tesseract";
    }
}
