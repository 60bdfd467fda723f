package com.odedia.contracts.rtl;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.odedia.contracts.dto.ContractText;
import com.odedia.contracts.utils.TextCleaningUtils;

/**
 * Extracts text from contract PDFs with support for Arabic (RTL) text.
 *
 * Key features:
 * - Automatic language detection (Arabic vs English)
 * - Position-based sorting when Arabic dominates
 * - Per-page extraction keeping the actual PDF page numbers
 * - Control character and embedded binary removal
 *
 * The extracted text still carries the RTL artifacts PDF text extraction
 * produces; {@link ContractTextNormalizer} repairs them.
 */
public class ArabicEnglishPdfPerPageExtractor {

	private static final Logger logger = LoggerFactory.getLogger(ArabicEnglishPdfPerPageExtractor.class);

	// Arabic block and the two presentation-form blocks
	private static final char ARABIC_START = '\u0600';
	private static final char ARABIC_END = '\u06FF';
	private static final char PRESENTATION_A_START = '\uFB50';
	private static final char PRESENTATION_A_END = '\uFDFF';
	private static final char PRESENTATION_B_START = '\uFE70';
	private static final char PRESENTATION_B_END = '\uFEFE';

	private ArabicEnglishPdfPerPageExtractor() {
	}

	/**
	 * Extracts text from a PDF file, page by page.
	 *
	 * @param pdfFile The PDF file
	 * @return ContractText containing the non-empty pages and detected language
	 * @throws IOException if the file is not a readable PDF
	 */
	public static ContractText extractPages(File pdfFile) throws IOException {
		try (PDDocument document = Loader.loadPDF(pdfFile)) {
			PDFTextStripper stripper = new PDFTextStripper();
			String fullText = stripper.getText(document);
			String language = detectDominantLanguage(fullText);

			// Enable position-based sorting for Arabic (RTL) documents
			if ("ar".equals(language)) {
				stripper.setSortByPosition(true);
				logger.debug("Detected Arabic text, enabling position-based sorting");
			}

			List<ContractText.PageData> pages = new ArrayList<>();
			int totalPages = document.getNumberOfPages();
			logger.info("Extracting {} pages from {} (language: {})", totalPages, pdfFile.getName(), language);

			for (int pageNum = 1; pageNum <= totalPages; pageNum++) {
				stripper.setStartPage(pageNum);
				stripper.setEndPage(pageNum);

				String cleanedPage = TextCleaningUtils.cleanExtractedText(stripper.getText(document));
				if (!cleanedPage.isEmpty()) {
					pages.add(new ContractText.PageData(pageNum, cleanedPage));
				}
			}

			logger.info("Extracted {} non-empty pages", pages.size());
			return new ContractText(pages, language);
		}
	}

	/**
	 * Detects the dominant language in the text by counting Arabic vs English
	 * letters. Arabic presentation forms count as Arabic.
	 *
	 * @param text The text to analyze
	 * @return "ar" for Arabic, "en" for English
	 */
	public static String detectDominantLanguage(String text) {
		if (text == null || text.isEmpty()) {
			return "en";
		}

		int arabicChars = 0;
		int englishChars = 0;

		for (char c : text.toCharArray()) {
			if (isArabic(c)) {
				arabicChars++;
			} else if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z')) {
				englishChars++;
			}
		}

		logger.debug("Language detection: {} Arabic chars, {} English chars", arabicChars, englishChars);
		return (arabicChars >= englishChars && arabicChars > 0) ? "ar" : "en";
	}

	private static boolean isArabic(char c) {
		return (c >= ARABIC_START && c <= ARABIC_END)
				|| (c >= PRESENTATION_A_START && c <= PRESENTATION_A_END)
				|| (c >= PRESENTATION_B_START && c <= PRESENTATION_B_END);
	}
}
