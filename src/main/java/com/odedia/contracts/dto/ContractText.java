package com.odedia.contracts.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Text extracted from one contract PDF, page by page, with the actual PDF page
 * numbers (1-indexed) and the dominant script of the document.
 */
public class ContractText {
    private final List<PageData> pages;
    private final String language;

    public ContractText(List<PageData> pages, String language) {
        this.pages = List.copyOf(pages);
        this.language = language;
    }

    public List<PageData> getPages() {
        return pages;
    }

    /**
     * Returns just the page content strings.
     */
    public List<String> getStringPages() {
        List<String> result = new ArrayList<>();
        for (PageData page : pages) {
            result.add(page.getContent());
        }
        return result;
    }

    /**
     * All pages joined by a newline, the form the normalizer consumes.
     */
    public String getFullText() {
        return String.join("\n", getStringPages());
    }

    /**
     * "ar" or "en".
     */
    public String getLanguage() {
        return language;
    }

    /**
     * Represents a single page with its actual PDF page number and content.
     */
    public static class PageData {
        private final int actualPageNumber;
        private final String content;

        public PageData(int actualPageNumber, String content) {
            this.actualPageNumber = actualPageNumber;
            this.content = content == null ? "" : content;
        }

        public int getActualPageNumber() {
            return actualPageNumber;
        }

        public String getContent() {
            return content;
        }
    }
}
