package com.odedia.contracts.services;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import com.odedia.contracts.dto.BatchReport;
import com.odedia.contracts.dto.ContractText;
import com.odedia.contracts.dto.ContractUpload;
import com.odedia.contracts.dto.DocumentOutcome;
import com.odedia.contracts.dto.DocumentStatus;
import com.odedia.contracts.dto.ExtractedRecord;
import com.odedia.contracts.dto.FallbackResult;
import com.odedia.contracts.extraction.ContractFieldExtractor;
import com.odedia.contracts.quality.QualityReport;
import com.odedia.contracts.quality.QualityScorer;
import com.odedia.contracts.rtl.ArabicEnglishPdfPerPageExtractor;
import com.odedia.contracts.rtl.ContractTextNormalizer;
import com.odedia.contracts.schema.ContractSchema;

/**
 * Runs a batch of contract PDFs through extraction, one outcome per file.
 *
 * Documents are independent: a failure in one document becomes that
 * document's ERROR outcome and the batch continues. Uploaded files are staged
 * in a temporary directory owned by the run and deleted when the run ends,
 * whether it succeeds or not.
 */
@Service
public class ContractBatchService {

    private static final Logger logger = LoggerFactory.getLogger(ContractBatchService.class);

    public static final String RUN_DIRECTORY_PREFIX = "contract-batch-";

    private final ContractSchema schema;
    private final ContractTextNormalizer normalizer;
    private final ContractFieldExtractor extractor;
    private final QualityScorer qualityScorer;
    private final FallbackFillerService fallbackFiller;
    private final double qualityThreshold;
    private final int minBytes;

    public ContractBatchService(ContractSchema schema,
            ContractTextNormalizer normalizer,
            ContractFieldExtractor extractor,
            QualityScorer qualityScorer,
            FallbackFillerService fallbackFiller,
            @Value("${app.extraction.qualityThreshold:35}") double qualityThreshold,
            @Value("${app.extraction.minBytes:50}") int minBytes) {
        this.schema = schema;
        this.normalizer = normalizer;
        this.extractor = extractor;
        this.qualityScorer = qualityScorer;
        this.fallbackFiller = fallbackFiller;
        this.qualityThreshold = qualityThreshold;
        this.minBytes = minBytes;

        logger.info("Initialized ContractBatchService: qualityThreshold={}%, minBytes={}", qualityThreshold, minBytes);
    }

    public BatchReport process(List<ContractUpload> uploads) throws IOException {
        return process(uploads, outcome -> {
        });
    }

    /**
     * Processes the uploads in order.
     *
     * @param uploads  Files to process
     * @param listener Called after each document, e.g. to report progress
     * @return One outcome per upload, in upload order
     * @throws IOException if the run's temporary directory cannot be created
     */
    public BatchReport process(List<ContractUpload> uploads, Consumer<DocumentOutcome> listener)
            throws IOException {
        Instant start = Instant.now();
        Path runDirectory = Files.createTempDirectory(RUN_DIRECTORY_PREFIX);
        logger.info("Processing batch of {} files in {}", uploads.size(), runDirectory);

        List<DocumentOutcome> outcomes = new ArrayList<>();
        try {
            int index = 0;
            for (ContractUpload upload : uploads) {
                index++;
                DocumentOutcome outcome = processUpload(upload, runDirectory, index);
                outcomes.add(outcome);
                notify(listener, outcome);
            }
        } finally {
            deleteRunDirectory(runDirectory);
        }

        long elapsed = Duration.between(start, Instant.now()).toMillis();
        BatchReport report = new BatchReport(outcomes, elapsed);
        logger.info("Batch complete in {}ms: {}", elapsed, report.countsByStatus());
        return report;
    }

    DocumentOutcome processUpload(ContractUpload upload, Path runDirectory, int index) {
        logger.info("Processing file {}: {} ({} bytes)", index, upload.fileName(), upload.size());

        if (upload.readError() != null) {
            logger.error("Could not read upload {}", upload.fileName(), upload.readError());
            return failed(upload.fileName(), upload.readError());
        }
        if (upload.size() < minBytes) {
            return skipped(upload.fileName(), "File empty/too small");
        }

        try {
            Path staged = runDirectory.resolve(index + "-" + safeFileName(upload.fileName()));
            Files.write(staged, upload.content());
            ContractText contractText = ArabicEnglishPdfPerPageExtractor.extractPages(staged.toFile());
            return analyze(upload.fileName(), contractText.getFullText());
        } catch (Exception e) {
            logger.error("Failed to process file {}", upload.fileName(), e);
            return failed(upload.fileName(), e);
        }
    }

    /**
     * Processes text that was already extracted from a document.
     */
    public DocumentOutcome processText(String name, String rawText) {
        try {
            return analyze(name, rawText);
        } catch (RuntimeException e) {
            logger.error("Failed to process text {}", name, e);
            return failed(name, e);
        }
    }

    private DocumentOutcome analyze(String name, String rawText) {
        String normalized = normalizer.normalize(rawText);
        if (normalized.isEmpty()) {
            return skipped(name, "No text found");
        }

        ExtractedRecord record = extractor.extract(normalized);
        QualityReport quality = qualityScorer.score(record);

        int fallbackFilled = 0;
        String fallbackError = "";
        if (fallbackFiller.isEnabled() && !quality.missing().isEmpty()) {
            try {
                FallbackResult result = fallbackFiller.fill(quality.missing(), normalized);
                fallbackFilled = result.mergeInto(record);
                if (fallbackFilled > 0) {
                    quality = qualityScorer.score(record);
                }
            } catch (FallbackException | RuntimeException e) {
                fallbackError = e.getMessage();
                logger.warn("Fallback not applied to {}: {}", name, e.getMessage());
            }
        }

        DocumentStatus status = quality.percent() >= qualityThreshold ? DocumentStatus.OK : DocumentStatus.LOW_QUALITY;
        String note = status == DocumentStatus.OK
                ? "Parsed successfully"
                : "Low filled fields; check normalized text";
        if (fallbackFilled > 0) {
            note += " (" + fallbackFilled + " fields filled by fallback model)";
        }
        if (status == DocumentStatus.LOW_QUALITY) {
            logger.warn("{} is low quality: {}% ({}/{} fields)", name, quality.percent(), quality.filled(),
                    quality.total());
        } else {
            logger.info("{}: {}% ({}/{} fields)", name, quality.percent(), quality.filled(), quality.total());
        }

        return new DocumentOutcome(name, Instant.now(), status, record, quality, note, fallbackFilled,
                fallbackError);
    }

    private DocumentOutcome skipped(String name, String note) {
        logger.info("Skipping {}: {}", name, note);
        ExtractedRecord empty = ExtractedRecord.empty(schema);
        return new DocumentOutcome(name, Instant.now(), DocumentStatus.SKIPPED, empty,
                qualityScorer.score(empty), note, 0, "");
    }

    private DocumentOutcome failed(String name, Exception e) {
        ExtractedRecord empty = ExtractedRecord.empty(schema);
        String note = e.getClass().getSimpleName() + ": " + e.getMessage();
        return new DocumentOutcome(name, Instant.now(), DocumentStatus.ERROR, empty,
                qualityScorer.score(empty), note, 0, "");
    }

    private void notify(Consumer<DocumentOutcome> listener, DocumentOutcome outcome) {
        try {
            listener.accept(outcome);
        } catch (RuntimeException e) {
            logger.warn("Progress listener failed for {}: {}", outcome.fileName(), e.getMessage());
        }
    }

    private void deleteRunDirectory(Path runDirectory) {
        try {
            FileSystemUtils.deleteRecursively(runDirectory);
            logger.debug("Deleted run directory {}", runDirectory);
        } catch (IOException e) {
            logger.warn("Could not delete run directory {}: {}", runDirectory, e.getMessage());
        }
    }

    static String safeFileName(String fileName) {
        String name = Path.of(fileName.replace('\\', '/')).getFileName().toString();
        return name.replaceAll("[^\\p{L}\\p{N}._-]", "_");
    }
}
