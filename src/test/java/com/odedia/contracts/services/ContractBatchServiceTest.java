package com.odedia.contracts.services;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.odedia.contracts.config.ExtractionSettings;
import com.odedia.contracts.dto.BatchReport;
import com.odedia.contracts.dto.ContractUpload;
import com.odedia.contracts.dto.DocumentOutcome;
import com.odedia.contracts.dto.DocumentStatus;
import com.odedia.contracts.extraction.ContractFieldExtractor;
import com.odedia.contracts.extraction.FieldRuleTable;
import com.odedia.contracts.extraction.SampleContracts;
import com.odedia.contracts.quality.QualityScorer;
import com.odedia.contracts.rtl.ContractTextNormalizer;
import com.odedia.contracts.rtl.TestPdfs;
import com.odedia.contracts.sanitize.ValueSanitizers;
import com.odedia.contracts.schema.ContractField;
import com.odedia.contracts.schema.ContractSchema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ContractBatchServiceTest {

    private final ContractSchema schema = ContractSchema.standard();
    private FallbackModelClient modelClient;

    @BeforeEach
    void setUp() {
        modelClient = mock(FallbackModelClient.class);
    }

    private ContractBatchService service(boolean fallbackEnabled, String apiKey) {
        ExtractionSettings settings = ExtractionSettings.defaults();
        ValueSanitizers sanitizers = new ValueSanitizers(settings);
        ContractFieldExtractor extractor = new ContractFieldExtractor(schema,
                FieldRuleTable.standard(sanitizers, settings));
        FallbackFillerService fallback = new FallbackFillerService(schema, modelClient,
                new ResilientLlmService(0, 0, 5), new ObjectMapper(), fallbackEnabled, apiKey, "sonar", 22000);
        return new ContractBatchService(schema, new ContractTextNormalizer(settings.sentenceFlipMinArabic()),
                extractor, new QualityScorer(schema), fallback, 35, 50);
    }

    private ContractBatchService service() {
        return service(false, "");
    }

    @Test
    void process_shouldSkipFilesBelowMinimumSize() throws IOException {
        BatchReport report = service().process(List.of(new ContractUpload("tiny.pdf", new byte[10])));

        DocumentOutcome outcome = report.outcomes().get(0);
        assertThat(outcome.status()).isEqualTo(DocumentStatus.SKIPPED);
        assertThat(outcome.note()).isEqualTo("File empty/too small");
        assertThat(outcome.record().asRow()).hasSize(40).allMatch(String::isEmpty);
        assertThat(outcome.quality().percent()).isEqualTo(0.0);
    }

    @Test
    void process_shouldReportUnparsableFileAsErrorAndContinue() throws IOException {
        byte[] junk = "this is definitely not a PDF document, only plain text bytes".getBytes(StandardCharsets.UTF_8);

        BatchReport report = service().process(List.of(
                new ContractUpload("broken.pdf", junk),
                new ContractUpload("contract.pdf", TestPdfs.englishContract())));

        assertThat(report.outcomes()).extracting(DocumentOutcome::status)
                .containsExactly(DocumentStatus.ERROR, DocumentStatus.OK);
        assertThat(report.outcomes().get(0).note()).isNotBlank();
        assertThat(report.outcomes().get(0).record().asRow()).allMatch(String::isEmpty);
    }

    @Test
    void process_shouldReportUnreadableUploadAsError() throws IOException {
        ContractUpload upload = ContractUpload.unreadable("lost.pdf", new IOException("stream closed"));

        DocumentOutcome outcome = service().process(List.of(upload)).outcomes().get(0);

        assertThat(outcome.status()).isEqualTo(DocumentStatus.ERROR);
        assertThat(outcome.note()).isEqualTo("IOException: stream closed");
    }

    @Test
    void process_shouldExtractFieldsFromPdf() throws IOException {
        DocumentOutcome outcome = service()
                .process(List.of(new ContractUpload("contract.pdf", TestPdfs.englishContract())))
                .outcomes().get(0);

        assertThat(outcome.status()).isEqualTo(DocumentStatus.OK);
        assertThat(outcome.note()).isEqualTo("Parsed successfully");
        assertThat(outcome.record().get(ContractField.CONTRACT_NUMBER)).isEqualTo("22477445");
        assertThat(outcome.quality().filled()).isGreaterThanOrEqualTo(14);
    }

    @Test
    void process_shouldKeepUploadOrderAndNotifyPerDocument() throws IOException {
        List<String> notified = new ArrayList<>();

        BatchReport report = service().process(List.of(
                new ContractUpload("a.pdf", new byte[0]),
                new ContractUpload("b.pdf", TestPdfs.englishContract()),
                new ContractUpload("c.pdf", new byte[1])),
                outcome -> notified.add(outcome.fileName()));

        assertThat(report.outcomes()).extracting(DocumentOutcome::fileName).containsExactly("a.pdf", "b.pdf", "c.pdf");
        assertThat(notified).containsExactly("a.pdf", "b.pdf", "c.pdf");
        assertThat(report.countsByStatus()).containsEntry(DocumentStatus.SKIPPED, 2L)
                .containsEntry(DocumentStatus.OK, 1L);
    }

    @Test
    void process_shouldSurviveFailingListener() throws IOException {
        BatchReport report = service().process(List.of(
                new ContractUpload("a.pdf", new byte[0]),
                new ContractUpload("b.pdf", new byte[0])),
                outcome -> {
                    throw new IllegalStateException("listener down");
                });

        assertThat(report.outcomes()).hasSize(2);
    }

    @Test
    void process_shouldDeleteRunDirectory() throws IOException {
        Set<Path> before = runDirectories();

        service().process(List.of(new ContractUpload("contract.pdf", TestPdfs.englishContract())));

        assertThat(runDirectories()).isSubsetOf(before);
    }

    @Test
    void processText_shouldScoreFullContractAsOk() {
        DocumentOutcome outcome = service().processText("sample", SampleContracts.fullContract());

        assertThat(outcome.status()).isEqualTo(DocumentStatus.OK);
        assertThat(outcome.quality().percent()).isEqualTo(100.0);
        assertThat(outcome.quality().missing()).isEmpty();
    }

    @Test
    void processText_shouldRepairVisuallyOrderedContract() {
        DocumentOutcome outcome = service().processText("visual", SampleContracts.visualContract());

        Map<ContractField, String> expected = new EnumMap<>(ContractField.class);
        expected.put(ContractField.CONTRACT_NUMBER, "22477445");
        expected.put(ContractField.CONTRACT_DATE, "21/09/2024");
        expected.put(ContractField.COMPANY_NAME, "شركة النخبة للتجارة");
        expected.put(ContractField.UNIFIED_NUMBER, "7001234567");
        expected.put(ContractField.ESTABLISHMENT_NUMBER, "1-2345678");
        expected.put(ContractField.COMMERCIAL_REGISTRATION, "1010123456");
        expected.put(ContractField.COMPANY_ADDRESS, "الرياض حي العليا");
        expected.put(ContractField.WORK_LOCATION, "الرياض");
        expected.put(ContractField.COMPANY_EMAIL, "hr@nokhba.com");
        expected.put(ContractField.SIGNATORY_NAME, "عبدالرحمن محمد");
        expected.put(ContractField.SIGNATORY_TITLE, "مدير الموارد البشرية");
        expected.put(ContractField.EMPLOYEE_NAME, "أحمد علي");
        expected.put(ContractField.ID_NUMBER, "1012345678");
        expected.put(ContractField.ID_TYPE, "هوية وطنية");
        expected.put(ContractField.BIRTH_DATE, "12/05/1990");
        expected.put(ContractField.ID_EXPIRY_DATE, "15/01/2030");
        expected.put(ContractField.NATIONALITY, "سعودي");
        expected.put(ContractField.GENDER, "ذكر");
        expected.put(ContractField.RELIGION, "مسلم");
        expected.put(ContractField.MARITAL_STATUS, "متزوج");
        expected.put(ContractField.EDUCATION, "بكالوريوس");
        expected.put(ContractField.SPECIALTY, "محاسبة");
        expected.put(ContractField.PROFESSION, "محاسب");
        expected.put(ContractField.EMPLOYEE_NUMBER, "5521");
        expected.put(ContractField.IBAN, "SA0380000000608010167519");
        expected.put(ContractField.BANK_NAME, "بنك الراجحي");
        expected.put(ContractField.EMPLOYEE_EMAIL, "ahmed.ali@mail.com");
        expected.put(ContractField.MOBILE, "966505606061");
        expected.put(ContractField.CONTRACT_START_DATE, "22/09/2024");
        expected.put(ContractField.CONTRACT_END_DATE, "21/09/2025");
        expected.put(ContractField.JOINING_DATE, "23/09/2024");
        expected.put(ContractField.CONTRACT_DURATION, "1");
        expected.put(ContractField.TRIAL_PERIOD_DAYS, "90");
        expected.put(ContractField.WEEKLY_WORKDAYS, "5");
        expected.put(ContractField.DAILY_HOURS, "8");
        expected.put(ContractField.BASE_SALARY, "9720");
        expected.put(ContractField.HOUSING_ALLOWANCE, "2430");
        expected.put(ContractField.ANNUAL_LEAVE_DAYS, "30");
        expected.put(ContractField.OVERTIME_RATE, "50");
        expected.put(ContractField.TERMINATION_COMPENSATION, "5000");

        Map<ContractField, String> actual = new EnumMap<>(ContractField.class);
        outcome.record().fields().forEach(f -> actual.put(f, outcome.record().get(f)));

        assertThat(expected).hasSize(40);
        assertThat(actual).containsExactlyEntriesOf(expected);
        assertThat(outcome.status()).isEqualTo(DocumentStatus.OK);
        assertThat(outcome.quality().percent()).isEqualTo(100.0);
    }

    @Test
    void processText_shouldFlagSparseTextAsLowQuality() {
        DocumentOutcome outcome = service().processText("sparse", "رقم العقد: 22477445");

        assertThat(outcome.status()).isEqualTo(DocumentStatus.LOW_QUALITY);
        assertThat(outcome.note()).isEqualTo("Low filled fields; check normalized text");
        assertThat(outcome.record().get(ContractField.CONTRACT_NUMBER)).isEqualTo("22477445");
    }

    @Test
    void processText_shouldSkipBlankText() {
        DocumentOutcome outcome = service().processText("blank", " \n\u200F\n ");

        assertThat(outcome.status()).isEqualTo(DocumentStatus.SKIPPED);
        assertThat(outcome.note()).isEqualTo("No text found");
    }

    @Test
    void processText_shouldRecordFallbackErrorWithoutFailingDocument() {
        DocumentOutcome outcome = service(true, "").processText("sparse", "رقم العقد: 22477445");

        assertThat(outcome.status()).isEqualTo(DocumentStatus.LOW_QUALITY);
        assertThat(outcome.fallbackError()).contains("API key");
        assertThat(outcome.fallbackFilled()).isZero();
    }

    @Test
    void processText_shouldMergeFallbackValuesAndRescore() throws Exception {
        StringBuilder reply = new StringBuilder("{");
        for (ContractField field : ContractField.values()) {
            if (reply.length() > 1) {
                reply.append(',');
            }
            reply.append('"').append(field.getHeader()).append("\":\"")
                    .append(field == ContractField.CONTRACT_NUMBER ? "999" : "x").append('"');
        }
        reply.append('}');
        when(modelClient.complete(eq("sonar"), anyString(), anyString())).thenReturn(reply.toString());

        DocumentOutcome outcome = service(true, "key").processText("sparse", "رقم العقد: 22477445");

        assertThat(outcome.status()).isEqualTo(DocumentStatus.OK);
        assertThat(outcome.fallbackFilled()).isEqualTo(39);
        assertThat(outcome.note()).isEqualTo("Parsed successfully (39 fields filled by fallback model)");
        assertThat(outcome.record().get(ContractField.CONTRACT_NUMBER)).isEqualTo("22477445");
        assertThat(outcome.quality().percent()).isEqualTo(100.0);
    }

    @Test
    void safeFileName_shouldDropDirectoriesAndOddCharacters() {
        assertThat(ContractBatchService.safeFileName("../../etc/passwd")).isEqualTo("passwd");
        assertThat(ContractBatchService.safeFileName("C:\\docs\\my contract.pdf")).isEqualTo("my_contract.pdf");
        assertThat(ContractBatchService.safeFileName("عقد 1.pdf")).isEqualTo("عقد_1.pdf");
    }

    private static Set<Path> runDirectories() throws IOException {
        Set<Path> found = new HashSet<>();
        Path tmp = Paths.get(System.getProperty("java.io.tmpdir"));
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(tmp,
                ContractBatchService.RUN_DIRECTORY_PREFIX + "*")) {
            stream.forEach(found::add);
        }
        return found;
    }
}
