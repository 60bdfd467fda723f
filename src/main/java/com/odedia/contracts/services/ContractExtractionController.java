package com.odedia.contracts.services;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.odedia.contracts.dto.BatchReport;
import com.odedia.contracts.dto.ContractUpload;
import com.odedia.contracts.dto.DocumentOutcome;
import com.odedia.contracts.dto.DocumentStatus;
import com.odedia.contracts.export.WorkbookExporter;
import com.odedia.contracts.rtl.ContractTextNormalizer;

import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/contracts")
public class ContractExtractionController {

	private final Logger logger = LoggerFactory.getLogger(ContractExtractionController.class);

	public static final String WORKBOOK_FILE_NAME = "Employees_Data.xlsx";
	public static final String REPORT_FILE_NAME = "Extraction_Report.txt";
	public static final MediaType XLSX = MediaType
			.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");
	private static final MediaType TEXT_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);

	private final ContractBatchService batchService;
	private final WorkbookExporter workbookExporter;
	private final ContractTextNormalizer normalizer;

	public ContractExtractionController(ContractBatchService batchService,
			WorkbookExporter workbookExporter,
			ContractTextNormalizer normalizer) {
		this.batchService = batchService;
		this.workbookExporter = workbookExporter;
		this.normalizer = normalizer;
	}

	@PostMapping(path = "/extract", produces = MediaType.APPLICATION_JSON_VALUE)
	public BatchReport extract(@RequestParam("files") MultipartFile[] files) throws IOException {
		return batchService.process(readUploads(files));
	}

	@PostMapping(path = "/extract/text", consumes = MediaType.TEXT_PLAIN_VALUE,
			produces = MediaType.APPLICATION_JSON_VALUE)
	public DocumentOutcome extractText(@RequestBody String text,
			@RequestParam(name = "name", defaultValue = "text") String name) {
		return batchService.processText(name, text);
	}

	@PostMapping(path = "/extract/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
	public Flux<ServerSentEvent<Map<String, Object>>> extractStream(
			@RequestParam("files") MultipartFile[] files) {

		// read on the request thread, multipart parts are gone once the request completes
		List<ContractUpload> uploads = readUploads(files);

		Flux<ServerSentEvent<Map<String, Object>>> progressFlux = Flux
				.<ServerSentEvent<Map<String, Object>>>create(emitter -> {
					int[] processedFiles = { 0 };
					try {
						BatchReport report = batchService.process(uploads, outcome -> {
							processedFiles[0]++;
							emitter.next(progressEvent(outcome, processedFiles[0], uploads.size()));
						});

						emitter.next(ServerSentEvent.<Map<String, Object>>builder()
								.event("jobComplete")
								.data(Map.of(
										"status", "success",
										"counts", report.countsByStatus(),
										"elapsed", Duration.ofMillis(report.elapsedMillis()).toSeconds()))
								.build());
					} catch (IOException e) {
						logger.error("Batch failed to start", e);
						emitter.next(ServerSentEvent.<Map<String, Object>>builder()
								.event("error")
								.data(Map.of("message", "Batch failed: " + e.getMessage()))
								.build());
						emitter.next(ServerSentEvent.<Map<String, Object>>builder()
								.event("jobComplete")
								.data(Map.of("status", "failed"))
								.build());
					}
					emitter.complete();
				}).subscribeOn(Schedulers.boundedElastic());

		Flux<ServerSentEvent<Map<String, Object>>> heartbeatFlux = Flux.interval(Duration.ofSeconds(15))
				.map(tick -> ServerSentEvent.<Map<String, Object>>builder()
						.comment("heartbeat")
						.build());

		return Flux
				.merge(progressFlux, heartbeatFlux)
				.takeUntil(sse -> "jobComplete".equals(sse.event()));
	}

	@PostMapping("/export")
	public ResponseEntity<byte[]> export(@RequestParam("files") MultipartFile[] files,
			@RequestParam(name = "includeLogs", required = false) Boolean includeLogs) throws IOException {
		BatchReport report = batchService.process(readUploads(files));
		byte[] workbook = includeLogs == null
				? workbookExporter.export(report)
				: workbookExporter.export(report, includeLogs);
		return attachment(workbook, WORKBOOK_FILE_NAME, XLSX);
	}

	@PostMapping("/report")
	public ResponseEntity<byte[]> report(@RequestParam("files") MultipartFile[] files) throws IOException {
		BatchReport report = batchService.process(readUploads(files));
		return attachment(report.toReportText().getBytes(StandardCharsets.UTF_8), REPORT_FILE_NAME, TEXT_UTF8);
	}

	@PostMapping(path = "/normalize", consumes = MediaType.TEXT_PLAIN_VALUE,
			produces = "text/plain;charset=UTF-8")
	public String normalize(@RequestBody String text) {
		return normalizer.normalize(text);
	}

	private ServerSentEvent<Map<String, Object>> progressEvent(DocumentOutcome outcome, int processed, int total) {
		int progressPercent = (int) ((processed * 100.0) / total);
		if (outcome.status() == DocumentStatus.ERROR) {
			return ServerSentEvent.<Map<String, Object>>builder()
					.event("error")
					.data(Map.of(
							"file", outcome.fileName(),
							"message", "Failed to process " + outcome.fileName() + ": " + outcome.note(),
							"progressPercent", progressPercent))
					.build();
		}
		return ServerSentEvent.<Map<String, Object>>builder()
				.event("fileDone")
				.data(Map.of(
						"file", outcome.fileName(),
						"status", outcome.status().name(),
						"qualityPercent", outcome.quality().percent(),
						"progressPercent", progressPercent))
				.build();
	}

	private List<ContractUpload> readUploads(MultipartFile[] files) {
		List<ContractUpload> uploads = new ArrayList<>();
		for (MultipartFile file : files) {
			try {
				uploads.add(new ContractUpload(file.getOriginalFilename(), file.getBytes()));
			} catch (IOException e) {
				logger.error("Failed to read upload {}", file.getOriginalFilename(), e);
				uploads.add(ContractUpload.unreadable(file.getOriginalFilename(), e));
			}
		}
		return uploads;
	}

	private ResponseEntity<byte[]> attachment(byte[] body, String fileName, MediaType mediaType) {
		return ResponseEntity.ok()
				.header(HttpHeaders.CONTENT_DISPOSITION,
						ContentDisposition.attachment().filename(fileName).build().toString())
				.contentType(mediaType)
				.body(body);
	}
}
