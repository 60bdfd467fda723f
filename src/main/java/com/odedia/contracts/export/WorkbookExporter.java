package com.odedia.contracts.export;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.odedia.contracts.dto.BatchReport;
import com.odedia.contracts.dto.DocumentOutcome;
import com.odedia.contracts.quality.QualityReport;
import com.odedia.contracts.schema.ContractSchema;

/**
 * Writes batch results to an .xlsx workbook.
 *
 * <p>The main sheet has one header row (the schema's Arabic headers) and one
 * row per document in batch order; SKIPPED and ERROR documents produce an
 * all-empty row so rows stay aligned with the uploaded files. The optional
 * "Logs" sheet has one row per document with its status and quality.
 */
@Component
public class WorkbookExporter {

	private static final Logger logger = LoggerFactory.getLogger(WorkbookExporter.class);

	public static final String SHEET_MAIN = "الموظفين";
	public static final String SHEET_LOGS = "Logs";
	public static final List<String> LOG_HEADERS = List.of(
			"timestamp", "file_name", "status",
			"filled_fields", "total_fields", "quality_%", "missing_fields",
			"note");

	static final int MIN_WIDTH = 10;
	static final int MAIN_MAX_WIDTH = 70;
	static final int LOGS_MAX_WIDTH = 90;
	private static final int MISSING_FIELDS_SHOWN = 10;

	private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
			.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'")
			.withZone(ZoneOffset.UTC);

	private final ContractSchema schema;
	private final boolean includeLogs;

	public WorkbookExporter(ContractSchema schema,
			@Value("${app.export.includeLogs:true}") boolean includeLogs) {
		this.schema = schema;
		this.includeLogs = includeLogs;
	}

	public byte[] export(BatchReport report) throws IOException {
		return export(report, includeLogs);
	}

	/**
	 * @param report      Batch results
	 * @param withLogs    Whether to add the "Logs" sheet
	 * @return The workbook as .xlsx bytes
	 * @throws IOException if the workbook cannot be serialized
	 */
	public byte[] export(BatchReport report, boolean withLogs) throws IOException {
		try (Workbook workbook = new XSSFWorkbook();
				ByteArrayOutputStream out = new ByteArrayOutputStream()) {
			CellStyle headerStyle = headerStyle(workbook);
			CellStyle bodyStyle = bodyStyle(workbook);

			Sheet main = workbook.createSheet(SHEET_MAIN);
			writeRow(main, 0, schema.headers(), headerStyle);
			int rowIndex = 1;
			for (DocumentOutcome outcome : report.outcomes()) {
				writeRow(main, rowIndex++, outcome.record().asRow(), bodyStyle);
			}
			main.createFreezePane(0, 1);
			autoWidth(main, schema.size(), MAIN_MAX_WIDTH);

			if (withLogs) {
				Sheet logs = workbook.createSheet(SHEET_LOGS);
				writeRow(logs, 0, LOG_HEADERS, headerStyle);
				rowIndex = 1;
				for (DocumentOutcome outcome : report.outcomes()) {
					writeRow(logs, rowIndex++, logRow(outcome), bodyStyle);
				}
				logs.createFreezePane(0, 1);
				autoWidth(logs, LOG_HEADERS.size(), LOGS_MAX_WIDTH);
			}

			workbook.write(out);
			logger.info("Exported {} rows (logs sheet: {})", report.outcomes().size(), withLogs);
			return out.toByteArray();
		}
	}

	static List<String> logRow(DocumentOutcome outcome) {
		QualityReport quality = outcome.quality();
		return List.of(
				TIMESTAMP_FORMAT.format(outcome.timestamp()),
				outcome.fileName(),
				outcome.status().name(),
				String.valueOf(quality.filled()),
				String.valueOf(quality.total()),
				String.valueOf(quality.percent()),
				quality.missingSummary(MISSING_FIELDS_SHOWN),
				outcome.note());
	}

	private void writeRow(Sheet sheet, int rowIndex, List<String> values, CellStyle style) {
		Row row = sheet.createRow(rowIndex);
		for (int c = 0; c < values.size(); c++) {
			Cell cell = row.createCell(c);
			cell.setCellValue(values.get(c));
			cell.setCellStyle(style);
		}
	}

	/**
	 * Sets each column to its longest value plus two characters, clamped to
	 * {@code [MIN_WIDTH, maxWidth]}.
	 */
	static void autoWidth(Sheet sheet, int columns, int maxWidth) {
		for (int c = 0; c < columns; c++) {
			int longest = 0;
			for (Row row : sheet) {
				Cell cell = row.getCell(c);
				if (cell != null) {
					longest = Math.max(longest, cell.getStringCellValue().length());
				}
			}
			int width = Math.min(Math.max(MIN_WIDTH, longest + 2), maxWidth);
			sheet.setColumnWidth(c, width * 256);
		}
	}

	private CellStyle headerStyle(Workbook workbook) {
		Font bold = workbook.createFont();
		bold.setBold(true);
		CellStyle style = workbook.createCellStyle();
		style.setFont(bold);
		style.setAlignment(HorizontalAlignment.CENTER);
		style.setVerticalAlignment(VerticalAlignment.CENTER);
		style.setWrapText(true);
		return style;
	}

	private CellStyle bodyStyle(Workbook workbook) {
		CellStyle style = workbook.createCellStyle();
		style.setVerticalAlignment(VerticalAlignment.TOP);
		style.setWrapText(true);
		return style;
	}
}
