package com.odedia.contracts.config;

import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.odedia.contracts.extraction.ContractFieldExtractor;
import com.odedia.contracts.extraction.EmailStrategy;
import com.odedia.contracts.extraction.FieldRuleTable;
import com.odedia.contracts.quality.QualityScorer;
import com.odedia.contracts.rtl.ContractTextNormalizer;
import com.odedia.contracts.sanitize.ValueSanitizers;
import com.odedia.contracts.schema.ContractField;
import com.odedia.contracts.schema.ContractSchema;

/**
 * Wires the extraction pipeline from {@code app.extraction.*} properties.
 */
@Configuration
public class ContractExtractionConfig {

	private static final Logger logger = LoggerFactory.getLogger(ContractExtractionConfig.class);

	@Bean
	public ContractSchema contractSchema() {
		return ContractSchema.standard();
	}

	@Bean
	public ExtractionSettings extractionSettings(
			@Value("${app.extraction.valueFlipMinArabic:3}") int valueFlipMinArabic,
			@Value("${app.extraction.sentenceFlipMinArabic:10}") int sentenceFlipMinArabic,
			@Value("${app.extraction.swappedDigitPattern:0\\d}") String swappedDigitPattern,
			@Value("${app.extraction.maxPlausibleYear:2100}") int maxPlausibleYear,
			@Value("${app.extraction.emailStrategy:POSITIONAL}") EmailStrategy emailStrategy) {
		ExtractionSettings settings = new ExtractionSettings(
				valueFlipMinArabic,
				sentenceFlipMinArabic,
				Pattern.compile(swappedDigitPattern),
				maxPlausibleYear,
				emailStrategy);
		logger.info("Extraction settings: {}", settings);
		return settings;
	}

	@Bean
	public ValueSanitizers valueSanitizers(ExtractionSettings settings) {
		return new ValueSanitizers(settings);
	}

	@Bean
	public FieldRuleTable fieldRuleTable(ValueSanitizers sanitizers, ExtractionSettings settings,
			ContractSchema schema) {
		FieldRuleTable table = FieldRuleTable.standard(sanitizers, settings);
		Set<ContractField> uncovered = table.uncovered();
		uncovered.retainAll(schema.fields());
		if (!uncovered.isEmpty()) {
			logger.warn("No extraction rule for fields: {}", uncovered);
		}
		return table;
	}

	@Bean
	public ContractFieldExtractor contractFieldExtractor(ContractSchema schema, FieldRuleTable ruleTable) {
		return new ContractFieldExtractor(schema, ruleTable);
	}

	@Bean
	public ContractTextNormalizer contractTextNormalizer(ExtractionSettings settings) {
		return new ContractTextNormalizer(settings.sentenceFlipMinArabic());
	}

	@Bean
	public QualityScorer qualityScorer(ContractSchema schema) {
		return new QualityScorer(schema);
	}
}
