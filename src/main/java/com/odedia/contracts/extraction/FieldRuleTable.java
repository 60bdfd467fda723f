package com.odedia.contracts.extraction;

import static com.odedia.contracts.schema.ContractField.*;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.odedia.contracts.config.ExtractionSettings;
import com.odedia.contracts.sanitize.ValueSanitizers;
import com.odedia.contracts.schema.ContractField;

/**
 * Declarative table of extraction rules, one entry per field (or field pair).
 *
 * Label aliases are listed Arabic first, then English. Misspelt Arabic aliases
 * ("الميالد", "اإلنتهاء") are the spellings PDF text extraction produces for
 * lam-alef ligatures.
 */
public final class FieldRuleTable {

	private static final String DATE = "(\\d{1,4}[-/]\\d{1,2}[-/]\\d{1,4})";
	private static final String AMOUNT = "(\\d[\\d,.]*\\d|\\d)";
	// optional tanween and alef after a noun, "أجرًا"
	private static final String TANWEEN = "[\\p{Mn}ا]*";

	private final List<ExtractionRule> rules;

	public FieldRuleTable(List<ExtractionRule> rules) {
		Set<ContractField> seen = EnumSet.noneOf(ContractField.class);
		for (ExtractionRule rule : rules) {
			for (ContractField field : rule.targets()) {
				if (!seen.add(field)) {
					throw new IllegalArgumentException("Field " + field + " has more than one rule");
				}
			}
		}
		this.rules = List.copyOf(rules);
	}

	public List<ExtractionRule> rules() {
		return rules;
	}

	/**
	 * The rule that fills the given field, for testing rules in isolation.
	 */
	public Optional<ExtractionRule> ruleFor(ContractField field) {
		return rules.stream().filter(r -> r.targets().contains(field)).findFirst();
	}

	/**
	 * Fields no rule fills. Empty for the standard table.
	 */
	public Set<ContractField> uncovered() {
		Set<ContractField> missing = EnumSet.allOf(ContractField.class);
		rules.forEach(r -> missing.removeAll(r.targets()));
		return missing;
	}

	public static FieldRuleTable standard(ValueSanitizers s, ExtractionSettings settings) {
		List<ExtractionRule> rules = new ArrayList<>();

		// Document metadata
		rules.add(FieldRule.of(CONTRACT_NUMBER, s::digitsOnly,
				LabelLocator.of("رقم العقد", "Contract Number", "Contract No")));
		rules.add(FieldRule.of(CONTRACT_DATE, s::formatDate,
				sentence("في يوم[^\\d\\n]{0,20}" + DATE),
				LabelLocator.of("تاريخ العقد", "Contract Date")));

		// Employer
		rules.add(FieldRule.of(COMPANY_NAME, s::text,
				LabelLocator.of("شركة/مؤسسة", "Corporation/Company", "Company Name")));
		rules.add(FieldRule.of(UNIFIED_NUMBER, s::digitsOnly,
				LabelLocator.of("الرقم الوطني الموحد", "National Unified Number", "Unified National Number")));
		rules.add(FieldRule.of(ESTABLISHMENT_NUMBER, s::text,
				LabelLocator.of("رقم المنشأة", "Establishment Number")));
		rules.add(FieldRule.of(COMMERCIAL_REGISTRATION, s::digitsOnly,
				LabelLocator.of("السجل التجاري", "رقم السجل التجاري", "Commercial Registration")));
		rules.add(FieldRule.of(COMPANY_ADDRESS, s::text,
				LabelLocator.of(Label.of("العنوان"), Label.of("عنوان الشركة"), Label.lineStart("Address"))));
		rules.add(FieldRule.of(WORK_LOCATION, s::text,
				LabelLocator.of("مكان العمل", "Work Location")));
		rules.add(new EmailAssignmentRule(settings.emailStrategy()));
		rules.add(new SignatoryRule(
				LabelLocator.of("ويمثلها بالتوقيع", "يمثلها بالتوقيع", "Represented by"), s::text));

		// Employee
		rules.add(FieldRule.of(EMPLOYEE_NAME, s::text,
				LabelLocator.of(Label.of("الاسم"), Label.of("االسم"), Label.of("اسم الموظف"),
						Label.of("Employee Name"), Label.lineStart("Name"))));
		rules.add(FieldRule.of(ID_NUMBER, s::digitsOnly,
				LabelLocator.of("رقم الهوية", "Identity Number", "ID Number")));
		rules.add(FieldRule.of(ID_TYPE, s::text,
				LabelLocator.of("نوع الهوية", "ID Type")));
		rules.add(FieldRule.of(BIRTH_DATE, s::formatDate,
				LabelLocator.of("تاريخ الميلاد", "تاريخ الميالد", "Date of Birth")));
		rules.add(FieldRule.of(ID_EXPIRY_DATE, s::formatDate,
				LabelLocator.of("تاريخ انتهاء الهوية", "تاريخ الانتهاء", "تاريخ اإلنتهاء", "ID Expiry Date")));
		rules.add(FieldRule.of(NATIONALITY, s::text,
				LabelLocator.of("الجنسية", "Nationality")));
		rules.add(FieldRule.of(GENDER, s::text,
				LabelLocator.of("الجنس", "Gender")));
		rules.add(FieldRule.of(RELIGION, s::text,
				LabelLocator.of("الديانة", "Religion")));
		rules.add(FieldRule.of(MARITAL_STATUS, s::text,
				LabelLocator.of("الحالة الاجتماعية", "الحالة االجتماعية", "Marital Status")));
		rules.add(FieldRule.of(EDUCATION, s::text,
				LabelLocator.of("المؤهل العلمي", "Education")));
		rules.add(FieldRule.of(SPECIALTY, s::text,
				LabelLocator.of("التخصص", "Speciality", "Specialty")));
		rules.add(FieldRule.of(PROFESSION, s::text,
				LabelLocator.of("المهنة", "Profession")));
		rules.add(FieldRule.of(EMPLOYEE_NUMBER, s::digitsOnly,
				LabelLocator.of("الرقم الوظيفي", "Employee Number")));
		rules.add(FieldRule.of(IBAN, s::compactIban,
				LabelLocator.of("رقم الآيبان", "رقم اآليبان", "رقم الايبان", "IBAN")));
		rules.add(FieldRule.of(BANK_NAME, s::text,
				LabelLocator.of("اسم البنك", "Bank Name")));
		rules.add(FieldRule.of(MOBILE, s::normalizeMobile,
				LineLocator.of("رقم الجوال", "Mobile Number", "Mobile")));

		// Contract terms
		rules.add(FieldRule.of(CONTRACT_START_DATE, s::formatDate,
				sentence("يبدأ من تاريخ[^\\d\\n]{0,10}" + DATE),
				LabelLocator.of("تاريخ بدء العقد", "بدء العقد", "Contract Start Date")));
		rules.add(FieldRule.of(CONTRACT_END_DATE, s::formatDate,
				sentence("وينتهي في[^\\d\\n]{0,10}" + DATE),
				LabelLocator.of("تاريخ انتهاء العقد", "انتهاء العقد", "Contract End Date")));
		rules.add(FieldRule.of(JOINING_DATE, s::formatDate,
				sentence("تاريخ مباشرة[^\\n]*?هو[^\\d\\n]{0,5}" + DATE),
				LabelLocator.of("تاريخ المباشرة الفعلية", "تاريخ المباشرة", "Joining Date")));
		rules.add(FieldRule.of(CONTRACT_DURATION, s::firstNumber,
				sentence("مدة هذا العقد[^\\d\\n]{0,10}(\\d+)\\s*(?:سن|شه|أشه|اشه)"),
				LabelLocator.of("مدة العقد", "Contract Duration")));
		rules.add(FieldRule.of(TRIAL_PERIOD_DAYS, s::repairSwappedDigits,
				sentence("فترة تجربة مدتها[^\\d\\n]{0,5}(\\d+)\\s*يوم"),
				sentence("فترة التجربة[ \\t]*:[^\\d\\n]*(\\d+)")));
		rules.add(FieldRule.of(WEEKLY_WORKDAYS, s::digitsOnly,
				sentence("أيام العمل العادية\\s*بـ?\\s*(\\d+)"),
				sentence("أيام العمل الأسبوعية[ \\t]*:[^\\d\\n]*(\\d+)")));
		rules.add(FieldRule.of(DAILY_HOURS, s::digitsOnly,
				sentence("تحدد ساعات العمل\\s*بـ?\\s*(\\d+)"),
				sentence("ساعات العمل اليومية[ \\t]*:[^\\d\\n]*(\\d+)")));
		rules.add(FieldRule.of(BASE_SALARY, s::cleanAmount,
				sentence("أجر" + TANWEEN + "\\s*أساسي" + TANWEEN + "\\s*قدره\\s*" + AMOUNT),
				LabelLocator.of("الراتب الأساسي", "Basic Salary", "Basic Wage")));
		rules.add(FieldRule.of(HOUSING_ALLOWANCE, s::cleanAmount,
				sentence("أجر\\s*" + AMOUNT + "\\s*ريال\\s*سعودي\\s*[,،]?\\s*بدل\\s*سكن"),
				LabelLocator.of("بدل السكن", "Housing Allowance")));
		rules.add(FieldRule.of(ANNUAL_LEAVE_DAYS, s::repairSwappedDigits,
				sentence("[إا]جازة\\s*سنوية\\s*مدتها\\s*(\\d+)\\s*يوم"),
				sentence("الإجازة السنوية[ \\t]*:[^\\d\\n]*(\\d+)")));
		rules.add(FieldRule.of(OVERTIME_RATE, s::repairSwappedDigits,
				sentence("مضاف" + TANWEEN + "\\s*إليه\\s*[٪%]?\\s*(\\d+)"),
				sentence("أجر الساعة الإضافية[ \\t]*:[^\\d\\n]*(\\d+)")));
		rules.add(FieldRule.of(TERMINATION_COMPENSATION, s::cleanAmount,
				sentence("تعويض" + TANWEEN + "[^\\n]*?قدره\\s*" + AMOUNT)));

		return new FieldRuleTable(rules);
	}

	private static SentencePatternLocator sentence(String regex) {
		return SentencePatternLocator.of(regex);
	}
}
