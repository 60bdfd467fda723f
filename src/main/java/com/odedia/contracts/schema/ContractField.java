package com.odedia.contracts.schema;

/**
 * Canonical fields of an employment contract record.
 *
 * Each constant carries the Arabic column header used by downstream consumers
 * (the exported spreadsheet, the fallback model prompt). Header text and
 * declaration order are contractual.
 */
public enum ContractField {

	// Document metadata
	CONTRACT_NUMBER("رقم العقد"),
	CONTRACT_DATE("تاريخ العقد"),

	// Employer (first party)
	COMPANY_NAME("شركة/مؤسسة"),
	UNIFIED_NUMBER("الرقم الوطني الموحد"),
	ESTABLISHMENT_NUMBER("رقم المنشأة"),
	COMMERCIAL_REGISTRATION("السجل التجاري"),
	COMPANY_ADDRESS("عنوان الشركة"),
	WORK_LOCATION("مكان العمل"),
	COMPANY_EMAIL("بريد الشركة"),
	SIGNATORY_NAME("المسؤول الموقع"),
	SIGNATORY_TITLE("الصفة"),

	// Employee (second party)
	EMPLOYEE_NAME("اسم الموظف"),
	ID_NUMBER("رقم الهوية"),
	ID_TYPE("نوع الهوية"),
	BIRTH_DATE("تاريخ الميلاد"),
	ID_EXPIRY_DATE("تاريخ انتهاء الهوية"),
	NATIONALITY("الجنسية"),
	GENDER("الجنس"),
	RELIGION("الديانة"),
	MARITAL_STATUS("الحالة الاجتماعية"),
	EDUCATION("المؤهل العلمي"),
	SPECIALTY("التخصص"),
	PROFESSION("المهنة"),
	EMPLOYEE_NUMBER("الرقم الوظيفي"),
	IBAN("رقم الآيبان"),
	BANK_NAME("اسم البنك"),
	EMPLOYEE_EMAIL("بريد الموظف"),
	MOBILE("رقم الجوال"),

	// Contract terms
	CONTRACT_START_DATE("بدء العقد"),
	CONTRACT_END_DATE("انتهاء العقد"),
	JOINING_DATE("تاريخ المباشرة الفعلية"),
	CONTRACT_DURATION("مدة العقد"),
	TRIAL_PERIOD_DAYS("فترة التجربة"),
	WEEKLY_WORKDAYS("أيام العمل الأسبوعية"),
	DAILY_HOURS("ساعات العمل اليومية"),
	BASE_SALARY("الراتب الأساسي"),
	HOUSING_ALLOWANCE("بدل السكن"),
	ANNUAL_LEAVE_DAYS("الإجازة السنوية"),
	OVERTIME_RATE("أجر الساعة الإضافية"),
	TERMINATION_COMPENSATION("التعويض عند الفسخ بدون سبب");

	private final String header;

	ContractField(String header) {
		this.header = header;
	}

	/**
	 * The Arabic column header of this field.
	 */
	public String getHeader() {
		return header;
	}
}
