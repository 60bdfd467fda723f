package com.odedia.contracts.extraction;

/**
 * How the employer and employee email addresses are told apart.
 */
public enum EmailStrategy {

	/**
	 * First email in the document belongs to the employer, second to the
	 * employee.
	 */
	POSITIONAL,

	/**
	 * First email inside the first-party section belongs to the employer, first
	 * email inside the second-party section to the employee. Falls back to
	 * {@link #POSITIONAL} when the section headings are not found.
	 */
	SECTION
}
