package com.odedia.contracts.dto;

import java.io.IOException;

/**
 * One uploaded contract file.
 *
 * @param fileName  Original file name
 * @param content   File bytes, empty when the upload could not be read
 * @param readError Why the upload could not be read, or {@code null}
 */
public record ContractUpload(String fileName, byte[] content, IOException readError) {

	public ContractUpload {
		fileName = fileName == null || fileName.isBlank() ? "unnamed.pdf" : fileName;
		content = content == null ? new byte[0] : content;
	}

	public ContractUpload(String fileName, byte[] content) {
		this(fileName, content, null);
	}

	public static ContractUpload unreadable(String fileName, IOException readError) {
		return new ContractUpload(fileName, new byte[0], readError);
	}

	public int size() {
		return content.length;
	}
}
