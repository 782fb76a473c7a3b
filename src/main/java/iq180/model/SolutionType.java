package iq180.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SolutionType {
	NORMAL("normal"),
	SIGMA("sigma");

	private final String label;

	SolutionType(String label) {
		this.label = label;
	}

	@JsonValue
	public String label() {
		return label;
	}
}
