package my.portfolioanalyst.app.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of one validate-retry run. {@code RETRYING} loops back to {@code AWAITING_RESPONSE} with a
 * corrective prompt; {@code ACCEPTED} and {@code EXHAUSTED} end the run.
 */
public enum RetryState {
	BUILDING,
	AWAITING_RESPONSE,
	EXTRACTING,
	VALIDATING,
	RETRYING,
	ACCEPTED,
	EXHAUSTED;

	public boolean isTerminal() {
		return this == ACCEPTED || this == EXHAUSTED;
	}

	public boolean canMoveTo(RetryState next) {
		return successors().contains(next);
	}

	private Set<RetryState> successors() {
		return switch (this) {
			case BUILDING -> EnumSet.of(AWAITING_RESPONSE);
			case AWAITING_RESPONSE -> EnumSet.of(EXTRACTING);
			case EXTRACTING -> EnumSet.of(VALIDATING);
			case VALIDATING -> EnumSet.of(ACCEPTED, RETRYING, EXHAUSTED);
			case RETRYING -> EnumSet.of(AWAITING_RESPONSE);
			case ACCEPTED, EXHAUSTED -> EnumSet.noneOf(RetryState.class);
		};
	}
}
