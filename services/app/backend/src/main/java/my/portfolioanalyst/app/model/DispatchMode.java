package my.portfolioanalyst.app.model;

public enum DispatchMode {
	WHOLE_PORTFOLIO,
	PER_ENTITY
}
