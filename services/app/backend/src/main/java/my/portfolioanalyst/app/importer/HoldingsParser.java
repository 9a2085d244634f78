package my.portfolioanalyst.app.importer;

import my.portfolioanalyst.app.model.Holding;

import java.util.List;

public interface HoldingsParser {
	List<Holding> parse(byte[] payload);
}
