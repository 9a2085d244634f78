package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.model.Holding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Narrows today's holdings to those whose price moved at least a given percentage against the
 * previous snapshot. Holdings are matched by key; new positions and positions without a positive
 * previous price are dropped.
 */
@Component
public class PriceMovementFilter {
	private static final Logger logger = LoggerFactory.getLogger(PriceMovementFilter.class);
	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

	public List<Holding> filter(List<Holding> today, List<Holding> yesterday, BigDecimal minVariationPercent) {
		if (today == null || today.isEmpty()) {
			return List.of();
		}
		BigDecimal threshold = minVariationPercent == null ? BigDecimal.ZERO : minVariationPercent.abs();
		Map<String, Holding> previous = new LinkedHashMap<>();
		if (yesterday != null) {
			for (Holding holding : yesterday) {
				previous.putIfAbsent(holding.key(), holding);
			}
		}
		List<Holding> moved = new ArrayList<>();
		for (Holding holding : today) {
			Holding before = previous.get(holding.key());
			if (before == null || before.price() == null || before.price().signum() <= 0 || holding.price() == null) {
				continue;
			}
			BigDecimal variation = holding.price().subtract(before.price())
					.multiply(HUNDRED)
					.divide(before.price(), 4, RoundingMode.HALF_UP);
			if (variation.abs().compareTo(threshold) >= 0) {
				logger.debug("{} moved {}% ({} -> {})", holding.key(), variation, before.price(), holding.price());
				moved.add(holding.withPriceMovement(before.price(), variation));
			}
		}
		logger.info("Found {} of {} holding(s) with a price variation of at least {}%",
				moved.size(), today.size(), threshold.toPlainString());
		return moved;
	}
}
