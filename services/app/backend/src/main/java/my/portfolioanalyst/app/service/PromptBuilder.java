package my.portfolioanalyst.app.service;

import my.portfolioanalyst.app.config.AnalysisSettings;
import my.portfolioanalyst.app.model.AnalysisContext;
import my.portfolioanalyst.app.model.AnalysisShape;
import my.portfolioanalyst.app.model.FieldIssue;
import my.portfolioanalyst.app.model.Holding;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders prompt text for an analysis context. Output depends only on the inputs, so equal
 * contexts and issue lists always yield identical prompts.
 */
@Component
public class PromptBuilder {
	static final String UNCATEGORIZED = "Uncategorized";

	private static final String PER_HOLDING_SHAPE = """
			{
			  "recommendation": "BUY | SELL | RETAIN",
			  "estimated_return": <number or null>,
			  "confidence": <number between 0.0 and 1.0>,
			  "risk_notes": "<key risks in one or two sentences>",
			  "sources": ["<type of source, e.g. news, financial report>"],
			  "follow_up_question": "<optional question, omit when none>"
			}""";

	private static final String PORTFOLIO_SHAPE = """
			{
			  "analyses": [
			    {
			      "symbol": "<holding identifier as listed>",
			      "recommendation": "BUY | SELL | RETAIN",
			      "estimated_return": <number or null>,
			      "confidence": <number between 0.0 and 1.0>,
			      "risk_notes": "<key risks in one or two sentences>",
			      "sources": ["<type of source, e.g. news, financial report>"],
			      "follow_up_question": "<optional question, omit when none>"
			    }
			  ]
			}""";

	private final int maxPreviousOutputChars;

	public PromptBuilder(AnalysisSettings settings) {
		this.maxPreviousOutputChars = settings.maxPreviousOutputChars();
	}

	public String buildInitial(AnalysisContext context) {
		StringBuilder prompt = new StringBuilder();
		if (context.isPortfolio()) {
			prompt.append("""
					You are a financial advisor assistant reviewing an equity portfolio.
					For every holding listed below, give a recommendation (BUY, SELL or RETAIN), an estimated return \
					in percent if you can justify one, your confidence between 0.0 and 1.0, the main risks and the \
					kinds of sources your view is based on.
					""");
		} else {
			prompt.append("""
					You are a financial advisor assistant reviewing a single portfolio holding.
					Give a recommendation (BUY, SELL or RETAIN), an estimated return in percent if you can justify one, \
					your confidence between 0.0 and 1.0, the main risks and the kinds of sources your view is based on.
					If the price moved noticeably since yesterday, take the likely reasons into account.
					""");
		}
		prompt.append("Do not invent data. If you need more information, add a follow_up_question.\n\n");
		appendResponseFormat(prompt, context.shape());
		prompt.append('\n');
		appendContext(prompt, context);
		return prompt.toString();
	}

	public String buildCorrective(AnalysisContext context, String previousOutput, List<FieldIssue> issues) {
		StringBuilder prompt = new StringBuilder();
		prompt.append("Your previous response could not be accepted.\n\nProblems found:\n");
		for (FieldIssue issue : issues == null ? List.<FieldIssue>of() : issues) {
			prompt.append("- ").append(issue.describe()).append('\n');
		}
		prompt.append("\nPrevious response:\n---BEGIN PREVIOUS RESPONSE---\n")
				.append(truncate(previousOutput))
				.append("\n---END PREVIOUS RESPONSE---\n\n");
		prompt.append("Fix every problem listed above. ");
		appendResponseFormat(prompt, context.shape());
		prompt.append('\n');
		appendContext(prompt, context);
		return prompt.toString();
	}

	public String buildFollowUp(AnalysisContext context, String previousAnalysisJson, String question) {
		StringBuilder prompt = new StringBuilder();
		prompt.append("""
				You previously analysed the holding below and raised a follow-up question.
				Answer the question yourself using reliable sources, then return an updated analysis.
				Do not ask another follow-up question unless it is strictly necessary.

				""");
		prompt.append("Follow-up question: ").append(question == null ? "" : question.trim()).append("\n\n");
		prompt.append("Previous analysis:\n").append(truncate(previousAnalysisJson)).append("\n\n");
		appendResponseFormat(prompt, AnalysisShape.PER_HOLDING);
		prompt.append('\n');
		appendContext(prompt, context);
		return prompt.toString();
	}

	private void appendResponseFormat(StringBuilder prompt, AnalysisShape shape) {
		prompt.append("Respond ONLY with a single JSON object in exactly this format:\n");
		prompt.append(shape == AnalysisShape.SINGLE ? PORTFOLIO_SHAPE : PER_HOLDING_SHAPE).append('\n');
		if (shape == AnalysisShape.SINGLE) {
			prompt.append("Include exactly one entry in \"analyses\" per holding. Set \"symbol\" to the holding "
					+ "identifier exactly as listed, including any EXCHANGE: prefix.\n");
		}
	}

	private void appendContext(StringBuilder prompt, AnalysisContext context) {
		if (context.isPortfolio()) {
			appendPortfolio(prompt, context.holdings());
		} else {
			appendHolding(prompt, context.focus());
		}
		if (!context.facts().isEmpty()) {
			prompt.append("\nMarket context:\n");
			for (Map.Entry<String, String> fact : context.facts().entrySet()) {
				prompt.append("- ").append(fact.getKey()).append(": ").append(fact.getValue()).append('\n');
			}
		}
	}

	private void appendPortfolio(StringBuilder prompt, List<Holding> holdings) {
		BigDecimal total = BigDecimal.ZERO;
		Map<String, BigDecimal> sectors = new LinkedHashMap<>();
		for (Holding holding : holdings) {
			BigDecimal value = holding.marketValue();
			total = total.add(value);
			String sector = holding.sector() == null ? UNCATEGORIZED : holding.sector();
			sectors.merge(sector, value, BigDecimal::add);
		}
		prompt.append("Portfolio summary:\n");
		prompt.append("- Total holdings: ").append(holdings.size()).append('\n');
		prompt.append("- Total value: ").append(money(total)).append('\n');

		prompt.append("\nSector breakdown:\n");
		List<Map.Entry<String, BigDecimal>> sortedSectors = new ArrayList<>(sectors.entrySet());
		sortedSectors.sort(Map.Entry.<String, BigDecimal>comparingByValue().reversed());
		for (Map.Entry<String, BigDecimal> entry : sortedSectors) {
			prompt.append("- ").append(entry.getKey()).append(": ").append(money(entry.getValue()))
					.append(" (").append(percentOf(entry.getValue(), total)).append("%)\n");
		}

		prompt.append("\nHoldings (by value):\n");
		List<Holding> sorted = new ArrayList<>(holdings);
		sorted.sort(Comparator.comparing(Holding::marketValue).reversed());
		for (Holding holding : sorted) {
			prompt.append("- ").append(holding.key());
			if (holding.companyName() != null) {
				prompt.append(" (").append(holding.companyName()).append(')');
			}
			prompt.append(": quantity ").append(plain(holding.quantity()))
					.append(", price ").append(plain(holding.price()))
					.append(", value ").append(money(holding.marketValue()))
					.append(", sector ").append(holding.sector() == null ? UNCATEGORIZED : holding.sector());
			appendMovement(prompt, holding);
			prompt.append('\n');
		}
	}

	private void appendHolding(StringBuilder prompt, Holding holding) {
		prompt.append("Holding:\n");
		prompt.append("- Symbol: ").append(holding.symbol()).append('\n');
		if (holding.exchange() != null) {
			prompt.append("- Exchange: ").append(holding.exchange()).append('\n');
		}
		prompt.append("- Company: ").append(holding.displayName()).append('\n');
		prompt.append("- Quantity: ").append(plain(holding.quantity())).append('\n');
		prompt.append("- Price: ").append(plain(holding.price()));
		if (holding.currency() != null) {
			prompt.append(' ').append(holding.currency());
		}
		prompt.append('\n');
		prompt.append("- Value: ").append(money(holding.marketValue())).append('\n');
		prompt.append("- Sector: ").append(holding.sector() == null ? UNCATEGORIZED : holding.sector()).append('\n');
		if (holding.yesterdayPrice() != null) {
			prompt.append("- Yesterday's price: ").append(plain(holding.yesterdayPrice())).append('\n');
		}
		if (holding.variationPercent() != null) {
			prompt.append("- Variation since yesterday: ").append(plain(holding.variationPercent())).append("%\n");
		}
	}

	private void appendMovement(StringBuilder prompt, Holding holding) {
		if (holding.yesterdayPrice() != null) {
			prompt.append(", yesterday ").append(plain(holding.yesterdayPrice()));
		}
		if (holding.variationPercent() != null) {
			prompt.append(", variation ").append(plain(holding.variationPercent())).append('%');
		}
	}

	private String truncate(String text) {
		if (text == null) {
			return "";
		}
		if (text.length() <= maxPreviousOutputChars) {
			return text;
		}
		return text.substring(0, maxPreviousOutputChars)
				+ "\n[truncated " + (text.length() - maxPreviousOutputChars) + " characters]";
	}

	private static String percentOf(BigDecimal part, BigDecimal total) {
		if (total.signum() == 0) {
			return "0.0";
		}
		return part.multiply(BigDecimal.valueOf(100)).divide(total, 1, RoundingMode.HALF_UP).toPlainString();
	}

	private static String money(BigDecimal value) {
		return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
	}

	private static String plain(BigDecimal value) {
		return value == null ? "n/a" : value.stripTrailingZeros().toPlainString();
	}
}
