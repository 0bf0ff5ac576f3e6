package my.statementfusion.app.strategy;

import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.IdentifierMatch;
import my.statementfusion.app.model.StrategyProposal;
import my.statementfusion.app.model.ValueCandidate;

import java.util.List;

/**
 * A heuristic that maps identifiers to values. Implementations hold no mutable state, may be
 * invoked concurrently, and return at most one proposal per identifier code.
 */
public interface ExtractionStrategy {
	String name();

	List<StrategyProposal> propose(List<IdentifierMatch> identifierMatches,
								   List<ValueCandidate> valueCandidates,
								   Document document);
}
