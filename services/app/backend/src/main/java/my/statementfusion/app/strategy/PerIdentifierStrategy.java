package my.statementfusion.app.strategy;

import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.IdentifierMatch;
import my.statementfusion.app.model.StrategyProposal;
import my.statementfusion.app.model.ValueCandidate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public abstract class PerIdentifierStrategy implements ExtractionStrategy {
	@Override
	public List<StrategyProposal> propose(List<IdentifierMatch> identifierMatches,
										  List<ValueCandidate> valueCandidates,
										  Document document) {
		if (identifierMatches == null || identifierMatches.isEmpty()) {
			return List.of();
		}
		CandidateIndex index = CandidateIndex.of(valueCandidates);
		List<StrategyProposal> perOccurrence = new ArrayList<>();
		for (IdentifierMatch match : identifierMatches) {
			proposeFor(match, index, identifierMatches, document).ifPresent(perOccurrence::add);
		}
		return bestPerIdentifier(perOccurrence);
	}

	protected abstract Optional<StrategyProposal> proposeFor(IdentifierMatch match,
															 CandidateIndex candidates,
															 List<IdentifierMatch> allMatches,
															 Document document);

	static List<StrategyProposal> bestPerIdentifier(List<StrategyProposal> proposals) {
		Map<String, StrategyProposal> best = new LinkedHashMap<>();
		for (StrategyProposal proposal : proposals) {
			best.merge(proposal.identifierCode(), proposal, CandidateRanking::preferProposal);
		}
		return List.copyOf(best.values());
	}

	/**
	 * True when another identifier's occurrence sits strictly closer to the line, meaning the
	 * line most likely belongs to that identifier's block.
	 */
	static boolean closerToOtherIdentifier(int lineIndex, IdentifierMatch match, List<IdentifierMatch> allMatches) {
		int own = Math.abs(lineIndex - match.lineIndex());
		for (IdentifierMatch other : allMatches) {
			if (other.code().equals(match.code())) {
				continue;
			}
			if (Math.abs(lineIndex - other.lineIndex()) < own) {
				return true;
			}
		}
		return false;
	}

	static String describe(ValueCandidate candidate) {
		return "'" + candidate.raw() + "' (" + candidate.localeFormat().name().toLowerCase(Locale.ROOT).replace('_', '-')
				+ ") on line " + candidate.lineIndex();
	}
}
