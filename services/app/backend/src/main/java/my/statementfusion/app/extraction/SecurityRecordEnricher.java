package my.statementfusion.app.extraction;

import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.IdentifierMatch;
import my.statementfusion.app.model.SecurityRecord;
import my.statementfusion.app.model.ValueCandidate;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class SecurityRecordEnricher {
	private final SecurityNameResolver nameResolver;
	private final CurrencyDetector currencyDetector;

	public SecurityRecordEnricher() {
		this(new SecurityNameResolver(), new CurrencyDetector());
	}

	public SecurityRecordEnricher(SecurityNameResolver nameResolver, CurrencyDetector currencyDetector) {
		this.nameResolver = nameResolver;
		this.currencyDetector = currencyDetector;
	}

	public SecurityRecord enrich(SecurityRecord record, Document document, List<IdentifierMatch> matches,
								 List<ValueCandidate> candidates) {
		List<IdentifierMatch> occurrences = matches.stream()
				.filter(match -> match.code().equals(record.identifierCode()))
				.sorted(Comparator.comparingInt(IdentifierMatch::lineIndex))
				.toList();
		if (occurrences.isEmpty()) {
			return record;
		}
		String name = occurrences.stream()
				.map(match -> nameResolver.resolve(document, match))
				.flatMap(Optional::stream)
				.findFirst()
				.orElse(null);

		IdentifierMatch anchor = nearestOccurrence(occurrences, record.sourceLineIndex());
		Integer valueOffset = valueOffset(record, candidates);
		String currency = currencyDetector.infer(document, anchor.lineIndex(), record.sourceLineIndex(), valueOffset)
				.orElse(null);
		return record.withDescription(name, currency);
	}

	private IdentifierMatch nearestOccurrence(List<IdentifierMatch> occurrences, Integer sourceLine) {
		if (sourceLine == null) {
			return occurrences.get(0);
		}
		return occurrences.stream()
				.min(Comparator.comparingInt(match -> Math.abs(match.lineIndex() - sourceLine)))
				.orElse(occurrences.get(0));
	}

	private Integer valueOffset(SecurityRecord record, List<ValueCandidate> candidates) {
		if (!record.hasValue() || record.sourceLineIndex() == null) {
			return null;
		}
		return candidates.stream()
				.filter(candidate -> candidate.lineIndex() == record.sourceLineIndex())
				.filter(candidate -> candidate.numericValue().compareTo(record.value()) == 0)
				.map(ValueCandidate::startOffset)
				.findFirst()
				.orElse(null);
	}
}
