package my.statementfusion.app.service;

import my.statementfusion.app.extraction.IdentifierCheck;
import my.statementfusion.app.extraction.IdentifierLocator;
import my.statementfusion.app.extraction.IsinChecksumCheck;
import my.statementfusion.app.extraction.SecurityRecordEnricher;
import my.statementfusion.app.extraction.ValueCandidateExtractor;
import my.statementfusion.app.fusion.FusionEngine;
import my.statementfusion.app.fusion.ResultValidator;
import my.statementfusion.app.importer.TextSource;
import my.statementfusion.app.importer.TextSourceReader;
import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.ExtractionRequest;
import my.statementfusion.app.model.FusionResult;
import my.statementfusion.app.model.IdentifierMatch;
import my.statementfusion.app.model.SecurityRecord;
import my.statementfusion.app.model.StrategyProposal;
import my.statementfusion.app.model.UnreadableDocumentException;
import my.statementfusion.app.model.ValueCandidate;
import my.statementfusion.app.strategy.CompoundTemplateStrategy;
import my.statementfusion.app.strategy.ContextWindowStrategy;
import my.statementfusion.app.strategy.ExtractionStrategy;
import my.statementfusion.app.strategy.FixedOffsetCalibrator;
import my.statementfusion.app.strategy.FixedOffsetStrategy;
import my.statementfusion.app.strategy.OverrideStrategy;
import my.statementfusion.app.strategy.RowAdjacencyStrategy;
import my.statementfusion.app.strategy.StrategyRunResult;
import my.statementfusion.app.strategy.StrategyRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

public class StatementExtractionService {
	private static final Logger logger = LoggerFactory.getLogger(StatementExtractionService.class);

	private final ExtractionSettings settings;
	private final StrategyRunner strategyRunner;
	private final TextSourceReader sourceReader;
	private final IdentifierLocator identifierLocator;
	private final ValueCandidateExtractor candidateExtractor;
	private final List<ExtractionStrategy> strategies;
	private final FusionEngine fusionEngine;
	private final ResultValidator validator;
	private final SecurityRecordEnricher enricher;

	public StatementExtractionService(ExtractionSettings settings,
									  StrategyRunner strategyRunner,
									  TextSourceReader sourceReader) {
		this(settings, strategyRunner, sourceReader, defaultStrategies(settings));
	}

	StatementExtractionService(ExtractionSettings settings,
							   StrategyRunner strategyRunner,
							   TextSourceReader sourceReader,
							   List<ExtractionStrategy> strategies) {
		this.settings = settings == null ? ExtractionSettings.defaults() : settings;
		this.strategyRunner = strategyRunner;
		this.sourceReader = sourceReader;
		IdentifierCheck check = this.settings.checksumValidation() ? new IsinChecksumCheck() : IdentifierCheck.SHAPE_ONLY;
		this.identifierLocator = new IdentifierLocator(check);
		this.candidateExtractor = new ValueCandidateExtractor(this.settings.minCandidateValue());
		this.strategies = List.copyOf(strategies);
		this.fusionEngine = new FusionEngine(this.settings.fusionPolicy());
		this.validator = new ResultValidator(this.settings.band(), this.settings.outOfBandCap(),
				this.settings.shortfallThreshold());
		this.enricher = new SecurityRecordEnricher();
	}

	static List<ExtractionStrategy> defaultStrategies(ExtractionSettings settings) {
		ExtractionSettings resolved = settings == null ? ExtractionSettings.defaults() : settings;
		return List.of(
				new FixedOffsetStrategy(resolved.fixedOffset(), resolved.fixedOffsetValidated()),
				new CompoundTemplateStrategy(resolved.templates(), resolved.templateLinesBefore(),
						resolved.templateLinesAfter(), resolved.band()),
				new RowAdjacencyStrategy(resolved.rowContinuationLines(), resolved.band()),
				new ContextWindowStrategy(resolved.contextWindowLines(), resolved.band())
		);
	}

	public ExtractionSettings settings() {
		return settings;
	}

	public FusionResult extract(Document document, ExtractionRequest request) {
		requireReadable(document);
		ExtractionRequest effective = request == null ? ExtractionRequest.empty() : request;
		Analysis analysis = analyze(document);
		StrategyRunResult run = strategyRunner.run(strategiesFor(effective), analysis.matches(),
				analysis.candidates(), document);

		List<SecurityRecord> fused = fusionEngine.fuse(analysis.codes(), run.allProposals());
		List<SecurityRecord> enriched = new ArrayList<>();
		for (SecurityRecord record : fused) {
			enriched.add(enricher.enrich(record, document, analysis.matches(), analysis.candidates()));
		}
		FusionResult result = validator.validate(enriched, effective.expectedTotal(), run.failedStrategies());
		logSummary(document.sourceName(), result);
		return result;
	}

	/**
	 * Reads every source concurrently and fuses the proposals of all readable sources. Proposals
	 * are tagged {@code strategy@source}, so agreement across sources corroborates a value.
	 */
	public FusionResult extract(List<? extends TextSource> sources, ExtractionRequest request) {
		if (sources == null || sources.isEmpty()) {
			throw new UnreadableDocumentException("No text source given");
		}
		ExtractionRequest effective = request == null ? ExtractionRequest.empty() : request;
		Map<String, Document> documents = new LinkedHashMap<>();
		sourceReader.readAll(sources).forEach((name, document) -> {
			if (document != null && document.isReadable()) {
				documents.put(name, document);
			} else {
				logger.warn("Text source {} produced no readable text", name);
			}
		});
		if (documents.isEmpty()) {
			throw new UnreadableDocumentException("None of the " + sources.size() + " text sources produced readable text");
		}

		Map<String, Analysis> analyses = new LinkedHashMap<>();
		Set<String> codes = new LinkedHashSet<>();
		List<StrategyProposal> proposals = new ArrayList<>();
		List<String> failed = new ArrayList<>();
		List<ExtractionStrategy> sourceStrategies = strategiesFor(effective);
		for (Map.Entry<String, Document> entry : documents.entrySet()) {
			String sourceName = entry.getKey();
			Analysis analysis = analyze(entry.getValue());
			analyses.put(sourceName, analysis);
			codes.addAll(analysis.codes());
			StrategyRunResult run = strategyRunner.run(sourceStrategies, analysis.matches(), analysis.candidates(),
					entry.getValue());
			for (StrategyProposal proposal : run.allProposals()) {
				proposals.add(proposal.withStrategyName(FusionEngine.tagged(proposal.strategyName(), sourceName)));
			}
			run.failedStrategies().forEach(name -> failed.add(FusionEngine.tagged(name, sourceName)));
		}

		List<SecurityRecord> enriched = new ArrayList<>();
		for (SecurityRecord record : fusionEngine.fuse(codes, proposals)) {
			String sourceName = sourceOf(record, analyses);
			Analysis analysis = analyses.get(sourceName);
			enriched.add(enricher.enrich(record, documents.get(sourceName), analysis.matches(), analysis.candidates()));
		}
		FusionResult result = validator.validate(enriched, effective.expectedTotal(), failed);
		logSummary(String.join(", ", documents.keySet()), result);
		return result;
	}

	/**
	 * Learns the identifier-to-value line offset of a document family from a reference
	 * statement whose values are known.
	 */
	public OptionalInt calibrateFixedOffset(Document reference, Map<String, BigDecimal> knownValues, int maxOffset) {
		requireReadable(reference);
		Analysis analysis = analyze(reference);
		OptionalInt offset = FixedOffsetCalibrator.calibrate(analysis.matches(), analysis.candidates(), knownValues,
				maxOffset);
		if (offset.isPresent()) {
			logger.info("Calibrated fixed offset {} from {}", offset.getAsInt(), reference.sourceName());
		} else {
			logger.info("No fixed offset within {} lines matches the known values of {}", maxOffset,
					reference.sourceName());
		}
		return offset;
	}

	/**
	 * Returns a service for the reference's document family: the fixed-offset strategy uses the
	 * calibrated offset and scores it as validated. Returns this service when no offset matches.
	 */
	public StatementExtractionService calibrated(Document reference, Map<String, BigDecimal> knownValues,
												 int maxOffset) {
		OptionalInt offset = calibrateFixedOffset(reference, knownValues, maxOffset);
		if (offset.isEmpty()) {
			return this;
		}
		List<ExtractionStrategy> calibratedStrategies = new ArrayList<>();
		for (ExtractionStrategy strategy : strategies) {
			calibratedStrategies.add(strategy instanceof FixedOffsetStrategy
					? new FixedOffsetStrategy(offset.getAsInt(), true)
					: strategy);
		}
		return new StatementExtractionService(settings.withFixedOffset(offset.getAsInt(), true), strategyRunner,
				sourceReader, calibratedStrategies);
	}

	List<ExtractionStrategy> strategies() {
		return strategies;
	}

	private List<ExtractionStrategy> strategiesFor(ExtractionRequest request) {
		OverrideStrategy overrides = new OverrideStrategy(request.overrides());
		if (overrides.isEmpty()) {
			return strategies;
		}
		List<ExtractionStrategy> out = new ArrayList<>();
		out.add(overrides);
		out.addAll(strategies);
		return out;
	}

	private Analysis analyze(Document document) {
		List<IdentifierMatch> matches = identifierLocator.locate(document);
		List<ValueCandidate> candidates = candidateExtractor.extract(document);
		Set<String> codes = new LinkedHashSet<>();
		matches.forEach(match -> codes.add(match.code()));
		logger.debug("Found {} identifier occurrences and {} value candidates in {}", matches.size(),
				candidates.size(), document.sourceName());
		return new Analysis(matches, candidates, List.copyOf(codes));
	}

	private static String sourceOf(SecurityRecord record, Map<String, Analysis> analyses) {
		Optional<String> winnerSource = FusionEngine.sourceName(record.winningStrategy());
		if (winnerSource.isPresent() && analyses.containsKey(winnerSource.get())) {
			return winnerSource.get();
		}
		for (Map.Entry<String, Analysis> entry : analyses.entrySet()) {
			if (entry.getValue().codes().contains(record.identifierCode())) {
				return entry.getKey();
			}
		}
		return analyses.keySet().iterator().next();
	}

	private static void requireReadable(Document document) {
		if (document == null) {
			throw new UnreadableDocumentException("Document is missing");
		}
		if (!document.isReadable()) {
			throw new UnreadableDocumentException("Document " + document.sourceName() + " contains no readable text");
		}
	}

	private static void logSummary(String sourceName, FusionResult result) {
		logger.info("Extracted {} of {} identifiers from {} (total {}, {} need review{})",
				result.resolvedCount(),
				result.recordCount(),
				sourceName,
				result.totalValue().toPlainString(),
				result.records().stream().filter(SecurityRecord::needsReview).count(),
				result.failedStrategies().isEmpty() ? "" : ", failed strategies " + result.failedStrategies());
	}

	private record Analysis(List<IdentifierMatch> matches, List<ValueCandidate> candidates, List<String> codes) {
	}
}
