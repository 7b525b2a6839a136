package org.javai.nlrecon;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.javai.nlrecon.exec.ConnectionSource;
import org.javai.nlrecon.exec.ExecutionCancellation;
import org.javai.nlrecon.exec.ExecutionResult;
import org.javai.nlrecon.exec.ReconciliationExecutor;
import org.javai.nlrecon.intent.IntentClassifier;
import org.javai.nlrecon.intent.QueryIntent;
import org.javai.nlrecon.intent.extract.EntityExtractor;
import org.javai.nlrecon.join.JoinPathResolver;
import org.javai.nlrecon.join.JoinPlan;
import org.javai.nlrecon.kg.KnowledgeGraph;
import org.javai.nlrecon.kg.KnowledgeGraphRegistry;
import org.javai.nlrecon.resolve.EntityResolver;
import org.javai.nlrecon.resolve.Resolution;
import org.javai.nlrecon.resolve.ResolutionIssue;
import org.javai.nlrecon.sql.SqlGenerationException;
import org.javai.nlrecon.sql.SqlGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns natural-language reconciliation definitions into SQL and runs them.
 *
 * <p>Each definition goes through classification, resolution, join planning, generation
 * and execution on its own. A definition that fails at any stage yields a failed result
 * and the batch carries on. Only execution touches a connection, and every definition
 * gets its own.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * KnowledgeGraphRegistry registry = new KnowledgeGraphRegistry();
 * registry.register(new KnowledgeGraphLoader().load(Path.of("gpu-planning.json")));
 *
 * ReconciliationEngine engine = new ReconciliationEngine(registry,
 *         ConnectionSource.of(dataSource),
 *         kg -> new ChatClientEntityExtractor(chatClient, kg),
 *         ReconciliationConfig.defaults());
 *
 * ReconciliationReport report = engine.run(request);
 * }</pre>
 */
public final class ReconciliationEngine {

	private static final Logger logger = LoggerFactory.getLogger(ReconciliationEngine.class);

	private final KnowledgeGraphRegistry registry;
	private final ConnectionSource connectionSource;
	private final Function<KnowledgeGraph, EntityExtractor> extractorFactory;
	private final ReconciliationConfig config;
	private final ReconciliationExecutor executor;

	public ReconciliationEngine(KnowledgeGraphRegistry registry, ConnectionSource connectionSource) {
		this(registry, connectionSource, null, ReconciliationConfig.defaults());
	}

	/**
	 * @param registry knowledge graphs addressable by name
	 * @param connectionSource supplies one connection per executed definition
	 * @param extractorFactory creates the entity extractor for a knowledge graph, may be null
	 * @param config thresholds and limits
	 */
	public ReconciliationEngine(KnowledgeGraphRegistry registry, ConnectionSource connectionSource,
			Function<KnowledgeGraph, EntityExtractor> extractorFactory, ReconciliationConfig config) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
		this.connectionSource = Objects.requireNonNull(connectionSource, "connectionSource must not be null");
		this.extractorFactory = extractorFactory;
		this.config = config != null ? config : ReconciliationConfig.defaults();
		this.executor = new ReconciliationExecutor(this.config);
	}

	/**
	 * Runs every definition and waits for the report.
	 *
	 * @throws InvalidRequestException when the request is rejected; nothing is executed
	 */
	public ReconciliationReport run(ReconciliationRequest request) {
		return start(request).join();
	}

	/**
	 * Starts the batch on a bounded worker pool and returns without waiting.
	 *
	 * @throws InvalidRequestException when the request is rejected; nothing is executed
	 */
	public ReconciliationBatch start(ReconciliationRequest request) {
		Pipeline pipeline = pipelineFor(request);
		ExecutionCancellation cancellation = new ExecutionCancellation();
		int poolSize = Math.min(config.maxConcurrency(), request.definitions().size());
		ExecutorService workers = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());
		Instant startedAt = Instant.now();

		logger.info("Starting reconciliation of {} definition(s) against '{}' ({}, {} worker(s))",
				request.definitions().size(), pipeline.kg().name(), request.dialect(), poolSize);

		List<Future<DefinitionOutcome>> futures = new ArrayList<>();
		for (String definition : request.definitions()) {
			futures.add(workers.submit(() -> reconcile(pipeline, definition, request, cancellation)));
		}
		workers.shutdown();
		return new ReconciliationBatch(pipeline.kg().name(), request.dialect(), startedAt, futures, cancellation);
	}

	/**
	 * Generates the SQL for every definition without touching the database.
	 *
	 * @throws InvalidRequestException when the request is rejected
	 */
	public List<SqlPreview> preview(ReconciliationRequest request) {
		Pipeline pipeline = pipelineFor(request);
		List<SqlPreview> previews = new ArrayList<>();
		for (String definition : request.definitions()) {
			Prepared prepared = prepare(pipeline, definition, request);
			previews.add(new SqlPreview(definition, prepared.intent(), prepared.mapping(), prepared.sql(),
					prepared.confidence(), prepared.errorType(), prepared.errorMessage()));
		}
		return previews;
	}

	private Pipeline pipelineFor(ReconciliationRequest request) {
		if (request == null) {
			throw new InvalidRequestException("request must not be null");
		}
		request.validate();
		KnowledgeGraph kg = registry.find(request.kgName())
				.orElseThrow(() -> new InvalidRequestException(
						"Unknown knowledge graph '" + request.kgName() + "'; registered: " + registry.names()));
		EntityExtractor extractor = extractorFactory != null ? extractorFactory.apply(kg) : null;
		return new Pipeline(kg,
				new IntentClassifier(kg, extractor, config),
				new EntityResolver(kg, config),
				new JoinPathResolver(kg, config),
				new SqlGenerator(kg::schemaOf));
	}

	private DefinitionOutcome reconcile(Pipeline pipeline, String definition, ReconciliationRequest request,
			ExecutionCancellation cancellation) {
		if (cancellation.isCancelled()) {
			return new DefinitionOutcome(definition, null, null, null,
					ExecutionResult.notExecuted(ReconciliationErrorType.CANCELLED, "Batch cancelled", 0.0));
		}
		Prepared prepared = prepare(pipeline, definition, request);
		if (prepared.sql() == null || prepared.errorType() != null) {
			return prepared.toOutcome(definition,
					ExecutionResult.notExecuted(prepared.errorType(), prepared.errorMessage(), prepared.confidence()));
		}
		try {
			ExecutionResult result = execute(prepared, request, cancellation);
			logger.info("Definition '{}' finished {} with {} record(s), confidence {}",
					definition, result.status(), result.recordCount(), result.confidence());
			return prepared.toOutcome(definition, result);
		}
		catch (RuntimeException e) {
			logger.error("Unexpected failure executing '{}'", definition, e);
			return prepared.toOutcome(definition,
					ExecutionResult.notExecuted(ReconciliationErrorType.EXECUTION_FAILURE,
							"Unexpected failure: " + e.getMessage(), prepared.confidence()));
		}
	}

	private ExecutionResult execute(Prepared prepared, ReconciliationRequest request,
			ExecutionCancellation cancellation) {
		int timeout = request.effectiveTimeout(config);
		try (Connection connection = connectionSource.getConnection()) {
			return executor.execute(prepared.sql(), connection, timeout, prepared.confidence(), cancellation);
		}
		catch (SQLException e) {
			logger.warn("Could not obtain or release a connection: {}", e.getMessage());
			return ExecutionResult.notExecuted(ReconciliationErrorType.EXECUTION_FAILURE,
					"Connection failure: " + e.getMessage(), prepared.confidence());
		}
	}

	/**
	 * Runs every stage up to SQL generation. Failures are reported in the result rather
	 * than thrown, together with whatever the earlier stages produced.
	 */
	private Prepared prepare(Pipeline pipeline, String definition, ReconciliationRequest request) {
		QueryIntent intent = null;
		ResolvedMapping mapping = null;
		double confidence = 0.0;
		try {
			intent = pipeline.classifier().classify(definition, request.useLlm());
			confidence = intent.extractionConfidence();

			Resolution resolution = pipeline.resolver().resolve(intent, request.schemas());
			confidence = Math.min(confidence, resolution.confidence());
			mapping = ResolvedMapping.of(resolution);
			if (!resolution.isComplete()) {
				ResolutionIssue issue = resolution.issues().get(0);
				logger.info("Definition '{}' not resolved: {}", definition, issue.message());
				return new Prepared(intent, mapping, null, confidence, issue.type(), issue.message());
			}

			JoinPlan plan;
			try {
				plan = pipeline.joinResolver().plan(intent.archetype(), resolution);
			}
			catch (ReconciliationException e) {
				logger.info("Definition '{}' could not be planned: {}", definition, e.getMessage());
				return new Prepared(intent, mapping, null, confidence, e.errorType(), e.getMessage());
			}
			confidence = Math.min(confidence, plan.confidence());
			mapping = ResolvedMapping.of(resolution, plan);

			String sql;
			try {
				sql = pipeline.generator().generate(intent.archetype(), plan, request.dialect(),
						request.effectiveLimit(config));
			}
			catch (SqlGenerationException e) {
				logger.warn("SQL generation failed for '{}': {}", definition, e.getMessage());
				return new Prepared(intent, mapping, null, confidence, ReconciliationErrorType.EXECUTION_FAILURE,
						"SQL generation failed: " + e.getMessage());
			}

			if (confidence < request.minConfidence()) {
				String message = String.format(Locale.ROOT, "Confidence %.2f is below the requested minimum %.2f",
						confidence, request.minConfidence());
				logger.info("Definition '{}' not executed: {}", definition, message);
				return new Prepared(intent, mapping, sql, confidence, ReconciliationErrorType.LOW_CONFIDENCE, message);
			}
			return new Prepared(intent, mapping, sql, confidence, null, null);
		}
		catch (RuntimeException e) {
			logger.error("Unexpected failure preparing '{}'", definition, e);
			return new Prepared(intent, mapping, null, confidence, ReconciliationErrorType.EXECUTION_FAILURE,
					"Unexpected failure: " + e.getMessage());
		}
	}

	private record Pipeline(
			KnowledgeGraph kg,
			IntentClassifier classifier,
			EntityResolver resolver,
			JoinPathResolver joinResolver,
			SqlGenerator generator
	) {
	}

	private record Prepared(
			QueryIntent intent,
			ResolvedMapping mapping,
			String sql,
			double confidence,
			ReconciliationErrorType errorType,
			String errorMessage
	) {

		DefinitionOutcome toOutcome(String definition, ExecutionResult result) {
			return new DefinitionOutcome(definition, intent, mapping, sql, result);
		}
	}

	private static final class WorkerThreadFactory implements ThreadFactory {
		private static final AtomicInteger POOL = new AtomicInteger();
		private final int pool = POOL.incrementAndGet();
		private final AtomicInteger thread = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread worker = new Thread(runnable, "reconcile-" + pool + "-" + thread.incrementAndGet());
			worker.setDaemon(true);
			return worker;
		}
	}
}
