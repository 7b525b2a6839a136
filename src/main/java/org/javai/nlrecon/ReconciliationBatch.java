package org.javai.nlrecon;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import org.javai.nlrecon.exec.ExecutionCancellation;
import org.javai.nlrecon.sql.Dialect;

/**
 * A running batch. Results are collected in request order by {@link #join()}.
 *
 * <p>{@link #cancel()} stops definitions that have not started and cancels running
 * statements. Finished results are kept; cancelled definitions report
 * {@link ReconciliationErrorType#CANCELLED}.</p>
 */
public final class ReconciliationBatch {

	private final String kgName;
	private final Dialect dialect;
	private final Instant startedAt;
	private final List<Future<DefinitionOutcome>> futures;
	private final ExecutionCancellation cancellation;

	ReconciliationBatch(String kgName, Dialect dialect, Instant startedAt, List<Future<DefinitionOutcome>> futures,
			ExecutionCancellation cancellation) {
		this.kgName = kgName;
		this.dialect = dialect;
		this.startedAt = startedAt;
		this.futures = List.copyOf(futures);
		this.cancellation = cancellation;
	}

	public void cancel() {
		cancellation.cancel();
	}

	public boolean isCancelled() {
		return cancellation.isCancelled();
	}

	public boolean isDone() {
		return futures.stream().allMatch(Future::isDone);
	}

	/**
	 * Waits for every definition to finish.
	 *
	 * @throws IllegalStateException when interrupted while waiting
	 */
	public ReconciliationReport join() {
		List<DefinitionOutcome> outcomes = new ArrayList<>(futures.size());
		try {
			for (Future<DefinitionOutcome> future : futures) {
				outcomes.add(future.get());
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			cancel();
			throw new IllegalStateException("Interrupted while waiting for reconciliation batch", e);
		}
		catch (ExecutionException | CancellationException e) {
			throw new IllegalStateException("Reconciliation worker failed", e);
		}
		return ReconciliationReport.of(kgName, dialect, startedAt, Instant.now(), outcomes);
	}
}
