package fla.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.function.Function;
import java.util.logging.Logger;

import fla.Config;
import fla.FLAException;

/**
 * Runs independent analyses in parallel.
 *
 * Each analysis is executed single threaded on one of the pool threads. The analyses must not share
 * mutable state, all engines in this project only use call local state.
 */
public class BatchRunner implements AutoCloseable {

	public static final Logger LOG = Logger.getLogger("Batch");

	private final ExecutorService executor;

	public final int threads;

	public BatchRunner(){
		this(Config.batchThreads());
	}

	public BatchRunner(int threads) {
		if (threads <= 0){
			throw new IllegalArgumentException("Need at least one thread, got " + threads);
		}
		this.threads = threads;
		this.executor = Executors.newFixedThreadPool(threads);
	}

	/**
	 * Runs all tasks and returns their results in the order of the passed list.
	 *
	 * @throws FLAException if a task failed or the current thread was interrupted, runtime exceptions of the
	 *                      tasks are rethrown unchanged
	 */
	public <T> List<T> runAll(List<? extends Callable<T>> tasks){
		LOG.fine(() -> String.format("Run %d tasks on %d threads", tasks.size(), threads));
		List<Future<T>> futures = new ArrayList<>();
		for (Callable<T> task : tasks){
			futures.add(executor.submit(task));
		}
		List<T> results = new ArrayList<>(futures.size());
		try {
			for (Future<T> future : futures){
				results.add(future.get());
			}
		} catch (InterruptedException e) {
			futures.forEach(f -> f.cancel(true));
			Thread.currentThread().interrupt();
			throw new FLAException("Interrupted while waiting for the batch", e);
		} catch (ExecutionException e) {
			futures.forEach(f -> f.cancel(true));
			if (e.getCause() instanceof RuntimeException){
				throw (RuntimeException)e.getCause();
			}
			throw new FLAException("Analysis failed: " + e.getCause(), e.getCause());
		}
		return results;
	}

	/**
	 * Applies the analysis to every input in parallel.
	 *
	 * @return results in input order
	 */
	public <I, O> List<O> map(List<I> inputs, Function<I, O> analysis){
		List<Callable<O>> tasks = new ArrayList<>();
		for (I input : inputs){
			tasks.add(() -> analysis.apply(input));
		}
		return runAll(tasks);
	}

	@Override
	public void close() {
		executor.shutdownNow();
	}
}
