package my.goalplanner.app.service;

import jakarta.annotation.PreDestroy;
import my.goalplanner.app.config.AppProperties;
import my.goalplanner.app.model.GoalProjection;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulates terminal portfolio values under normally distributed monthly returns.
 *
 * <p>Iterations are cut into fixed-size batches. Every batch takes its own seed, drawn in batch
 * order from the caller's generator, and fills a disjoint slice of the result array, so the
 * output for a given seed does not depend on the pool size or on scheduling.
 */
@Service
public class MonteCarloEngine {
	private static final Logger logger = LoggerFactory.getLogger(MonteCarloEngine.class);

	private final int batchSize;
	private final int parallelism;
	private final ExecutorService executor;

	public MonteCarloEngine(AppProperties properties) {
		AppProperties.Simulation simulation = properties.simulation();
		this.batchSize = Math.max(1, simulation.batchSize());
		this.parallelism = Math.max(1, simulation.parallelism());
		this.executor = Executors.newFixedThreadPool(parallelism, new SimulationThreadFactory());
		logger.info("Monte Carlo engine ready (parallelism={}, batchSize={}).", parallelism, batchSize);
	}

	public double[] simulate(GoalProjection projection, int iterations, RandomGenerator random) {
		if (projection.yearsToGoal() <= 0) {
			return new double[]{projection.currentAmount()};
		}
		int total = Math.max(1, iterations);
		double[] terminalValues = new double[total];
		int batches = (total + batchSize - 1) / batchSize;
		long[] seeds = new long[batches];
		for (int i = 0; i < batches; i++) {
			seeds[i] = random.nextLong();
		}
		if (batches == 1 || parallelism == 1) {
			for (int i = 0; i < batches; i++) {
				runBatch(projection, seeds[i], terminalValues, i * batchSize, Math.min(total, (i + 1) * batchSize));
			}
			return terminalValues;
		}
		List<Future<?>> futures = new ArrayList<>(batches);
		for (int i = 0; i < batches; i++) {
			long seed = seeds[i];
			int from = i * batchSize;
			int to = Math.min(total, from + batchSize);
			futures.add(executor.submit(() -> runBatch(projection, seed, terminalValues, from, to)));
		}
		awaitAll(futures);
		return terminalValues;
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private void runBatch(GoalProjection projection, long seed, double[] target, int from, int to) {
		RandomGenerator generator = new Well19937c(seed);
		int months = projection.months();
		double monthlyReturn = projection.expectedReturn() / 12.0;
		double monthlyVolatility = projection.volatility() / FastMath.sqrt(12.0);
		double contribution = projection.monthlyContribution();
		for (int path = from; path < to; path++) {
			double value = projection.currentAmount();
			for (int month = 0; month < months; month++) {
				double monthReturn = monthlyReturn + monthlyVolatility * generator.nextGaussian();
				value = value * (1.0 + monthReturn) + contribution;
			}
			target[path] = value;
		}
	}

	private void awaitAll(List<Future<?>> futures) {
		try {
			for (Future<?> future : futures) {
				future.get();
			}
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			futures.forEach(future -> future.cancel(true));
			throw new IllegalStateException("Monte Carlo simulation interrupted", ex);
		} catch (ExecutionException ex) {
			futures.forEach(future -> future.cancel(true));
			Throwable cause = ex.getCause();
			if (cause instanceof RuntimeException runtimeException) {
				throw runtimeException;
			}
			throw new IllegalStateException("Monte Carlo batch failed", cause);
		}
	}

	private static final class SimulationThreadFactory implements ThreadFactory {
		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "monte-carlo-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}
}
