/*-
 * #%L
 * This file is part of SkyFind.
 * %%
 * Copyright (C) 2024 - 2026 SkyFind developers
 * %%
 * SkyFind is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * SkyFind is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with SkyFind.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package skyfind.lib.extract;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import skyfind.lib.common.ThreadTools;

/**
 * Run one task per frame on a fixed-size thread pool.
 * <p>
 * A new pool is created for every stage and shut down before {@link #run(String, Map)} returns. 
 * Results are collected in order of completion and keyed by frame name; a task that throws 
 * an exception gives a failed {@link FrameTaskResult} without affecting the others.
 * 
 * @author SkyFind developers
 */
public class StageExecutor {
	
	private static final Logger logger = LoggerFactory.getLogger(StageExecutor.class);
	
	private final int numThreads;
	
	/**
	 * Create an executor.
	 * @param numThreads maximum number of frames processed in parallel, or &lt;= 0 to use {@link ThreadTools#getParallelism()}
	 */
	public StageExecutor(int numThreads) {
		this.numThreads = numThreads;
	}
	
	/**
	 * Run all tasks of one stage and wait for them to finish.
	 * 
	 * @param stage name of the stage, used for thread names and logging
	 * @param tasks tasks keyed by frame name
	 * @return results keyed by frame name, in order of completion
	 */
	public Map<String, FrameTaskResult> run(String stage, Map<String, ? extends Callable<ExtractionResult>> tasks) {
		var results = new LinkedHashMap<String, FrameTaskResult>();
		if (tasks.isEmpty())
			return results;
		
		int n = Math.min(numThreads <= 0 ? ThreadTools.getParallelism() : numThreads, tasks.size());
		var pool = Executors.newFixedThreadPool(n, ThreadTools.createThreadFactory("skyfind-" + stage + "-", false));
		logger.debug("New threadpool created with {} threads for {}", n, stage);
		var service = new ExecutorCompletionService<ExtractionResult>(pool);
		
		Map<Future<ExtractionResult>, String> pending = new HashMap<>();
		try {
			for (var entry : tasks.entrySet()) {
				if (entry.getValue() == null) {
					logger.warn("Skipping null task for {}", entry.getKey());
					continue;
				}
				pending.put(service.submit(entry.getValue()), entry.getKey());
			}
			pool.shutdown();
			
			while (!pending.isEmpty()) {
				var future = service.take();
				String name = pending.remove(future);
				try {
					var result = future.get();
					results.put(name, FrameTaskResult.completed(name, result));
					logger.debug("{} completed for {}", stage, name);
				} catch (ExecutionException e) {
					var cause = e.getCause() == null ? e : e.getCause();
					logger.error("Error in {} for frame {}: {}", stage, name, cause.getMessage(), cause);
					results.put(name, FrameTaskResult.failed(name, cause.getMessage() == null ? cause.toString() : cause.getMessage()));
				}
			}
		} catch (InterruptedException e) {
			logger.error("{} interrupted: {}", stage, e.getMessage(), e);
			pool.shutdownNow();
			for (var name : pending.values())
				results.put(name, FrameTaskResult.failed(name, "Interrupted"));
			Thread.currentThread().interrupt();
		} finally {
			pool.shutdown();
			try {
				if (!pool.awaitTermination(1, TimeUnit.MINUTES))
					logger.warn("Threadpool for {} did not terminate", stage);
			} catch (InterruptedException e) {
				logger.warn("Interrupted while waiting for threadpool of {} to terminate", stage);
				Thread.currentThread().interrupt();
			}
		}
		return results;
	}

}
