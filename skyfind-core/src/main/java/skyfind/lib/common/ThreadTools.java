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

package skyfind.lib.common;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Helpers for creating named worker threads and deciding how many of them to use.
 * <p>
 * Thread names carry a prefix identifying the pipeline stage, which makes thread dumps readable 
 * when several stages have been run in succession.
 * 
 * @author SkyFind developers
 */
public class ThreadTools {
	
	private static int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
	
	/**
	 * Get the default number of worker threads used when no explicit count is requested.
	 * @return
	 */
	public static synchronized int getParallelism() {
		return parallelism;
	}
	
	/**
	 * Set the default number of worker threads.
	 * @param n the new value, must be &gt; 0
	 * @throws IllegalArgumentException if n is &lt; 1
	 */
	public static synchronized void setParallelism(int n) {
		if (n < 1)
			throw new IllegalArgumentException("Parallelism must be at least 1, but requested " + n);
		parallelism = n;
	}
	
	/**
	 * Create a named thread factory with a specified priority.
	 * 
	 * @param prefix
	 * @param daemon
	 * @param priority
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon, int priority) {
		return new PrefixedThreadFactory(prefix, daemon, priority);
	}
	
	/**
	 * Create a named thread factory with {@code Thread.NORM_PRIORITY}.
	 * 
	 * @param prefix
	 * @param daemon
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon) {
		return createThreadFactory(prefix, daemon, Thread.NORM_PRIORITY);
	}
	
	
	static class PrefixedThreadFactory implements ThreadFactory {
		
		private final AtomicInteger threadNumber = new AtomicInteger(1);
		private final String prefix;
		private final boolean daemon;
		private final int priority;
	
		PrefixedThreadFactory(final String prefix, final boolean daemon, final int priority) {
			this.prefix = prefix;
			this.daemon = daemon;
			this.priority = Math.max(Thread.MIN_PRIORITY, Math.min(Thread.MAX_PRIORITY, priority));
		}
	
		@Override
		public Thread newThread(Runnable r) {
			Thread t = new Thread(r, prefix + threadNumber.getAndIncrement());
			t.setDaemon(daemon);
			if (t.getPriority() != priority)
				t.setPriority(priority);
			return t;
		}
		
	}
	
}
