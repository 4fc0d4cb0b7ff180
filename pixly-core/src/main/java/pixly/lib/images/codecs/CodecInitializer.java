/*-
 * #%L
 * This file is part of Pixly.
 * %%
 * Copyright (C) 2024 Pixly developers
 * %%
 * Pixly is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * Pixly is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with Pixly.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package pixly.lib.images.codecs;

import java.io.IOException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import pixly.lib.common.LogTools;

/**
 * Run a one-time initialization task, such as loading a native codec library.
 * <p>
 * Concurrent callers of {@link #ensureInitialized()} may race to perform the initialization: 
 * the first to complete successfully wins, and all later callers see that initialization is already done. 
 * If the task fails, the failure is reported to the caller and the next call tries again.
 */
public class CodecInitializer {
	
	private final static Logger logger = LoggerFactory.getLogger(CodecInitializer.class);
	
	private final String name;
	private final InitializationTask task;
	private final Object lock = new Object();
	
	private volatile boolean initialized = false;
	
	/**
	 * Constructor.
	 * @param name name used for logging
	 * @param task the task to run once
	 */
	public CodecInitializer(String name, InitializationTask task) {
		this.name = Objects.requireNonNull(name);
		this.task = Objects.requireNonNull(task);
	}
	
	/**
	 * Ensure that the initialization task has completed successfully, running it if necessary.
	 * This blocks if another thread is currently running the task.
	 * 
	 * @throws IOException if the task fails
	 */
	public void ensureInitialized() throws IOException {
		if (initialized)
			return;
		synchronized (lock) {
			if (initialized) {
				logger.trace("{} already initialized", name);
				return;
			}
			long startTime = System.nanoTime();
			task.run();
			initialized = true;
			LogTools.logDuration(logger, Level.DEBUG, "Initialized " + name, startTime);
		}
	}
	
	/**
	 * Query whether initialization has completed successfully.
	 * @return
	 */
	public boolean isInitialized() {
		return initialized;
	}
	
	@Override
	public String toString() {
		return "CodecInitializer [" + name + ", initialized=" + initialized + "]";
	}
	
	/**
	 * Task performing the initialization.
	 */
	@FunctionalInterface
	public interface InitializationTask {
		
		/**
		 * Run the task.
		 * @throws IOException
		 */
		void run() throws IOException;
		
	}

}
