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

package pixly.lib.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Core Pixly preferences.
 * <p>
 * Initial values are read once from system properties, and may be changed later using the setters. 
 * These are not persistent.
 * <ul>
 *   <li>{@code pixly.threads} - number of threads used by chunked neighborhood kernels</li>
 *   <li>{@code pixly.parallelThreshold} - minimum number of pixels before kernels are chunked across threads</li>
 *   <li>{@code pixly.fetchTimeout} - timeout in milliseconds used when reading URL inputs</li>
 * </ul>
 */
public class Prefs {
	
	private final static Logger logger = LoggerFactory.getLogger(Prefs.class);
	
	/**
	 * System property used to set the number of threads.
	 */
	public static final String PROP_THREADS = "pixly.threads";
	
	/**
	 * System property used to set the parallel threshold, in pixels.
	 */
	public static final String PROP_PARALLEL_THRESHOLD = "pixly.parallelThreshold";
	
	/**
	 * System property used to set the fetch timeout, in milliseconds.
	 */
	public static final String PROP_FETCH_TIMEOUT = "pixly.fetchTimeout";
	
	private static volatile int nThreads = readInt(PROP_THREADS, Runtime.getRuntime().availableProcessors() - 1, 1);
	
	private static volatile int parallelThreshold = readInt(PROP_PARALLEL_THRESHOLD, 1024 * 1024, 1);
	
	private static volatile int fetchTimeoutMillis = readInt(PROP_FETCH_TIMEOUT, 5000, 0);
	
	private Prefs() {
		throw new AssertionError("Cannot instantiate this class");
	}
	
	private static int readInt(String key, int defaultValue, int minValue) {
		String value = System.getProperty(key);
		if (value == null || value.isBlank())
			return Math.max(minValue, defaultValue);
		try {
			return Math.max(minValue, Integer.parseInt(value.strip()));
		} catch (NumberFormatException e) {
			logger.warn("Invalid value for {}: '{}', will use {} instead", key, value, defaultValue);
			return Math.max(minValue, defaultValue);
		}
	}
	
	/**
	 * Get the requested number of threads to use for parallelization.
	 * @return
	 */
	public static int getNumThreads() {
		return nThreads;
	}

	/**
	 * Set the requested number of threads. This will be clipped to be at least 1.
	 * @param n
	 */
	public static void setNumThreads(int n) {
		nThreads = Math.max(1, n);
	}
	
	/**
	 * Get the minimum number of pixels an image must have before neighborhood kernels are split across threads.
	 * @return
	 */
	public static int getParallelThreshold() {
		return parallelThreshold;
	}
	
	/**
	 * Set the minimum number of pixels an image must have before neighborhood kernels are split across threads.
	 * This will be clipped to be at least 1.
	 * @param nPixels
	 */
	public static void setParallelThreshold(int nPixels) {
		parallelThreshold = Math.max(1, nPixels);
	}
	
	/**
	 * Get the timeout used when reading inputs from a URL.
	 * @return timeout in milliseconds
	 */
	public static int getFetchTimeoutMillis() {
		return fetchTimeoutMillis;
	}
	
	/**
	 * Set the timeout used when reading inputs from a URL. 0 means no timeout.
	 * @param millis
	 */
	public static void setFetchTimeoutMillis(int millis) {
		fetchTimeoutMillis = Math.max(0, millis);
	}

}
