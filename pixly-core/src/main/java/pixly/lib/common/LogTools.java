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

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Helper class for logging.
 */
public class LogTools {
	
	/**
	 * Keys are "logger name|level|message".
	 */
	private static final Set<String> alreadyLogged = ConcurrentHashMap.newKeySet();
	
	private LogTools() {
		throw new AssertionError("Cannot instantiate this class");
	}

	/**
	 * Log a message once at the specified level.
	 * <p>
	 * This is intended for messages that can be triggered for every image processed 
	 * (e.g. an unrecognized file signature), where repeating the same message adds nothing.
	 * Messages are tracked per logger name and level.
	 * 
	 * @param logger
	 * @param level
	 * @param message
	 * @return true if the message was logged, false if it had been logged before
	 */
	public static boolean logOnce(Logger logger, Level level, String message) {
		String key = logger.getName() + "|" + level + "|" + message;
		if (!alreadyLogged.add(key))
			return false;
		logger.atLevel(level).log(message);
		return true;
	}

	/**
	 * Log a message once at the INFO level.
	 * 
	 * @param logger
	 * @param message
	 * @return true if the message was logged, false if it had been logged before
	 */
	public static boolean logOnce(Logger logger, String message) {
		return logOnce(logger, Level.INFO, message);
	}

	/**
	 * Log a message once at the WARN level.
	 * 
	 * @param logger
	 * @param message
	 * @return true if the message was logged, false if it had been logged before
	 */
	public static boolean warnOnce(Logger logger, String message) {
		return logOnce(logger, Level.WARN, message);
	}
	
	/**
	 * Log the time elapsed since {@code startNanos} for a named step, 
	 * e.g. "Applied adjust.invert in 1.25 ms".
	 * Nothing is formatted unless the level is enabled.
	 * 
	 * @param logger
	 * @param level
	 * @param step description of the completed step
	 * @param startNanos value of {@link System#nanoTime()} when the step started
	 * @return the elapsed time in milliseconds
	 */
	public static double logDuration(Logger logger, Level level, String step, long startNanos) {
		double millis = (System.nanoTime() - startNanos) / 1e6;
		if (logger.isEnabledForLevel(level))
			logger.atLevel(level).log("{} in {} ms", step, GeneralTools.formatNumber(millis, 2));
		return millis;
	}

}
