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

import java.text.NumberFormat;
import java.util.HashMap;
import java.util.Locale;
import java.util.Locale.Category;
import java.util.Map;
import java.util.Optional;

/**
 * A collection of generally-useful static methods.
 */
public class GeneralTools {
	
	private GeneralTools() {
		throw new AssertionError("Cannot instantiate this class");
	}
	
	/**
	 * Check if a string is null or empty, optionally trimming first.
	 * @param s
	 * @param trim
	 * @return
	 */
	public static boolean blankString(final String s, final boolean trim) {
		return s == null || (trim ? s.isBlank() : s.isEmpty());
	}
	
	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}
	
	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}
	
	/**
	 * Round a value to the nearest integer, with ties rounded away from zero.
	 * <p>
	 * This differs from {@link Math#round(double)}, which rounds -2.5 to -2.
	 * 
	 * @param value
	 * @return
	 */
	public static long roundHalfAwayFromZero(final double value) {
		if (value < 0)
			return -(long)Math.floor(-value + 0.5);
		return (long)Math.floor(value + 0.5);
	}
	
	/**
	 * Get the extension of a file name or path, in lower case and without the dot.
	 * @param name
	 * @return the extension if available, or empty if the name has no extension
	 */
	public static Optional<String> getExtension(String name) {
		if (name == null)
			return Optional.empty();
		int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
		int dot = name.lastIndexOf('.');
		if (dot <= slash + 1 || dot == name.length() - 1)
			return Optional.empty();
		return Optional.of(name.substring(dot + 1).toLowerCase(Locale.ROOT));
	}
	
	private static final Map<Locale, NumberFormat> formatters = new HashMap<>();
	
	/**
	 * Format a value with a maximum number of decimal places, using the default Locale.
	 * 
	 * @param value
	 * @param maxDecimalPlaces
	 * @return
	 */
	public static String formatNumber(final double value, final int maxDecimalPlaces) {
		return formatNumber(Locale.getDefault(Category.FORMAT), value, maxDecimalPlaces);
	}
	
	/**
	 * Format a value with a maximum number of decimal places, using a specified Locale.
	 * Grouping separators are not used.
	 * 
	 * @param locale
	 * @param value
	 * @param maxDecimalPlaces
	 * @return
	 */
	public static synchronized String formatNumber(final Locale locale, final double value, final int maxDecimalPlaces) {
		NumberFormat nf = formatters.computeIfAbsent(locale, l -> {
			var format = NumberFormat.getInstance(l);
			format.setGroupingUsed(false);
			return format;
		});
		nf.setMaximumFractionDigits(maxDecimalPlaces);
		return nf.format(value);
	}

}
