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

/**
 * Static functions to help work with 8-bit RGBA values.
 * <p>
 * Packed values follow the {@code java.awt} convention of ARGB, with alpha in the highest byte.
 */
public class ColorTools {
	
	/**
	 * Weight of the red channel when computing luminance.
	 */
	final public static double LUMINANCE_RED = 0.299;

	/**
	 * Weight of the green channel when computing luminance.
	 */
	final public static double LUMINANCE_GREEN = 0.587;

	/**
	 * Weight of the blue channel when computing luminance.
	 */
	final public static double LUMINANCE_BLUE = 0.114;
	
	private ColorTools() {
		throw new AssertionError("Cannot instantiate this class");
	}
	
	/**
	 * Compute the luminance of an RGB value, as {@code 0.299R + 0.587G + 0.114B}.
	 * <p>
	 * All operations that need to agree on the brightness of a pixel should use this method.
	 * 
	 * @param r
	 * @param g
	 * @param b
	 * @return the luminance, in the range 0-255 for 8-bit inputs
	 */
	public static double luminance(double r, double g, double b) {
		return LUMINANCE_RED * r + LUMINANCE_GREEN * g + LUMINANCE_BLUE * b;
	}
	
	/**
	 * Clip an input value to be an integer in the range 0-255.
	 * 
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(int v) {
		return v < 0 ? 0 : (v > 255 ? 255 : v);
	}
	
	/**
	 * Convert a floating point value into a byte value, as stored in a clamped 8-bit buffer.
	 * <p>
	 * The value is first clipped to 0-255, then rounded to the nearest integer with ties going to 
	 * the even neighbor. {@code NaN} becomes 0.
	 * 
	 * @param val
	 * @return
	 */
	public static int clip255(double val) {
		if (Double.isNaN(val) || val <= 0)
			return 0;
		if (val >= 255)
			return 255;
		return (int)Math.rint(val);
	}
	
	/**
	 * Test whether a value falls within the range 0-255.
	 * @param v
	 * @return
	 */
	public static boolean is8Bit(int v) {
		return v >= 0 && v <= 255;
	}
	
	/**
	 * Make a packed ARGB value from specified input values.
	 * <p>
	 * Input values should be in the range 0-255 - but no checking is applied.
	 * 
	 * @param a
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 */
	public static int packARGB(int a, int r, int g, int b) {
		return (a << 24) | (r << 16) | (g << 8) | b;
	}

	/**
	 * Extract the 8-bit alpha value from a packed ARGB value.
	 * @param argb
	 * @return
	 */
	public static int alpha(int argb) {
		return (argb >> 24) & 0xff;
	}

	/**
	 * Extract the 8-bit red value from a packed ARGB value.
	 * @param argb
	 * @return
	 */
	public static int red(int argb) {
		return (argb >> 16) & 0xff;
	}

	/**
	 * Extract the 8-bit green value from a packed ARGB value.
	 * @param argb
	 * @return
	 */
	public static int green(int argb) {
		return (argb >> 8) & 0xff;
	}
	
	/**
	 * Extract the 8-bit blue value from a packed ARGB value.
	 * @param argb
	 * @return
	 */
	public static int blue(int argb) {
		return argb & 0xff;
	}

}
