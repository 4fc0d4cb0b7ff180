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

package pixly.lib.images;

import java.util.Objects;

import pixly.lib.common.ColorTools;

/**
 * An 8-bit RGBA color.
 * <p>
 * Instances are immutable. Each channel is stored as an int in the range 0-255.
 */
public final class Color {
	
	/**
	 * Opaque white.
	 */
	public static final Color WHITE = new Color(255, 255, 255, 255);
	
	/**
	 * Opaque black.
	 */
	public static final Color BLACK = new Color(0, 0, 0, 255);
	
	/**
	 * Fully transparent black.
	 */
	public static final Color TRANSPARENT = new Color(0, 0, 0, 0);
	
	/**
	 * Fully transparent white, the default background for resizing and cropping.
	 */
	public static final Color TRANSPARENT_WHITE = new Color(255, 255, 255, 0);
	
	private final int red;
	private final int green;
	private final int blue;
	private final int alpha;
	
	private Color(int red, int green, int blue, int alpha) {
		this.red = red;
		this.green = green;
		this.blue = blue;
		this.alpha = alpha;
	}
	
	/**
	 * Create a color from RGBA values.
	 * @param red
	 * @param green
	 * @param blue
	 * @param alpha
	 * @return
	 * @throws IllegalArgumentException if any value is outside the range 0-255
	 */
	public static Color rgba(int red, int green, int blue, int alpha) {
		checkRange("red", red);
		checkRange("green", green);
		checkRange("blue", blue);
		checkRange("alpha", alpha);
		return new Color(red, green, blue, alpha);
	}
	
	/**
	 * Create an opaque color from RGB values.
	 * @param red
	 * @param green
	 * @param blue
	 * @return
	 * @throws IllegalArgumentException if any value is outside the range 0-255
	 */
	public static Color rgb(int red, int green, int blue) {
		return rgba(red, green, blue, 255);
	}
	
	/**
	 * Create a color from a packed ARGB value.
	 * @param argb
	 * @return
	 */
	public static Color fromARGB(int argb) {
		return new Color(ColorTools.red(argb), ColorTools.green(argb), ColorTools.blue(argb), ColorTools.alpha(argb));
	}
	
	private static void checkRange(String name, int value) {
		if (!ColorTools.is8Bit(value))
			throw new IllegalArgumentException("Color " + name + " must be between 0 and 255, but was " + value);
	}
	
	/**
	 * Get the red value.
	 * @return
	 */
	public int getRed() {
		return red;
	}

	/**
	 * Get the green value.
	 * @return
	 */
	public int getGreen() {
		return green;
	}

	/**
	 * Get the blue value.
	 * @return
	 */
	public int getBlue() {
		return blue;
	}

	/**
	 * Get the alpha value.
	 * @return
	 */
	public int getAlpha() {
		return alpha;
	}
	
	/**
	 * Get the value of a channel by index.
	 * @param channel 0 for red, 1 for green, 2 for blue and 3 for alpha
	 * @return
	 */
	public int getChannel(int channel) {
		switch (channel) {
		case 0: return red;
		case 1: return green;
		case 2: return blue;
		case 3: return alpha;
		default:
			throw new IndexOutOfBoundsException("Channel must be between 0 and 3, but was " + channel);
		}
	}
	
	/**
	 * Get the packed ARGB representation of this color.
	 * @return
	 */
	public int toARGB() {
		return ColorTools.packARGB(alpha, red, green, blue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(red, green, blue, alpha);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Color))
			return false;
		Color other = (Color)obj;
		return red == other.red && green == other.green && blue == other.blue && alpha == other.alpha;
	}

	@Override
	public String toString() {
		return "Color [" + red + ", " + green + ", " + blue + ", " + alpha + "]";
	}

}
