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

import java.util.Arrays;
import java.util.Objects;

/**
 * An in-memory RGBA image with 8 bits per channel.
 * <p>
 * Pixels are stored row by row, with channels interleaved in the order R, G, B, A. 
 * The pixel array always has exactly {@code width * height * 4} elements.
 * <p>
 * Bitmaps are immutable. Operations should create a new bitmap rather than attempt to change an existing one, 
 * because the same bitmap may be shared between threads.
 */
public final class Bitmap {
	
	/**
	 * Number of channels per pixel.
	 */
	public static final int CHANNELS = 4;
	
	private final int width;
	private final int height;
	private final byte[] pixels;
	
	private Bitmap(int width, int height, byte[] pixels) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Bitmap width and height must be > 0, but requested " + width + "x" + height);
		Objects.requireNonNull(pixels, "Pixels must not be null!");
		if ((long)width * height * CHANNELS != pixels.length)
			throw new IllegalArgumentException(String.format(
					"Pixel array length %d does not match dimensions %dx%d (expected %d)", 
					pixels.length, width, height, (long)width * height * CHANNELS));
		this.width = width;
		this.height = height;
		this.pixels = pixels;
	}
	
	/**
	 * Create a bitmap using a copy of the provided RGBA pixels.
	 * @param width
	 * @param height
	 * @param pixels
	 * @return
	 * @throws IllegalArgumentException if the dimensions are not positive, or do not match the pixel array length
	 */
	public static Bitmap create(int width, int height, byte[] pixels) {
		Objects.requireNonNull(pixels, "Pixels must not be null!");
		return new Bitmap(width, height, pixels.clone());
	}
	
	/**
	 * Create a bitmap that takes ownership of the provided RGBA pixels, without making a copy.
	 * <p>
	 * The caller must not modify the array afterwards. This is intended for code that has just 
	 * allocated the array to hold the output of an operation.
	 * 
	 * @param width
	 * @param height
	 * @param pixels
	 * @return
	 * @throws IllegalArgumentException if the dimensions are not positive, or do not match the pixel array length
	 */
	public static Bitmap wrap(int width, int height, byte[] pixels) {
		return new Bitmap(width, height, pixels);
	}
	
	/**
	 * Create a bitmap where every pixel has the same color.
	 * @param width
	 * @param height
	 * @param color
	 * @return
	 */
	public static Bitmap createFilled(int width, int height, Color color) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Bitmap width and height must be > 0, but requested " + width + "x" + height);
		byte[] pixels = new byte[width * height * CHANNELS];
		fill(pixels, color);
		return new Bitmap(width, height, pixels);
	}
	
	/**
	 * Fill an RGBA array with a single color.
	 * @param pixels
	 * @param color
	 */
	public static void fill(byte[] pixels, Color color) {
		byte r = (byte)color.getRed();
		byte g = (byte)color.getGreen();
		byte b = (byte)color.getBlue();
		byte a = (byte)color.getAlpha();
		for (int i = 0; i < pixels.length; i += CHANNELS) {
			pixels[i] = r;
			pixels[i+1] = g;
			pixels[i+2] = b;
			pixels[i+3] = a;
		}
	}

	/**
	 * Get the bitmap width.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Get the bitmap height.
	 * @return
	 */
	public int getHeight() {
		return height;
	}
	
	/**
	 * Get the total number of pixels, i.e. {@code width * height}.
	 * @return
	 */
	public int getPixelCount() {
		return width * height;
	}
	
	/**
	 * Get a copy of the RGBA pixels.
	 * @return
	 */
	public byte[] getPixels() {
		return pixels.clone();
	}
	
	/**
	 * Get the value of one channel of a pixel.
	 * @param x
	 * @param y
	 * @param channel 0 for red, 1 for green, 2 for blue and 3 for alpha
	 * @return the value, in the range 0-255
	 */
	public int getValue(int x, int y, int channel) {
		checkBounds(x, y);
		if (channel < 0 || channel >= CHANNELS)
			throw new IndexOutOfBoundsException("Channel must be between 0 and 3, but was " + channel);
		return pixels[(y * width + x) * CHANNELS + channel] & 0xff;
	}
	
	/**
	 * Get the color of a pixel.
	 * @param x
	 * @param y
	 * @return
	 */
	public Color getColor(int x, int y) {
		checkBounds(x, y);
		int i = (y * width + x) * CHANNELS;
		return Color.rgba(pixels[i] & 0xff, pixels[i+1] & 0xff, pixels[i+2] & 0xff, pixels[i+3] & 0xff);
	}
	
	private void checkBounds(int x, int y) {
		if (x < 0 || y < 0 || x >= width || y >= height)
			throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") is outside a " + width + "x" + height + " bitmap");
	}

	@Override
	public int hashCode() {
		return 31 * (31 * width + height) + Arrays.hashCode(pixels);
	}

	/**
	 * Bitmaps are equal if they have the same dimensions and identical pixels.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Bitmap))
			return false;
		Bitmap other = (Bitmap)obj;
		return width == other.width && height == other.height && Arrays.equals(pixels, other.pixels);
	}

	@Override
	public String toString() {
		return "Bitmap (" + width + "x" + height + ")";
	}
	
}
