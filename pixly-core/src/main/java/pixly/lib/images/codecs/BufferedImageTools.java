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

import java.awt.image.BufferedImage;

import pixly.lib.common.ColorTools;
import pixly.lib.images.Bitmap;

/**
 * Conversion between {@link Bitmap} and {@link BufferedImage}, for use with ImageIO.
 */
class BufferedImageTools {
	
	private BufferedImageTools() {
		throw new AssertionError("Cannot instantiate this class");
	}
	
	/**
	 * Convert any {@link BufferedImage} to an RGBA bitmap.
	 * Pixels are converted to non-premultiplied sRGB by {@link BufferedImage#getRGB(int, int, int, int, int[], int, int)}.
	 * @param img
	 * @return
	 */
	static Bitmap toBitmap(BufferedImage img) {
		int width = img.getWidth();
		int height = img.getHeight();
		int[] argb = img.getRGB(0, 0, width, height, null, 0, width);
		byte[] pixels = new byte[argb.length * Bitmap.CHANNELS];
		int ind = 0;
		for (int v : argb) {
			pixels[ind++] = (byte)ColorTools.red(v);
			pixels[ind++] = (byte)ColorTools.green(v);
			pixels[ind++] = (byte)ColorTools.blue(v);
			pixels[ind++] = (byte)ColorTools.alpha(v);
		}
		return Bitmap.wrap(width, height, pixels);
	}
	
	/**
	 * Convert a bitmap to a {@link BufferedImage}.
	 * @param bitmap
	 * @param keepAlpha if false, the alpha channel is discarded and the image has type {@code TYPE_INT_RGB}
	 * @return
	 */
	static BufferedImage toBufferedImage(Bitmap bitmap, boolean keepAlpha) {
		int width = bitmap.getWidth();
		int height = bitmap.getHeight();
		byte[] pixels = bitmap.getPixels();
		int[] argb = new int[width * height];
		for (int i = 0; i < argb.length; i++) {
			int ind = i * Bitmap.CHANNELS;
			argb[i] = ColorTools.packARGB(
					pixels[ind+3] & 0xff,
					pixels[ind] & 0xff,
					pixels[ind+1] & 0xff,
					pixels[ind+2] & 0xff);
		}
		var img = new BufferedImage(width, height, keepAlpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
		img.setRGB(0, 0, width, height, argb, 0, width);
		return img;
	}

}
