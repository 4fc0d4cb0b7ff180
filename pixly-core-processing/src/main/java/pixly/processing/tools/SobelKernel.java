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

package pixly.processing.tools;

import pixly.lib.common.ColorTools;
import pixly.lib.images.Bitmap;

/**
 * 3x3 Sobel edge detector producing a binary edge map.
 * <p>
 * Horizontal and vertical gradients of luminance are combined as {@code sqrt(gx*gx + gy*gy)}; 
 * pixels where this exceeds the threshold become white, all others black. Alpha is passed through unchanged.
 */
public final class SobelKernel implements NeighborhoodKernel {
	
	private static final int[] GX = {
			-1, 0, 1,
			-2, 0, 2,
			-1, 0, 1
	};
	
	private static final int[] GY = {
			-1, -2, -1,
			 0,  0,  0,
			 1,  2,  1
	};
	
	private final double threshold;
	
	/**
	 * Constructor.
	 * @param threshold gradient magnitude above which a pixel is considered to be an edge
	 */
	public SobelKernel(double threshold) {
		this.threshold = threshold;
	}
	
	/**
	 * Get the gradient magnitude threshold.
	 * @return
	 */
	public double getThreshold() {
		return threshold;
	}
	
	@Override
	public int getRadius() {
		return 1;
	}
	
	/**
	 * Compute the gradient magnitude of luminance at a pixel.
	 * @param src
	 * @param width
	 * @param x
	 * @param y
	 * @return
	 */
	static double magnitude(byte[] src, int width, int x, int y) {
		double gx = 0, gy = 0;
		int k = 0;
		for (int ky = -1; ky <= 1; ky++) {
			for (int kx = -1; kx <= 1; kx++) {
				int ind = ((y + ky) * width + x + kx) * Bitmap.CHANNELS;
				double lum = ColorTools.luminance(src[ind] & 0xff, src[ind+1] & 0xff, src[ind+2] & 0xff);
				gx += GX[k] * lum;
				gy += GY[k] * lum;
				k++;
			}
		}
		return Math.sqrt(gx * gx + gy * gy);
	}

	@Override
	public void apply(byte[] src, int width, int x, int y, double[] out) {
		double value = magnitude(src, width, x, y) > threshold ? 255 : 0;
		out[0] = value;
		out[1] = value;
		out[2] = value;
		out[3] = src[(y * width + x) * Bitmap.CHANNELS + 3] & 0xff;
	}

}
