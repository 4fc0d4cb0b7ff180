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
 * Luminance values and summary statistics computed from a {@link Bitmap}.
 * <p>
 * Luminance is rounded to the nearest integer in the range 0-255 for the histogram, 
 * while local statistics use integral images of the unrounded values.
 */
public class LuminanceStatistics {
	
	private final int width;
	private final int height;
	private final double[] luminance;
	private final int[] histogram = new int[256];
	private final double mean;
	private final double stdDev;
	
	// Integral images with an extra leading row and column of zeros
	private double[] integral;
	private double[] integralSquared;
	
	private LuminanceStatistics(Bitmap bitmap) {
		this.width = bitmap.getWidth();
		this.height = bitmap.getHeight();
		byte[] pixels = bitmap.getPixels();
		int n = width * height;
		luminance = new double[n];
		double sum = 0, sumSq = 0;
		for (int i = 0; i < n; i++) {
			int ind = i * Bitmap.CHANNELS;
			double lum = ColorTools.luminance(pixels[ind] & 0xff, pixels[ind+1] & 0xff, pixels[ind+2] & 0xff);
			luminance[i] = lum;
			histogram[ColorTools.clip255(lum)]++;
			sum += lum;
			sumSq += lum * lum;
		}
		mean = sum / n;
		stdDev = Math.sqrt(Math.max(0, sumSq / n - mean * mean));
	}
	
	/**
	 * Compute statistics for a bitmap.
	 * @param bitmap
	 * @return
	 */
	public static LuminanceStatistics compute(Bitmap bitmap) {
		return new LuminanceStatistics(bitmap);
	}
	
	/**
	 * Get the number of pixels.
	 * @return
	 */
	public int getPixelCount() {
		return luminance.length;
	}
	
	/**
	 * Get the luminance of the pixel with the specified index.
	 * @param pixelIndex
	 * @return
	 */
	public double getLuminance(int pixelIndex) {
		return luminance[pixelIndex];
	}
	
	/**
	 * Get a copy of the 256-bin luminance histogram.
	 * @return
	 */
	public int[] getHistogram() {
		return histogram.clone();
	}
	
	/**
	 * Get the cumulative histogram, normalized to the range 0-1.
	 * @return
	 */
	public double[] getNormalizedCDF() {
		double[] cdf = new double[histogram.length];
		double n = getPixelCount();
		long count = 0;
		for (int i = 0; i < histogram.length; i++) {
			count += histogram[i];
			cdf[i] = count / n;
		}
		return cdf;
	}
	
	/**
	 * Get the mean luminance over the whole image.
	 * @return
	 */
	public double getMean() {
		return mean;
	}
	
	/**
	 * Get the (population) standard deviation of luminance over the whole image.
	 * @return
	 */
	public double getStdDev() {
		return stdDev;
	}
	
	/**
	 * Get the mean luminance within a square window, clipped to the image bounds.
	 * @param x
	 * @param y
	 * @param radius
	 * @return
	 */
	public double getLocalMean(int x, int y, int radius) {
		ensureIntegralImages();
		return windowSum(integral, x, y, radius) / windowCount(x, y, radius);
	}
	
	/**
	 * Get the (population) standard deviation of luminance within a square window, clipped to the image bounds.
	 * @param x
	 * @param y
	 * @param radius
	 * @return
	 */
	public double getLocalStdDev(int x, int y, int radius) {
		ensureIntegralImages();
		double n = windowCount(x, y, radius);
		double m = windowSum(integral, x, y, radius) / n;
		double m2 = windowSum(integralSquared, x, y, radius) / n;
		return Math.sqrt(Math.max(0, m2 - m * m));
	}
	
	private int windowCount(int x, int y, int radius) {
		int x1 = Math.max(0, x - radius);
		int x2 = Math.min(width, x + radius + 1);
		int y1 = Math.max(0, y - radius);
		int y2 = Math.min(height, y + radius + 1);
		return (x2 - x1) * (y2 - y1);
	}
	
	private double windowSum(double[] table, int x, int y, int radius) {
		int x1 = Math.max(0, x - radius);
		int x2 = Math.min(width, x + radius + 1);
		int y1 = Math.max(0, y - radius);
		int y2 = Math.min(height, y + radius + 1);
		int w = width + 1;
		return table[y2 * w + x2] - table[y1 * w + x2] - table[y2 * w + x1] + table[y1 * w + x1];
	}
	
	private synchronized void ensureIntegralImages() {
		if (integral != null)
			return;
		int w = width + 1;
		double[] sum = new double[w * (height + 1)];
		double[] sumSq = new double[sum.length];
		for (int y = 0; y < height; y++) {
			double rowSum = 0, rowSumSq = 0;
			for (int x = 0; x < width; x++) {
				double v = luminance[y * width + x];
				rowSum += v;
				rowSumSq += v * v;
				int ind = (y + 1) * w + x + 1;
				sum[ind] = sum[ind - w] + rowSum;
				sumSq[ind] = sumSq[ind - w] + rowSumSq;
			}
		}
		integralSquared = sumSq;
		integral = sum;
	}

}
