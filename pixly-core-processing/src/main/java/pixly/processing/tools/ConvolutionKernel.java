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

import java.util.Arrays;

import pixly.lib.images.Bitmap;

/**
 * Square convolution kernel with an odd size, applied separately to the red, green and blue channels.
 * <p>
 * Each output value is {@code sum(weight * value) / divisor + offset}. Alpha is passed through unchanged.
 */
public final class ConvolutionKernel implements NeighborhoodKernel {
	
	private final int size;
	private final double[] weights;
	private final double divisor;
	private final double offset;
	
	private ConvolutionKernel(int size, double[] weights, double divisor, double offset) {
		if (size < 3 || size % 2 == 0)
			throw new IllegalArgumentException("Kernel size must be an odd number >= 3, but was " + size);
		if (weights == null || weights.length != size * size)
			throw new IllegalArgumentException("Kernel of size " + size + " needs " + (size * size) + " weights, but got " + 
					(weights == null ? 0 : weights.length));
		for (double w : weights) {
			if (!Double.isFinite(w))
				throw new IllegalArgumentException("Kernel weights must be finite: " + Arrays.toString(weights));
		}
		if (divisor == 0 || !Double.isFinite(divisor))
			throw new IllegalArgumentException("Kernel divisor must be finite and non-zero, but was " + divisor);
		if (!Double.isFinite(offset))
			throw new IllegalArgumentException("Kernel offset must be finite, but was " + offset);
		this.size = size;
		this.weights = weights.clone();
		this.divisor = divisor;
		this.offset = offset;
	}
	
	/**
	 * Create a kernel with a specified divisor and offset.
	 * @param size the kernel width and height; must be odd and &ge; 3
	 * @param weights row-major weights, of length {@code size * size}
	 * @param divisor
	 * @param offset
	 * @return
	 */
	public static ConvolutionKernel create(int size, double[] weights, double divisor, double offset) {
		return new ConvolutionKernel(size, weights, divisor, offset);
	}
	
	/**
	 * Create a kernel with no offset, and a divisor equal to the sum of the weights (or 1 if the weights sum to 0).
	 * @param size the kernel width and height; must be odd and &ge; 3
	 * @param weights row-major weights, of length {@code size * size}
	 * @return
	 */
	public static ConvolutionKernel create(int size, double[] weights) {
		double sum = weights == null ? 0 : Arrays.stream(weights).sum();
		return new ConvolutionKernel(size, weights, sum == 0 ? 1 : sum, 0);
	}
	
	/**
	 * Create a kernel with equal weights, which computes the mean of a (2 * radius + 1) square.
	 * @param radius
	 * @return
	 */
	public static ConvolutionKernel box(int radius) {
		int size = radius * 2 + 1;
		double[] weights = new double[size * size];
		Arrays.fill(weights, 1.0);
		return new ConvolutionKernel(size, weights, weights.length, 0);
	}
	
	/**
	 * Create a 3x3 sharpening kernel {@code [0, -i, 0, -i, 1 + 4i, -i, 0, -i, 0]}.
	 * @param intensity
	 * @return
	 */
	public static ConvolutionKernel sharpen(double intensity) {
		double i = intensity;
		return new ConvolutionKernel(3, new double[] {
				0, -i, 0,
				-i, 1 + 4 * i, -i,
				0, -i, 0
		}, 1, 0);
	}
	
	/**
	 * Get the kernel width (and height).
	 * @return
	 */
	public int getSize() {
		return size;
	}
	
	@Override
	public int getRadius() {
		return size / 2;
	}
	
	/**
	 * Get a copy of the row-major weights.
	 * @return
	 */
	public double[] getWeights() {
		return weights.clone();
	}
	
	/**
	 * Get the divisor.
	 * @return
	 */
	public double getDivisor() {
		return divisor;
	}
	
	/**
	 * Get the offset added after division.
	 * @return
	 */
	public double getOffset() {
		return offset;
	}

	@Override
	public void apply(byte[] src, int width, int x, int y, double[] out) {
		int r = size / 2;
		double sumR = 0, sumG = 0, sumB = 0;
		int k = 0;
		for (int ky = -r; ky <= r; ky++) {
			int row = (y + ky) * width;
			for (int kx = -r; kx <= r; kx++) {
				double w = weights[k++];
				if (w == 0)
					continue;
				int ind = (row + x + kx) * Bitmap.CHANNELS;
				sumR += (src[ind] & 0xff) * w;
				sumG += (src[ind+1] & 0xff) * w;
				sumB += (src[ind+2] & 0xff) * w;
			}
		}
		out[0] = sumR / divisor + offset;
		out[1] = sumG / divisor + offset;
		out[2] = sumB / divisor + offset;
		out[3] = src[(y * width + x) * Bitmap.CHANNELS + 3] & 0xff;
	}

	@Override
	public int hashCode() {
		return 31 * (31 * (31 * size + Arrays.hashCode(weights)) + Double.hashCode(divisor)) + Double.hashCode(offset);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ConvolutionKernel))
			return false;
		ConvolutionKernel other = (ConvolutionKernel)obj;
		return size == other.size && divisor == other.divisor && offset == other.offset 
				&& Arrays.equals(weights, other.weights);
	}

	@Override
	public String toString() {
		return "ConvolutionKernel [size=" + size + ", divisor=" + divisor + ", offset=" + offset + "]";
	}

}
