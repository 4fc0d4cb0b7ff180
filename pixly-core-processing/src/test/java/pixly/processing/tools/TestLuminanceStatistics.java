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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import pixly.lib.images.Bitmap;

@SuppressWarnings("javadoc")
public class TestLuminanceStatistics {
	
	static Bitmap createGray(int width, int height, int... values) {
		byte[] pixels = new byte[width * height * Bitmap.CHANNELS];
		for (int i = 0; i < values.length; i++) {
			pixels[i * 4] = (byte)values[i];
			pixels[i * 4 + 1] = (byte)values[i];
			pixels[i * 4 + 2] = (byte)values[i];
			pixels[i * 4 + 3] = (byte)255;
		}
		return Bitmap.create(width, height, pixels);
	}
	
	@Test
	public void test_global() {
		var stats = LuminanceStatistics.compute(createGray(2, 2, 0, 100, 100, 200));
		assertEquals(4, stats.getPixelCount());
		assertEquals(100, stats.getLuminance(1), 1e-9);
		assertEquals(100, stats.getMean(), 1e-9);
		assertEquals(Math.sqrt(5000), stats.getStdDev(), 1e-9);
		
		int[] histogram = stats.getHistogram();
		assertEquals(1, histogram[0]);
		assertEquals(2, histogram[100]);
		assertEquals(1, histogram[200]);
		
		double[] cdf = stats.getNormalizedCDF();
		assertEquals(0.25, cdf[0], 1e-9);
		assertEquals(0.25, cdf[99], 1e-9);
		assertEquals(0.75, cdf[100], 1e-9);
		assertEquals(1.0, cdf[255], 1e-9);
	}
	
	@Test
	public void test_luminanceWeights() {
		byte[] red = {(byte)255, 0, 0, (byte)255};
		var stats = LuminanceStatistics.compute(Bitmap.create(1, 1, red));
		assertEquals(0.299 * 255, stats.getLuminance(0), 1e-9);
		assertEquals(76, indexOfMax(stats.getHistogram()));
	}
	
	private static int indexOfMax(int[] values) {
		int ind = 0;
		for (int i = 1; i < values.length; i++) {
			if (values[i] > values[ind])
				ind = i;
		}
		return ind;
	}
	
	@Test
	public void test_local() {
		var stats = LuminanceStatistics.compute(createGray(3, 3, 
				0, 0, 0,
				0, 90, 0,
				0, 0, 180));
		// Full window
		assertEquals(30, stats.getLocalMean(1, 1, 1), 1e-9);
		// Window clipped to the top left 2x2 pixels
		assertEquals(22.5, stats.getLocalMean(0, 0, 1), 1e-9);
		// Window clipped to the bottom right 2x2 pixels
		assertEquals(67.5, stats.getLocalMean(2, 2, 1), 1e-9);
		assertEquals(180, stats.getLocalMean(2, 2, 0), 1e-9);
		assertEquals(0, stats.getLocalStdDev(2, 2, 0), 1e-9);
		// Values 0, 0, 90, 180
		double mean = 67.5;
		double expected = Math.sqrt((2 * mean * mean + (90 - mean) * (90 - mean) + (180 - mean) * (180 - mean)) / 4);
		assertEquals(expected, stats.getLocalStdDev(2, 2, 1), 1e-6);
		// Large radius covers everything
		assertEquals(stats.getMean(), stats.getLocalMean(0, 2, 10), 1e-9);
		assertEquals(stats.getStdDev(), stats.getLocalStdDev(0, 2, 10), 1e-6);
	}

}
