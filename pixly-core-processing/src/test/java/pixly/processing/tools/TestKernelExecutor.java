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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import pixly.lib.common.Prefs;
import pixly.lib.images.Bitmap;
import pixly.lib.images.Color;

@SuppressWarnings("javadoc")
public class TestKernelExecutor {
	
	private int nThreads;
	private int parallelThreshold;
	
	@BeforeEach
	public void storePrefs() {
		nThreads = Prefs.getNumThreads();
		parallelThreshold = Prefs.getParallelThreshold();
	}
	
	@AfterEach
	public void restorePrefs() {
		Prefs.setNumThreads(nThreads);
		Prefs.setParallelThreshold(parallelThreshold);
	}
	
	static Bitmap createRandom(int width, int height, long seed) {
		byte[] pixels = new byte[width * height * Bitmap.CHANNELS];
		new Random(seed).nextBytes(pixels);
		return Bitmap.create(width, height, pixels);
	}
	
	@Test
	public void test_pointKernel() {
		var bitmap = Bitmap.createFilled(3, 2, Color.rgba(10, 20, 30, 40));
		var output = KernelExecutor.applyPointKernel(bitmap, (r, g, b, a, out) -> {
			out[0] = r * 2;
			out[1] = -1;
			out[2] = 1000;
		});
		for (int y = 0; y < 2; y++) {
			for (int x = 0; x < 3; x++)
				assertEquals(Color.rgba(20, 0, 255, 40), output.getColor(x, y));
		}
		// Input unchanged
		assertEquals(Color.rgba(10, 20, 30, 40), bitmap.getColor(0, 0));
	}
	
	@Test
	public void test_twoPass() {
		var bitmap = createRandom(5, 4, 1L);
		var output = KernelExecutor.applyTwoPass(bitmap, Bitmap::getWidth, (width, ind, r, g, b, a, out) -> {
			out[0] = ind % width;
			out[1] = ind / width;
		});
		for (int y = 0; y < 4; y++) {
			for (int x = 0; x < 5; x++) {
				assertEquals(x, output.getValue(x, y, 0));
				assertEquals(y, output.getValue(x, y, 1));
				assertEquals(bitmap.getValue(x, y, 2), output.getValue(x, y, 2));
			}
		}
	}
	
	@Test
	public void test_parallelMatchesSequential() {
		var bitmap = createRandom(57, 43, 2L);
		for (var kernel : Arrays.asList(ConvolutionKernel.box(2), ConvolutionKernel.sharpen(1.5), new SobelKernel(50))) {
			var expected = KernelExecutor.applyNeighborhoodKernel(bitmap, kernel, false);
			for (int n : new int[] {2, 3, 7, 64}) {
				Prefs.setNumThreads(n);
				assertEquals(expected, KernelExecutor.applyNeighborhoodKernel(bitmap, kernel, true));
			}
			// Default decision based upon the threshold
			Prefs.setParallelThreshold(1);
			assertEquals(expected, KernelExecutor.applyNeighborhoodKernel(bitmap, kernel));
		}
	}
	
	@Test
	public void test_threadCountChangedDuringProcessing() throws Exception {
		var bitmap = createRandom(64, 48, 5L);
		var kernel = ConvolutionKernel.box(1);
		var expected = KernelExecutor.applyNeighborhoodKernel(bitmap, kernel, false);
		
		var callers = Executors.newFixedThreadPool(4);
		try {
			List<Future<Bitmap>> results = new ArrayList<>();
			for (int i = 0; i < 100; i++)
				results.add(callers.submit(() -> KernelExecutor.applyNeighborhoodKernel(bitmap, kernel, true)));
			// Each change replaces the shared pool while other threads may be submitting rows
			for (int i = 0; i < 50; i++)
				Prefs.setNumThreads(2 + i % 4);
			for (var result : results)
				assertEquals(expected, result.get(30, TimeUnit.SECONDS));
		} finally {
			callers.shutdownNow();
		}
	}
	
	@Test
	public void test_borderUnchanged() {
		var bitmap = createRandom(20, 15, 3L);
		int radius = 2;
		var output = KernelExecutor.applyNeighborhoodKernel(bitmap, ConvolutionKernel.box(radius), false);
		assertNotEquals(bitmap, output);
		for (int y = 0; y < bitmap.getHeight(); y++) {
			for (int x = 0; x < bitmap.getWidth(); x++) {
				boolean border = x < radius || y < radius || x >= bitmap.getWidth() - radius || y >= bitmap.getHeight() - radius;
				if (border)
					assertEquals(bitmap.getColor(x, y), output.getColor(x, y));
			}
		}
	}
	
	@Test
	public void test_noInterior() {
		var bitmap = createRandom(4, 10, 4L);
		assertSame(bitmap, KernelExecutor.applyNeighborhoodKernel(bitmap, ConvolutionKernel.box(2)));
		var small = createRandom(3, 3, 5L);
		var output = KernelExecutor.applyNeighborhoodKernel(small, ConvolutionKernel.box(1));
		assertEquals(small.getColor(0, 0), output.getColor(0, 0));
	}
	
	@Test
	public void test_rows() {
		var bitmap = createRandom(6, 6, 6L);
		byte[] src = bitmap.getPixels();
		byte[] dst = src.clone();
		var kernel = ConvolutionKernel.box(1);
		KernelExecutor.applyNeighborhoodKernelToRows(src, dst, 6, 6, kernel, 2, 3);
		var expected = KernelExecutor.applyNeighborhoodKernel(bitmap, kernel, false);
		// Only row 2 has been written
		assertArrayEquals(Arrays.copyOfRange(expected.getPixels(), 2 * 6 * 4, 3 * 6 * 4), Arrays.copyOfRange(dst, 2 * 6 * 4, 3 * 6 * 4));
		assertArrayEquals(Arrays.copyOfRange(src, 3 * 6 * 4, src.length), Arrays.copyOfRange(dst, 3 * 6 * 4, dst.length));
		
		assertThrows(IllegalArgumentException.class, () -> KernelExecutor.applyNeighborhoodKernelToRows(src, dst, 6, 6, kernel, 0, 3));
		assertThrows(IllegalArgumentException.class, () -> KernelExecutor.applyNeighborhoodKernelToRows(src, dst, 6, 6, kernel, 1, 6));
	}

}
