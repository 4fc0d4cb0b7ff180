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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import pixly.lib.images.Bitmap;
import pixly.lib.images.Color;

@SuppressWarnings("javadoc")
public class TestConvolutionKernel {
	
	@Test
	public void test_create() {
		var kernel = ConvolutionKernel.create(3, new double[] {1, 2, 1, 2, 4, 2, 1, 2, 1});
		assertEquals(3, kernel.getSize());
		assertEquals(1, kernel.getRadius());
		assertEquals(16.0, kernel.getDivisor());
		assertEquals(0.0, kernel.getOffset());
		assertTrue(kernel.hasInterior(3, 3));
		assertFalse(kernel.hasInterior(2, 3));
		assertFalse(kernel.hasInterior(3, 2));
		
		var laplacian = ConvolutionKernel.create(3, new double[] {0, 1, 0, 1, -4, 1, 0, 1, 0});
		assertEquals(1.0, laplacian.getDivisor());
		
		var box = ConvolutionKernel.box(2);
		assertEquals(5, box.getSize());
		assertEquals(25.0, box.getDivisor());
		
		var weights = kernel.getWeights();
		weights[0] = 100;
		assertEquals(1.0, kernel.getWeights()[0]);
	}
	
	@Test
	public void test_invalid() {
		assertThrows(IllegalArgumentException.class, () -> ConvolutionKernel.create(1, new double[] {1}));
		assertThrows(IllegalArgumentException.class, () -> ConvolutionKernel.create(4, new double[16]));
		assertThrows(IllegalArgumentException.class, () -> ConvolutionKernel.create(3, new double[8]));
		assertThrows(IllegalArgumentException.class, () -> ConvolutionKernel.create(3, null));
		assertThrows(IllegalArgumentException.class, () -> ConvolutionKernel.create(3, new double[] {1, 1, 1, 1, Double.NaN, 1, 1, 1, 1}));
		assertThrows(IllegalArgumentException.class, () -> ConvolutionKernel.create(3, new double[9], 0, 0));
		assertThrows(IllegalArgumentException.class, () -> ConvolutionKernel.create(3, new double[9], 1, Double.POSITIVE_INFINITY));
	}
	
	@Test
	public void test_equals() {
		double[] weights = {0, -1, 0, -1, 5, -1, 0, -1, 0};
		assertEquals(ConvolutionKernel.sharpen(1), ConvolutionKernel.create(3, weights, 1, 0));
		assertEquals(ConvolutionKernel.sharpen(1).hashCode(), ConvolutionKernel.create(3, weights, 1, 0).hashCode());
		assertNotEquals(ConvolutionKernel.sharpen(1), ConvolutionKernel.create(3, weights, 1, 1));
	}
	
	@Test
	public void test_apply() {
		// Identity kernel with an offset
		var kernel = ConvolutionKernel.create(3, new double[] {0, 0, 0, 0, 1, 0, 0, 0, 0}, 1, 10);
		var bitmap = TestKernelExecutor.createRandom(3, 3, 7L);
		double[] out = new double[4];
		kernel.apply(bitmap.getPixels(), 3, 1, 1, out);
		for (int c = 0; c < 3; c++)
			assertEquals(bitmap.getValue(1, 1, c) + 10, out[c], 1e-9);
		assertEquals(bitmap.getValue(1, 1, 3), out[3]);
		
		// Mean of a uniform region is unchanged
		var uniform = Bitmap.createFilled(5, 5, Color.rgba(20, 40, 60, 80));
		ConvolutionKernel.box(2).apply(uniform.getPixels(), 5, 2, 2, out);
		assertArrayEquals(new double[] {20, 40, 60, 80}, out, 1e-9);
	}
	
	@Test
	public void test_sobel() {
		// Two black columns on the left, three white columns on the right
		byte[] pixels = new byte[5 * 5 * Bitmap.CHANNELS];
		for (int y = 0; y < 5; y++) {
			for (int x = 0; x < 5; x++) {
				int ind = (y * 5 + x) * Bitmap.CHANNELS;
				byte v = (byte)(x < 2 ? 0 : 255);
				pixels[ind] = v;
				pixels[ind+1] = v;
				pixels[ind+2] = v;
				pixels[ind+3] = (byte)255;
			}
		}
		var output = KernelExecutor.applyNeighborhoodKernel(Bitmap.create(5, 5, pixels), new SobelKernel(100), false);
		for (int y = 1; y < 4; y++) {
			assertEquals(Color.WHITE, output.getColor(1, y));
			assertEquals(Color.WHITE, output.getColor(2, y));
			assertEquals(Color.BLACK, output.getColor(3, y));
		}
		// Magnitude at the edge is 4 * 255
		assertEquals(1020, SobelKernel.magnitude(pixels, 5, 2, 2), 1e-6);
		assertEquals(0, SobelKernel.magnitude(pixels, 5, 3, 2), 1e-6);
	}

}
