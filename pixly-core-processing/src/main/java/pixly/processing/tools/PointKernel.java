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

/**
 * Function applied independently to every pixel of an image.
 * 
 * @see KernelExecutor#applyPointKernel(pixly.lib.images.Bitmap, PointKernel)
 */
@FunctionalInterface
public interface PointKernel {
	
	/**
	 * Compute the output for a single pixel.
	 * <p>
	 * The output array is reused between calls, and is pre-filled with the input values so that 
	 * implementations need only set the channels they change. Values are clipped to 0-255 and rounded afterwards.
	 * 
	 * @param r red input value
	 * @param g green input value
	 * @param b blue input value
	 * @param a alpha input value
	 * @param out array of length 4 to hold the output R, G, B, A values
	 */
	void apply(int r, int g, int b, int a, double[] out);

}
