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
 * Function that computes each output pixel from a square neighborhood of input pixels.
 * <p>
 * Implementations are only called for pixels whose entire neighborhood lies within the image, 
 * so they do not need to check bounds.
 * 
 * @see KernelExecutor#applyNeighborhoodKernel(pixly.lib.images.Bitmap, NeighborhoodKernel)
 */
public interface NeighborhoodKernel {
	
	/**
	 * Get the neighborhood radius, i.e. {@code floor(size/2)}.
	 * Pixels closer than this to the image edge are copied unchanged.
	 * @return
	 */
	int getRadius();
	
	/**
	 * Query whether an image of the given size has any pixels outside the border of width {@link #getRadius()}.
	 * @param width
	 * @param height
	 * @return true if at least one pixel would be computed by this kernel
	 */
	default boolean hasInterior(int width, int height) {
		int radius = getRadius();
		return width > 2 * radius && height > 2 * radius;
	}
	
	/**
	 * Compute the output for a single pixel.
	 * @param src the source RGBA pixels (read only)
	 * @param width the source width
	 * @param x the pixel column
	 * @param y the pixel row
	 * @param out array of length 4 to hold the output R, G, B, A values, which are clipped to 0-255 and rounded afterwards
	 */
	void apply(byte[] src, int width, int x, int y, double[] out);

}
