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

import java.util.Objects;

import pixly.lib.common.ColorTools;
import pixly.lib.geom.FitSpec;
import pixly.lib.geom.FlipDirection;
import pixly.lib.geom.FrameGeometry;
import pixly.lib.images.Bitmap;
import pixly.lib.images.Color;

/**
 * Static methods for geometric transforms of a {@link Bitmap}: scaling, framing, cropping, flipping and rotating.
 */
public class TransformTools {
	
	// Suppress default constructor for non-instantiability
	private TransformTools() {
		throw new AssertionError();
	}
	
	/**
	 * Scale a bitmap to a new size using bilinear interpolation.
	 * Pixel centers are aligned, and samples beyond the edge are clamped to the nearest edge pixel.
	 * @param bitmap
	 * @param width
	 * @param height
	 * @return the scaled bitmap, or the input if the size is unchanged
	 */
	public static Bitmap scale(Bitmap bitmap, int width, int height) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Scaled size must be > 0, but was " + width + "x" + height);
		int sw = bitmap.getWidth();
		int sh = bitmap.getHeight();
		if (sw == width && sh == height)
			return bitmap;
		
		byte[] src = bitmap.getPixels();
		byte[] dst = new byte[width * height * Bitmap.CHANNELS];
		double xScale = sw / (double)width;
		double yScale = sh / (double)height;
		
		// Precompute column positions, since these are the same for every row
		int[] x0 = new int[width];
		int[] x1 = new int[width];
		double[] fx = new double[width];
		for (int x = 0; x < width; x++) {
			double xx = clamp((x + 0.5) * xScale - 0.5, sw - 1);
			x0[x] = (int)xx;
			x1[x] = Math.min(x0[x] + 1, sw - 1);
			fx[x] = xx - x0[x];
		}
		
		int ind = 0;
		for (int y = 0; y < height; y++) {
			double yy = clamp((y + 0.5) * yScale - 0.5, sh - 1);
			int y0 = (int)yy;
			int y1 = Math.min(y0 + 1, sh - 1);
			double fy = yy - y0;
			int row0 = y0 * sw;
			int row1 = y1 * sw;
			for (int x = 0; x < width; x++) {
				int i00 = (row0 + x0[x]) * Bitmap.CHANNELS;
				int i01 = (row0 + x1[x]) * Bitmap.CHANNELS;
				int i10 = (row1 + x0[x]) * Bitmap.CHANNELS;
				int i11 = (row1 + x1[x]) * Bitmap.CHANNELS;
				double wx = fx[x];
				for (int c = 0; c < Bitmap.CHANNELS; c++) {
					double top = (src[i00+c] & 0xff) * (1 - wx) + (src[i01+c] & 0xff) * wx;
					double bottom = (src[i10+c] & 0xff) * (1 - wx) + (src[i11+c] & 0xff) * wx;
					dst[ind++] = (byte)ColorTools.clip255(top * (1 - fy) + bottom * fy);
				}
			}
		}
		return Bitmap.wrap(width, height, dst);
	}
	
	private static double clamp(double v, double max) {
		return v < 0 ? 0 : (v > max ? max : v);
	}
	
	/**
	 * Resize a bitmap according to a fit specification.
	 * @param bitmap
	 * @param spec
	 * @return
	 * @see FrameGeometry
	 */
	public static Bitmap resize(Bitmap bitmap, FitSpec spec) {
		var geometry = FrameGeometry.calculate(bitmap.getWidth(), bitmap.getHeight(), spec);
		var scaled = scale(bitmap, geometry.getScaledWidth(), geometry.getScaledHeight());
		if (geometry.getFrameWidth() == scaled.getWidth() && geometry.getFrameHeight() == scaled.getHeight() 
				&& geometry.getOffsetX() == 0 && geometry.getOffsetY() == 0)
			return scaled;
		return placeOnCanvas(scaled, geometry.getFrameWidth(), geometry.getFrameHeight(), 
				geometry.getOffsetX(), geometry.getOffsetY(), spec.getBackground());
	}
	
	/**
	 * Create a new canvas filled with a background color, and copy a bitmap onto it.
	 * Any part of the bitmap that falls outside the canvas is discarded.
	 * @param bitmap the bitmap to place
	 * @param width canvas width
	 * @param height canvas height
	 * @param offsetX x-coordinate of the bitmap origin on the canvas; may be negative
	 * @param offsetY y-coordinate of the bitmap origin on the canvas; may be negative
	 * @param background canvas color
	 * @return
	 */
	public static Bitmap placeOnCanvas(Bitmap bitmap, int width, int height, int offsetX, int offsetY, Color background) {
		Objects.requireNonNull(background, "Background color must not be null!");
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Canvas size must be > 0, but was " + width + "x" + height);
		byte[] dst = new byte[width * height * Bitmap.CHANNELS];
		Bitmap.fill(dst, background);
		
		int sw = bitmap.getWidth();
		int sh = bitmap.getHeight();
		int x1 = Math.max(0, offsetX);
		int x2 = Math.min(width, offsetX + sw);
		int y1 = Math.max(0, offsetY);
		int y2 = Math.min(height, offsetY + sh);
		if (x2 > x1) {
			byte[] src = bitmap.getPixels();
			int rowLength = (x2 - x1) * Bitmap.CHANNELS;
			for (int y = y1; y < y2; y++) {
				int srcInd = ((y - offsetY) * sw + (x1 - offsetX)) * Bitmap.CHANNELS;
				int dstInd = (y * width + x1) * Bitmap.CHANNELS;
				System.arraycopy(src, srcInd, dst, dstInd, rowLength);
			}
		}
		return Bitmap.wrap(width, height, dst);
	}
	
	/**
	 * Extract a rectangle from a bitmap. Parts of the rectangle outside the bitmap are filled with the background.
	 * @param bitmap
	 * @param x
	 * @param y
	 * @param width
	 * @param height
	 * @param background
	 * @return
	 */
	public static Bitmap crop(Bitmap bitmap, int x, int y, int width, int height, Color background) {
		return placeOnCanvas(bitmap, width, height, -x, -y, background);
	}
	
	/**
	 * Mirror a bitmap.
	 * @param bitmap
	 * @param direction
	 * @return
	 */
	public static Bitmap flip(Bitmap bitmap, FlipDirection direction) {
		Objects.requireNonNull(direction, "Flip direction must not be null!");
		int w = bitmap.getWidth();
		int h = bitmap.getHeight();
		byte[] src = bitmap.getPixels();
		byte[] dst = new byte[src.length];
		for (int y = 0; y < h; y++) {
			int yy = direction.isVertical() ? h - 1 - y : y;
			for (int x = 0; x < w; x++) {
				int xx = direction.isHorizontal() ? w - 1 - x : x;
				System.arraycopy(src, (yy * w + xx) * Bitmap.CHANNELS, dst, (y * w + x) * Bitmap.CHANNELS, Bitmap.CHANNELS);
			}
		}
		return Bitmap.wrap(w, h, dst);
	}
	
	/**
	 * Rotate a bitmap clockwise about its center.
	 * <p>
	 * Multiples of 90 degrees are exact. For other angles the canvas is expanded to hold the rotated image, 
	 * pixels are sampled using nearest neighbor interpolation, and uncovered pixels are filled with the background.
	 * @param bitmap
	 * @param degrees clockwise rotation; negative values rotate counter-clockwise
	 * @param background
	 * @return
	 */
	public static Bitmap rotate(Bitmap bitmap, double degrees, Color background) {
		if (!Double.isFinite(degrees))
			throw new IllegalArgumentException("Rotation must be finite, but was " + degrees);
		double normalized = degrees % 360;
		if (normalized < 0)
			normalized += 360;
		if (normalized == 0)
			return bitmap;
		if (normalized % 90 == 0)
			return rotateQuadrants(bitmap, (int)(normalized / 90));
		return rotateArbitrary(bitmap, Math.toRadians(normalized), background);
	}
	
	private static Bitmap rotateQuadrants(Bitmap bitmap, int quadrants) {
		int w = bitmap.getWidth();
		int h = bitmap.getHeight();
		if (quadrants == 2)
			return flip(bitmap, FlipDirection.BOTH);
		byte[] src = bitmap.getPixels();
		byte[] dst = new byte[src.length];
		// Output is transposed, so has size h x w
		int ind = 0;
		for (int y = 0; y < w; y++) {
			for (int x = 0; x < h; x++) {
				int sx, sy;
				if (quadrants == 1) {
					sx = y;
					sy = h - 1 - x;
				} else {
					sx = w - 1 - y;
					sy = x;
				}
				System.arraycopy(src, (sy * w + sx) * Bitmap.CHANNELS, dst, ind, Bitmap.CHANNELS);
				ind += Bitmap.CHANNELS;
			}
		}
		return Bitmap.wrap(h, w, dst);
	}
	
	private static Bitmap rotateArbitrary(Bitmap bitmap, double theta, Color background) {
		Objects.requireNonNull(background, "Background color must not be null!");
		int w = bitmap.getWidth();
		int h = bitmap.getHeight();
		double cos = Math.cos(theta);
		double sin = Math.sin(theta);
		int dw = (int)Math.max(1, Math.round(Math.abs(w * cos) + Math.abs(h * sin)));
		int dh = (int)Math.max(1, Math.round(Math.abs(w * sin) + Math.abs(h * cos)));
		
		byte[] src = bitmap.getPixels();
		byte[] dst = new byte[dw * dh * Bitmap.CHANNELS];
		Bitmap.fill(dst, background);
		double cxSrc = w / 2.0;
		double cySrc = h / 2.0;
		double cxDst = dw / 2.0;
		double cyDst = dh / 2.0;
		for (int y = 0; y < dh; y++) {
			double dy = y + 0.5 - cyDst;
			for (int x = 0; x < dw; x++) {
				double dx = x + 0.5 - cxDst;
				// Inverse rotation maps the output pixel center back to the source
				int sx = (int)Math.floor(dx * cos + dy * sin + cxSrc);
				int sy = (int)Math.floor(-dx * sin + dy * cos + cySrc);
				if (sx < 0 || sy < 0 || sx >= w || sy >= h)
					continue;
				System.arraycopy(src, (sy * w + sx) * Bitmap.CHANNELS, dst, (y * dw + x) * Bitmap.CHANNELS, Bitmap.CHANNELS);
			}
		}
		return Bitmap.wrap(dw, dh, dst);
	}

}
