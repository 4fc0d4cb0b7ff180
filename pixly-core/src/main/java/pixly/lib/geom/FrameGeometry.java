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

package pixly.lib.geom;

import java.util.Objects;

import pixly.lib.common.GeneralTools;

/**
 * The result of fitting an image into a frame: the size of the output canvas, the size the source 
 * should be scaled to, and where the scaled source should be placed on the canvas.
 * <p>
 * Offsets may be negative, in which case part of the scaled source lies outside the frame and is cropped.
 */
public final class FrameGeometry {
	
	private final int frameWidth;
	private final int frameHeight;
	private final int scaledWidth;
	private final int scaledHeight;
	private final int offsetX;
	private final int offsetY;
	
	private FrameGeometry(int frameWidth, int frameHeight, int scaledWidth, int scaledHeight, int offsetX, int offsetY) {
		this.frameWidth = frameWidth;
		this.frameHeight = frameHeight;
		this.scaledWidth = scaledWidth;
		this.scaledHeight = scaledHeight;
		this.offsetX = offsetX;
		this.offsetY = offsetY;
	}
	
	/**
	 * Calculate how a source image with the specified size should be fitted according to a {@link FitSpec}.
	 * 
	 * @param sourceWidth
	 * @param sourceHeight
	 * @param spec
	 * @return
	 * @throws IllegalArgumentException if the source dimensions are not positive
	 */
	public static FrameGeometry calculate(int sourceWidth, int sourceHeight, FitSpec spec) {
		Objects.requireNonNull(spec, "Fit specification must not be null!");
		if (sourceWidth <= 0 || sourceHeight <= 0)
			throw new IllegalArgumentException("Source dimensions must be > 0, but were " + sourceWidth + "x" + sourceHeight);
		
		double sw = sourceWidth;
		double sh = sourceHeight;
		int tw, th;
		if (spec.getWidth() == null) {
			th = spec.getHeight();
			tw = roundDimension(sw * th / sh);
		} else if (spec.getHeight() == null) {
			tw = spec.getWidth();
			th = roundDimension(sh * tw / sw);
		} else {
			tw = spec.getWidth();
			th = spec.getHeight();
		}
		
		double scaleX = tw / sw;
		double scaleY = th / sh;
		switch (spec.getFit()) {
		case FILL:
			return new FrameGeometry(tw, th, tw, th, 0, 0);
		case CONTAIN: {
			double scale = Math.min(scaleX, scaleY);
			int w = Math.min(tw, roundDimension(sw * scale));
			int h = Math.min(th, roundDimension(sh * scale));
			return placeInFrame(tw, th, w, h, spec.getAnchor());
		}
		case COVER: {
			double scale = Math.max(scaleX, scaleY);
			int w = Math.max(tw, roundDimension(sw * scale));
			int h = Math.max(th, roundDimension(sh * scale));
			return placeInFrame(tw, th, w, h, spec.getAnchor());
		}
		case INSIDE: {
			double scale = Math.min(1.0, Math.min(scaleX, scaleY));
			int w = Math.min(tw, roundDimension(sw * scale));
			int h = Math.min(th, roundDimension(sh * scale));
			return new FrameGeometry(w, h, w, h, 0, 0);
		}
		case OUTSIDE: {
			double scale = Math.max(1.0, Math.max(scaleX, scaleY));
			int w = Math.max(tw, roundDimension(sw * scale));
			int h = Math.max(th, roundDimension(sh * scale));
			return new FrameGeometry(w, h, w, h, 0, 0);
		}
		default:
			throw new IllegalArgumentException("Unsupported fit mode " + spec.getFit());
		}
	}
	
	private static FrameGeometry placeInFrame(int frameWidth, int frameHeight, int scaledWidth, int scaledHeight, Anchor anchor) {
		int x = (int)GeneralTools.roundHalfAwayFromZero((frameWidth - scaledWidth) * anchor.getHorizontal().getFraction());
		int y = (int)GeneralTools.roundHalfAwayFromZero((frameHeight - scaledHeight) * anchor.getVertical().getFraction());
		return new FrameGeometry(frameWidth, frameHeight, scaledWidth, scaledHeight, x, y);
	}
	
	private static int roundDimension(double value) {
		return (int)Math.max(1, GeneralTools.roundHalfAwayFromZero(value));
	}

	/**
	 * Width of the output canvas.
	 * @return
	 */
	public int getFrameWidth() {
		return frameWidth;
	}

	/**
	 * Height of the output canvas.
	 * @return
	 */
	public int getFrameHeight() {
		return frameHeight;
	}

	/**
	 * Width the source image should be scaled to.
	 * @return
	 */
	public int getScaledWidth() {
		return scaledWidth;
	}

	/**
	 * Height the source image should be scaled to.
	 * @return
	 */
	public int getScaledHeight() {
		return scaledHeight;
	}

	/**
	 * Horizontal position of the left edge of the scaled image within the frame.
	 * @return
	 */
	public int getOffsetX() {
		return offsetX;
	}

	/**
	 * Vertical position of the top edge of the scaled image within the frame.
	 * @return
	 */
	public int getOffsetY() {
		return offsetY;
	}
	
	/**
	 * Returns true if the scaled image covers the entire frame, so that no background is visible.
	 * @return
	 */
	public boolean coversFrame() {
		return offsetX <= 0 && offsetY <= 0 && 
				offsetX + scaledWidth >= frameWidth && 
				offsetY + scaledHeight >= frameHeight;
	}

	@Override
	public int hashCode() {
		return Objects.hash(frameWidth, frameHeight, scaledWidth, scaledHeight, offsetX, offsetY);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FrameGeometry))
			return false;
		FrameGeometry other = (FrameGeometry)obj;
		return frameWidth == other.frameWidth && frameHeight == other.frameHeight
				&& scaledWidth == other.scaledWidth && scaledHeight == other.scaledHeight
				&& offsetX == other.offsetX && offsetY == other.offsetY;
	}

	@Override
	public String toString() {
		return "FrameGeometry [frame=" + frameWidth + "x" + frameHeight + ", scaled=" + scaledWidth + "x" + scaledHeight
				+ ", offset=(" + offsetX + ", " + offsetY + ")]";
	}

}
