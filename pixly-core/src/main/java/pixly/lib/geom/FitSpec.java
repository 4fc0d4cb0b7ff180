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

import pixly.lib.images.Color;

/**
 * Request to fit an image into a target frame.
 * <p>
 * At least one of the target width and height must be given; a missing dimension is derived from the 
 * source aspect ratio. Instances are immutable and validated on construction.
 * 
 * @see FrameGeometry
 */
public final class FitSpec {
	
	private final Integer width;
	private final Integer height;
	private final FitMode fit;
	private final Anchor anchor;
	private final Color background;
	
	private FitSpec(Builder builder) {
		this.width = builder.width;
		this.height = builder.height;
		this.fit = builder.fit;
		this.anchor = builder.anchor;
		this.background = builder.background;
		validate();
	}
	
	/**
	 * Check that this specification is valid.
	 * <p>
	 * This is called on construction, but may also be used to check instances that have been deserialized.
	 * 
	 * @throws IllegalArgumentException if the specification is invalid
	 */
	public void validate() {
		if (width == null && height == null)
			throw invalid("at least one of width or height must be provided");
		if (width != null && width <= 0)
			throw invalid("width must be > 0, but was " + width);
		if (height != null && height <= 0)
			throw invalid("height must be > 0, but was " + height);
	}
	
	private static IllegalArgumentException invalid(String message) {
		return new IllegalArgumentException("Invalid fit specification: " + message);
	}
	
	/**
	 * Create a fit specification with the default anchor and background.
	 * @param width target width, or null if this should be derived from the height
	 * @param height target height, or null if this should be derived from the width
	 * @param fit
	 * @return
	 */
	public static FitSpec of(Integer width, Integer height, FitMode fit) {
		return builder().width(width).height(height).fit(fit).build();
	}
	
	/**
	 * Create a new builder.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}
	
	/**
	 * Create a builder initialized with the values of this specification.
	 * @return
	 */
	public Builder toBuilder() {
		return new Builder()
				.width(width)
				.height(height)
				.fit(getFit())
				.anchor(getAnchor())
				.background(getBackground());
	}
	
	/**
	 * Get the target width.
	 * @return the target width, or null if it should be derived from the source aspect ratio
	 */
	public Integer getWidth() {
		return width;
	}

	/**
	 * Get the target height.
	 * @return the target height, or null if it should be derived from the source aspect ratio
	 */
	public Integer getHeight() {
		return height;
	}

	/**
	 * Get the fit mode.
	 * @return
	 */
	public FitMode getFit() {
		return fit == null ? FitMode.COVER : fit;
	}

	/**
	 * Get the anchor.
	 * @return
	 */
	public Anchor getAnchor() {
		return anchor == null ? Anchor.CENTER : anchor;
	}

	/**
	 * Get the background color, used wherever the frame is not covered by the image.
	 * @return
	 */
	public Color getBackground() {
		return background == null ? Color.TRANSPARENT_WHITE : background;
	}

	@Override
	public int hashCode() {
		return Objects.hash(width, height, getFit(), getAnchor(), getBackground());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FitSpec))
			return false;
		FitSpec other = (FitSpec)obj;
		return Objects.equals(width, other.width) && Objects.equals(height, other.height) 
				&& getFit() == other.getFit() && getAnchor().equals(other.getAnchor()) 
				&& getBackground().equals(other.getBackground());
	}

	@Override
	public String toString() {
		return "FitSpec [width=" + width + ", height=" + height + ", fit=" + getFit() + 
				", anchor=" + getAnchor() + ", background=" + getBackground() + "]";
	}
	
	
	/**
	 * Builder for {@link FitSpec}.
	 * The default fit is {@link FitMode#COVER}, the default anchor is centered and the default background is transparent white.
	 */
	public static class Builder {
		
		private Integer width;
		private Integer height;
		private FitMode fit = FitMode.COVER;
		private Anchor anchor = Anchor.CENTER;
		private Color background = Color.TRANSPARENT_WHITE;
		
		private Builder() {}
		
		/**
		 * Set the target width.
		 * @param width the width, or null to derive it from the height
		 * @return this builder
		 */
		public Builder width(Integer width) {
			this.width = width;
			return this;
		}
		
		/**
		 * Set the target height.
		 * @param height the height, or null to derive it from the width
		 * @return this builder
		 */
		public Builder height(Integer height) {
			this.height = height;
			return this;
		}
		
		/**
		 * Set the target width and height.
		 * @param width
		 * @param height
		 * @return this builder
		 */
		public Builder size(int width, int height) {
			return width(width).height(height);
		}
		
		/**
		 * Set the fit mode.
		 * @param fit
		 * @return this builder
		 */
		public Builder fit(FitMode fit) {
			this.fit = Objects.requireNonNull(fit, "Fit mode must not be null!");
			return this;
		}
		
		/**
		 * Set the anchor.
		 * @param anchor
		 * @return this builder
		 */
		public Builder anchor(Anchor anchor) {
			this.anchor = Objects.requireNonNull(anchor, "Anchor must not be null!");
			return this;
		}
		
		/**
		 * Set the anchor by parsing a String, e.g. "left top".
		 * @param anchor
		 * @return this builder
		 * @see Anchor#parse(String)
		 */
		public Builder anchor(String anchor) {
			return anchor(Anchor.parse(anchor));
		}
		
		/**
		 * Set the background color.
		 * @param background
		 * @return this builder
		 */
		public Builder background(Color background) {
			this.background = Objects.requireNonNull(background, "Background must not be null!");
			return this;
		}
		
		/**
		 * Build the fit specification.
		 * @return
		 * @throws IllegalArgumentException if the specification is invalid
		 */
		public FitSpec build() {
			return new FitSpec(this);
		}
		
	}

}
