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

import java.util.Locale;
import java.util.Objects;

import com.google.gson.annotations.SerializedName;

/**
 * Horizontal and vertical position used to place a scaled image within a frame, 
 * e.g. to determine which part of the image is kept when cropping.
 */
public final class Anchor {
	
	/**
	 * Horizontal position.
	 */
	public enum Horizontal {
		/**
		 * Left edge.
		 */
		@SerializedName("left") LEFT(0.0),
		/**
		 * Centered.
		 */
		@SerializedName("center") CENTER(0.5),
		/**
		 * Right edge.
		 */
		@SerializedName("right") RIGHT(1.0);
		
		private final double fraction;
		
		Horizontal(double fraction) {
			this.fraction = fraction;
		}
		
		/**
		 * Proportion of any spare width that should be placed before the image.
		 * @return 0 for left, 0.5 for center, 1 for right
		 */
		public double getFraction() {
			return fraction;
		}
		
		@Override
		public String toString() {
			return name().toLowerCase(Locale.ROOT);
		}
	}
	
	/**
	 * Vertical position.
	 */
	public enum Vertical {
		/**
		 * Top edge.
		 */
		@SerializedName("top") TOP(0.0),
		/**
		 * Centered.
		 */
		@SerializedName("center") CENTER(0.5),
		/**
		 * Bottom edge.
		 */
		@SerializedName("bottom") BOTTOM(1.0);
		
		private final double fraction;
		
		Vertical(double fraction) {
			this.fraction = fraction;
		}
		
		/**
		 * Proportion of any spare height that should be placed above the image.
		 * @return 0 for top, 0.5 for center, 1 for bottom
		 */
		public double getFraction() {
			return fraction;
		}
		
		@Override
		public String toString() {
			return name().toLowerCase(Locale.ROOT);
		}
	}
	
	/**
	 * Centered in both dimensions, the default anchor.
	 */
	public static final Anchor CENTER = new Anchor(Horizontal.CENTER, Vertical.CENTER);
	
	private final Horizontal horizontal;
	private final Vertical vertical;
	
	private Anchor(Horizontal horizontal, Vertical vertical) {
		this.horizontal = horizontal;
		this.vertical = vertical;
	}
	
	/**
	 * Get an anchor. Null values are replaced by {@code CENTER}.
	 * @param horizontal
	 * @param vertical
	 * @return
	 */
	public static Anchor of(Horizontal horizontal, Vertical vertical) {
		return new Anchor(
				horizontal == null ? Horizontal.CENTER : horizontal,
				vertical == null ? Vertical.CENTER : vertical);
	}
	
	/**
	 * Parse an anchor from a String.
	 * <p>
	 * Accepts a single position ("left", "top", "center"), or a horizontal position followed by a vertical 
	 * position separated by whitespace ("left top", "right center"). Any position that is not given is centered.
	 * 
	 * @param text
	 * @return
	 * @throws IllegalArgumentException if the text cannot be parsed
	 */
	public static Anchor parse(String text) {
		if (text == null || text.isBlank())
			return CENTER;
		String[] tokens = text.strip().toLowerCase(Locale.ROOT).split("\\s+");
		if (tokens.length > 2)
			throw new IllegalArgumentException("Cannot parse anchor from '" + text + "'");
		Horizontal horizontal = null;
		Vertical vertical = null;
		if (tokens.length == 1) {
			String token = tokens[0];
			if ("center".equals(token))
				return CENTER;
			horizontal = parseHorizontal(token);
			if (horizontal == null)
				vertical = parseVertical(token);
			if (horizontal == null && vertical == null)
				throw new IllegalArgumentException("Cannot parse anchor from '" + text + "'");
		} else {
			horizontal = parseHorizontal(tokens[0]);
			vertical = parseVertical(tokens[1]);
			if (horizontal == null || vertical == null)
				throw new IllegalArgumentException("Cannot parse anchor from '" + text + "' - expected '<left|center|right> <top|center|bottom>'");
		}
		return of(horizontal, vertical);
	}
	
	private static Horizontal parseHorizontal(String token) {
		for (var h : Horizontal.values()) {
			if (h.toString().equals(token))
				return h;
		}
		return null;
	}
	
	private static Vertical parseVertical(String token) {
		for (var v : Vertical.values()) {
			if (v.toString().equals(token))
				return v;
		}
		return null;
	}
	
	/**
	 * Get the horizontal position.
	 * @return
	 */
	public Horizontal getHorizontal() {
		return horizontal;
	}
	
	/**
	 * Get the vertical position.
	 * @return
	 */
	public Vertical getVertical() {
		return vertical;
	}

	@Override
	public int hashCode() {
		return Objects.hash(horizontal, vertical);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Anchor))
			return false;
		Anchor other = (Anchor)obj;
		return horizontal == other.horizontal && vertical == other.vertical;
	}

	@Override
	public String toString() {
		return horizontal + " " + vertical;
	}

}
