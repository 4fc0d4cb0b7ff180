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

package pixly.processing.ops;

import java.util.Locale;

import com.google.gson.annotations.SerializedName;

import pixly.lib.common.ColorTools;

/**
 * Methods to convert RGB values to a single gray value.
 */
public enum GrayscaleMethod {
	
	/**
	 * Mean of red, green and blue.
	 */
	@SerializedName("average") AVERAGE {
		@Override
		public double toGray(int r, int g, int b) {
			return (r + g + b) / 3.0;
		}
	},
	
	/**
	 * Weighted sum using {@link ColorTools#luminance(double, double, double)}.
	 */
	@SerializedName("luminance") LUMINANCE {
		@Override
		public double toGray(int r, int g, int b) {
			return ColorTools.luminance(r, g, b);
		}
	},
	
	/**
	 * Midpoint of the largest and smallest of red, green and blue.
	 */
	@SerializedName("desaturation") DESATURATION {
		@Override
		public double toGray(int r, int g, int b) {
			return (Math.max(r, Math.max(g, b)) + Math.min(r, Math.min(g, b))) / 2.0;
		}
	},
	
	/**
	 * Red channel only.
	 */
	@SerializedName("red") RED {
		@Override
		public double toGray(int r, int g, int b) {
			return r;
		}
	},
	
	/**
	 * Green channel only.
	 */
	@SerializedName("green") GREEN {
		@Override
		public double toGray(int r, int g, int b) {
			return g;
		}
	},
	
	/**
	 * Blue channel only.
	 */
	@SerializedName("blue") BLUE {
		@Override
		public double toGray(int r, int g, int b) {
			return b;
		}
	};
	
	/**
	 * Compute a gray value.
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 */
	public abstract double toGray(int r, int g, int b);
	
	/**
	 * Get the method with the specified name (case insensitive).
	 * @param name
	 * @return
	 * @throws IllegalArgumentException if the name is not recognized
	 */
	public static GrayscaleMethod fromString(String name) {
		for (var method : values()) {
			if (method.toString().equalsIgnoreCase(name == null ? null : name.trim()))
				return method;
		}
		throw new IllegalArgumentException("Unknown grayscale method: " + name);
	}
	
	@Override
	public String toString() {
		return name().toLowerCase(Locale.ROOT);
	}

}
