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

import com.google.gson.annotations.SerializedName;

/**
 * Policy governing how a source image is scaled, cropped or padded into a target frame.
 */
public enum FitMode {
	
	/**
	 * Preserve aspect ratio, keep the whole image visible within the target frame and fill any remainder with the background.
	 */
	@SerializedName("contain") CONTAIN,
	
	/**
	 * Preserve aspect ratio, scale the image so that it covers the whole target frame and crop anything outside.
	 */
	@SerializedName("cover") COVER,
	
	/**
	 * Ignore aspect ratio, stretch the image to exactly the target size.
	 */
	@SerializedName("fill") FILL,
	
	/**
	 * Preserve aspect ratio, make the image as large as possible with dimensions &le; the target, without enlarging it.
	 */
	@SerializedName("inside") INSIDE,
	
	/**
	 * Preserve aspect ratio, make the image as small as possible with dimensions &ge; the target, without reducing it.
	 */
	@SerializedName("outside") OUTSIDE;
	
	/**
	 * Get the fit mode matching a name (ignoring case), e.g. "cover".
	 * @param name
	 * @return
	 * @throws IllegalArgumentException if the name is not recognized
	 */
	public static FitMode fromString(String name) {
		if (name != null) {
			for (var mode : values()) {
				if (mode.name().equalsIgnoreCase(name.strip()))
					return mode;
			}
		}
		throw new IllegalArgumentException("Unknown fit mode: " + name);
	}
	
	@Override
	public String toString() {
		return name().toLowerCase(Locale.ROOT);
	}

}
