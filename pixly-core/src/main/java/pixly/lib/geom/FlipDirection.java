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
 * Direction in which an image is mirrored.
 */
public enum FlipDirection {
	
	/**
	 * Mirror left to right.
	 */
	@SerializedName("horizontal") HORIZONTAL,
	
	/**
	 * Mirror top to bottom.
	 */
	@SerializedName("vertical") VERTICAL,
	
	/**
	 * Mirror in both directions, equivalent to a rotation by 180 degrees.
	 */
	@SerializedName("both") BOTH;
	
	/**
	 * Returns true if columns are reversed.
	 * @return
	 */
	public boolean isHorizontal() {
		return this != VERTICAL;
	}
	
	/**
	 * Returns true if rows are reversed.
	 * @return
	 */
	public boolean isVertical() {
		return this != HORIZONTAL;
	}
	
	@Override
	public String toString() {
		return name().toLowerCase(Locale.ROOT);
	}

}
