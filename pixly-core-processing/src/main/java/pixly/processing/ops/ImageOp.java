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

import pixly.lib.images.Bitmap;

/**
 * An operation that transforms one {@link Bitmap} into another.
 * <p>
 * Operations must not modify the input bitmap. Since {@link Bitmap} is immutable, this is guaranteed for any 
 * implementation that does not resort to reflection.
 * 
 * @see ImageOps
 */
@FunctionalInterface
public interface ImageOp {
	
	/**
	 * Apply the operation.
	 * 
	 * @param input the input image
	 * @return the output image, which may be the same as the input if nothing needs to change
	 */
	Bitmap apply(Bitmap input);
	
	/**
	 * Get a name for the operation, used when reporting errors.
	 * <p>
	 * The default returns the JSON type label for built-in ops (without the {@code op.} prefix), 
	 * or the simple class name otherwise.
	 * 
	 * @return
	 */
	default String getName() {
		return ImageOps.getName(this);
	}

}
