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
 * Function that provides an output when an operation fails.
 * 
 * @see ImageOps.Core#safe(ImageOp, OpFallback)
 */
@FunctionalInterface
public interface OpFallback {
	
	/**
	 * Compute a replacement output.
	 * @param input the input that was passed to the failing operation
	 * @param exception the failure
	 * @return the output image
	 */
	Bitmap apply(Bitmap input, Exception exception);

}
