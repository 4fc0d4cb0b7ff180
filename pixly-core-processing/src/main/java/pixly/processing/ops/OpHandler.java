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
 * Function that applies an operation using a set of parameters.
 *
 * @param <P> the parameter type
 * @see ImageOps.Core#create(String, OpHandler, Object)
 */
@FunctionalInterface
public interface OpHandler<P> {
	
	/**
	 * Apply the operation.
	 * @param input the input image
	 * @param params parameters, as provided when the operation was created
	 * @return the output image
	 */
	Bitmap apply(Bitmap input, P params);

}
