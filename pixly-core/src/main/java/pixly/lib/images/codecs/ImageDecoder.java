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

package pixly.lib.images.codecs;

import pixly.lib.images.Bitmap;

/**
 * Convert encoded image data into a {@link Bitmap}.
 * <p>
 * Implementations must not return a placeholder image if the data cannot be read; 
 * they should throw an {@link ImageDecodeException} instead.
 * 
 * @see ImageCodecs#decoder(ImageFormat)
 * @see ImageCodecs#autoDecoder()
 */
@FunctionalInterface
public interface ImageDecoder {
	
	/**
	 * Decode an image.
	 * @param data the encoded image
	 * @return the decoded bitmap
	 * @throws ImageDecodeException if the image cannot be decoded
	 */
	Bitmap decode(byte[] data) throws ImageDecodeException;

}
