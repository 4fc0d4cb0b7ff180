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

import java.util.Objects;

import pixly.lib.images.Bitmap;

/**
 * Convert a {@link Bitmap} into encoded image data of a specific format.
 * 
 * @see ImageCodecs#encoder(ImageFormat, EncodeOptions)
 */
public interface ImageEncoder {
	
	/**
	 * Get the format written by this encoder.
	 * @return
	 */
	ImageFormat getFormat();
	
	/**
	 * Encode an image.
	 * @param bitmap
	 * @return the encoded bytes
	 * @throws ImageEncodeException if the image cannot be encoded
	 */
	byte[] encode(Bitmap bitmap) throws ImageEncodeException;
	
	/**
	 * Get the MIME type of the encoded output.
	 * @return
	 */
	default String getMimeType() {
		return getFormat().getMimeType();
	}
	
	/**
	 * Create an encoder from a function that does the encoding.
	 * @param format the format of the output
	 * @param function
	 * @return
	 */
	static ImageEncoder create(ImageFormat format, EncodingFunction function) {
		Objects.requireNonNull(format, "Format must not be null!");
		Objects.requireNonNull(function, "Function must not be null!");
		return new ImageEncoder() {
			
			@Override
			public ImageFormat getFormat() {
				return format;
			}

			@Override
			public byte[] encode(Bitmap bitmap) throws ImageEncodeException {
				return function.encode(bitmap);
			}
			
			@Override
			public String toString() {
				return "ImageEncoder (" + format + ")";
			}
			
		};
	}
	
	/**
	 * Function performing the encoding for {@link ImageEncoder#create(ImageFormat, EncodingFunction)}.
	 */
	@FunctionalInterface
	interface EncodingFunction {
		
		/**
		 * Encode an image.
		 * @param bitmap
		 * @return
		 * @throws ImageEncodeException
		 */
		byte[] encode(Bitmap bitmap) throws ImageEncodeException;
		
	}

}
