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

import java.io.IOException;

import pixly.lib.images.Bitmap;

/**
 * Service provider for reading and writing one image format.
 * <p>
 * Additional codecs can be installed by listing them in 
 * {@code META-INF/services/pixly.lib.images.codecs.ImageCodec}; 
 * these take precedence over the built-in codecs for the same format.
 * 
 * @see ImageCodecs
 */
public interface ImageCodec {
	
	/**
	 * Get the format handled by this codec.
	 * @return
	 */
	ImageFormat getFormat();
	
	/**
	 * Get a readable name for the codec.
	 * @return
	 */
	default String getName() {
		return getFormat() + " (" + getClass().getSimpleName() + ")";
	}
	
	/**
	 * Perform any one-time setup required before decoding or encoding, such as loading native libraries.
	 * <p>
	 * This is called by {@link ImageCodecs} at most once successfully per codec instance, before the first 
	 * call to {@link #decode(byte[])} or {@link #encode(Bitmap, EncodeOptions)}.
	 * 
	 * @throws IOException if the codec cannot be initialized
	 */
	default void initialize() throws IOException {}
	
	/**
	 * Returns true if this codec is currently able to decode images.
	 * @return
	 */
	boolean canDecode();
	
	/**
	 * Returns true if this codec is currently able to encode images.
	 * @return
	 */
	boolean canEncode();
	
	/**
	 * Decode an image.
	 * @param data
	 * @return
	 * @throws ImageDecodeException
	 */
	Bitmap decode(byte[] data) throws ImageDecodeException;
	
	/**
	 * Encode an image.
	 * @param bitmap
	 * @param options encoding options; values that are not set should be taken from {@link EncodeOptions#defaults(ImageFormat)}
	 * @return
	 * @throws ImageEncodeException
	 */
	byte[] encode(Bitmap bitmap, EncodeOptions options) throws ImageEncodeException;

}
