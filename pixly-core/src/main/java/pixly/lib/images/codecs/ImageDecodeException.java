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

/**
 * Exception thrown when encoded data cannot be decoded to a bitmap.
 */
public class ImageDecodeException extends ImageCodecException {
	
	private static final long serialVersionUID = 1L;

	/**
	 * Constructor.
	 * @param format
	 * @param message
	 * @param cause
	 */
	public ImageDecodeException(ImageFormat format, String message, Throwable cause) {
		super(format, message, cause);
	}
	
	/**
	 * Constructor.
	 * @param format
	 * @param message
	 */
	public ImageDecodeException(ImageFormat format, String message) {
		super(format, message);
	}

}
