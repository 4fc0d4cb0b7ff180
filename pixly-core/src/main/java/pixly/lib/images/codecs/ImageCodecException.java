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

/**
 * Exception thrown whenever an image cannot be decoded or encoded.
 */
public class ImageCodecException extends IOException {
	
	private static final long serialVersionUID = 1L;
	
	private final ImageFormat format;
	
	/**
	 * Constructor.
	 * @param format the format being read or written; may be null if unknown
	 * @param message
	 * @param cause
	 */
	public ImageCodecException(ImageFormat format, String message, Throwable cause) {
		super(message, cause);
		this.format = format;
	}
	
	/**
	 * Constructor.
	 * @param format the format being read or written; may be null if unknown
	 * @param message
	 */
	public ImageCodecException(ImageFormat format, String message) {
		this(format, message, null);
	}
	
	/**
	 * Get the format that was being read or written, if known.
	 * @return the format, or null
	 */
	public ImageFormat getFormat() {
		return format;
	}

}
