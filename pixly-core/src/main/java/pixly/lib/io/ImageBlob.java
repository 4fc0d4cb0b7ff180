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

package pixly.lib.io;

import java.util.Arrays;
import java.util.Objects;

/**
 * Binary data with an associated MIME type.
 */
public final class ImageBlob {
	
	private final String mimeType;
	private final byte[] bytes;
	
	/**
	 * Constructor. The bytes are copied.
	 * @param mimeType the MIME type, e.g. "image/png"
	 * @param bytes
	 */
	public ImageBlob(String mimeType, byte[] bytes) {
		this.mimeType = Objects.requireNonNull(mimeType, "MIME type must not be null!");
		this.bytes = Objects.requireNonNull(bytes, "Bytes must not be null!").clone();
	}
	
	/**
	 * Get the MIME type.
	 * @return
	 */
	public String getMimeType() {
		return mimeType;
	}
	
	/**
	 * Get the number of bytes.
	 * @return
	 */
	public int size() {
		return bytes.length;
	}
	
	/**
	 * Get a copy of the bytes.
	 * @return
	 */
	public byte[] getBytes() {
		return bytes.clone();
	}

	@Override
	public int hashCode() {
		return 31 * mimeType.hashCode() + Arrays.hashCode(bytes);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ImageBlob))
			return false;
		ImageBlob other = (ImageBlob)obj;
		return mimeType.equals(other.mimeType) && Arrays.equals(bytes, other.bytes);
	}

	@Override
	public String toString() {
		return "ImageBlob [" + mimeType + ", " + bytes.length + " bytes]";
	}

}
