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

import java.nio.ByteBuffer;
import java.util.Objects;

import pixly.lib.common.URLTools;
import pixly.lib.images.codecs.ImageFormat;

/**
 * Encoded image bytes, with views as a byte array, a read-only buffer, a blob and a data URL.
 * <p>
 * All views are created from the same encoded bytes; the image is never encoded again. 
 * The data URL is computed once, when it is first requested.
 */
public class EncodedImage {
	
	private final ImageFormat format;
	private final byte[] bytes;
	
	private volatile String dataURL;
	
	/**
	 * Constructor. The bytes are not copied, and must not be modified afterwards.
	 * @param format
	 * @param bytes
	 */
	public EncodedImage(ImageFormat format, byte[] bytes) {
		this.format = Objects.requireNonNull(format, "Format must not be null!");
		this.bytes = Objects.requireNonNull(bytes, "Bytes must not be null!");
	}
	
	/**
	 * Get the format of the encoded image.
	 * @return
	 */
	public ImageFormat getFormat() {
		return format;
	}
	
	/**
	 * Get the MIME type of the encoded image.
	 * @return
	 */
	public String getMimeType() {
		return format.getMimeType();
	}
	
	/**
	 * Get the number of encoded bytes.
	 * @return
	 */
	public int size() {
		return bytes.length;
	}
	
	/**
	 * Get a copy of the encoded bytes.
	 * @return
	 */
	public byte[] toBuffer() {
		return bytes.clone();
	}
	
	/**
	 * Get a read-only buffer wrapping the encoded bytes.
	 * @return
	 */
	public ByteBuffer toByteBuffer() {
		return ByteBuffer.wrap(bytes).asReadOnlyBuffer();
	}
	
	/**
	 * Get the encoded bytes as a blob with the MIME type of the format.
	 * @return
	 */
	public ImageBlob toBlob() {
		return new ImageBlob(getMimeType(), bytes);
	}
	
	/**
	 * Get a base64 data URL containing the encoded bytes.
	 * @return
	 */
	public String toDataURL() {
		String url = dataURL;
		if (url == null) {
			url = URLTools.toDataURL(getMimeType(), bytes);
			dataURL = url;
		}
		return url;
	}
	
	@Override
	public String toString() {
		return "EncodedImage [" + format + ", " + bytes.length + " bytes]";
	}

}
