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

package pixly.processing.pipeline;

import java.nio.ByteBuffer;
import java.util.Objects;

import pixly.lib.images.codecs.ImageFormat;
import pixly.lib.io.EncodedImage;
import pixly.lib.io.ImageBlob;

/**
 * The encoded output of a pipeline.
 * <p>
 * The image is encoded once; each view is derived from the same bytes.
 */
public final class ProcessingResult {
	
	private final EncodedImage image;
	private final int width;
	private final int height;
	
	ProcessingResult(EncodedImage image, int width, int height) {
		this.image = Objects.requireNonNull(image);
		this.width = width;
		this.height = height;
	}
	
	/**
	 * Get the output format.
	 * @return
	 */
	public ImageFormat getFormat() {
		return image.getFormat();
	}
	
	/**
	 * Get the MIME type of the output.
	 * @return
	 */
	public String getMimeType() {
		return image.getMimeType();
	}
	
	/**
	 * Width of the image that was encoded.
	 * @return
	 */
	public int getWidth() {
		return width;
	}
	
	/**
	 * Height of the image that was encoded.
	 * @return
	 */
	public int getHeight() {
		return height;
	}
	
	/**
	 * Number of encoded bytes.
	 * @return
	 */
	public int size() {
		return image.size();
	}
	
	/**
	 * Get a copy of the encoded bytes.
	 * @return
	 */
	public byte[] toBuffer() {
		return image.toBuffer();
	}
	
	/**
	 * Get a read-only view of the encoded bytes.
	 * @return
	 */
	public ByteBuffer toByteBuffer() {
		return image.toByteBuffer();
	}
	
	/**
	 * Get the encoded bytes with their MIME type.
	 * @return
	 */
	public ImageBlob toBlob() {
		return image.toBlob();
	}
	
	/**
	 * Get a base64 data URL. The result is computed once and cached.
	 * @return
	 */
	public String toDataURL() {
		return image.toDataURL();
	}
	
	/**
	 * Get the underlying encoded image.
	 * @return
	 */
	public EncodedImage getEncodedImage() {
		return image;
	}

	@Override
	public String toString() {
		return "ProcessingResult [" + getFormat() + ", " + width + "x" + height + ", " + size() + " bytes]";
	}

}
