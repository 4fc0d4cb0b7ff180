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

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixly.lib.common.LogTools;

/**
 * Identify image formats from the signature bytes at the start of the encoded data.
 */
public class ImageFormatSniffer {
	
	private final static Logger logger = LoggerFactory.getLogger(ImageFormatSniffer.class);
	
	/**
	 * Format assumed whenever no signature matches.
	 */
	public static final ImageFormat DEFAULT_FORMAT = ImageFormat.PNG;
	
	private static final int[] PNG_SIGNATURE = {0x89, 0x50, 0x4E, 0x47};
	private static final int[] JPEG_SIGNATURE = {0xFF, 0xD8};
	private static final int[] RIFF = {0x52, 0x49, 0x46, 0x46};
	private static final int[] WEBP = {0x57, 0x45, 0x42, 0x50};
	private static final int[] JXL_CONTAINER = {0x00, 0x00, 0x00, 0x0C, 0x6A, 0x58, 0x4C, 0x20};
	private static final int[] FTYP = {0x66, 0x74, 0x79, 0x70};
	private static final int[] AVIF_BRAND = {0x61, 0x76, 0x69, 0x66};
	private static final int[] QOI_MAGIC = {0x71, 0x6F, 0x69, 0x66};
	
	private ImageFormatSniffer() {
		throw new AssertionError("Cannot instantiate this class");
	}
	
	/**
	 * Identify the format of encoded image data from its signature.
	 * 
	 * @param bytes the encoded image, or at least its first 12 bytes
	 * @return the format, or empty if no known signature was found
	 */
	public static Optional<ImageFormat> sniff(byte[] bytes) {
		if (bytes == null)
			return Optional.empty();
		if (matches(bytes, 0, PNG_SIGNATURE))
			return Optional.of(ImageFormat.PNG);
		if (matches(bytes, 0, JPEG_SIGNATURE))
			return Optional.of(ImageFormat.JPEG);
		if (matches(bytes, 0, RIFF) && matches(bytes, 8, WEBP))
			return Optional.of(ImageFormat.WEBP);
		if (matches(bytes, 0, JXL_CONTAINER))
			return Optional.of(ImageFormat.JXL);
		if (matches(bytes, 4, FTYP) && matches(bytes, 8, AVIF_BRAND))
			return Optional.of(ImageFormat.AVIF);
		if (matches(bytes, 0, QOI_MAGIC))
			return Optional.of(ImageFormat.QOI);
		return Optional.empty();
	}
	
	/**
	 * Identify the format of encoded image data, falling back to {@link #DEFAULT_FORMAT} if no signature matches.
	 * 
	 * @param bytes
	 * @return
	 */
	public static ImageFormat detect(byte[] bytes) {
		var format = sniff(bytes);
		if (format.isPresent()) {
			logger.debug("Detected image format {}", format.get());
			return format.get();
		}
		LogTools.warnOnce(logger, "Unrecognized image signature, will assume " + DEFAULT_FORMAT);
		return DEFAULT_FORMAT;
	}
	
	private static boolean matches(byte[] bytes, int offset, int[] signature) {
		if (bytes.length < offset + signature.length)
			return false;
		for (int i = 0; i < signature.length; i++) {
			if ((bytes[offset + i] & 0xff) != signature[i])
				return false;
		}
		return true;
	}

}
