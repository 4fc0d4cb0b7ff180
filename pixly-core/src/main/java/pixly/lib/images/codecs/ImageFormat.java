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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Image formats known to Pixly, with their MIME types and file extensions.
 */
public enum ImageFormat {
	
	/**
	 * Portable Network Graphics (lossless).
	 */
	PNG("image/png", "png", true, "png"),
	
	/**
	 * JPEG (lossy, no alpha).
	 */
	JPEG("image/jpeg", "jpeg", false, "jpg", "jpeg"),
	
	/**
	 * WebP.
	 */
	WEBP("image/webp", "webp", false, "webp"),
	
	/**
	 * AV1 Image File Format.
	 */
	AVIF("image/avif", "avif", false, "avif"),
	
	/**
	 * JPEG XL.
	 */
	JXL("image/jxl", "jxl", false, "jxl"),
	
	/**
	 * Quite OK Image format (lossless).
	 */
	QOI("image/qoi", "qoi", true, "qoi");
	
	private final String mimeType;
	private final String imageIOName;
	private final boolean lossless;
	private final List<String> extensions;
	
	ImageFormat(String mimeType, String imageIOName, boolean lossless, String... extensions) {
		this.mimeType = mimeType;
		this.imageIOName = imageIOName;
		this.lossless = lossless;
		this.extensions = Collections.unmodifiableList(Arrays.asList(extensions));
	}
	
	/**
	 * Get the MIME type, e.g. "image/png".
	 * @return
	 */
	public String getMimeType() {
		return mimeType;
	}
	
	/**
	 * Get the format name used to request readers and writers from {@link javax.imageio.ImageIO}.
	 * @return
	 */
	public String getImageIOName() {
		return imageIOName;
	}
	
	/**
	 * Returns true if the format always stores pixels exactly.
	 * @return
	 */
	public boolean isLossless() {
		return lossless;
	}
	
	/**
	 * Get the file extensions associated with the format, without the dot. The first is the default.
	 * @return
	 */
	public List<String> getExtensions() {
		return extensions;
	}
	
	/**
	 * Get the default file extension, without the dot.
	 * @return
	 */
	public String getDefaultExtension() {
		return extensions.get(0);
	}
	
	/**
	 * Find the format corresponding to a MIME type (ignoring case and any parameters).
	 * @param mimeType
	 * @return
	 */
	public static Optional<ImageFormat> fromMimeType(String mimeType) {
		if (mimeType == null)
			return Optional.empty();
		String type = mimeType.split(";")[0].strip().toLowerCase(Locale.ROOT);
		for (var format : values()) {
			if (format.mimeType.equals(type))
				return Optional.of(format);
		}
		return Optional.empty();
	}
	
	/**
	 * Find the format corresponding to a file extension (with or without the dot, ignoring case).
	 * @param extension
	 * @return
	 */
	public static Optional<ImageFormat> fromExtension(String extension) {
		if (extension == null)
			return Optional.empty();
		String ext = extension.strip().toLowerCase(Locale.ROOT);
		if (ext.startsWith("."))
			ext = ext.substring(1);
		for (var format : values()) {
			if (format.extensions.contains(ext))
				return Optional.of(format);
		}
		return Optional.empty();
	}

}
