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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixly.lib.common.URLTools;

/**
 * Source of encoded image bytes.
 * <p>
 * This normalizes the different ways an image may be supplied (raw bytes, buffers, blobs, files, URLs 
 * and data URLs) into a byte array. Reading is deferred until {@link #readBytes()} is called.
 */
public final class ImageInput {
	
	private final static Logger logger = LoggerFactory.getLogger(ImageInput.class);
	
	private final String description;
	private final ByteSource source;
	
	private ImageInput(String description, ByteSource source) {
		this.description = description;
		this.source = source;
	}
	
	/**
	 * Create an input from a byte array. The array is copied.
	 * @param bytes
	 * @return
	 */
	public static ImageInput of(byte[] bytes) {
		Objects.requireNonNull(bytes, "Bytes must not be null!");
		byte[] copy = bytes.clone();
		return new ImageInput("byte[" + copy.length + "]", () -> copy.clone());
	}
	
	/**
	 * Create an input from the remaining bytes of a buffer. The buffer position is unchanged.
	 * @param buffer
	 * @return
	 */
	public static ImageInput of(ByteBuffer buffer) {
		Objects.requireNonNull(buffer, "Buffer must not be null!");
		var view = buffer.duplicate();
		byte[] copy = new byte[view.remaining()];
		view.get(copy);
		return new ImageInput("ByteBuffer[" + copy.length + "]", () -> copy.clone());
	}
	
	/**
	 * Create an input from a blob.
	 * @param blob
	 * @return
	 */
	public static ImageInput of(ImageBlob blob) {
		Objects.requireNonNull(blob, "Blob must not be null!");
		return new ImageInput(blob.toString(), blob::getBytes);
	}
	
	/**
	 * Create an input that reads a file.
	 * @param path
	 * @return
	 */
	public static ImageInput of(Path path) {
		Objects.requireNonNull(path, "Path must not be null!");
		return new ImageInput(path.toString(), () -> Files.readAllBytes(path));
	}
	
	/**
	 * Create an input that reads a file.
	 * @param file
	 * @return
	 */
	public static ImageInput of(File file) {
		Objects.requireNonNull(file, "File must not be null!");
		return of(file.toPath());
	}
	
	/**
	 * Create an input that fetches a URL.
	 * @param url
	 * @return
	 */
	public static ImageInput of(URL url) {
		Objects.requireNonNull(url, "URL must not be null!");
		return new ImageInput(url.toString(), () -> URLTools.readURLAsBytes(url));
	}
	
	/**
	 * Create an input that fetches a URI.
	 * @param uri
	 * @return
	 * @throws IllegalArgumentException if the URI cannot be converted to a URL
	 */
	public static ImageInput of(URI uri) {
		Objects.requireNonNull(uri, "URI must not be null!");
		if ("data".equalsIgnoreCase(uri.getScheme()))
			return of(uri.toString());
		try {
			return of(uri.toURL());
		} catch (MalformedURLException e) {
			throw new IllegalArgumentException("Cannot read from " + uri, e);
		}
	}
	
	/**
	 * Create an input that reads a stream. The stream can only be read once, and is closed after reading.
	 * @param stream
	 * @return
	 */
	public static ImageInput of(InputStream stream) {
		Objects.requireNonNull(stream, "Stream must not be null!");
		var consumed = new AtomicBoolean(false);
		return new ImageInput("InputStream", () -> {
			if (consumed.getAndSet(true))
				throw new IOException("Input stream has already been read");
			try (stream) {
				return stream.readAllBytes();
			}
		});
	}
	
	/**
	 * Create an input from a String.
	 * <ul>
	 *   <li>Data URLs are decoded from their embedded payload, without any fetching</li>
	 *   <li>Other Strings that can be parsed as URLs are fetched</li>
	 *   <li>Anything else is treated as a file path</li>
	 * </ul>
	 * @param input
	 * @return
	 */
	public static ImageInput of(String input) {
		Objects.requireNonNull(input, "Input must not be null!");
		if (URLTools.isDataURL(input)) {
			return new ImageInput("data URL", () -> {
				try {
					return URLTools.decodeDataURL(input);
				} catch (IllegalArgumentException e) {
					throw new IOException("Invalid data URL: " + e.getLocalizedMessage(), e);
				}
			});
		}
		if (URLTools.checkURL(input)) {
			try {
				return of(new URL(input));
			} catch (MalformedURLException e) {
				throw new UncheckedIOException(e);
			}
		}
		return of(Paths.get(input));
	}
	
	/**
	 * Read the encoded bytes.
	 * @return
	 * @throws IOException if the bytes cannot be read
	 */
	public byte[] readBytes() throws IOException {
		logger.trace("Reading bytes from {}", description);
		return source.read();
	}
	
	@Override
	public String toString() {
		return "ImageInput [" + description + "]";
	}
	
	@FunctionalInterface
	private interface ByteSource {
		byte[] read() throws IOException;
	}

}
