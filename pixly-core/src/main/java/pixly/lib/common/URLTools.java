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

package pixly.lib.common;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLConnection;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static methods for working with URLs, including data URLs.
 */
public class URLTools {
	
	private final static Logger logger = LoggerFactory.getLogger(URLTools.class);
	
	private static final String DATA_SCHEME = "data:";
	
	private URLTools() {
		throw new AssertionError("Cannot instantiate this class");
	}
	
	/**
	 * Check if a String represents a data URL, i.e. starts with {@code data:} (ignoring case).
	 * @param url
	 * @return
	 */
	public static boolean isDataURL(String url) {
		return url != null && url.regionMatches(true, 0, DATA_SCHEME, 0, DATA_SCHEME.length());
	}
	
	/**
	 * Check if a String can be parsed as a URL.
	 * @param url
	 * @return
	 */
	public static boolean checkURL(String url) {
		try {
			new URL(url);
			return true;
		} catch (MalformedURLException e) {
			return false;
		}
	}
	
	/**
	 * Get the MIME type declared by a data URL.
	 * @param dataURL
	 * @return the MIME type, or empty if none is declared
	 * @throws IllegalArgumentException if the input is not a data URL
	 */
	public static Optional<String> getDataURLMimeType(String dataURL) {
		String header = getDataURLHeader(dataURL);
		int semicolon = header.indexOf(';');
		String mime = (semicolon < 0 ? header : header.substring(0, semicolon)).strip();
		if (mime.isEmpty())
			return Optional.empty();
		return Optional.of(mime.toLowerCase(Locale.ROOT));
	}
	
	/**
	 * Decode the payload of a data URL.
	 * Both base64 and percent-encoded payloads are supported.
	 * 
	 * @param dataURL
	 * @return the decoded bytes
	 * @throws IllegalArgumentException if the input is not a valid data URL
	 */
	public static byte[] decodeDataURL(String dataURL) {
		String header = getDataURLHeader(dataURL);
		String payload = dataURL.substring(dataURL.indexOf(',') + 1);
		if (header.toLowerCase(Locale.ROOT).endsWith(";base64")) {
			// MIME decoder tolerates line breaks within the payload
			return Base64.getMimeDecoder().decode(payload);
		}
		return URLDecoder.decode(payload, StandardCharsets.UTF_8).getBytes(StandardCharsets.ISO_8859_1);
	}
	
	/**
	 * Create a base64-encoded data URL.
	 * @param mimeType
	 * @param bytes
	 * @return a String of the form {@code data:<mimeType>;base64,<payload>}
	 */
	public static String toDataURL(String mimeType, byte[] bytes) {
		return DATA_SCHEME + mimeType + ";base64," + Base64.getEncoder().encodeToString(bytes);
	}
	
	private static String getDataURLHeader(String dataURL) {
		if (!isDataURL(dataURL))
			throw new IllegalArgumentException("Not a data URL: " + abbreviate(dataURL));
		int comma = dataURL.indexOf(',');
		if (comma < 0)
			throw new IllegalArgumentException("Data URL has no payload: " + abbreviate(dataURL));
		return dataURL.substring(DATA_SCHEME.length(), comma);
	}
	
	/**
	 * Read all bytes available from a URL, using the timeout in {@link Prefs#getFetchTimeoutMillis()}.
	 * 
	 * @param url
	 * @return
	 * @throws IOException
	 */
	public static byte[] readURLAsBytes(final URL url) throws IOException {
		return readURLAsBytes(url, Prefs.getFetchTimeoutMillis());
	}

	/**
	 * Read all bytes available from a URL, with specified timeout in milliseconds.
	 * <p>
	 * For HTTP connections, an IOException is thrown if the response code does not indicate success.
	 * 
	 * @param url
	 * @param timeoutMillis
	 * @return
	 * @throws IOException
	 */
	public static byte[] readURLAsBytes(final URL url, final int timeoutMillis) throws IOException {
		URLConnection connection = url.openConnection();
		connection.setConnectTimeout(timeoutMillis);
		connection.setReadTimeout(timeoutMillis);
		if (connection instanceof HttpURLConnection) {
			int code = ((HttpURLConnection)connection).getResponseCode();
			if (code < 200 || code >= 300)
				throw new IOException("Unable to fetch " + url + " (HTTP status " + code + ")");
		}
		logger.debug("Reading {} (content type {})", url, connection.getContentType());
		try (InputStream stream = connection.getInputStream()) {
			return stream.readAllBytes();
		}
	}
	
	private static String abbreviate(String s) {
		if (s == null)
			return "null";
		return s.length() <= 40 ? s : s.substring(0, 40) + "...";
	}

}
