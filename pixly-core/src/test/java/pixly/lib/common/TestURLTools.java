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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("javadoc")
public class TestURLTools {
	
	@Test
	public void test_isDataURL() {
		assertTrue(URLTools.isDataURL("data:image/png;base64,AA=="));
		assertTrue(URLTools.isDataURL("DATA:,abc"));
		assertFalse(URLTools.isDataURL("https://example.org/image.png"));
		assertFalse(URLTools.isDataURL(null));
	}
	
	@Test
	public void test_checkURL() {
		assertTrue(URLTools.checkURL("https://example.org/image.png"));
		assertTrue(URLTools.checkURL("file:/tmp/image.png"));
		assertFalse(URLTools.checkURL("image.png"));
	}
	
	@Test
	public void test_decodeDataURL() {
		assertArrayEquals("Hello".getBytes(StandardCharsets.US_ASCII), 
				URLTools.decodeDataURL("data:text/plain;base64,SGVsbG8="));
		assertArrayEquals("Hello World".getBytes(StandardCharsets.US_ASCII), 
				URLTools.decodeDataURL("data:,Hello%20World"));
		assertThrows(IllegalArgumentException.class, () -> URLTools.decodeDataURL("data:image/png;base64"));
		assertThrows(IllegalArgumentException.class, () -> URLTools.decodeDataURL("image.png"));
	}
	
	@Test
	public void test_dataURLMimeType() {
		assertEquals(Optional.of("image/png"), URLTools.getDataURLMimeType("data:IMAGE/PNG;base64,AA=="));
		assertEquals(Optional.empty(), URLTools.getDataURLMimeType("data:,abc"));
	}
	
	@Test
	public void test_toDataURL() {
		var url = URLTools.toDataURL("image/png", new byte[] {1, 2, 3});
		assertEquals("data:image/png;base64,AQID", url);
		assertArrayEquals(new byte[] {1, 2, 3}, URLTools.decodeDataURL(url));
	}
	
	@Test
	public void test_readFileURL(@TempDir Path dir) throws IOException {
		var path = dir.resolve("bytes.bin");
		byte[] bytes = {4, 5, 6, 7};
		Files.write(path, bytes);
		assertArrayEquals(bytes, URLTools.readURLAsBytes(path.toUri().toURL()));
	}

}
