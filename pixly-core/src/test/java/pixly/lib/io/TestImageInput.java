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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("javadoc")
public class TestImageInput {
	
	private static final byte[] BYTES = {1, 2, 3, 4, 5};
	
	@Test
	public void test_bytesAreCopied() throws IOException {
		byte[] bytes = BYTES.clone();
		var input = ImageInput.of(bytes);
		bytes[0] = 100;
		assertArrayEquals(BYTES, input.readBytes());
		input.readBytes()[1] = 100;
		assertArrayEquals(BYTES, input.readBytes());
	}
	
	@Test
	public void test_buffer() throws IOException {
		var buffer = ByteBuffer.wrap(new byte[] {9, 9, 1, 2, 3, 4, 5});
		buffer.position(2);
		var input = ImageInput.of(buffer);
		assertEquals(2, buffer.position());
		assertArrayEquals(BYTES, input.readBytes());
	}
	
	@Test
	public void test_blob() throws IOException {
		assertArrayEquals(BYTES, ImageInput.of(new ImageBlob("image/png", BYTES)).readBytes());
	}
	
	@Test
	public void test_dataURL() throws IOException {
		assertArrayEquals(BYTES, ImageInput.of("data:image/png;base64,AQIDBAU=").readBytes());
		var input = ImageInput.of("data:image/png;base64");
		assertThrows(IOException.class, () -> input.readBytes());
	}
	
	@Test
	public void test_files(@TempDir Path dir) throws IOException {
		var path = dir.resolve("image.bin");
		Files.write(path, BYTES);
		assertArrayEquals(BYTES, ImageInput.of(path).readBytes());
		assertArrayEquals(BYTES, ImageInput.of(path.toFile()).readBytes());
		assertArrayEquals(BYTES, ImageInput.of(path.toString()).readBytes());
		assertArrayEquals(BYTES, ImageInput.of(path.toUri()).readBytes());
		assertArrayEquals(BYTES, ImageInput.of(path.toUri().toString()).readBytes());
		
		// Reading is deferred until requested
		var missing = ImageInput.of(dir.resolve("missing.png"));
		assertThrows(NoSuchFileException.class, () -> missing.readBytes());
	}
	
	@Test
	public void test_streamIsReadOnce() throws IOException {
		var input = ImageInput.of(new ByteArrayInputStream(BYTES));
		assertArrayEquals(BYTES, input.readBytes());
		assertThrows(IOException.class, () -> input.readBytes());
	}

}
