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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ReadOnlyBufferException;

import org.junit.jupiter.api.Test;

import pixly.lib.images.codecs.ImageFormat;

@SuppressWarnings("javadoc")
public class TestEncodedImage {
	
	@Test
	public void test_outputs() {
		byte[] bytes = {1, 2, 3};
		var image = new EncodedImage(ImageFormat.PNG, bytes);
		assertEquals(3, image.size());
		assertEquals("image/png", image.getMimeType());
		assertEquals("data:image/png;base64,AQID", image.toDataURL());
		
		var buffer = image.toBuffer();
		assertArrayEquals(bytes, buffer);
		buffer[0] = 100;
		assertArrayEquals(new byte[] {1, 2, 3}, image.toBuffer());
		
		var byteBuffer = image.toByteBuffer();
		assertTrue(byteBuffer.isReadOnly());
		assertEquals(3, byteBuffer.remaining());
		assertThrows(ReadOnlyBufferException.class, () -> byteBuffer.put((byte)0));
		
		var blob = image.toBlob();
		assertEquals("image/png", blob.getMimeType());
		assertArrayEquals(bytes, blob.getBytes());
	}
	
	@Test
	public void test_mimeTypes() {
		assertEquals("image/webp", new EncodedImage(ImageFormat.WEBP, new byte[0]).getMimeType());
		assertEquals("data:image/jpeg;base64,", new EncodedImage(ImageFormat.JPEG, new byte[0]).toDataURL());
	}

}
