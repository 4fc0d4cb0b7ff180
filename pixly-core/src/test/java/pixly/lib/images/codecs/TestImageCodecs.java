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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

import pixly.lib.images.Bitmap;
import pixly.lib.images.Color;

@SuppressWarnings("javadoc")
public class TestImageCodecs {
	
	// Lossless 3x2 WebP, every pixel rgb(200, 30, 60)
	private static final byte[] WEBP_3x2 = {
			0x52, 0x49, 0x46, 0x46, 0x1a, 0x00, 0x00, 0x00, 0x57, 0x45, 0x42, 0x50,
			0x56, 0x50, 0x38, 0x4c, 0x0d, 0x00, 0x00, 0x00, 0x2f, 0x02, 0x40, 0x00,
			0x00, (byte)0xa8, 0x47, (byte)0x91, (byte)0xcb, (byte)0xd3, (byte)0xff, 0x02, 0x00, 0x00
	};
	
	private static Bitmap createGradient(int width, int height, boolean alpha) {
		byte[] pixels = new byte[width * height * Bitmap.CHANNELS];
		int i = 0;
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				pixels[i++] = (byte)(x * 255 / (width - 1));
				pixels[i++] = (byte)(y * 255 / (height - 1));
				pixels[i++] = (byte)128;
				pixels[i++] = (byte)(alpha ? (x + y) * 255 / (width + height - 2) : 255);
			}
		}
		return Bitmap.create(width, height, pixels);
	}
	
	@Test
	public void test_pngLossless() throws ImageCodecException {
		var rand = new Random(42L);
		byte[] pixels = new byte[16 * 9 * Bitmap.CHANNELS];
		rand.nextBytes(pixels);
		var bitmap = Bitmap.create(16, 9, pixels);
		
		var encoder = ImageCodecs.encoder(ImageFormat.PNG);
		assertEquals("image/png", encoder.getMimeType());
		var bytes = encoder.encode(bitmap);
		assertEquals(ImageFormat.PNG, ImageFormatSniffer.detect(bytes));
		assertEquals(bitmap, ImageCodecs.decoder(ImageFormat.PNG).decode(bytes));
	}
	
	@Test
	public void test_jpegApproximate() throws ImageCodecException {
		var bitmap = createGradient(32, 24, true);
		var bytes = ImageCodecs.encoder(ImageFormat.JPEG, EncodeOptions.quality(95)).encode(bitmap);
		assertEquals(ImageFormat.JPEG, ImageFormatSniffer.detect(bytes));
		
		var decoded = ImageCodecs.decoder(ImageFormat.JPEG).decode(bytes);
		assertEquals(bitmap.getWidth(), decoded.getWidth());
		assertEquals(bitmap.getHeight(), decoded.getHeight());
		for (int y = 0; y < decoded.getHeight(); y++) {
			for (int x = 0; x < decoded.getWidth(); x++) {
				assertEquals(255, decoded.getValue(x, y, 3));
				for (int c = 0; c < 3; c++)
					assertEquals(bitmap.getValue(x, y, c), decoded.getValue(x, y, c), 24.0);
			}
		}
	}
	
	@Test
	public void test_jpegQualityAffectsSize() throws ImageCodecException {
		var rand = new Random(1L);
		byte[] pixels = new byte[64 * 64 * Bitmap.CHANNELS];
		rand.nextBytes(pixels);
		var bitmap = Bitmap.create(64, 64, pixels);
		var small = ImageCodecs.encoder(ImageFormat.JPEG, EncodeOptions.quality(10)).encode(bitmap);
		var large = ImageCodecs.encoder(ImageFormat.JPEG, EncodeOptions.quality(100)).encode(bitmap);
		assertTrue(small.length < large.length);
	}
	
	@Test
	public void test_autoDecoder() throws ImageCodecException {
		var bitmap = createGradient(8, 8, true);
		var decoder = ImageCodecs.autoDecoder();
		var png = ImageCodecs.encoder(ImageFormat.PNG).encode(bitmap);
		var qoi = ImageCodecs.encoder(ImageFormat.QOI).encode(bitmap);
		assertEquals(bitmap, decoder.decode(png));
		assertEquals(bitmap, decoder.decode(qoi));
		// Unrecognized data is passed to the PNG decoder, which rejects it
		assertThrows(ImageDecodeException.class, () -> decoder.decode(new byte[] {1, 2, 3, 4, 5}));
	}
	
	@Test
	public void test_webpDecode() throws ImageCodecException {
		assertEquals(ImageFormat.WEBP, ImageFormatSniffer.detect(WEBP_3x2));
		assertTrue(ImageCodecs.getCodec(ImageFormat.WEBP).canDecode());
		
		var decoded = ImageCodecs.autoDecoder().decode(WEBP_3x2);
		assertEquals(3, decoded.getWidth());
		assertEquals(2, decoded.getHeight());
		assertEquals(Bitmap.createFilled(3, 2, Color.rgb(200, 30, 60)), decoded);
		assertEquals(decoded, ImageCodecs.decoder(ImageFormat.WEBP).decode(WEBP_3x2));
		
		// Truncated data is recognized as WebP but cannot be read
		byte[] truncated = Arrays.copyOf(WEBP_3x2, 22);
		assertEquals(ImageFormat.WEBP, ImageFormatSniffer.detect(truncated));
		var e = assertThrows(ImageDecodeException.class, () -> ImageCodecs.autoDecoder().decode(truncated));
		assertEquals(ImageFormat.WEBP, e.getFormat());
	}
	
	@Test
	public void test_missingPlugin() {
		// No JPEG XL plugin is available on the test classpath
		var bitmap = Bitmap.createFilled(4, 4, Color.BLACK);
		var encodeException = assertThrows(ImageEncodeException.class, () -> ImageCodecs.encoder(ImageFormat.JXL).encode(bitmap));
		assertEquals(ImageFormat.JXL, encodeException.getFormat());
		
		byte[] jxl = {0, 0, 0, 0x0C, 0x6A, 0x58, 0x4C, 0x20, 0x0D, 0x0A, (byte)0x87, 0x0A, 0, 0, 0, 0};
		var decodeException = assertThrows(ImageDecodeException.class, () -> ImageCodecs.autoDecoder().decode(jxl));
		assertEquals(ImageFormat.JXL, decodeException.getFormat());
	}
	
	@Test
	public void test_installedCodec() throws ImageCodecException {
		var codec = ImageCodecs.getCodec(ImageFormat.AVIF);
		assertInstanceOf(FakeAvifCodec.class, codec);
		
		var encoder = ImageCodecs.encoder(ImageFormat.AVIF);
		var bytes = encoder.encode(Bitmap.createFilled(1, 1, Color.WHITE));
		assertArrayEquals(FakeAvifCodec.SIGNATURE, bytes);
		assertEquals(ImageFormat.AVIF, ImageFormatSniffer.detect(bytes));
		
		var decoded = ImageCodecs.autoDecoder().decode(bytes);
		assertEquals(Color.rgb(10, 20, 30), decoded.getColor(1, 0));
		ImageCodecs.decoder(ImageFormat.AVIF).decode(bytes);
		
		// Initialized once, however often it is used
		assertEquals(1, FakeAvifCodec.initCount.get());
	}

}
