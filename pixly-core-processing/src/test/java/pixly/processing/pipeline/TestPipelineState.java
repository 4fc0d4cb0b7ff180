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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import pixly.lib.images.Bitmap;
import pixly.lib.images.Color;
import pixly.lib.images.codecs.ImageCodecs;
import pixly.lib.images.codecs.ImageDecodeException;
import pixly.lib.images.codecs.ImageFormat;
import pixly.lib.io.ImageInput;
import pixly.processing.ops.ImageOps;
import pixly.processing.ops.OperationException;

@SuppressWarnings("javadoc")
public class TestPipelineState {
	
	@Test
	public void test_immutable() {
		var empty = PipelineState.empty();
		var invert = ImageOps.Adjust.invert();
		var state = empty.withOps(invert);
		assertTrue(empty.getOps().isEmpty());
		assertEquals(Arrays.asList(invert), state.getOps());
		assertSame(state, state.withOps());
		
		var decoder = ImageCodecs.decoder(ImageFormat.QOI);
		var withDecoder = state.withDecoder(decoder);
		assertSame(decoder, withDecoder.getDecoder());
		assertEquals(null, state.getDecoder());
		assertFalse(withDecoder.isProcessable());
		assertTrue(withDecoder.withEncoder(ImageCodecs.encoder(ImageFormat.PNG)).isProcessable());
		
		assertThrows(NullPointerException.class, () -> state.withDecoder(null));
		assertThrows(NullPointerException.class, () -> state.withEncoder(null));
	}
	
	@Test
	public void test_missingBindings() {
		var read = new AtomicBoolean(false);
		var input = ImageInput.of(new InputStream() {
			@Override
			public int read() {
				read.set(true);
				return -1;
			}
		});
		
		var decoderOnly = PipelineState.empty().withDecoder(ImageCodecs.autoDecoder());
		var e = assertThrows(MissingBindingException.class, () -> decoderOnly.process(input));
		assertTrue(e.isEncoderMissing());
		assertFalse(e.isDecoderMissing());
		assertTrue(e.getMessage().contains("encoder"));
		
		var encoderOnly = PipelineState.empty().withEncoder(ImageCodecs.encoder(ImageFormat.PNG));
		var e2 = assertThrows(MissingBindingException.class, () -> encoderOnly.process(input));
		assertTrue(e2.isDecoderMissing());
		assertFalse(e2.isEncoderMissing());
		
		var e3 = assertThrows(MissingBindingException.class, () -> PipelineState.empty().process(input));
		assertEquals("Cannot process image: no decoder and encoder has been set", e3.getMessage());
		
		// The input is never read
		assertFalse(read.get());
	}
	
	@Test
	public void test_process() throws IOException {
		var bitmap = Bitmap.createFilled(6, 4, Color.rgba(10, 20, 30, 200));
		var qoi = ImageCodecs.encoder(ImageFormat.QOI).encode(bitmap);
		var state = PipelineState.empty()
				.withOps(ImageOps.Adjust.invert(), ImageOps.Transform.rotate(90))
				.withDecoder(ImageCodecs.decoder(ImageFormat.QOI))
				.withEncoder(ImageCodecs.encoder(ImageFormat.PNG));
		var result = state.process(ImageInput.of(qoi));
		assertEquals(ImageFormat.PNG, result.getFormat());
		assertEquals("image/png", result.getMimeType());
		assertEquals(4, result.getWidth());
		assertEquals(6, result.getHeight());
		assertEquals(result.size(), result.toBuffer().length);
		assertTrue(result.toDataURL().startsWith("data:image/png;base64,"));
		
		var decoded = ImageCodecs.decoder(ImageFormat.PNG).decode(result.toBuffer());
		assertEquals(Bitmap.createFilled(4, 6, Color.rgba(245, 235, 225, 200)), decoded);
		assertEquals(decoded, state.applyOps(bitmap));
		assertEquals(decoded, state.preset().apply(bitmap));
	}
	
	@Test
	public void test_processFailures() {
		var state = PipelineState.empty()
				.withDecoder(ImageCodecs.decoder(ImageFormat.QOI))
				.withEncoder(ImageCodecs.encoder(ImageFormat.PNG));
		assertThrows(ImageDecodeException.class, () -> state.process(ImageInput.of(new byte[] {1, 2, 3})));
		
		var nullDecoder = state.withDecoder(data -> null);
		assertThrows(ImageDecodeException.class, () -> nullDecoder.process(ImageInput.of(new byte[] {1, 2, 3})));
		
		var failing = state
				.withDecoder(data -> Bitmap.createFilled(2, 2, Color.WHITE))
				.withOps(ImageOps.Core.create("fails", (input, p) -> {
					throw new IllegalStateException("No luck");
				}, null));
		var e = assertThrows(OperationException.class, () -> failing.process(ImageInput.of(new byte[0])));
		assertEquals("fails", e.getOperationName());
	}

}
