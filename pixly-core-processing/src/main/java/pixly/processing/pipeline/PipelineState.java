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

import java.io.IOException;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import pixly.lib.common.LogTools;
import pixly.lib.images.Bitmap;
import pixly.lib.images.codecs.ImageDecodeException;
import pixly.lib.images.codecs.ImageDecoder;
import pixly.lib.images.codecs.ImageEncoder;
import pixly.lib.io.EncodedImage;
import pixly.lib.io.ImageInput;
import pixly.processing.ops.ImageOp;
import pixly.processing.ops.ImageOps;
import pixly.processing.ops.OperationException;

/**
 * Immutable state of an image pipeline: the ops to apply, and an optional decoder and encoder.
 * <p>
 * Every modification returns a new state. A state can be shared between threads, and 
 * {@link #process(ImageInput)} may be called concurrently.
 */
public final class PipelineState {
	
	final private static Logger logger = LoggerFactory.getLogger(PipelineState.class);
	
	private static final PipelineState EMPTY = new PipelineState(OpChain.empty(), null, null);
	
	private final OpChain ops;
	private final ImageDecoder decoder;
	private final ImageEncoder encoder;
	
	private PipelineState(OpChain ops, ImageDecoder decoder, ImageEncoder encoder) {
		this.ops = ops;
		this.decoder = decoder;
		this.encoder = encoder;
	}
	
	/**
	 * Get a state with no ops, decoder or encoder.
	 * @return
	 */
	public static PipelineState empty() {
		return EMPTY;
	}
	
	/**
	 * Create a new state with additional ops appended.
	 * @param ops
	 * @return
	 */
	public PipelineState withOps(ImageOp... ops) {
		if (ops.length == 0)
			return this;
		return new PipelineState(this.ops.appendAll(ops), decoder, encoder);
	}
	
	/**
	 * Create a new state with the specified decoder.
	 * @param decoder
	 * @return
	 */
	public PipelineState withDecoder(ImageDecoder decoder) {
		Objects.requireNonNull(decoder, "Decoder must not be null!");
		return new PipelineState(ops, decoder, encoder);
	}
	
	/**
	 * Create a new state with the specified encoder.
	 * @param encoder
	 * @return
	 */
	public PipelineState withEncoder(ImageEncoder encoder) {
		Objects.requireNonNull(encoder, "Encoder must not be null!");
		return new PipelineState(ops, decoder, encoder);
	}
	
	/**
	 * Get the ops, in the order they will be applied.
	 * @return an unmodifiable list
	 */
	public List<ImageOp> getOps() {
		return ops.toList();
	}
	
	/**
	 * Get the decoder, or null if none has been set.
	 * @return
	 */
	public ImageDecoder getDecoder() {
		return decoder;
	}
	
	/**
	 * Get the encoder, or null if none has been set.
	 * @return
	 */
	public ImageEncoder getEncoder() {
		return encoder;
	}
	
	/**
	 * Returns true if both a decoder and an encoder have been set.
	 * @return
	 */
	public boolean isProcessable() {
		return decoder != null && encoder != null;
	}
	
	/**
	 * Get a single op that applies all the ops in this state sequentially.
	 * The decoder and encoder are ignored.
	 * @return
	 */
	public ImageOp preset() {
		return ImageOps.Core.sequential(ops.toList());
	}
	
	/**
	 * Apply the ops to a bitmap.
	 * @param bitmap
	 * @return
	 * @throws OperationException if an op fails
	 */
	public Bitmap applyOps(Bitmap bitmap) throws OperationException {
		for (var op : ops.toList()) {
			long startTime = System.nanoTime();
			bitmap = ImageOps.applyOp(op, bitmap);
			LogTools.logDuration(logger, Level.TRACE, "Applied " + op.getName(), startTime);
		}
		return bitmap;
	}
	
	/**
	 * Read, decode, transform and encode an image.
	 * @param input the encoded input image
	 * @return
	 * @throws MissingBindingException if the decoder or encoder has not been set; this is checked before the input is read
	 * @throws IOException if the input cannot be read, decoded or encoded
	 * @throws OperationException if an op fails
	 */
	public ProcessingResult process(ImageInput input) throws IOException {
		if (!isProcessable())
			throw new MissingBindingException(decoder == null, encoder == null);
		Objects.requireNonNull(input, "Input must not be null!");
		
		byte[] bytes = input.readBytes();
		var bitmap = decoder.decode(bytes);
		if (bitmap == null)
			throw new ImageDecodeException(null, "Decoder returned no image for " + input);
		logger.debug("Decoded {} from {}", bitmap, input);
		
		bitmap = applyOps(bitmap);
		
		byte[] encoded = encoder.encode(bitmap);
		logger.debug("Encoded {} as {} ({} bytes)", bitmap, encoder.getFormat(), encoded.length);
		return new ProcessingResult(new EncodedImage(encoder.getFormat(), encoded), bitmap.getWidth(), bitmap.getHeight());
	}

	@Override
	public String toString() {
		return "PipelineState [ops=" + ops.size() + ", decoder=" + (decoder != null) + ", encoder=" + (encoder != null) + "]";
	}

}
