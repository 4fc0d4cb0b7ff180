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

import pixly.lib.images.codecs.EncodeOptions;
import pixly.lib.images.codecs.ImageDecoder;
import pixly.lib.images.codecs.ImageEncoder;
import pixly.lib.images.codecs.ImageFormat;
import pixly.processing.ops.ImageOp;

/**
 * An image pipeline with no decoder or encoder.
 * <p>
 * Ops can be added and extracted as a preset, but images cannot be processed until both a decoder 
 * and an encoder are bound. Every method returns a new editor, leaving this one unchanged.
 * 
 * @see ImageEditors#create()
 */
public interface ImageEditor {
	
	/**
	 * Append ops.
	 * @param ops
	 * @return
	 */
	ImageEditor apply(ImageOp... ops);
	
	/**
	 * Bind a decoder.
	 * @param decoder
	 * @return
	 */
	DecoderBoundEditor decoder(ImageDecoder decoder);
	
	/**
	 * Bind the registered decoder for a format.
	 * @param format
	 * @return
	 */
	DecoderBoundEditor decoder(ImageFormat format);
	
	/**
	 * Bind a decoder that detects the format of each input.
	 * @return
	 */
	DecoderBoundEditor autoDecoder();
	
	/**
	 * Bind an encoder.
	 * @param encoder
	 * @return
	 */
	EncoderBoundEditor encoder(ImageEncoder encoder);
	
	/**
	 * Bind the registered encoder for a format, with default options.
	 * @param format
	 * @return
	 */
	EncoderBoundEditor encoder(ImageFormat format);
	
	/**
	 * Bind the registered encoder for a format.
	 * @param format
	 * @param options options, where unset values are taken from the format defaults
	 * @return
	 */
	EncoderBoundEditor encoder(ImageFormat format, EncodeOptions options);
	
	/**
	 * Get a single op that applies all ops added so far.
	 * @return
	 */
	ImageOp preset();
	
	/**
	 * Get the underlying pipeline state.
	 * @return
	 */
	PipelineState getState();

}
