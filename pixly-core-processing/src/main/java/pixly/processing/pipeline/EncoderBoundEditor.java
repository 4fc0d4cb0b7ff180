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
 * An image pipeline with an encoder but no decoder.
 * Binding a decoder gives a {@link ProcessableEditor}.
 * 
 * @see PipelinePresets
 */
public interface EncoderBoundEditor {
	
	EncoderBoundEditor apply(ImageOp... ops);
	
	ProcessableEditor decoder(ImageDecoder decoder);
	
	ProcessableEditor decoder(ImageFormat format);
	
	ProcessableEditor autoDecoder();
	
	/**
	 * Replace the encoder.
	 * @param encoder
	 * @return
	 */
	EncoderBoundEditor encoder(ImageEncoder encoder);
	
	EncoderBoundEditor encoder(ImageFormat format);
	
	EncoderBoundEditor encoder(ImageFormat format, EncodeOptions options);
	
	ImageOp preset();
	
	PipelineState getState();

}
