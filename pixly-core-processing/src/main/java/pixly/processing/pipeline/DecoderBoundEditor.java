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
 * An image pipeline with a decoder but no encoder.
 * Binding an encoder gives a {@link ProcessableEditor}.
 */
public interface DecoderBoundEditor {
	
	DecoderBoundEditor apply(ImageOp... ops);
	
	/**
	 * Replace the decoder.
	 * @param decoder
	 * @return
	 */
	DecoderBoundEditor decoder(ImageDecoder decoder);
	
	DecoderBoundEditor decoder(ImageFormat format);
	
	DecoderBoundEditor autoDecoder();
	
	ProcessableEditor encoder(ImageEncoder encoder);
	
	ProcessableEditor encoder(ImageFormat format);
	
	ProcessableEditor encoder(ImageFormat format, EncodeOptions options);
	
	ImageOp preset();
	
	PipelineState getState();

}
