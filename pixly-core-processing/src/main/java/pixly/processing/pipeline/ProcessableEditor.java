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
import java.nio.file.Path;

import pixly.lib.images.codecs.EncodeOptions;
import pixly.lib.images.codecs.ImageDecoder;
import pixly.lib.images.codecs.ImageEncoder;
import pixly.lib.images.codecs.ImageFormat;
import pixly.lib.io.ImageBlob;
import pixly.lib.io.ImageInput;
import pixly.processing.ops.ImageOp;
import pixly.processing.ops.OperationException;

/**
 * An image pipeline with both a decoder and an encoder, which can process images.
 * <p>
 * Processing does not change the editor, so the same editor can be used for many images, including concurrently.
 */
public interface ProcessableEditor {
	
	ProcessableEditor apply(ImageOp... ops);
	
	ProcessableEditor decoder(ImageDecoder decoder);
	
	ProcessableEditor decoder(ImageFormat format);
	
	ProcessableEditor autoDecoder();
	
	ProcessableEditor encoder(ImageEncoder encoder);
	
	ProcessableEditor encoder(ImageFormat format);
	
	ProcessableEditor encoder(ImageFormat format, EncodeOptions options);
	
	ImageOp preset();
	
	PipelineState getState();
	
	/**
	 * Decode the input, apply all ops, and encode the result.
	 * @param input
	 * @return
	 * @throws IOException if the input cannot be read, decoded or encoded
	 * @throws OperationException if an op fails
	 */
	default ProcessingResult process(ImageInput input) throws IOException {
		return getState().process(input);
	}
	
	/**
	 * Process encoded image bytes.
	 * @param bytes
	 * @return
	 * @throws IOException
	 */
	default ProcessingResult process(byte[] bytes) throws IOException {
		return process(ImageInput.of(bytes));
	}
	
	/**
	 * Process an image given as a data URL, a URL to fetch, or a file path.
	 * @param input
	 * @return
	 * @throws IOException
	 * @see ImageInput#of(String)
	 */
	default ProcessingResult process(String input) throws IOException {
		return process(ImageInput.of(input));
	}
	
	/**
	 * Process an image file.
	 * @param path
	 * @return
	 * @throws IOException
	 */
	default ProcessingResult process(Path path) throws IOException {
		return process(ImageInput.of(path));
	}
	
	/**
	 * Process an image blob.
	 * @param blob
	 * @return
	 * @throws IOException
	 */
	default ProcessingResult process(ImageBlob blob) throws IOException {
		return process(ImageInput.of(blob));
	}

}
