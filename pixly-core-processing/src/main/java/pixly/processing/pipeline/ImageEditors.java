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
import pixly.lib.images.codecs.ImageCodecs;
import pixly.lib.images.codecs.ImageDecoder;
import pixly.lib.images.codecs.ImageEncoder;
import pixly.lib.images.codecs.ImageFormat;
import pixly.processing.ops.ImageOp;

/**
 * Entry point for building image pipelines.
 * <p>
 * The editor returned by {@link #create()} only allows images to be processed once both a decoder 
 * and an encoder have been bound, since the type returned by each binding method determines which 
 * methods are available.
 */
public class ImageEditors {
	
	private static final ImageEditor EMPTY = new EmptyEditor(PipelineState.empty());
	
	// Suppress default constructor for non-instantiability
	private ImageEditors() {
		throw new AssertionError();
	}
	
	/**
	 * Create an editor with no ops, decoder or encoder.
	 * @return
	 */
	public static ImageEditor create() {
		return EMPTY;
	}
	
	private static abstract class AbstractEditor {
		
		protected final PipelineState state;
		
		AbstractEditor(PipelineState state) {
			this.state = state;
		}
		
		public PipelineState getState() {
			return state;
		}
		
		public ImageOp preset() {
			return state.preset();
		}
		
		protected PipelineState withDecoder(ImageFormat format) {
			return state.withDecoder(ImageCodecs.decoder(format));
		}
		
		protected PipelineState withAutoDecoder() {
			return state.withDecoder(ImageCodecs.autoDecoder());
		}
		
		protected PipelineState withEncoder(ImageFormat format, EncodeOptions options) {
			return state.withEncoder(ImageCodecs.encoder(format, options));
		}
		
		@Override
		public String toString() {
			return getClass().getSimpleName() + " [" + state + "]";
		}
		
	}
	
	
	private static class EmptyEditor extends AbstractEditor implements ImageEditor {
		
		EmptyEditor(PipelineState state) {
			super(state);
		}

		@Override
		public ImageEditor apply(ImageOp... ops) {
			return new EmptyEditor(state.withOps(ops));
		}

		@Override
		public DecoderBoundEditor decoder(ImageDecoder decoder) {
			return new DecoderBound(state.withDecoder(decoder));
		}

		@Override
		public DecoderBoundEditor decoder(ImageFormat format) {
			return new DecoderBound(withDecoder(format));
		}

		@Override
		public DecoderBoundEditor autoDecoder() {
			return new DecoderBound(withAutoDecoder());
		}

		@Override
		public EncoderBoundEditor encoder(ImageEncoder encoder) {
			return new EncoderBound(state.withEncoder(encoder));
		}

		@Override
		public EncoderBoundEditor encoder(ImageFormat format) {
			return encoder(format, EncodeOptions.empty());
		}

		@Override
		public EncoderBoundEditor encoder(ImageFormat format, EncodeOptions options) {
			return new EncoderBound(withEncoder(format, options));
		}
		
	}
	
	
	private static class DecoderBound extends AbstractEditor implements DecoderBoundEditor {
		
		DecoderBound(PipelineState state) {
			super(state);
		}

		@Override
		public DecoderBoundEditor apply(ImageOp... ops) {
			return new DecoderBound(state.withOps(ops));
		}

		@Override
		public DecoderBoundEditor decoder(ImageDecoder decoder) {
			return new DecoderBound(state.withDecoder(decoder));
		}

		@Override
		public DecoderBoundEditor decoder(ImageFormat format) {
			return new DecoderBound(withDecoder(format));
		}

		@Override
		public DecoderBoundEditor autoDecoder() {
			return new DecoderBound(withAutoDecoder());
		}

		@Override
		public ProcessableEditor encoder(ImageEncoder encoder) {
			return new Processable(state.withEncoder(encoder));
		}

		@Override
		public ProcessableEditor encoder(ImageFormat format) {
			return encoder(format, EncodeOptions.empty());
		}

		@Override
		public ProcessableEditor encoder(ImageFormat format, EncodeOptions options) {
			return new Processable(withEncoder(format, options));
		}
		
	}
	
	
	private static class EncoderBound extends AbstractEditor implements EncoderBoundEditor {
		
		EncoderBound(PipelineState state) {
			super(state);
		}

		@Override
		public EncoderBoundEditor apply(ImageOp... ops) {
			return new EncoderBound(state.withOps(ops));
		}

		@Override
		public ProcessableEditor decoder(ImageDecoder decoder) {
			return new Processable(state.withDecoder(decoder));
		}

		@Override
		public ProcessableEditor decoder(ImageFormat format) {
			return new Processable(withDecoder(format));
		}

		@Override
		public ProcessableEditor autoDecoder() {
			return new Processable(withAutoDecoder());
		}

		@Override
		public EncoderBoundEditor encoder(ImageEncoder encoder) {
			return new EncoderBound(state.withEncoder(encoder));
		}

		@Override
		public EncoderBoundEditor encoder(ImageFormat format) {
			return encoder(format, EncodeOptions.empty());
		}

		@Override
		public EncoderBoundEditor encoder(ImageFormat format, EncodeOptions options) {
			return new EncoderBound(withEncoder(format, options));
		}
		
	}
	
	
	private static class Processable extends AbstractEditor implements ProcessableEditor {
		
		Processable(PipelineState state) {
			super(state);
		}

		@Override
		public ProcessableEditor apply(ImageOp... ops) {
			return new Processable(state.withOps(ops));
		}

		@Override
		public ProcessableEditor decoder(ImageDecoder decoder) {
			return new Processable(state.withDecoder(decoder));
		}

		@Override
		public ProcessableEditor decoder(ImageFormat format) {
			return new Processable(withDecoder(format));
		}

		@Override
		public ProcessableEditor autoDecoder() {
			return new Processable(withAutoDecoder());
		}

		@Override
		public ProcessableEditor encoder(ImageEncoder encoder) {
			return new Processable(state.withEncoder(encoder));
		}

		@Override
		public ProcessableEditor encoder(ImageFormat format) {
			return encoder(format, EncodeOptions.empty());
		}

		@Override
		public ProcessableEditor encoder(ImageFormat format, EncodeOptions options) {
			return new Processable(withEncoder(format, options));
		}
		
	}

}
