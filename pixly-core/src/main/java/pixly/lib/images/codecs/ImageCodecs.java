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

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixly.lib.images.Bitmap;

/**
 * Access {@link ImageCodec ImageCodecs} and create decoders and encoders from them.
 * <p>
 * Built-in codecs are registered for all formats in {@link ImageFormat}. 
 * Codecs found by {@link ServiceLoader}, or registered with {@link #registerCodec(ImageCodec)}, replace these.
 * <p>
 * Each codec is initialized lazily, the first time one of its decoders or encoders is used.
 */
public class ImageCodecs {
	
	private final static Logger logger = LoggerFactory.getLogger(ImageCodecs.class);
	
	private static ServiceLoader<ImageCodec> serviceLoader = ServiceLoader.load(ImageCodec.class);
	
	private static final Map<ImageFormat, RegisteredCodec> codecs = new EnumMap<>(ImageFormat.class);
	
	static {
		registerCodec(new PngCodec());
		registerCodec(new JpegCodec());
		registerCodec(new QoiCodec());
		registerCodec(new PluginImageIOCodec(ImageFormat.WEBP));
		registerCodec(new PluginImageIOCodec(ImageFormat.AVIF));
		registerCodec(new PluginImageIOCodec(ImageFormat.JXL));
		for (var codec : getInstalledCodecs()) {
			registerCodec(codec);
		}
	}
	
	private ImageCodecs() {
		throw new AssertionError("Cannot instantiate this class");
	}
	
	/**
	 * Request all codecs available from the {@link ServiceLoader}.
	 * @return
	 */
	static List<ImageCodec> getInstalledCodecs() {
		List<ImageCodec> list = new ArrayList<>();
		synchronized (serviceLoader) {
			try {
				for (ImageCodec codec : serviceLoader)
					list.add(codec);
			} catch (ServiceConfigurationError e) {
				logger.warn("Unable to load image codecs: {}", e.getLocalizedMessage(), e);
			}
		}
		return list;
	}
	
	/**
	 * Register a codec, replacing any codec previously registered for the same format.
	 * @param codec
	 */
	public static void registerCodec(ImageCodec codec) {
		Objects.requireNonNull(codec, "Codec must not be null!");
		var registered = new RegisteredCodec(codec);
		synchronized (codecs) {
			var previous = codecs.put(codec.getFormat(), registered);
			if (previous != null)
				logger.debug("Replacing codec {} with {}", previous.codec.getName(), codec.getName());
			else
				logger.debug("Registering codec {}", codec.getName());
		}
	}
	
	/**
	 * Get the codec currently registered for a format.
	 * @param format
	 * @return
	 */
	public static ImageCodec getCodec(ImageFormat format) {
		return getRegistered(format).codec;
	}
	
	private static RegisteredCodec getRegistered(ImageFormat format) {
		Objects.requireNonNull(format, "Format must not be null!");
		synchronized (codecs) {
			return codecs.get(format);
		}
	}
	
	/**
	 * Get a decoder for a specific format, using the codec registered when this method is called.
	 * @param format
	 * @return
	 */
	public static ImageDecoder decoder(ImageFormat format) {
		var registered = getRegistered(format);
		return registered::decode;
	}
	
	/**
	 * Get a decoder that identifies the format of each input from its signature, 
	 * and then uses the codec registered for that format.
	 * <p>
	 * If the format cannot be identified, PNG is assumed.
	 * 
	 * @return
	 * @see ImageFormatSniffer#detect(byte[])
	 */
	public static ImageDecoder autoDecoder() {
		return data -> getRegistered(ImageFormatSniffer.detect(data)).decode(data);
	}
	
	/**
	 * Get an encoder for a specific format with default options.
	 * @param format
	 * @return
	 */
	public static ImageEncoder encoder(ImageFormat format) {
		return encoder(format, EncodeOptions.empty());
	}
	
	/**
	 * Get an encoder for a specific format, using the codec registered when this method is called.
	 * @param format
	 * @param options encoding options; any value that is not set is taken from {@link EncodeOptions#defaults(ImageFormat)}
	 * @return
	 */
	public static ImageEncoder encoder(ImageFormat format, EncodeOptions options) {
		var registered = getRegistered(format);
		var merged = (options == null ? EncodeOptions.empty() : options).withDefaults(EncodeOptions.defaults(format));
		return ImageEncoder.create(format, bitmap -> registered.encode(bitmap, merged));
	}
	
	
	private static class RegisteredCodec {
		
		private final ImageCodec codec;
		private final CodecInitializer initializer;
		
		private RegisteredCodec(ImageCodec codec) {
			this.codec = codec;
			this.initializer = new CodecInitializer(codec.getName(), codec::initialize);
		}
		
		private Bitmap decode(byte[] data) throws ImageDecodeException {
			try {
				initializer.ensureInitialized();
			} catch (IOException e) {
				throw new ImageDecodeException(codec.getFormat(), "Unable to initialize " + codec.getName() + ": " + e.getLocalizedMessage(), e);
			}
			return codec.decode(data);
		}
		
		private byte[] encode(Bitmap bitmap, EncodeOptions options) throws ImageEncodeException {
			try {
				initializer.ensureInitialized();
			} catch (IOException e) {
				throw new ImageEncodeException(codec.getFormat(), "Unable to initialize " + codec.getName() + ": " + e.getLocalizedMessage(), e);
			}
			return codec.encode(bitmap, options);
		}
		
	}

}
