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

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixly.lib.images.Bitmap;

/**
 * Abstract {@link ImageCodec} to use Java's ImageIO.
 */
abstract class AbstractImageIOCodec implements ImageCodec {
	
	private final static Logger logger = LoggerFactory.getLogger(AbstractImageIOCodec.class);
	
	private final ImageFormat format;
	
	AbstractImageIOCodec(ImageFormat format) {
		this.format = format;
	}
	
	@Override
	public ImageFormat getFormat() {
		return format;
	}
	
	@Override
	public String getName() {
		return format + " (ImageIO)";
	}
	
	@Override
	public boolean canDecode() {
		return ImageIO.getImageReadersByFormatName(format.getImageIOName()).hasNext() ||
				ImageIO.getImageReadersByMIMEType(format.getMimeType()).hasNext();
	}
	
	@Override
	public boolean canEncode() {
		return findWriter() != null;
	}
	
	private ImageWriter findWriter() {
		Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getImageIOName());
		if (!writers.hasNext())
			writers = ImageIO.getImageWritersByMIMEType(format.getMimeType());
		return writers.hasNext() ? writers.next() : null;
	}
	
	@Override
	public Bitmap decode(byte[] data) throws ImageDecodeException {
		try (ImageInputStream stream = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
			Iterator<ImageReader> readers = ImageIO.getImageReaders(stream);
			if (!readers.hasNext())
				throw new ImageDecodeException(format, "No ImageIO reader is able to decode the data as " + format);
			ImageReader reader = readers.next();
			try {
				logger.trace("Decoding {} with {}", format, reader.getClass().getName());
				reader.setInput(stream, true, true);
				BufferedImage img = reader.read(0);
				return BufferedImageTools.toBitmap(img);
			} finally {
				reader.dispose();
			}
		} catch (ImageDecodeException e) {
			throw e;
		} catch (IOException | RuntimeException e) {
			throw new ImageDecodeException(format, "Unable to decode " + format + " image: " + e.getLocalizedMessage(), e);
		}
	}
	
	@Override
	public byte[] encode(Bitmap bitmap, EncodeOptions options) throws ImageEncodeException {
		ImageWriter writer = findWriter();
		if (writer == null)
			throw new ImageEncodeException(format, "No ImageIO writer available for " + format);
		var merged = (options == null ? EncodeOptions.empty() : options).withDefaults(EncodeOptions.defaults(format));
		var img = BufferedImageTools.toBufferedImage(bitmap, supportsAlpha());
		var bytes = new ByteArrayOutputStream();
		try (ImageOutputStream stream = ImageIO.createImageOutputStream(bytes)) {
			ImageWriteParam param = writer.getDefaultWriteParam();
			configureWriteParam(param, merged);
			writer.setOutput(stream);
			writer.write(null, new IIOImage(img, null, null), param);
			stream.flush();
		} catch (IOException | RuntimeException e) {
			throw new ImageEncodeException(format, "Unable to encode " + format + " image: " + e.getLocalizedMessage(), e);
		} finally {
			writer.dispose();
		}
		return bytes.toByteArray();
	}
	
	/**
	 * Returns true if the alpha channel should be written.
	 * @return
	 */
	protected boolean supportsAlpha() {
		return true;
	}
	
	/**
	 * Apply encoding options to the write parameters.
	 * @param param
	 * @param options the requested options, already merged with the format defaults
	 */
	protected abstract void configureWriteParam(ImageWriteParam param, EncodeOptions options);
	
	/**
	 * Request explicit compression with a specified quality, if the writer supports it.
	 * @param param
	 * @param quality value between 0 and 1
	 */
	static void setCompressionQuality(ImageWriteParam param, float quality) {
		if (!param.canWriteCompressed()) {
			logger.debug("ImageIO writer does not support compression settings");
			return;
		}
		param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
		if (param.getCompressionType() == null) {
			String[] types = param.getCompressionTypes();
			if (types != null && types.length > 0)
				param.setCompressionType(types[0]);
		}
		param.setCompressionQuality(Math.max(0f, Math.min(1f, quality)));
	}
	
	@Override
	public String toString() {
		return getName();
	}

}
