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

import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codec for formats that Java does not support out of the box (e.g. WebP, AVIF, JPEG XL), 
 * relying on an ImageIO plugin being available on the class path.
 * <p>
 * If no plugin is found, decoding and encoding fail with an {@link ImageCodecException}.
 */
public class PluginImageIOCodec extends AbstractImageIOCodec {
	
	private final static Logger logger = LoggerFactory.getLogger(PluginImageIOCodec.class);
	
	/**
	 * Constructor.
	 * @param format
	 */
	public PluginImageIOCodec(ImageFormat format) {
		super(format);
	}
	
	@Override
	public String getName() {
		return getFormat() + " (ImageIO plugin)";
	}
	
	@Override
	public void initialize() throws IOException {
		ImageIO.scanForPlugins();
		logger.debug("{} codec: reader available={}, writer available={}", getFormat(), canDecode(), canEncode());
	}

	@Override
	protected void configureWriteParam(ImageWriteParam param, EncodeOptions options) {
		Integer quality = options.getQuality();
		if (quality != null)
			setCompressionQuality(param, quality / 100f);
	}

}
