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

import javax.imageio.ImageWriteParam;

/**
 * Codec to read and write JPEG images using ImageIO.
 * <p>
 * JPEG has no alpha channel, so alpha is discarded when encoding.
 */
public class JpegCodec extends AbstractImageIOCodec {
	
	/**
	 * Constructor.
	 */
	public JpegCodec() {
		super(ImageFormat.JPEG);
	}
	
	@Override
	protected boolean supportsAlpha() {
		return false;
	}

	@Override
	protected void configureWriteParam(ImageWriteParam param, EncodeOptions options) {
		Integer quality = options.getQuality();
		if (quality != null)
			setCompressionQuality(param, quality / 100f);
	}

}
