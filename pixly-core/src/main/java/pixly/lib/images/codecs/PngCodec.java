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
 * Codec to read and write PNG images using ImageIO (lossless compression).
 * <p>
 * The compression level (0-9) is mapped onto the deflate level used by the writer.
 */
public class PngCodec extends AbstractImageIOCodec {
	
	/**
	 * Constructor.
	 */
	public PngCodec() {
		super(ImageFormat.PNG);
	}

	@Override
	protected void configureWriteParam(ImageWriteParam param, EncodeOptions options) {
		Integer level = options.getCompressionLevel();
		if (level != null)
			setCompressionQuality(param, 1f - level / 9f);
	}

}
