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

/**
 * Exception thrown when an image is processed before both a decoder and an encoder have been bound.
 */
public class MissingBindingException extends IllegalStateException {
	
	private static final long serialVersionUID = 1L;
	
	private final boolean decoderMissing;
	private final boolean encoderMissing;
	
	MissingBindingException(boolean decoderMissing, boolean encoderMissing) {
		super(createMessage(decoderMissing, encoderMissing));
		this.decoderMissing = decoderMissing;
		this.encoderMissing = encoderMissing;
	}
	
	private static String createMessage(boolean decoderMissing, boolean encoderMissing) {
		String missing;
		if (decoderMissing && encoderMissing)
			missing = "decoder and encoder";
		else if (decoderMissing)
			missing = "decoder";
		else
			missing = "encoder";
		return "Cannot process image: no " + missing + " has been set";
	}
	
	/**
	 * Returns true if no decoder was bound.
	 * @return
	 */
	public boolean isDecoderMissing() {
		return decoderMissing;
	}
	
	/**
	 * Returns true if no encoder was bound.
	 * @return
	 */
	public boolean isEncoderMissing() {
		return encoderMissing;
	}

}
