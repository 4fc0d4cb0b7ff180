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

import java.util.Objects;

/**
 * Format-specific options used when encoding an image.
 * <p>
 * All values are optional; encoders ignore options that do not apply to their format, and use 
 * {@link #defaults(ImageFormat)} for anything that is not set.
 * <p>
 * The loop count and frame delay describe animated output. None of the built-in codecs write 
 * animations, so these are only used by codecs installed separately (see {@link ImageCodecs}).
 */
public final class EncodeOptions {
	
	private static final EncodeOptions EMPTY = new EncodeOptions(null, null, null, null);
	
	private final Integer quality;
	private final Integer compressionLevel;
	private final Integer loop;
	private final Integer delay;
	
	private EncodeOptions(Integer quality, Integer compressionLevel, Integer loop, Integer delay) {
		this.quality = quality;
		this.compressionLevel = compressionLevel;
		this.loop = loop;
		this.delay = delay;
	}
	
	/**
	 * Get options with no values set.
	 * @return
	 */
	public static EncodeOptions empty() {
		return EMPTY;
	}
	
	/**
	 * Get options with only the quality set.
	 * @param quality quality from 0 (smallest) to 100 (best)
	 * @return
	 */
	public static EncodeOptions quality(int quality) {
		return builder().quality(quality).build();
	}
	
	/**
	 * Get the default options for a format.
	 * @param format
	 * @return
	 */
	public static EncodeOptions defaults(ImageFormat format) {
		switch (format) {
		case JPEG:
		case AVIF:
		case JXL:
			return new EncodeOptions(80, null, null, null);
		case WEBP:
			return new EncodeOptions(80, 9, null, null);
		case PNG:
			return new EncodeOptions(null, 9, null, null);
		case QOI:
		default:
			return EMPTY;
		}
	}
	
	/**
	 * Create a new builder.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}
	
	/**
	 * Create options where any value not set here is taken from another options object.
	 * This object is unchanged.
	 * @param defaults
	 * @return
	 */
	public EncodeOptions withDefaults(EncodeOptions defaults) {
		if (defaults == null || defaults == EMPTY)
			return this;
		return new EncodeOptions(
				quality == null ? defaults.quality : quality,
				compressionLevel == null ? defaults.compressionLevel : compressionLevel,
				loop == null ? defaults.loop : loop,
				delay == null ? defaults.delay : delay);
	}
	
	/**
	 * Get the requested quality, from 0 to 100.
	 * @return the quality, or null if not set
	 */
	public Integer getQuality() {
		return quality;
	}

	/**
	 * Get the requested compression level, from 0 (fastest) to 9 (smallest).
	 * @return the compression level, or null if not set
	 */
	public Integer getCompressionLevel() {
		return compressionLevel;
	}

	/**
	 * Get the number of times an animation should loop, where 0 means forever.
	 * @return the loop count, or null if not set
	 */
	public Integer getLoop() {
		return loop;
	}

	/**
	 * Get the delay between animation frames, in milliseconds.
	 * @return the delay, or null if not set
	 */
	public Integer getDelay() {
		return delay;
	}

	@Override
	public int hashCode() {
		return Objects.hash(quality, compressionLevel, loop, delay);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof EncodeOptions))
			return false;
		EncodeOptions other = (EncodeOptions)obj;
		return Objects.equals(quality, other.quality) && Objects.equals(compressionLevel, other.compressionLevel)
				&& Objects.equals(loop, other.loop) && Objects.equals(delay, other.delay);
	}

	@Override
	public String toString() {
		return "EncodeOptions [quality=" + quality + ", compressionLevel=" + compressionLevel + ", loop=" + loop
				+ ", delay=" + delay + "]";
	}
	
	
	/**
	 * Builder for {@link EncodeOptions}.
	 */
	public static class Builder {
		
		private Integer quality;
		private Integer compressionLevel;
		private Integer loop;
		private Integer delay;
		
		private Builder() {}
		
		/**
		 * Set the quality.
		 * @param quality value from 0 to 100
		 * @return this builder
		 */
		public Builder quality(int quality) {
			if (quality < 0 || quality > 100)
				throw new IllegalArgumentException("Quality must be between 0 and 100, but was " + quality);
			this.quality = quality;
			return this;
		}
		
		/**
		 * Set the compression level.
		 * @param level value from 0 to 9
		 * @return this builder
		 */
		public Builder compressionLevel(int level) {
			if (level < 0 || level > 9)
				throw new IllegalArgumentException("Compression level must be between 0 and 9, but was " + level);
			this.compressionLevel = level;
			return this;
		}
		
		/**
		 * Set the animation loop count.
		 * @param loop 0 to loop forever
		 * @return this builder
		 */
		public Builder loop(int loop) {
			if (loop < 0)
				throw new IllegalArgumentException("Loop count must be >= 0, but was " + loop);
			this.loop = loop;
			return this;
		}
		
		/**
		 * Set the animation frame delay.
		 * @param delay delay in milliseconds
		 * @return this builder
		 */
		public Builder delay(int delay) {
			if (delay < 0)
				throw new IllegalArgumentException("Delay must be >= 0, but was " + delay);
			this.delay = delay;
			return this;
		}
		
		/**
		 * Build the options.
		 * @return
		 */
		public EncodeOptions build() {
			if (quality == null && compressionLevel == null && loop == null && delay == null)
				return EMPTY;
			return new EncodeOptions(quality, compressionLevel, loop, delay);
		}
		
	}

}
