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

import java.util.Objects;

import pixly.lib.geom.Anchor;
import pixly.lib.geom.FitMode;
import pixly.lib.geom.FitSpec;
import pixly.lib.images.Color;
import pixly.lib.images.codecs.EncodeOptions;
import pixly.lib.images.codecs.ImageFormat;
import pixly.processing.ops.ImageOp;
import pixly.processing.ops.ImageOps;

/**
 * Commonly-used pipelines.
 * <p>
 * Each preset has its ops and encoder bound, so only a decoder needs to be added before processing, e.g.
 * <pre>
 * var result = PipelinePresets.thumbnail().autoDecoder().process(bytes);
 * </pre>
 * Further ops can be appended with {@code apply} before processing.
 */
public class PipelinePresets {
	
	/**
	 * Default thumbnail width and height.
	 */
	public static final int DEFAULT_THUMBNAIL_SIZE = 150;
	
	/**
	 * Default JPEG quality for thumbnails.
	 */
	public static final int DEFAULT_THUMBNAIL_QUALITY = 80;
	
	/**
	 * Default maximum width for web images.
	 */
	public static final int DEFAULT_WEB_MAX_WIDTH = 1920;
	
	/**
	 * Default WebP quality for web images.
	 */
	public static final int DEFAULT_WEB_QUALITY = 85;
	
	/**
	 * Default JPEG quality for compression.
	 */
	public static final int DEFAULT_COMPRESSION_QUALITY = 60;
	
	/**
	 * JPEG quality used by {@link #speedOptimized()}.
	 */
	public static final int SPEED_OPTIMIZED_QUALITY = 70;
	
	/**
	 * WebP quality used by {@link #sizeOptimized()}.
	 */
	public static final int SIZE_OPTIMIZED_QUALITY = 60;
	
	private static final Color DEFAULT_BACKGROUND = Color.TRANSPARENT_WHITE;
	
	// Suppress default constructor for non-instantiability
	private PipelinePresets() {
		throw new AssertionError();
	}
	
	/**
	 * Square JPEG thumbnail with the default size.
	 * @return
	 */
	public static EncoderBoundEditor thumbnail() {
		return thumbnail(DEFAULT_THUMBNAIL_SIZE);
	}
	
	/**
	 * Square JPEG thumbnail (quality 80), resized to cover the square and cropped about the center.
	 * @param size width and height of the thumbnail
	 * @return
	 */
	public static EncoderBoundEditor thumbnail(int size) {
		return thumbnail(size, DEFAULT_THUMBNAIL_QUALITY);
	}
	
	/**
	 * Square JPEG thumbnail, resized to cover the square and cropped about the center.
	 * @param size width and height of the thumbnail
	 * @param quality JPEG quality between 0 and 100
	 * @return
	 */
	public static EncoderBoundEditor thumbnail(int size, int quality) {
		return thumbnail(size, quality, null, null, null);
	}
	
	/**
	 * Square JPEG thumbnail.
	 * @param size width and height of the thumbnail
	 * @param quality JPEG quality between 0 and 100
	 * @param fit how the image fills the square; if null, {@link FitMode#COVER} is used
	 * @param anchor where the image is placed within the square; if null, the center is used
	 * @param background color for any part of the square not covered by the image; if null, transparent white is used
	 * @return
	 */
	public static EncoderBoundEditor thumbnail(int size, int quality, FitMode fit, Anchor anchor, Color background) {
		var spec = FitSpec.builder()
				.size(size, size)
				.fit(fit == null ? FitMode.COVER : fit)
				.anchor(anchor == null ? Anchor.CENTER : anchor)
				.background(background == null ? DEFAULT_BACKGROUND : background)
				.build();
		return resizeAndEncode(spec, ImageFormat.JPEG, EncodeOptions.quality(quality));
	}
	
	/**
	 * WebP image for the web, with the default maximum width.
	 * @return
	 */
	public static EncoderBoundEditor webOptimized() {
		return webOptimized(DEFAULT_WEB_MAX_WIDTH);
	}
	
	/**
	 * WebP image (quality 85) for the web, downsized if necessary to a maximum width.
	 * Encoding requires a WebP ImageIO writer to be available.
	 * @param maxWidth
	 * @return
	 */
	public static EncoderBoundEditor webOptimized(int maxWidth) {
		return webOptimized(maxWidth, null);
	}
	
	/**
	 * WebP image (quality 85) for the web, downsized if necessary to fit within a maximum size.
	 * @param maxWidth maximum width, or null if the width should not be constrained
	 * @param maxHeight maximum height, or null if the height should not be constrained
	 * @return
	 */
	public static EncoderBoundEditor webOptimized(Integer maxWidth, Integer maxHeight) {
		return webOptimized(maxWidth, maxHeight, DEFAULT_WEB_QUALITY, null, null, null);
	}
	
	/**
	 * WebP image for the web.
	 * @param maxWidth maximum width, or null if the width should not be constrained
	 * @param maxHeight maximum height, or null if the height should not be constrained
	 * @param quality WebP quality between 0 and 100
	 * @param fit if null, {@link FitMode#INSIDE} is used so that images are never enlarged
	 * @param anchor if null, the center is used
	 * @param background if null, transparent white is used
	 * @return
	 */
	public static EncoderBoundEditor webOptimized(Integer maxWidth, Integer maxHeight, int quality, FitMode fit, Anchor anchor, Color background) {
		var spec = FitSpec.builder()
				.width(maxWidth)
				.height(maxHeight)
				.fit(fit == null ? FitMode.INSIDE : fit)
				.anchor(anchor == null ? Anchor.CENTER : anchor)
				.background(background == null ? DEFAULT_BACKGROUND : background)
				.build();
		return resizeAndEncode(spec, ImageFormat.WEBP, EncodeOptions.quality(quality));
	}
	
	/**
	 * JPEG with the default compression quality, without resizing.
	 * @return
	 */
	public static EncoderBoundEditor compression() {
		return compression(DEFAULT_COMPRESSION_QUALITY);
	}
	
	/**
	 * JPEG with the specified quality, without resizing.
	 * @param quality JPEG quality between 0 and 100
	 * @return
	 */
	public static EncoderBoundEditor compression(int quality) {
		return compression(quality, (FitSpec)null);
	}
	
	/**
	 * JPEG with the specified quality, downsized if necessary to fit within a maximum size.
	 * @param quality JPEG quality between 0 and 100
	 * @param maxWidth maximum width, or null if the width should not be constrained
	 * @param maxHeight maximum height, or null if the height should not be constrained
	 * @return
	 */
	public static EncoderBoundEditor compression(int quality, Integer maxWidth, Integer maxHeight) {
		if (maxWidth == null && maxHeight == null)
			return compression(quality);
		return compression(quality, FitSpec.of(maxWidth, maxHeight, FitMode.INSIDE));
	}
	
	/**
	 * JPEG with the specified quality, optionally resized first.
	 * @param quality JPEG quality between 0 and 100
	 * @param resize how to resize the image, or null if the image should not be resized
	 * @return
	 */
	public static EncoderBoundEditor compression(int quality, FitSpec resize) {
		var options = EncodeOptions.quality(quality);
		if (resize == null)
			return ImageEditors.create().encoder(ImageFormat.JPEG, options);
		return resizeAndEncode(resize, ImageFormat.JPEG, options);
	}
	
	/**
	 * Fast encoding, using JPEG with quality 70.
	 * @return
	 */
	public static EncoderBoundEditor speedOptimized() {
		return speedOptimized(EncodeOptions.empty());
	}
	
	/**
	 * Fast encoding using JPEG.
	 * @param options options that replace the defaults (quality 70)
	 * @return
	 */
	public static EncoderBoundEditor speedOptimized(EncodeOptions options) {
		return encodeOnly(ImageFormat.JPEG, options, EncodeOptions.quality(SPEED_OPTIMIZED_QUALITY));
	}
	
	/**
	 * Lossless encoding, using PNG.
	 * @return
	 */
	public static EncoderBoundEditor qualityOptimized() {
		return qualityOptimized(EncodeOptions.empty());
	}
	
	/**
	 * Lossless encoding using PNG.
	 * @param options options that replace the PNG defaults
	 * @return
	 */
	public static EncoderBoundEditor qualityOptimized(EncodeOptions options) {
		return encodeOnly(ImageFormat.PNG, options, EncodeOptions.empty());
	}
	
	/**
	 * Small output, using WebP with quality 60.
	 * Encoding requires a WebP ImageIO writer to be available.
	 * @return
	 */
	public static EncoderBoundEditor sizeOptimized() {
		return sizeOptimized(EncodeOptions.empty());
	}
	
	/**
	 * Small output using WebP.
	 * @param options options that replace the defaults (quality 60)
	 * @return
	 */
	public static EncoderBoundEditor sizeOptimized(EncodeOptions options) {
		return encodeOnly(ImageFormat.WEBP, options, EncodeOptions.quality(SIZE_OPTIMIZED_QUALITY));
	}
	
	/**
	 * Create an editor with the ops and encoder described by a template.
	 * @param template
	 * @return
	 */
	public static EncoderBoundEditor fromTemplate(PipelineTemplate template) {
		Objects.requireNonNull(template, "Template must not be null!");
		return ImageEditors.create()
				.apply(template.getOps().toArray(ImageOp[]::new))
				.encoder(template.getFormat(), template.getOptions());
	}
	
	private static EncoderBoundEditor resizeAndEncode(FitSpec spec, ImageFormat format, EncodeOptions options) {
		return ImageEditors.create()
				.apply(ImageOps.Transform.resize(spec))
				.encoder(format, options);
	}
	
	private static EncoderBoundEditor encodeOnly(ImageFormat format, EncodeOptions options, EncodeOptions presetDefaults) {
		var merged = options == null ? presetDefaults : options.withDefaults(presetDefaults);
		return ImageEditors.create().encoder(format, merged);
	}

}
