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

package pixly.processing.ops;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import com.google.gson.Gson;

import pixly.lib.common.ColorTools;
import pixly.lib.common.LogTools;
import pixly.lib.geom.FitMode;
import pixly.lib.geom.FitSpec;
import pixly.lib.geom.FlipDirection;
import pixly.lib.images.Bitmap;
import pixly.lib.images.Color;
import pixly.lib.io.GsonTools;
import pixly.lib.io.GsonTools.SubTypeAdapterFactory;
import pixly.processing.tools.ConvolutionKernel;
import pixly.processing.tools.KernelExecutor;
import pixly.processing.tools.LuminanceStatistics;
import pixly.processing.tools.SobelKernel;
import pixly.processing.tools.TransformTools;

/**
 * Create and combine {@link ImageOp} objects.
 * <p>
 * Built-in ops are grouped by category, and can be serialized to JSON with {@link #toJson(ImageOp)}. 
 * Ops created from arbitrary handlers or predicates cannot be serialized.
 */
public class ImageOps {
	
	private final static Logger logger = LoggerFactory.getLogger(ImageOps.class);
	
	private static final String OP_BASE = "op";
	
	@Target(ElementType.TYPE)
	@Retention(RetentionPolicy.RUNTIME)
	private @interface OpType {
		String value();
	}
	
	private static final SubTypeAdapterFactory<ImageOp> factoryOps = GsonTools.createSubTypeAdapterFactory(ImageOp.class, "type");
	
	@SuppressWarnings("unchecked")
	private static <T> void registerTypes(SubTypeAdapterFactory<T> factory, Class<T> factoryType, Class<?> cls, String base) {
		var annotation = cls.getAnnotation(OpType.class);
		if (annotation != null) {
			base = base + "." + annotation.value();
			if (factoryType.isAssignableFrom(cls)) {
				factory.registerSubtype((Class<? extends T>)cls, base);
			}
		}
		for (var c : cls.getDeclaredClasses()) {
			registerTypes(factory, factoryType, c, base);
		}
	}

	static {
		registerTypes(factoryOps, ImageOp.class, ImageOps.class, OP_BASE);
		factoryOps.setValidator(op -> {
			if (op instanceof ValidatedOp validated)
				validated.validate();
		});
		GsonTools.getDefaultBuilder().registerTypeAdapterFactory(factoryOps);
	}
	
	/**
	 * An op with parameters that are checked before any image is supplied.
	 * Constructors call {@link #validate()}, and ops read from JSON are checked as soon as they are deserialized.
	 */
	interface ValidatedOp extends ImageOp {
		
		/**
		 * Check the parameters of this op.
		 * @throws IllegalArgumentException if any parameter is invalid
		 */
		void validate();
		
	}
	
	// Suppress default constructor for non-instantiability
	private ImageOps() {
		throw new AssertionError();
	}
	
	/**
	 * Get the name of an op, used for logging and error messages.
	 * @param op
	 * @return
	 * @see ImageOp#getName()
	 */
	static String getName(ImageOp op) {
		var cls = op.getClass();
		var label = factoryOps.getLabel(cls);
		if (label != null)
			return label.substring(OP_BASE.length() + 1);
		var name = cls.getSimpleName();
		if (name.isEmpty() || name.contains("$$Lambda"))
			return "anonymous";
		return name;
	}
	
	/**
	 * Get a Gson instance that can serialize and deserialize built-in ops, including as fields of other objects.
	 * @param pretty if true, use pretty printing
	 * @return
	 */
	public static Gson getGson(boolean pretty) {
		return GsonTools.getInstance(pretty);
	}
	
	/**
	 * Serialize a built-in op (including any ops it contains) to JSON.
	 * @param op
	 * @return
	 * @throws com.google.gson.JsonParseException if the op (or a nested op) is not a built-in type
	 */
	public static String toJson(ImageOp op) {
		return toJson(op, false);
	}
	
	/**
	 * Serialize a built-in op (including any ops it contains) to JSON, optionally using pretty printing.
	 * @param op
	 * @param pretty
	 * @return
	 */
	public static String toJson(ImageOp op, boolean pretty) {
		var json = getGson(pretty).toJson(op, ImageOp.class);
		logger.trace("Serialized {} to {}", op.getName(), json);
		return json;
	}
	
	/**
	 * Create an op from its JSON representation.
	 * @param json
	 * @return
	 * @throws com.google.gson.JsonParseException if the JSON does not represent a built-in op
	 * @throws IllegalArgumentException if the op (or a nested op) has invalid parameters
	 */
	public static ImageOp fromJson(String json) {
		var op = getGson(false).fromJson(json, ImageOp.class);
		logger.trace("Deserialized {} from {}", op == null ? null : op.getName(), json);
		return op;
	}
	
	
	/**
	 * Ops that create, validate and combine other ops.
	 */
	@OpType("core")
	public static class Core {
		
		private static final ImageOp IDENTITY = new IdentityOp();
		
		private static final String DEFAULT_NAME = "custom";
		
		/**
		 * Get an op that returns its input unchanged.
		 * @return
		 */
		public static ImageOp identity() {
			return IDENTITY;
		}
		
		/**
		 * Create an op by binding parameters to a handler.
		 * @param <P>
		 * @param handler the function that performs the operation
		 * @param params parameters passed to the handler on every invocation
		 * @return
		 * @see #validate(Object, Predicate, String)
		 */
		public static <P> ImageOp create(OpHandler<P> handler, P params) {
			return create(DEFAULT_NAME, handler, params);
		}
		
		/**
		 * Create a named op by binding parameters to a handler.
		 * @param <P>
		 * @param name name used in error messages
		 * @param handler the function that performs the operation
		 * @param params parameters passed to the handler on every invocation
		 * @return
		 */
		public static <P> ImageOp create(String name, OpHandler<P> handler, P params) {
			return new HandlerOp<>(name, handler, params);
		}
		
		/**
		 * Give an existing op a name.
		 * @param name name used in error messages
		 * @param op
		 * @return
		 */
		public static ImageOp create(String name, ImageOp op) {
			Objects.requireNonNull(op, "Op must not be null!");
			return new HandlerOp<ImageOp>(name, (input, o) -> o.apply(input), op);
		}
		
		/**
		 * Check parameters for an op, before any image is supplied.
		 * @param <P>
		 * @param params the parameters
		 * @param predicate test that returns true if the parameters are valid
		 * @param message description of the valid parameters
		 * @return the parameters, unchanged
		 * @throws IllegalArgumentException if the predicate returns false
		 */
		public static <P> P validate(P params, Predicate<? super P> predicate, String message) {
			if (!predicate.test(params))
				throw new IllegalArgumentException("Invalid operation parameters: " + message);
			return params;
		}
		
		/**
		 * Apply a collection of ops sequentially, chaining the output of one op as the input for the next.
		 * @param ops
		 * @return an op that represents the result of chaining the other ops together, 
		 *         or the identity op if the collection is empty
		 */
		public static ImageOp sequential(Collection<? extends ImageOp> ops) {
			if (ops.isEmpty())
				return identity();
			if (ops.size() == 1)
				return ops.iterator().next();
			return new SequentialMultiOp(ops);
		}
		
		/**
		 * Apply an array of ops sequentially, chaining the output of one op as the input for the next.
		 * @param ops
		 * @return an op that represents the result of chaining the other ops together
		 */
		public static ImageOp sequential(ImageOp...ops) {
			return sequential(Arrays.asList(ops));
		}
		
		/**
		 * Apply an op only if a predicate is true.
		 * @param predicate test evaluated once per input
		 * @param thenOp op applied if the predicate is true
		 * @return
		 */
		public static ImageOp conditional(Predicate<? super Bitmap> predicate, ImageOp thenOp) {
			return conditional(predicate, thenOp, null);
		}
		
		/**
		 * Apply one of two ops, depending upon a predicate.
		 * @param predicate test evaluated once per input
		 * @param thenOp op applied if the predicate is true
		 * @param elseOp op applied if the predicate is false; if null, the input is returned unchanged
		 * @return
		 */
		public static ImageOp conditional(Predicate<? super Bitmap> predicate, ImageOp thenOp, ImageOp elseOp) {
			return new ConditionalOp(predicate, thenOp, elseOp);
		}
		
		/**
		 * Apply an op, returning the input unchanged (and logging a warning) if it fails.
		 * @param op
		 * @return
		 */
		public static ImageOp safe(ImageOp op) {
			return safe(op, null);
		}
		
		/**
		 * Apply an op, using a fallback if it fails.
		 * @param op
		 * @param fallback function to compute the output on failure; if null, a warning is logged and the input returned
		 * @return
		 */
		public static ImageOp safe(ImageOp op, OpFallback fallback) {
			return new SafeOp(op, fallback);
		}
		
		/**
		 * Create an op from a handler, returning the input unchanged if it fails.
		 * @param <P>
		 * @param handler
		 * @param params
		 * @param fallback function to compute the output on failure; may be null
		 * @return
		 */
		public static <P> ImageOp safe(OpHandler<P> handler, P params, OpFallback fallback) {
			return safe(create(handler, params), fallback);
		}
		
		
		@OpType("identity")
		static class IdentityOp implements ImageOp {

			@Override
			public Bitmap apply(Bitmap input) {
				return input;
			}
			
		}
		
		static class HandlerOp<P> implements ImageOp {
			
			private final String name;
			private final OpHandler<P> handler;
			private final P params;
			
			HandlerOp(String name, OpHandler<P> handler, P params) {
				this.name = Objects.requireNonNull(name, "Op name must not be null!");
				this.handler = Objects.requireNonNull(handler, "Op handler must not be null!");
				this.params = params;
			}

			@Override
			public Bitmap apply(Bitmap input) {
				var output = handler.apply(input, params);
				if (output == null)
					throw new IllegalStateException("Op handler returned null");
				return output;
			}
			
			@Override
			public String getName() {
				return name;
			}
			
		}
		
		@OpType("sequential")
		static class SequentialMultiOp implements ValidatedOp {
			
			private final static Logger logger = LoggerFactory.getLogger(SequentialMultiOp.class);
			
			private final List<ImageOp> ops;
			
			SequentialMultiOp(Collection<? extends ImageOp> ops) {
				this.ops = Collections.unmodifiableList(new ArrayList<>(ops));
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(ops, list -> list != null && list.stream().allMatch(Objects::nonNull), "Sequential ops must not contain null");
			}
			
			List<ImageOp> getOps() {
				return ops;
			}

			@Override
			public Bitmap apply(Bitmap input) {
				for (var op : ops) {
					long startTime = System.nanoTime();
					input = applyOp(op, input);
					LogTools.logDuration(logger, Level.TRACE, "Applied " + op.getName(), startTime);
				}
				return input;
			}
			
		}
		
		static class ConditionalOp implements ImageOp {
			
			private final Predicate<? super Bitmap> predicate;
			private final ImageOp thenOp;
			private final ImageOp elseOp;
			
			ConditionalOp(Predicate<? super Bitmap> predicate, ImageOp thenOp, ImageOp elseOp) {
				this.predicate = Objects.requireNonNull(predicate, "Predicate must not be null!");
				this.thenOp = Objects.requireNonNull(thenOp, "Op must not be null!");
				this.elseOp = elseOp;
			}

			@Override
			public Bitmap apply(Bitmap input) {
				if (predicate.test(input))
					return thenOp.apply(input);
				if (elseOp != null)
					return elseOp.apply(input);
				return input;
			}
			
			@Override
			public String getName() {
				return "conditional(" + thenOp.getName() + (elseOp == null ? "" : ", " + elseOp.getName()) + ")";
			}
			
		}
		
		/**
		 * The fallback is not serialized.
		 */
		@OpType("safe")
		static class SafeOp implements ValidatedOp {
			
			private final static Logger logger = LoggerFactory.getLogger(SafeOp.class);
			
			private final ImageOp op;
			private final transient OpFallback fallback;
			
			SafeOp(ImageOp op, OpFallback fallback) {
				this.op = op;
				this.fallback = fallback;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(op, Objects::nonNull, "Safe op must wrap another op");
			}

			@Override
			public Bitmap apply(Bitmap input) {
				try {
					return op.apply(input);
				} catch (RuntimeException e) {
					if (fallback != null) {
						logger.debug("Op {} failed, applying fallback", op.getName(), e);
						return fallback.apply(input, e);
					}
					logger.warn("Op {} failed, returning the input unchanged: {}", op.getName(), e.getLocalizedMessage());
					logger.debug(e.getLocalizedMessage(), e);
					return input;
				}
			}
			
			@Override
			public String getName() {
				return "safe(" + op.getName() + ")";
			}
			
		}
		
	}
	
	/**
	 * Apply an op, converting any failure into an {@link OperationException} that names the op.
	 * @param op
	 * @param input
	 * @return
	 * @throws OperationException
	 */
	public static Bitmap applyOp(ImageOp op, Bitmap input) throws OperationException {
		Bitmap output;
		try {
			output = op.apply(input);
		} catch (OperationException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new OperationException(op.getName(), e);
		}
		if (output == null)
			throw new OperationException(op.getName(), new IllegalStateException("Op returned null"));
		return output;
	}
	
	
	/**
	 * Ops that change pixel values independently of their neighbors.
	 */
	@OpType("adjust")
	public static class Adjust {
		
		/**
		 * Add a constant to the red, green and blue values.
		 * @param amount value between -255 and 255
		 * @return
		 */
		public static ImageOp brightness(double amount) {
			return new BrightnessOp(amount);
		}
		
		/**
		 * Increase or decrease contrast about the middle value 128.
		 * @param amount value between -1 (flat gray) and 1 (maximum contrast)
		 * @return
		 */
		public static ImageOp contrast(double amount) {
			return new ContrastOp(amount);
		}
		
		/**
		 * Convert to grayscale using luminance.
		 * @return
		 */
		public static ImageOp grayscale() {
			return grayscale(GrayscaleMethod.LUMINANCE);
		}
		
		/**
		 * Convert to grayscale using the specified method. Alpha is unchanged.
		 * @param method
		 * @return
		 */
		public static ImageOp grayscale(GrayscaleMethod method) {
			Core.validate(method, Objects::nonNull, "Grayscale method must not be null");
			return new GrayscaleOp(method);
		}
		
		/**
		 * Apply a full sepia tone.
		 * @return
		 */
		public static ImageOp sepia() {
			return sepia(1.0);
		}
		
		/**
		 * Blend with a sepia tone.
		 * @param intensity value between 0 (no change) and 1 (full sepia)
		 * @return
		 */
		public static ImageOp sepia(double intensity) {
			return new SepiaOp(intensity);
		}
		
		/**
		 * Invert the red, green and blue values. Alpha is unchanged.
		 * @return
		 */
		public static ImageOp invert() {
			return new InvertOp();
		}
		
		/**
		 * Blend the red, green and blue values towards a color.
		 * @param color the tint color; its alpha is ignored
		 * @param opacity value between 0 (no change) and 1 (solid color)
		 * @return
		 */
		public static ImageOp tint(Color color, double opacity) {
			Core.validate(color, Objects::nonNull, "Tint color must not be null");
			return tint(color.getRed(), color.getGreen(), color.getBlue(), opacity);
		}
		
		/**
		 * Blend the red, green and blue values towards a color.
		 * @param red
		 * @param green
		 * @param blue
		 * @param opacity value between 0 (no change) and 1 (solid color)
		 * @return
		 */
		public static ImageOp tint(int red, int green, int blue, double opacity) {
			return new TintOp(red, green, blue, opacity);
		}
		
		/**
		 * Multiply channel values by constants.
		 * @param red red multiplier, or null to leave the channel unchanged
		 * @param green green multiplier, or null to leave the channel unchanged
		 * @param blue blue multiplier, or null to leave the channel unchanged
		 * @param alpha alpha multiplier, or null to leave the channel unchanged
		 * @return
		 */
		public static ImageOp channels(Double red, Double green, Double blue, Double alpha) {
			return new ChannelsOp(red, green, blue, alpha);
		}
		
		
		@OpType("brightness")
		static class BrightnessOp implements ValidatedOp {
			
			private final double amount;
			
			BrightnessOp(double amount) {
				this.amount = amount;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(amount, a -> a >= -255 && a <= 255, "Brightness must be between -255 and 255");
			}

			@Override
			public Bitmap apply(Bitmap input) {
				return KernelExecutor.applyPointKernel(input, (r, g, b, a, out) -> {
					out[0] = r + amount;
					out[1] = g + amount;
					out[2] = b + amount;
				});
			}
			
		}
		
		@OpType("contrast")
		static class ContrastOp implements ValidatedOp {
			
			private final double amount;
			
			ContrastOp(double amount) {
				this.amount = amount;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(amount, a -> a >= -1 && a <= 1, "Contrast must be between -1 and 1");
			}

			@Override
			public Bitmap apply(Bitmap input) {
				double c = amount * 255;
				double factor = (259 * (c + 255)) / (255 * (259 - c));
				return KernelExecutor.applyPointKernel(input, (r, g, b, a, out) -> {
					out[0] = factor * (r - 128) + 128;
					out[1] = factor * (g - 128) + 128;
					out[2] = factor * (b - 128) + 128;
				});
			}
			
		}
		
		@OpType("grayscale")
		static class GrayscaleOp implements ImageOp {
			
			private final GrayscaleMethod method;
			
			GrayscaleOp(GrayscaleMethod method) {
				this.method = method;
			}

			@Override
			public Bitmap apply(Bitmap input) {
				var m = method == null ? GrayscaleMethod.LUMINANCE : method;
				return KernelExecutor.applyPointKernel(input, (r, g, b, a, out) -> {
					double gray = m.toGray(r, g, b);
					out[0] = gray;
					out[1] = gray;
					out[2] = gray;
				});
			}
			
		}
		
		@OpType("sepia")
		static class SepiaOp implements ValidatedOp {
			
			private final double intensity;
			
			SepiaOp(double intensity) {
				this.intensity = intensity;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(intensity, i -> i >= 0 && i <= 1, "Sepia intensity must be between 0 and 1");
			}

			@Override
			public Bitmap apply(Bitmap input) {
				return KernelExecutor.applyPointKernel(input, (r, g, b, a, out) -> {
					double sr = Math.min(255, 0.393 * r + 0.769 * g + 0.189 * b);
					double sg = Math.min(255, 0.349 * r + 0.686 * g + 0.168 * b);
					double sb = Math.min(255, 0.272 * r + 0.534 * g + 0.131 * b);
					out[0] = r + intensity * (sr - r);
					out[1] = g + intensity * (sg - g);
					out[2] = b + intensity * (sb - b);
				});
			}
			
		}
		
		@OpType("invert")
		static class InvertOp implements ImageOp {

			@Override
			public Bitmap apply(Bitmap input) {
				return KernelExecutor.applyPointKernel(input, (r, g, b, a, out) -> {
					out[0] = 255 - r;
					out[1] = 255 - g;
					out[2] = 255 - b;
				});
			}
			
		}
		
		@OpType("tint")
		static class TintOp implements ValidatedOp {
			
			private final int red;
			private final int green;
			private final int blue;
			private final double opacity;
			
			TintOp(int red, int green, int blue, double opacity) {
				this.red = red;
				this.green = green;
				this.blue = blue;
				this.opacity = opacity;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(opacity, 
						o -> ColorTools.is8Bit(red) && ColorTools.is8Bit(green) && ColorTools.is8Bit(blue) && o >= 0 && o <= 1, 
						"Tint values must be valid (RGB: 0-255, opacity: 0-1)");
			}

			@Override
			public Bitmap apply(Bitmap input) {
				return KernelExecutor.applyPointKernel(input, (r, g, b, a, out) -> {
					out[0] = r + opacity * (red - r);
					out[1] = g + opacity * (green - g);
					out[2] = b + opacity * (blue - b);
				});
			}
			
		}
		
		@OpType("channels")
		static class ChannelsOp implements ValidatedOp {
			
			private final Double red;
			private final Double green;
			private final Double blue;
			private final Double alpha;
			
			ChannelsOp(Double red, Double green, Double blue, Double alpha) {
				this.red = red;
				this.green = green;
				this.blue = blue;
				this.alpha = alpha;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(new Double[] {red, green, blue, alpha}, 
						values -> Arrays.stream(values).allMatch(v -> v == null || (Double.isFinite(v) && v >= 0)), 
						"Channel multipliers must be finite and >= 0");
			}

			@Override
			public Bitmap apply(Bitmap input) {
				if (red == null && green == null && blue == null && alpha == null)
					return input;
				double mr = red == null ? 1 : red;
				double mg = green == null ? 1 : green;
				double mb = blue == null ? 1 : blue;
				double ma = alpha == null ? 1 : alpha;
				return KernelExecutor.applyPointKernel(input, (r, g, b, a, out) -> {
					out[0] = r * mr;
					out[1] = g * mg;
					out[2] = b * mb;
					out[3] = a * ma;
				});
			}
			
		}
		
	}
	
	
	/**
	 * Ops that compute each pixel from its neighborhood.
	 * <p>
	 * Neighborhood filters leave a border of {@code floor(size/2)} pixels unchanged.
	 */
	@OpType("filters")
	public static class Filters {
		
		/**
		 * Default Sobel threshold.
		 */
		public static final double DEFAULT_EDGE_THRESHOLD = 100;
		
		/**
		 * Sharpen using a 3x3 kernel with intensity 1.
		 * @return
		 */
		public static ImageOp sharpen() {
			return sharpen(1.0);
		}
		
		/**
		 * Sharpen using the 3x3 kernel {@code [0, -i, 0, -i, 1 + 4i, -i, 0, -i, 0]}.
		 * @param intensity value between 0 and 2
		 * @return
		 */
		public static ImageOp sharpen(double intensity) {
			return new SharpenOp(intensity);
		}
		
		/**
		 * Apply a custom convolution kernel.
		 * @param kernel
		 * @return
		 */
		public static ImageOp convolve(ConvolutionKernel kernel) {
			Core.validate(kernel, Objects::nonNull, "Kernel must not be null");
			return new ConvolveOp(kernel);
		}
		
		/**
		 * Apply a custom convolution kernel, normalized by the sum of its weights.
		 * @param size kernel width and height; must be odd and &ge; 3
		 * @param weights row-major weights
		 * @return
		 */
		public static ImageOp convolve(int size, double... weights) {
			try {
				return convolve(ConvolutionKernel.create(size, weights));
			} catch (IllegalArgumentException e) {
				throw new IllegalArgumentException("Invalid operation parameters: " + e.getLocalizedMessage(), e);
			}
		}
		
		/**
		 * Detect edges using the Sobel operator with the default threshold.
		 * @return
		 */
		public static ImageOp sobelEdges() {
			return sobelEdges(DEFAULT_EDGE_THRESHOLD);
		}
		
		/**
		 * Detect edges using the Sobel operator, giving a binary image.
		 * @param threshold luminance gradient magnitude between 0 and 255; pixels above this are edges
		 * @return
		 */
		public static ImageOp sobelEdges(double threshold) {
			return new SobelOp(threshold);
		}
		
		/**
		 * Blur using a square mean filter.
		 * @param radius integer between 1 and 20; the filter size is {@code 2 * radius + 1}
		 * @return
		 */
		public static ImageOp blur(int radius) {
			return new BlurOp(radius);
		}
		
		/**
		 * Replace square blocks by their mean value. Blocks at the right and bottom edges may be smaller.
		 * @param blockSize integer between 1 and 100
		 * @return
		 */
		public static ImageOp pixelate(int blockSize) {
			return new PixelateOp(blockSize);
		}
		
		
		@OpType("sharpen")
		static class SharpenOp implements ValidatedOp {
			
			private final double intensity;
			
			SharpenOp(double intensity) {
				this.intensity = intensity;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(intensity, i -> i >= 0 && i <= 2, "Sharpen intensity must be between 0 and 2");
			}

			@Override
			public Bitmap apply(Bitmap input) {
				return KernelExecutor.applyNeighborhoodKernel(input, ConvolutionKernel.sharpen(intensity));
			}
			
		}
		
		@OpType("convolve")
		static class ConvolveOp implements ValidatedOp {
			
			private final int size;
			private final double[] weights;
			private final double divisor;
			private final double offset;
			
			private transient ConvolutionKernel kernel;
			
			ConvolveOp(ConvolutionKernel kernel) {
				this.size = kernel.getSize();
				this.weights = kernel.getWeights();
				this.divisor = kernel.getDivisor();
				this.offset = kernel.getOffset();
				this.kernel = kernel;
			}
			
			@Override
			public void validate() {
				Core.validate(weights, Objects::nonNull, "Kernel weights must not be null");
				try {
					kernel = ConvolutionKernel.create(size, weights, divisor, offset);
				} catch (IllegalArgumentException e) {
					throw new IllegalArgumentException("Invalid operation parameters: " + e.getLocalizedMessage(), e);
				}
			}
			
			private ConvolutionKernel getKernel() {
				if (kernel == null)
					validate();
				return kernel;
			}

			@Override
			public Bitmap apply(Bitmap input) {
				return KernelExecutor.applyNeighborhoodKernel(input, getKernel());
			}
			
		}
		
		@OpType("sobel")
		static class SobelOp implements ValidatedOp {
			
			private final double threshold;
			
			SobelOp(double threshold) {
				this.threshold = threshold;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(threshold, t -> t >= 0 && t <= 255, "Edge threshold must be between 0 and 255");
			}

			@Override
			public Bitmap apply(Bitmap input) {
				return KernelExecutor.applyNeighborhoodKernel(input, new SobelKernel(threshold));
			}
			
		}
		
		@OpType("blur")
		static class BlurOp implements ValidatedOp {
			
			private final int radius;
			
			BlurOp(int radius) {
				this.radius = radius;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(radius, r -> r >= 1 && r <= 20, "Blur radius must be between 1 and 20");
			}

			@Override
			public Bitmap apply(Bitmap input) {
				return KernelExecutor.applyNeighborhoodKernel(input, ConvolutionKernel.box(radius));
			}
			
		}
		
		@OpType("pixelate")
		static class PixelateOp implements ValidatedOp {
			
			private final int blockSize;
			
			PixelateOp(int blockSize) {
				this.blockSize = blockSize;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(blockSize, s -> s >= 1 && s <= 100, "Block size must be between 1 and 100");
			}

			@Override
			public Bitmap apply(Bitmap input) {
				if (blockSize <= 1)
					return input;
				int w = input.getWidth();
				int h = input.getHeight();
				byte[] src = input.getPixels();
				byte[] dst = new byte[src.length];
				long[] sums = new long[Bitmap.CHANNELS];
				for (int by = 0; by < h; by += blockSize) {
					int yEnd = Math.min(by + blockSize, h);
					for (int bx = 0; bx < w; bx += blockSize) {
						int xEnd = Math.min(bx + blockSize, w);
						Arrays.fill(sums, 0L);
						for (int y = by; y < yEnd; y++) {
							for (int x = bx; x < xEnd; x++) {
								int ind = (y * w + x) * Bitmap.CHANNELS;
								for (int c = 0; c < Bitmap.CHANNELS; c++)
									sums[c] += src[ind + c] & 0xff;
							}
						}
						double count = (yEnd - by) * (xEnd - bx);
						byte[] mean = new byte[Bitmap.CHANNELS];
						for (int c = 0; c < Bitmap.CHANNELS; c++)
							mean[c] = (byte)Math.round(sums[c] / count);
						for (int y = by; y < yEnd; y++) {
							for (int x = bx; x < xEnd; x++) {
								System.arraycopy(mean, 0, dst, (y * w + x) * Bitmap.CHANNELS, Bitmap.CHANNELS);
							}
						}
					}
				}
				return Bitmap.wrap(w, h, dst);
			}
			
		}
		
	}
	
	
	/**
	 * Ops that adjust contrast using luminance statistics.
	 */
	@OpType("contrast")
	public static class Contrast {
		
		/**
		 * Default radius for adaptive contrast.
		 */
		public static final int DEFAULT_RADIUS = 16;
		
		/**
		 * Default strength for adaptive contrast.
		 */
		public static final double DEFAULT_STRENGTH = 1.0;
		
		/**
		 * Equalize the luminance histogram, scaling red, green and blue by the same factor for each pixel.
		 * @return
		 */
		public static ImageOp equalize() {
			return new EqualizeOp();
		}
		
		/**
		 * Enhance local contrast using default parameters.
		 * @return
		 */
		public static ImageOp adaptiveContrast() {
			return adaptiveContrast(DEFAULT_RADIUS, DEFAULT_STRENGTH);
		}
		
		/**
		 * Enhance local contrast, with the greatest gain in regions where the local standard deviation is low 
		 * relative to the global standard deviation.
		 * @param radius window radius, between 1 and 50
		 * @param strength value between 0 (no change) and 4
		 * @return
		 */
		public static ImageOp adaptiveContrast(int radius, double strength) {
			return new AdaptiveContrastOp(radius, strength);
		}
		
		
		@OpType("equalize")
		static class EqualizeOp implements ImageOp {

			@Override
			public Bitmap apply(Bitmap input) {
				var stats = LuminanceStatistics.compute(input);
				int[] histogram = stats.getHistogram();
				long[] cdf = new long[histogram.length];
				long count = 0;
				long cdfMin = -1;
				for (int i = 0; i < histogram.length; i++) {
					count += histogram[i];
					cdf[i] = count;
					if (cdfMin < 0 && count > 0)
						cdfMin = count;
				}
				long n = stats.getPixelCount();
				if (n == cdfMin)
					return input;
				double[] lut = new double[histogram.length];
				for (int i = 0; i < lut.length; i++)
					lut[i] = Math.round((cdf[i] - cdfMin) / (double)(n - cdfMin) * 255);
				
				return KernelExecutor.applyTwoPass(input, b -> stats, (s, ind, r, g, b, a, out) -> {
					double lum = s.getLuminance(ind);
					double target = lut[ColorTools.clip255(lum)];
					if (lum == 0) {
						out[0] = target;
						out[1] = target;
						out[2] = target;
					} else {
						double scale = target / lum;
						out[0] = r * scale;
						out[1] = g * scale;
						out[2] = b * scale;
					}
				});
			}
			
		}
		
		@OpType("adaptive")
		static class AdaptiveContrastOp implements ValidatedOp {
			
			private final int radius;
			private final double strength;
			
			AdaptiveContrastOp(int radius, double strength) {
				this.radius = radius;
				this.strength = strength;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(radius, r -> r >= 1 && r <= 50, "Adaptive contrast radius must be between 1 and 50");
				Core.validate(strength, s -> s >= 0 && s <= 4, "Adaptive contrast strength must be between 0 and 4");
			}

			@Override
			public Bitmap apply(Bitmap input) {
				if (strength == 0)
					return input;
				int width = input.getWidth();
				return KernelExecutor.applyTwoPass(input, LuminanceStatistics::compute, (stats, ind, r, g, b, a, out) -> {
					int x = ind % width;
					int y = ind / width;
					double globalStd = stats.getStdDev() == 0 ? 1 : stats.getStdDev();
					double mean = stats.getLocalMean(x, y, radius);
					double std = stats.getLocalStdDev(x, y, radius);
					double gain = 1 + strength * (1 - std / (std + globalStd));
					out[0] = mean + gain * (r - mean);
					out[1] = mean + gain * (g - mean);
					out[2] = mean + gain * (b - mean);
				});
			}
			
		}
		
	}
	
	
	/**
	 * Ops that change the image geometry.
	 */
	@OpType("transform")
	public static class Transform {
		
		/**
		 * Resize according to a fit specification.
		 * @param spec
		 * @return
		 */
		public static ImageOp resize(FitSpec spec) {
			return new ResizeOp(spec);
		}
		
		/**
		 * Resize to cover the specified size, cropping about the center.
		 * @param width
		 * @param height
		 * @return
		 */
		public static ImageOp resize(int width, int height) {
			return resize(FitSpec.of(width, height, FitMode.COVER));
		}
		
		/**
		 * Crop a rectangle, filling any region outside the image with transparent white.
		 * @param x
		 * @param y
		 * @param width
		 * @param height
		 * @return
		 * @see #crop(double, double, double, double, Color)
		 */
		public static ImageOp crop(double x, double y, double width, double height) {
			return crop(x, y, width, height, Color.TRANSPARENT_WHITE);
		}
		
		/**
		 * Crop a rectangle. Values less than 1 are treated as fractions of the image width or height.
		 * @param x left of the rectangle
		 * @param y top of the rectangle
		 * @param width rectangle width, which will be the output width
		 * @param height rectangle height, which will be the output height
		 * @param background color used for any region outside the image
		 * @return
		 */
		public static ImageOp crop(double x, double y, double width, double height, Color background) {
			Core.validate(background, Objects::nonNull, "Background color must not be null");
			return new CropOp(x, y, width, height, background);
		}
		
		/**
		 * Mirror the image.
		 * @param direction
		 * @return
		 */
		public static ImageOp flip(FlipDirection direction) {
			return new FlipOp(direction);
		}
		
		/**
		 * Rotate clockwise, filling uncovered regions with transparent white.
		 * @param degrees
		 * @return
		 */
		public static ImageOp rotate(double degrees) {
			return rotate(degrees, Color.TRANSPARENT_WHITE);
		}
		
		/**
		 * Rotate clockwise about the image center.
		 * @param degrees rotation; multiples of 90 are exact, other angles expand the canvas
		 * @param background color used for regions not covered by the rotated image
		 * @return
		 */
		public static ImageOp rotate(double degrees, Color background) {
			Core.validate(background, Objects::nonNull, "Background color must not be null");
			return new RotateOp(degrees, background);
		}
		
		
		@OpType("resize")
		static class ResizeOp implements ValidatedOp {
			
			private final FitSpec spec;
			
			ResizeOp(FitSpec spec) {
				this.spec = spec;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(spec, Objects::nonNull, "Fit specification must not be null");
				spec.validate();
			}

			@Override
			public Bitmap apply(Bitmap input) {
				return TransformTools.resize(input, spec);
			}
			
		}
		
		@OpType("crop")
		static class CropOp implements ValidatedOp {
			
			private final double x;
			private final double y;
			private final double width;
			private final double height;
			private final Color background;
			
			CropOp(double x, double y, double width, double height, Color background) {
				this.x = x;
				this.y = y;
				this.width = width;
				this.height = height;
				this.background = background;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(new double[] {x, y, width, height}, 
						v -> Arrays.stream(v).allMatch(Double::isFinite) && width > 0 && height > 0, 
						"Crop values must be finite, with width and height > 0");
			}
			
			private static int resolve(double value, int size) {
				return (int)(value < 1 ? Math.round(value * size) : Math.round(value));
			}

			@Override
			public Bitmap apply(Bitmap input) {
				int w = input.getWidth();
				int h = input.getHeight();
				int cropWidth = resolve(width, w);
				int cropHeight = resolve(height, h);
				if (cropWidth <= 0 || cropHeight <= 0)
					throw new IllegalArgumentException("Crop size must be > 0, but resolved to " + cropWidth + "x" + cropHeight);
				return TransformTools.crop(input, resolve(x, w), resolve(y, h), cropWidth, cropHeight, 
						background == null ? Color.TRANSPARENT_WHITE : background);
			}
			
		}
		
		@OpType("flip")
		static class FlipOp implements ValidatedOp {
			
			private final FlipDirection direction;
			
			FlipOp(FlipDirection direction) {
				this.direction = direction;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(direction, Objects::nonNull, "Flip direction must not be null");
			}

			@Override
			public Bitmap apply(Bitmap input) {
				return TransformTools.flip(input, direction);
			}
			
		}
		
		@OpType("rotate")
		static class RotateOp implements ValidatedOp {
			
			private final double degrees;
			private final Color background;
			
			RotateOp(double degrees, Color background) {
				this.degrees = degrees;
				this.background = background;
				validate();
			}
			
			@Override
			public void validate() {
				Core.validate(degrees, Double::isFinite, "Rotation must be finite");
			}

			@Override
			public Bitmap apply(Bitmap input) {
				return TransformTools.rotate(input, degrees, background == null ? Color.TRANSPARENT_WHITE : background);
			}
			
		}
		
	}

}
