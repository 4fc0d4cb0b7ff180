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

package pixly.processing.tools;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixly.lib.common.ColorTools;
import pixly.lib.common.Prefs;
import pixly.lib.common.ThreadTools;
import pixly.lib.images.Bitmap;

/**
 * Static methods for running pixel kernels over a {@link Bitmap}.
 * <p>
 * Neighborhood kernels are split into row bands and run in parallel when the image contains at least 
 * {@link Prefs#getParallelThreshold()} pixels. The output is identical whether or not parallel execution is used.
 */
public class KernelExecutor {
	
	final private static Logger logger = LoggerFactory.getLogger(KernelExecutor.class);
	
	private static ExecutorService pool;
	private static int poolThreads = -1;
	
	// Suppress default constructor for non-instantiability
	private KernelExecutor() {
		throw new AssertionError();
	}
	
	/**
	 * Function applied to every pixel, with access to statistics collected over the whole image in a first pass.
	 *
	 * @param <S> type of the statistics
	 * @see KernelExecutor#applyTwoPass(Bitmap, Function, StatisticsKernel)
	 */
	@FunctionalInterface
	public static interface StatisticsKernel<S> {
		
		/**
		 * Compute the output for a single pixel.
		 * @param stats statistics computed from the input image
		 * @param pixelIndex index of the pixel, i.e. {@code y * width + x}
		 * @param r
		 * @param g
		 * @param b
		 * @param a
		 * @param out array of length 4, pre-filled with the input values
		 */
		void apply(S stats, int pixelIndex, int r, int g, int b, int a, double[] out);
		
	}
	
	/**
	 * Apply a point kernel to every pixel, returning a new bitmap.
	 * @param bitmap
	 * @param kernel
	 * @return
	 */
	public static Bitmap applyPointKernel(Bitmap bitmap, PointKernel kernel) {
		byte[] src = bitmap.getPixels();
		byte[] dst = new byte[src.length];
		double[] out = new double[4];
		for (int i = 0; i < src.length; i += Bitmap.CHANNELS) {
			int r = src[i] & 0xff;
			int g = src[i+1] & 0xff;
			int b = src[i+2] & 0xff;
			int a = src[i+3] & 0xff;
			out[0] = r;
			out[1] = g;
			out[2] = b;
			out[3] = a;
			kernel.apply(r, g, b, a, out);
			store(dst, i, out);
		}
		return Bitmap.wrap(bitmap.getWidth(), bitmap.getHeight(), dst);
	}
	
	/**
	 * Collect statistics from the image, then apply a kernel to every pixel using those statistics.
	 * @param <S>
	 * @param bitmap
	 * @param collector function to compute statistics from the input
	 * @param kernel
	 * @return
	 */
	public static <S> Bitmap applyTwoPass(Bitmap bitmap, Function<Bitmap, S> collector, StatisticsKernel<S> kernel) {
		S stats = collector.apply(bitmap);
		byte[] src = bitmap.getPixels();
		byte[] dst = new byte[src.length];
		double[] out = new double[4];
		for (int i = 0; i < src.length; i += Bitmap.CHANNELS) {
			int r = src[i] & 0xff;
			int g = src[i+1] & 0xff;
			int b = src[i+2] & 0xff;
			int a = src[i+3] & 0xff;
			out[0] = r;
			out[1] = g;
			out[2] = b;
			out[3] = a;
			kernel.apply(stats, i / Bitmap.CHANNELS, r, g, b, a, out);
			store(dst, i, out);
		}
		return Bitmap.wrap(bitmap.getWidth(), bitmap.getHeight(), dst);
	}
	
	/**
	 * Apply a neighborhood kernel to all pixels at least {@code kernel.getRadius()} pixels from the image edge.
	 * Other pixels are copied unchanged.
	 * If the image is too small to have any interior pixels, the input is returned unchanged.
	 * @param bitmap
	 * @param kernel
	 * @return
	 */
	public static Bitmap applyNeighborhoodKernel(Bitmap bitmap, NeighborhoodKernel kernel) {
		return applyNeighborhoodKernel(bitmap, kernel, bitmap.getPixelCount() >= Prefs.getParallelThreshold());
	}
	
	/**
	 * Apply a neighborhood kernel, optionally in parallel.
	 * @param bitmap
	 * @param kernel
	 * @param parallel if true, split the rows across the shared thread pool
	 * @return
	 * @see #applyNeighborhoodKernel(Bitmap, NeighborhoodKernel)
	 */
	public static Bitmap applyNeighborhoodKernel(Bitmap bitmap, NeighborhoodKernel kernel, boolean parallel) {
		int width = bitmap.getWidth();
		int height = bitmap.getHeight();
		int radius = kernel.getRadius();
		if (!kernel.hasInterior(width, height))
			return bitmap;
		
		byte[] src = bitmap.getPixels();
		byte[] dst = src.clone();
		int yStart = radius;
		int yEnd = height - radius;
		int nThreads = Math.min(Prefs.getNumThreads(), yEnd - yStart);
		if (!parallel || nThreads <= 1) {
			applyNeighborhoodKernelToRows(src, dst, width, height, kernel, yStart, yEnd);
			return Bitmap.wrap(width, height, dst);
		}
		
		int rowsPerBand = (int)Math.ceil((yEnd - yStart) / (double)nThreads);
		List<Runnable> bands = new ArrayList<>();
		for (int y = yStart; y < yEnd; y += rowsPerBand) {
			int y1 = y;
			int y2 = Math.min(y + rowsPerBand, yEnd);
			bands.add(() -> applyNeighborhoodKernelToRows(src, dst, width, height, kernel, y1, y2));
		}
		List<Future<?>> futures = submitAll(bands);
		logger.trace("Applying {} to {}x{} image in {} bands", kernel, width, height, futures.size());
		try {
			for (var future : futures)
				future.get();
		} catch (InterruptedException e) {
			futures.forEach(f -> f.cancel(true));
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while applying " + kernel, e);
		} catch (ExecutionException e) {
			var cause = e.getCause();
			if (cause instanceof RuntimeException)
				throw (RuntimeException)cause;
			if (cause instanceof Error)
				throw (Error)cause;
			throw new IllegalStateException(cause);
		}
		return Bitmap.wrap(width, height, dst);
	}
	
	/**
	 * Apply a neighborhood kernel to a band of rows.
	 * Only columns at least {@code kernel.getRadius()} from the left and right edges are written.
	 * @param src source pixels (read only)
	 * @param dst destination pixels, of the same length as src
	 * @param width image width
	 * @param height image height
	 * @param kernel
	 * @param yStart first row (inclusive); must be &ge; radius
	 * @param yEnd last row (exclusive); must be &le; height - radius
	 */
	public static void applyNeighborhoodKernelToRows(byte[] src, byte[] dst, int width, int height, NeighborhoodKernel kernel, int yStart, int yEnd) {
		int radius = kernel.getRadius();
		if (yStart < radius || yEnd > height - radius)
			throw new IllegalArgumentException("Rows " + yStart + "-" + yEnd + " are outside the interior of an image with height " + height);
		double[] out = new double[4];
		for (int y = yStart; y < yEnd; y++) {
			for (int x = radius; x < width - radius; x++) {
				kernel.apply(src, width, x, y, out);
				store(dst, (y * width + x) * Bitmap.CHANNELS, out);
			}
		}
	}
	
	private static void store(byte[] dst, int ind, double[] out) {
		dst[ind] = (byte)ColorTools.clip255(out[0]);
		dst[ind+1] = (byte)ColorTools.clip255(out[1]);
		dst[ind+2] = (byte)ColorTools.clip255(out[2]);
		dst[ind+3] = (byte)ColorTools.clip255(out[3]);
	}
	
	/**
	 * Submit tasks to the shared pool.
	 * The pool is only replaced (and the previous pool shut down) while holding the same lock, 
	 * so tasks are never submitted to a pool that has been shut down. 
	 * Tasks that were already submitted to a replaced pool still run to completion.
	 */
	private static synchronized List<Future<?>> submitAll(List<Runnable> tasks) {
		ExecutorService executor = getPool();
		List<Future<?>> futures = new ArrayList<>(tasks.size());
		for (var task : tasks)
			futures.add(executor.submit(task));
		return futures;
	}
	
	private static synchronized ExecutorService getPool() {
		int n = Prefs.getNumThreads();
		if (pool == null || poolThreads != n) {
			if (pool != null)
				pool.shutdown();
			logger.debug("Creating kernel thread pool with {} threads", n);
			pool = ThreadTools.createFixedDaemonPool("pixly-kernel-", n);
			poolThreads = n;
		}
		return pool;
	}

}
