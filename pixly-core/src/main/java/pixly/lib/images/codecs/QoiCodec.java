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

import java.util.Arrays;

import pixly.lib.images.Bitmap;

/**
 * Codec for the Quite OK Image format (QOI).
 * <p>
 * Images are always written with 4 channels and the sRGB color space flag. 
 * Both 3 and 4 channel images can be read; 3 channel images are returned as opaque.
 * <p>
 * See https://qoiformat.org/qoi-specification.pdf
 */
public class QoiCodec implements ImageCodec {
	
	private static final int MAGIC = 0x716f6966; // "qoif"
	private static final int HEADER_SIZE = 14;
	private static final byte[] END_MARKER = {0, 0, 0, 0, 0, 0, 0, 1};
	
	/**
	 * Maximum number of pixels accepted when decoding.
	 */
	private static final long MAX_PIXELS = 400_000_000L;
	
	private static final int OP_INDEX = 0x00;
	private static final int OP_DIFF = 0x40;
	private static final int OP_LUMA = 0x80;
	private static final int OP_RUN = 0xc0;
	private static final int OP_RGB = 0xfe;
	private static final int OP_RGBA = 0xff;
	private static final int MASK_2 = 0xc0;
	
	private static final int SRGB = 0;
	
	@Override
	public ImageFormat getFormat() {
		return ImageFormat.QOI;
	}
	
	@Override
	public String getName() {
		return "QOI";
	}

	@Override
	public boolean canDecode() {
		return true;
	}

	@Override
	public boolean canEncode() {
		return true;
	}
	
	private static int hash(int r, int g, int b, int a) {
		return (r * 3 + g * 5 + b * 7 + a * 11) % 64;
	}
	
	private static int readInt(byte[] data, int p) {
		return ((data[p] & 0xff) << 24) | ((data[p+1] & 0xff) << 16) | ((data[p+2] & 0xff) << 8) | (data[p+3] & 0xff);
	}
	
	private static void writeInt(byte[] data, int p, int value) {
		data[p] = (byte)(value >>> 24);
		data[p+1] = (byte)(value >>> 16);
		data[p+2] = (byte)(value >>> 8);
		data[p+3] = (byte)value;
	}

	@Override
	public Bitmap decode(byte[] data) throws ImageDecodeException {
		if (data == null || data.length < HEADER_SIZE + END_MARKER.length)
			throw new ImageDecodeException(ImageFormat.QOI, "QOI data is too short");
		if (readInt(data, 0) != MAGIC)
			throw new ImageDecodeException(ImageFormat.QOI, "Missing QOI signature");
		long width = readInt(data, 4) & 0xffffffffL;
		long height = readInt(data, 8) & 0xffffffffL;
		int channels = data[12] & 0xff;
		if (width == 0 || height == 0 || width * height > MAX_PIXELS)
			throw new ImageDecodeException(ImageFormat.QOI, "Unsupported QOI dimensions " + width + "x" + height);
		if (channels != 3 && channels != 4)
			throw new ImageDecodeException(ImageFormat.QOI, "Unsupported QOI channel count " + channels);
		
		int nPixels = (int)(width * height);
		byte[] pixels = new byte[nPixels * Bitmap.CHANNELS];
		byte[] index = new byte[64 * 4];
		int r = 0, g = 0, b = 0, a = 255;
		int run = 0;
		int p = HEADER_SIZE;
		int chunksEnd = data.length - END_MARKER.length;
		
		for (int pos = 0; pos < pixels.length; pos += Bitmap.CHANNELS) {
			if (run > 0) {
				run--;
			} else if (p < chunksEnd) {
				int b1 = data[p++] & 0xff;
				if (b1 == OP_RGB) {
					r = data[p++] & 0xff;
					g = data[p++] & 0xff;
					b = data[p++] & 0xff;
				} else if (b1 == OP_RGBA) {
					r = data[p++] & 0xff;
					g = data[p++] & 0xff;
					b = data[p++] & 0xff;
					a = data[p++] & 0xff;
				} else if ((b1 & MASK_2) == OP_INDEX) {
					int i = b1 * 4;
					r = index[i] & 0xff;
					g = index[i+1] & 0xff;
					b = index[i+2] & 0xff;
					a = index[i+3] & 0xff;
				} else if ((b1 & MASK_2) == OP_DIFF) {
					r = (r + ((b1 >> 4) & 0x03) - 2) & 0xff;
					g = (g + ((b1 >> 2) & 0x03) - 2) & 0xff;
					b = (b + (b1 & 0x03) - 2) & 0xff;
				} else if ((b1 & MASK_2) == OP_LUMA) {
					int b2 = data[p++] & 0xff;
					int vg = (b1 & 0x3f) - 32;
					r = (r + vg - 8 + ((b2 >> 4) & 0x0f)) & 0xff;
					g = (g + vg) & 0xff;
					b = (b + vg - 8 + (b2 & 0x0f)) & 0xff;
				} else {
					run = b1 & 0x3f;
				}
				int i = hash(r, g, b, a) * 4;
				index[i] = (byte)r;
				index[i+1] = (byte)g;
				index[i+2] = (byte)b;
				index[i+3] = (byte)a;
			}
			pixels[pos] = (byte)r;
			pixels[pos+1] = (byte)g;
			pixels[pos+2] = (byte)b;
			pixels[pos+3] = (byte)a;
		}
		return Bitmap.wrap((int)width, (int)height, pixels);
	}

	@Override
	public byte[] encode(Bitmap bitmap, EncodeOptions options) throws ImageEncodeException {
		int width = bitmap.getWidth();
		int height = bitmap.getHeight();
		byte[] pixels = bitmap.getPixels();
		long maxSize = (long)width * height * (Bitmap.CHANNELS + 1) + HEADER_SIZE + END_MARKER.length;
		if (maxSize > Integer.MAX_VALUE - 8)
			throw new ImageEncodeException(ImageFormat.QOI, "Image is too large to encode as QOI: " + bitmap);
		
		byte[] out = new byte[(int)maxSize];
		writeInt(out, 0, MAGIC);
		writeInt(out, 4, width);
		writeInt(out, 8, height);
		out[12] = Bitmap.CHANNELS;
		out[13] = SRGB;
		int p = HEADER_SIZE;
		
		int[] index = new int[64];
		int prevR = 0, prevG = 0, prevB = 0, prevA = 255;
		int run = 0;
		int lastPos = pixels.length - Bitmap.CHANNELS;
		
		for (int pos = 0; pos < pixels.length; pos += Bitmap.CHANNELS) {
			int r = pixels[pos] & 0xff;
			int g = pixels[pos+1] & 0xff;
			int b = pixels[pos+2] & 0xff;
			int a = pixels[pos+3] & 0xff;
			
			if (r == prevR && g == prevG && b == prevB && a == prevA) {
				run++;
				if (run == 62 || pos == lastPos) {
					out[p++] = (byte)(OP_RUN | (run - 1));
					run = 0;
				}
			} else {
				if (run > 0) {
					out[p++] = (byte)(OP_RUN | (run - 1));
					run = 0;
				}
				int h = hash(r, g, b, a);
				int packed = (r << 24) | (g << 16) | (b << 8) | a;
				// Index starts zeroed on both sides, so an unused slot matches transparent black
				if (index[h] == packed) {
					out[p++] = (byte)(OP_INDEX | h);
				} else {
					index[h] = packed;
					if (a == prevA) {
						byte vr = (byte)(r - prevR);
						byte vg = (byte)(g - prevG);
						byte vb = (byte)(b - prevB);
						byte vgr = (byte)(vr - vg);
						byte vgb = (byte)(vb - vg);
						if (vr > -3 && vr < 2 && vg > -3 && vg < 2 && vb > -3 && vb < 2) {
							out[p++] = (byte)(OP_DIFF | ((vr + 2) << 4) | ((vg + 2) << 2) | (vb + 2));
						} else if (vgr > -9 && vgr < 8 && vg > -33 && vg < 32 && vgb > -9 && vgb < 8) {
							out[p++] = (byte)(OP_LUMA | (vg + 32));
							out[p++] = (byte)(((vgr + 8) << 4) | (vgb + 8));
						} else {
							out[p++] = (byte)OP_RGB;
							out[p++] = (byte)r;
							out[p++] = (byte)g;
							out[p++] = (byte)b;
						}
					} else {
						out[p++] = (byte)OP_RGBA;
						out[p++] = (byte)r;
						out[p++] = (byte)g;
						out[p++] = (byte)b;
						out[p++] = (byte)a;
					}
				}
			}
			prevR = r;
			prevG = g;
			prevB = b;
			prevA = a;
		}
		for (byte v : END_MARKER)
			out[p++] = v;
		return Arrays.copyOf(out, p);
	}
	
	@Override
	public String toString() {
		return getName();
	}

}
