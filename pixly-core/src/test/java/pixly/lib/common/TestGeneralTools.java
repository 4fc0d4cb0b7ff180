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

package pixly.lib.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Locale;
import java.util.Optional;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGeneralTools {
	
	@Test
	public void test_roundHalfAwayFromZero() {
		assertEquals(3, GeneralTools.roundHalfAwayFromZero(2.5));
		assertEquals(-3, GeneralTools.roundHalfAwayFromZero(-2.5));
		assertEquals(2, GeneralTools.roundHalfAwayFromZero(2.4));
		assertEquals(-1, GeneralTools.roundHalfAwayFromZero(-0.5));
		assertEquals(0, GeneralTools.roundHalfAwayFromZero(0.49));
		assertEquals(0, GeneralTools.roundHalfAwayFromZero(-0.49));
	}
	
	@Test
	public void test_clipValue() {
		assertEquals(5, GeneralTools.clipValue(10, 0, 5));
		assertEquals(0, GeneralTools.clipValue(-10, 0, 5));
		assertEquals(3, GeneralTools.clipValue(3, 0, 5));
		assertEquals(0.5, GeneralTools.clipValue(2.0, 0.0, 0.5));
	}
	
	@Test
	public void test_blankString() {
		assertTrue(GeneralTools.blankString(null, false));
		assertTrue(GeneralTools.blankString("", false));
		assertFalse(GeneralTools.blankString("  ", false));
		assertTrue(GeneralTools.blankString("  ", true));
		assertFalse(GeneralTools.blankString(" a ", true));
	}
	
	@Test
	public void test_getExtension() {
		assertEquals(Optional.of("png"), GeneralTools.getExtension("images/photo.PNG"));
		assertEquals(Optional.of("jpeg"), GeneralTools.getExtension("C:\\images\\photo.small.jpeg"));
		assertEquals(Optional.empty(), GeneralTools.getExtension(".hidden"));
		assertEquals(Optional.empty(), GeneralTools.getExtension("dir.name/file"));
		assertEquals(Optional.empty(), GeneralTools.getExtension("file."));
		assertEquals(Optional.empty(), GeneralTools.getExtension(null));
	}
	
	@Test
	public void test_formatNumber() {
		assertEquals("1.25", GeneralTools.formatNumber(Locale.US, 1.25, 2));
		assertEquals("1.3", GeneralTools.formatNumber(Locale.US, 1.25, 1));
		assertEquals("12345", GeneralTools.formatNumber(Locale.US, 12345.0, 3));
		assertEquals("0,5", GeneralTools.formatNumber(Locale.GERMANY, 0.5, 2));
	}

}
