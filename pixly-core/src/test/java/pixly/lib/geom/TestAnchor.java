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

package pixly.lib.geom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import pixly.lib.geom.Anchor.Horizontal;
import pixly.lib.geom.Anchor.Vertical;

@SuppressWarnings("javadoc")
public class TestAnchor {
	
	@Test
	public void test_defaults() {
		var anchor = Anchor.of(null, null);
		assertEquals(Anchor.CENTER, anchor);
		assertEquals(Anchor.of(Horizontal.LEFT, Vertical.CENTER), Anchor.of(Horizontal.LEFT, null));
		assertEquals(0.5, Anchor.CENTER.getHorizontal().getFraction());
		assertEquals(1.0, Vertical.BOTTOM.getFraction());
	}
	
	@Test
	public void test_parse() {
		assertEquals(Anchor.of(Horizontal.LEFT, Vertical.TOP), Anchor.parse("left top"));
		assertEquals(Anchor.of(Horizontal.RIGHT, Vertical.BOTTOM), Anchor.parse("  RIGHT   bottom "));
		assertEquals(Anchor.of(Horizontal.RIGHT, Vertical.CENTER), Anchor.parse("right"));
		assertEquals(Anchor.of(Horizontal.CENTER, Vertical.TOP), Anchor.parse("top"));
		assertSame(Anchor.CENTER, Anchor.parse("center"));
		assertSame(Anchor.CENTER, Anchor.parse(null));
		
		assertThrows(IllegalArgumentException.class, () -> Anchor.parse("middle"));
		assertThrows(IllegalArgumentException.class, () -> Anchor.parse("top left"));
		assertThrows(IllegalArgumentException.class, () -> Anchor.parse("left top right"));
	}
	
	@Test
	public void test_toString() {
		var anchor = Anchor.of(Horizontal.LEFT, Vertical.BOTTOM);
		assertEquals("left bottom", anchor.toString());
		assertEquals(anchor, Anchor.parse(anchor.toString()));
	}

}
