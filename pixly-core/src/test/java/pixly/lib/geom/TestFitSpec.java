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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import pixly.lib.images.Color;

@SuppressWarnings("javadoc")
public class TestFitSpec {
	
	@Test
	public void test_defaults() {
		var spec = FitSpec.builder().width(100).build();
		assertEquals(100, spec.getWidth());
		assertNull(spec.getHeight());
		assertEquals(FitMode.COVER, spec.getFit());
		assertEquals(Anchor.CENTER, spec.getAnchor());
		assertEquals(Color.TRANSPARENT_WHITE, spec.getBackground());
	}
	
	@Test
	public void test_invalid() {
		var e = assertThrows(IllegalArgumentException.class, () -> FitSpec.builder().build());
		assertTrue(e.getMessage().startsWith("Invalid fit specification"));
		assertThrows(IllegalArgumentException.class, () -> FitSpec.of(0, 10, FitMode.FILL));
		assertThrows(IllegalArgumentException.class, () -> FitSpec.of(10, -1, FitMode.CONTAIN));
	}
	
	@Test
	public void test_builder() {
		var spec = FitSpec.builder()
				.size(20, 30)
				.fit(FitMode.CONTAIN)
				.anchor("right bottom")
				.background(Color.BLACK)
				.build();
		assertEquals(Anchor.parse("right bottom"), spec.getAnchor());
		assertEquals(spec, spec.toBuilder().build());
		assertEquals(FitMode.FILL, spec.toBuilder().fit(FitMode.FILL).build().getFit());
	}
	
	@Test
	public void test_fitModeNames() {
		for (var fit : FitMode.values())
			assertEquals(fit, FitMode.fromString(fit.toString()));
		assertEquals(FitMode.INSIDE, FitMode.fromString("Inside"));
	}

}
