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

package pixly.lib.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import pixly.lib.geom.Anchor;
import pixly.lib.geom.FitMode;
import pixly.lib.geom.FitSpec;
import pixly.lib.images.Color;

@SuppressWarnings("javadoc")
public class TestGsonTools {
	
	@Test
	public void test_anchor() {
		var gson = GsonTools.getInstance();
		var anchor = Anchor.of(Anchor.Horizontal.LEFT, Anchor.Vertical.BOTTOM);
		assertEquals("\"left bottom\"", gson.toJson(anchor));
		assertEquals(anchor, gson.fromJson("\"left bottom\"", Anchor.class));
		assertEquals(Anchor.CENTER, gson.fromJson("\"center\"", Anchor.class));
		assertThrows(JsonParseException.class, () -> gson.fromJson("\"middle\"", Anchor.class));
		assertThrows(JsonParseException.class, () -> gson.fromJson("5", Anchor.class));
	}
	
	@Test
	public void test_fitSpec() {
		var gson = GsonTools.getInstance();
		var spec = FitSpec.builder()
				.size(120, 80)
				.fit(FitMode.CONTAIN)
				.anchor("right top")
				.background(Color.rgba(1, 2, 3, 4))
				.build();
		String json = gson.toJson(spec);
		assertTrue(json.contains("\"contain\""));
		assertTrue(json.contains("\"right top\""));
		assertEquals(spec, gson.fromJson(json, FitSpec.class));
		
		var widthOnly = FitSpec.of(50, null, FitMode.INSIDE);
		assertEquals(widthOnly, gson.fromJson(gson.toJson(widthOnly), FitSpec.class));
	}
	
	static interface Shape {}
	
	static class Circle implements Shape {
		double radius;
	}
	
	static class Square implements Shape {
		double side;
	}
	
	@Test
	public void test_subTypes() {
		var factory = GsonTools.createSubTypeAdapterFactory(Shape.class, "type")
				.registerSubtype(Circle.class, "circle")
				.registerSubtype(Square.class, "square")
				.registerAlias(Circle.class, "round");
		var gson = new GsonBuilder().registerTypeAdapterFactory(factory).create();
		
		var circle = new Circle();
		circle.radius = 2.5;
		String json = gson.toJson(circle, Shape.class);
		assertEquals("{\"type\":\"circle\",\"radius\":2.5}", json);
		
		var shape = gson.fromJson("{\"type\":\"round\",\"radius\":1.0}", Shape.class);
		assertInstanceOf(Circle.class, shape);
		assertEquals(1.0, ((Circle)shape).radius);
		assertInstanceOf(Square.class, gson.fromJson("{\"type\":\"square\",\"side\":3}", Shape.class));
		
		assertEquals("square", factory.getLabel(Square.class));
		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"type\":\"triangle\"}", Shape.class));
		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"radius\":1.0}", Shape.class));
		assertThrows(IllegalArgumentException.class, () -> factory.registerSubtype(Square.class, "circle"));
	}
	
	static class Group implements Shape {
		List<Shape> shapes;
	}
	
	@Test
	public void test_subTypeValidator() {
		List<Class<?>> validated = new ArrayList<>();
		var factory = GsonTools.createSubTypeAdapterFactory(Shape.class, "type")
				.registerSubtype(Circle.class, "circle")
				.registerSubtype(Group.class, "group")
				.setValidator(shape -> {
					validated.add(shape.getClass());
					if (shape instanceof Circle circle && circle.radius <= 0)
						throw new IllegalArgumentException("Radius must be > 0");
				});
		var gson = new GsonBuilder().registerTypeAdapterFactory(factory).create();
		
		assertInstanceOf(Circle.class, gson.fromJson("{\"type\":\"circle\",\"radius\":1.0}", Shape.class));
		var e = assertThrows(IllegalArgumentException.class, () -> gson.fromJson("{\"type\":\"circle\"}", Shape.class));
		assertEquals("Radius must be > 0", e.getMessage());
		
		// Nested objects are checked first
		validated.clear();
		gson.fromJson("{\"type\":\"group\",\"shapes\":[{\"type\":\"circle\",\"radius\":2.0}]}", Shape.class);
		assertEquals(List.of(Circle.class, Group.class), validated);
		assertThrows(IllegalArgumentException.class, 
				() -> gson.fromJson("{\"type\":\"group\",\"shapes\":[{\"type\":\"circle\",\"radius\":-2.0}]}", Shape.class));
		
		// Removing the validator accepts anything
		factory.setValidator(null);
		assertInstanceOf(Circle.class, gson.fromJson("{\"type\":\"circle\"}", Shape.class));
	}

}
