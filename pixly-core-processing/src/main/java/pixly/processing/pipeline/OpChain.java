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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import pixly.processing.ops.ImageOp;

/**
 * Immutable, persistent sequence of ops.
 * <p>
 * Appending creates a new chain that shares all existing links with this one, so earlier chains are never affected.
 */
final class OpChain {
	
	private static final OpChain EMPTY = new OpChain(null, null, 0);
	
	private final OpChain previous;
	private final ImageOp op;
	private final int size;
	
	private OpChain(OpChain previous, ImageOp op, int size) {
		this.previous = previous;
		this.op = op;
		this.size = size;
	}
	
	static OpChain empty() {
		return EMPTY;
	}
	
	OpChain append(ImageOp op) {
		Objects.requireNonNull(op, "Op must not be null!");
		return new OpChain(this, op, size + 1);
	}
	
	OpChain appendAll(ImageOp... ops) {
		var chain = this;
		for (var op : ops)
			chain = chain.append(op);
		return chain;
	}
	
	int size() {
		return size;
	}
	
	boolean isEmpty() {
		return size == 0;
	}
	
	/**
	 * Get the ops in the order they were appended.
	 * @return an unmodifiable list
	 */
	List<ImageOp> toList() {
		var list = new ArrayList<ImageOp>(size);
		for (var chain = this; chain.size > 0; chain = chain.previous)
			list.add(chain.op);
		Collections.reverse(list);
		return Collections.unmodifiableList(list);
	}
	
	@Override
	public String toString() {
		return "OpChain [size=" + size + "]";
	}

}
