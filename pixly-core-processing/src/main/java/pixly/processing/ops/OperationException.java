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

/**
 * Exception thrown when an {@link ImageOp} fails while being applied.
 * The message identifies the operation and the underlying cause.
 */
public class OperationException extends RuntimeException {
	
	private static final long serialVersionUID = 1L;
	
	private final String operationName;
	
	/**
	 * Constructor.
	 * @param operationName name of the operation that failed
	 * @param cause the underlying cause
	 */
	public OperationException(String operationName, Throwable cause) {
		super("Operation '" + operationName + "' failed: " + describe(cause), cause);
		this.operationName = operationName;
	}
	
	private static String describe(Throwable cause) {
		if (cause == null)
			return "unknown cause";
		var msg = cause.getLocalizedMessage();
		if (msg == null || msg.isBlank())
			return cause.getClass().getSimpleName();
		return msg;
	}
	
	/**
	 * Get the name of the operation that failed.
	 * @return
	 */
	public String getOperationName() {
		return operationName;
	}

}
