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

import com.google.gson.JsonParseException;

import pixly.lib.images.codecs.EncodeOptions;
import pixly.lib.images.codecs.ImageFormat;
import pixly.processing.ops.ImageOp;
import pixly.processing.ops.ImageOps;

/**
 * A named, reusable description of a pipeline: the ops to apply and the output format.
 * <p>
 * Templates containing only built-in ops can be stored as JSON, e.g.
 * <pre>
 * {"name": "avatar", "format": "PNG", "ops": [{"type": "op.adjust.grayscale", "method": "luminance"}]}
 * </pre>
 * 
 * @see PipelinePresets#fromTemplate(PipelineTemplate)
 */
public final class PipelineTemplate {
	
	private final String name;
	private final ImageFormat format;
	private final EncodeOptions options;
	private final List<ImageOp> ops;
	
	private PipelineTemplate(String name, ImageFormat format, EncodeOptions options, List<ImageOp> ops) {
		this.name = name;
		this.format = format;
		this.options = options;
		this.ops = ops;
		validate();
	}
	
	/**
	 * Create a template with default encoder options.
	 * @param name
	 * @param format the output format
	 * @param ops ops applied in order
	 * @return
	 */
	public static PipelineTemplate create(String name, ImageFormat format, List<? extends ImageOp> ops) {
		return create(name, format, EncodeOptions.empty(), ops);
	}
	
	/**
	 * Create a template.
	 * @param name
	 * @param format the output format
	 * @param options encoder options; values that are not set use the defaults for the format
	 * @param ops ops applied in order
	 * @return
	 */
	public static PipelineTemplate create(String name, ImageFormat format, EncodeOptions options, List<? extends ImageOp> ops) {
		Objects.requireNonNull(ops, "Template ops must not be null!");
		return new PipelineTemplate(name, format, options, Collections.unmodifiableList(new ArrayList<>(ops)));
	}
	
	private void validate() {
		if (name == null || name.isBlank())
			throw new IllegalArgumentException("Template name must not be empty");
		if (format == null)
			throw new IllegalArgumentException("Template " + name + " has no output format");
		if (ops != null && ops.contains(null))
			throw new IllegalArgumentException("Template " + name + " must not contain null ops");
	}
	
	/**
	 * Read a template from JSON.
	 * @param json
	 * @return
	 * @throws JsonParseException if the JSON cannot be parsed
	 * @throws IllegalArgumentException if the template or any op has invalid parameters
	 */
	public static PipelineTemplate fromJson(String json) {
		var template = ImageOps.getGson(false).fromJson(json, PipelineTemplate.class);
		if (template == null)
			throw new JsonParseException("No template found in " + json);
		template.validate();
		return template;
	}
	
	/**
	 * Write this template as JSON.
	 * @return
	 * @throws JsonParseException if any op is not a built-in op
	 */
	public String toJson() {
		return ImageOps.getGson(false).toJson(this);
	}
	
	/**
	 * Get the template name.
	 * @return
	 */
	public String getName() {
		return name;
	}
	
	/**
	 * Get the output format.
	 * @return
	 */
	public ImageFormat getFormat() {
		return format;
	}
	
	/**
	 * Get the encoder options.
	 * @return the options; never null
	 */
	public EncodeOptions getOptions() {
		return options == null ? EncodeOptions.empty() : options;
	}
	
	/**
	 * Get the ops, in the order they are applied.
	 * @return an unmodifiable list
	 */
	public List<ImageOp> getOps() {
		return ops == null ? Collections.emptyList() : Collections.unmodifiableList(ops);
	}

	@Override
	public String toString() {
		return "PipelineTemplate [name=" + name + ", format=" + format + ", ops=" + getOps().size() + "]";
	}

}
