package org.javai.askdata.schema;

import java.util.Objects;

/**
 * Schema source over a descriptor assembled in code, typically for tests or fixed deployments.
 */
public final class StaticSchemaSource implements SchemaSource {

	private final SchemaDescriptor descriptor;

	public StaticSchemaSource(SchemaDescriptor descriptor) {
		this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
	}

	@Override
	public SchemaDescriptor describe() {
		return descriptor;
	}
}
