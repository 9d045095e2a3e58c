package org.javai.askdata.schema;

/**
 * Supplies the schema that grounds prompts and validation.
 *
 * <p>Implementations load the descriptor once and return the same immutable
 * instance on every call.</p>
 */
public interface SchemaSource {

	/**
	 * @return the schema descriptor (never null)
	 * @throws SchemaUnavailableException if the backing store cannot be introspected
	 */
	SchemaDescriptor describe();
}
