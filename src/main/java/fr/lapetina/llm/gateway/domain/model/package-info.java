/**
 * Immutable domain types shared by every gateway component.
 *
 * <p>Records validate in their compact constructors and copy collections defensively.
 * {@link fr.lapetina.llm.gateway.domain.model.BackendDescriptor} and
 * {@link fr.lapetina.llm.gateway.domain.model.InferenceRequest} have builders for the
 * many optional fields.
 */
package fr.lapetina.llm.gateway.domain.model;
