/**
 * Best-effort usage delivery over an LMAX Disruptor ring buffer.
 *
 * <p>Request threads publish without blocking; a full ring buffer drops the record and
 * counts it. A single handler thread delivers to the {@link fr.lapetina.llm.gateway.infrastructure.usage.UsageSink}.
 */
package fr.lapetina.llm.gateway.infrastructure.usage;
