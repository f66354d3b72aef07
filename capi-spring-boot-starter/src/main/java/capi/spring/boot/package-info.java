/**
 * Spring Boot auto-configuration for conversion event delivery.
 *
 * <p>{@link capi.spring.boot.CapiAutoConfiguration} wires the processor and its collaborators
 * from a {@code DataSource}; {@link capi.spring.boot.CapiWebAutoConfiguration} exposes the
 * trigger and operator endpoints. Properties live under the {@code capi} prefix.
 *
 * @see capi.spring.boot.CapiProperties
 */
package capi.spring.boot;
