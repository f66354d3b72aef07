/**
 * Spring integration: {@link capi.spring.RestTemplateDeliveryClient} for HTTP delivery and
 * {@link capi.spring.SpringConversionEventWriter} for queueing events in Spring-managed
 * transactions.
 */
package capi.spring;
