/**
 * Conversion event, tenant configuration, credential and health records.
 */
package capi.model;
