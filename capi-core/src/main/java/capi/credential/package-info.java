/**
 * Per-tenant configuration and access token resolution, including encrypted credential storage.
 */
package capi.credential;
