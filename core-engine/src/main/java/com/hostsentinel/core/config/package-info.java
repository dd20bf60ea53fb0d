/**
 * Configuration loading and validation for the monitoring engine.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.hostsentinel.core.config.ConfigLoader} into a
 * {@link com.hostsentinel.core.config.MonitorConfig} instance, which is
 * validated right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.hostsentinel.core.config;
