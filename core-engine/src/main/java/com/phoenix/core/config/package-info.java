/**
 * Engine tunables.
 *
 * <p>
 * {@link com.phoenix.core.config.SettingsLoader} reads YAML into
 * {@link com.phoenix.core.config.EngineSettings} and validates the result.
 * </p>
 *
 * @since 1.0.0
 */
package com.phoenix.core.config;
