/**
 * YAML-backed engine settings.
 *
 * <p>
 * {@link com.cycleforecast.core.config.ForecastSettingsLoader} reads
 * {@link com.cycleforecast.core.config.ForecastSettings} and validates it
 * before returning, so misconfiguration fails at startup.
 * </p>
 *
 * @since 1.0.0
 */
package com.cycleforecast.core.config;
