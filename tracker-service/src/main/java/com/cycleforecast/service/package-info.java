/**
 * Tracker service: per-owner log keeping, prediction refresh, the Gemini
 * estimator and the HTTP front end.
 *
 * <p>
 * {@link com.cycleforecast.service.CycleForecastApp} wires everything from
 * environment variables and {@code forecast.yml}.
 * </p>
 */
package com.cycleforecast.service;
