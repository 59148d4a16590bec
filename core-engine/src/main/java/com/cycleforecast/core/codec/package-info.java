/**
 * JSON and plain-map representations of the engine's value types.
 *
 * @since 1.0.0
 */
package com.cycleforecast.core.codec;
