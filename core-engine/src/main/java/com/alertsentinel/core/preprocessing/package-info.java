/**
 * Smoothing, differencing and lag expansion applied to a series before
 * detection.
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.preprocessing;
