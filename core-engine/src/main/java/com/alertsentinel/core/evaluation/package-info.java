/**
 * Public entry point: recursive AND/OR evaluation of an alert's detector
 * tree, see {@link com.alertsentinel.core.evaluation.DetectorEvaluator}.
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.evaluation;
