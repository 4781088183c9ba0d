/**
 * Loading of alert detector trees from YAML or JSON.
 *
 * <p>
 * {@link com.alertsentinel.core.config.AlertConfigLoader} reads the document
 * and {@link com.alertsentinel.core.config.AlertConfigParser} turns it into
 * a {@link com.alertsentinel.core.model.AlertDetectorsConfig}.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.config;
