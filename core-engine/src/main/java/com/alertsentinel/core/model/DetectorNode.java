package com.alertsentinel.core.model;

/**
 * A node of an alert's detector tree: either a leaf {@link DetectorConfig}
 * or a nested {@link DetectorGroup}.
 *
 * @since 1.0.0
 */
public interface DetectorNode {

    /**
     * @return {@code true} for {@link DetectorGroup} nodes
     */
    boolean isGroup();
}
