package com.alertsentinel.core.config;

import com.alertsentinel.core.model.AlertDetectorsConfig;
import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;
import com.alertsentinel.core.model.DetectorGroup;
import com.alertsentinel.core.model.DetectorNode;
import com.alertsentinel.core.model.GroupOperator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts a parsed YAML/JSON tree into an {@link AlertDetectorsConfig}.
 *
 * <p>
 * A node whose {@code type} is {@code AND} or {@code OR} is a group and lists
 * its children under {@code detectors}; any other node is a leaf detector
 * config. Leaf parameters are not checked here: detectors validate them when
 * they are built.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertConfigParser {

    private AlertConfigParser() {
        // utility class — not instantiable
    }

    /**
     * @param root parsed top-level map with {@code type} and {@code groups}
     * @return the typed detector tree
     * @throws DetectorConfigException if the tree is malformed
     */
    public static AlertDetectorsConfig parse(Map<?, ?> root) {
        Objects.requireNonNull(root, "Alert detectors config must not be null");
        Object type = root.get("type");
        if (type == null) {
            throw new DetectorConfigException("Alert detectors config requires 'type' (AND or OR)");
        }
        GroupOperator operator = GroupOperator.parse(type.toString());
        return new AlertDetectorsConfig(operator, parseNodes(root.get("groups"), "groups"));
    }

    /**
     * @param node parsed map of a leaf or group
     * @return the typed node
     * @throws DetectorConfigException if the node is malformed
     */
    public static DetectorNode parseNode(Object node) {
        if (!(node instanceof Map<?, ?> map)) {
            throw new DetectorConfigException("Detector node must be a map, got: " + node);
        }
        Object type = map.get("type");
        if (GroupOperator.isOperator(type)) {
            return new DetectorGroup(GroupOperator.parse(type.toString()),
                    parseNodes(map.get("detectors"), "detectors"));
        }
        return DetectorConfig.of(map);
    }

    private static List<DetectorNode> parseNodes(Object raw, String field) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new DetectorConfigException("'" + field + "' must be a list, got: " + raw);
        }
        List<DetectorNode> nodes = new ArrayList<>(list.size());
        for (Object item : list) {
            nodes.add(parseNode(item));
        }
        return nodes;
    }
}
