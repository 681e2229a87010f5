package io.b2mash.workhub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Task hierarchy limits.
 *
 * @param maxAncestorDepth how many parent links a reparent check walks before giving up
 */
@ConfigurationProperties(prefix = "workhub.hierarchy")
public record HierarchyProperties(int maxAncestorDepth) {}
