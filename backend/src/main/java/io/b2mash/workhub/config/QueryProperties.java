package io.b2mash.workhub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Task query pagination bounds.
 *
 * @param defaultLimit page size used when the caller gives none
 * @param maxLimit largest page size a caller may request
 */
@ConfigurationProperties(prefix = "workhub.query")
public record QueryProperties(int defaultLimit, int maxLimit) {}
