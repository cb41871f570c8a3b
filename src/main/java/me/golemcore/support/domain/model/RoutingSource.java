package me.golemcore.support.domain.model;

/**
 * Which path produced a routing decision.
 */
public enum RoutingSource {
    LLM, FALLBACK
}
