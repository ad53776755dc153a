package com.shipyard.core.model;

import java.io.Serializable;

/**
 * A single vulnerability reported by the scanner.
 */
public record Finding(
    String id,
    String packageName,
    Severity severity,
    String title
) implements Serializable {}
