package com.tyron.textseek.core.text;

import com.tyron.textseek.api.text.TextPosition;

/**
 * Outcome of a {@link CharScanner} scan.
 *
 * @param position    where the scan stopped
 * @param reachedEdge true if the scan ran into the document start or end instead of a rejected character
 */
public record ScanResult(TextPosition position, boolean reachedEdge) {
}
