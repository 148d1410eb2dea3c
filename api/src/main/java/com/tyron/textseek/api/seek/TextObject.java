package com.tyron.textseek.api.seek;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * The three seek operations of one {@link ObjectKind}.
 */
public record TextObject(@NotNull ObjectKind kind, @NotNull Seek whole, @NotNull SeekStart start,
                         @NotNull SeekEnd end) {

    public TextObject {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(whole, "whole");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }
}
