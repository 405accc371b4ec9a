package dev.pinakes.module;

import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/** A unit's readme file. Contents are null when withheld. */
public record Readme(@NotBlank String filePath, @Nullable String contents) {}
