package com.payshield.gleaner.domain;

import java.util.UUID;

/**
 * A glean with the identifier assigned by the output step.
 */
public record GleanRecord(UUID gleanId, Glean glean) {
}
