package org.bhavforge.analysis.validation;

import org.bhavforge.runtime.isa.IOpcodeCatalog;

/**
 * Shared inputs of all validation checks.
 *
 * @param catalog opcode metadata
 * @param options validator tunables
 */
public record ValidationContext(IOpcodeCatalog catalog, ValidatorOptions options) {
}
