/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.exceptions;

/**
 * Thrown when a precondition owned by the caller is broken, e.g. running vertical alignment before horizontal
 * alignment or casting off without target segments. The running pass is aborted and there is no way to recover
 * from it other than fixing the calling code.
 */
public class ContractViolationException extends RuntimeException {
    public ContractViolationException(String message) {
        super(message);
    }
}
