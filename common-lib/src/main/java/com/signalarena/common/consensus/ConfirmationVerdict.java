package com.signalarena.common.consensus;

/**
 * Outcome classes of {@link SourceConfirmationPolicy#evaluate}.
 *
 * <ul>
 *   <li>CONFIRMED: enough sources agree; a fused signal is emitted</li>
 *   <li>INSUFFICIENT_EVIDENCE: fewer sources voted than the confirmation threshold</li>
 *   <li>SOURCE_CONFLICT: enough sources voted but neither direction reached
 *                               the threshold</li>
 * </ul>
 *
 * Neither non-confirmed verdict is an error.
 */
public enum ConfirmationVerdict {
    CONFIRMED,
    INSUFFICIENT_EVIDENCE,
    SOURCE_CONFLICT
}
