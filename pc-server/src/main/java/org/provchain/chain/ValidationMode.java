package org.provchain.chain;

/**
 * How far chain validation proceeds after a finding.
 */
public enum ValidationMode {

    /** Stop at the first finding, in index order. */
    FAIL_FAST,

    /** Check every block and report all the findings. */
    COLLECT_ALL

}
