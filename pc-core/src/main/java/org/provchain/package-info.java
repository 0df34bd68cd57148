/**
 * Ledger core ({@code pc-core}).
 * <p>
 * This package contains the checked exceptions shared by the ledger components, rooted at
 * {@link org.provchain.LedgerException}. Sub-packages provide data model helpers
 * ({@code org.provchain.data}), the ledger vocabulary ({@code org.provchain.vocabulary}) and the
 * canonicalization subsystem ({@code org.provchain.canon}).
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package org.provchain;

