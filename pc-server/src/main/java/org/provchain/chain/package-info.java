/**
 * Blocks, chain and the ledger manager.
 */
@javax.annotation.ParametersAreNonnullByDefault
package org.provchain.chain;

