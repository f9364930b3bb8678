/**
 * Public collection facade.
 *
 * <p>{@link com.ryuqq.artledger.application.collection.ArtworkCollection} is the operation
 * surface exposed to the execution host. The default implementation serializes mutating
 * calls and composes the ownership ledger with the metadata engine.</p>
 *
 * @since 1.0.0
 * @author ArtLedger Team
 */
package com.ryuqq.artledger.application.collection;
