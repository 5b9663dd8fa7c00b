package com.walletcustody.ingestion.lookup;

import com.walletcustody.ingestion.classifier.ClassificationResult;

/**
 * @param stored true when this lookup created the row; false for unowned or already stored transactions
 */
public record TransactionLookupResult(ClassificationResult classification, boolean stored) {
}
