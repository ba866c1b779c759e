package com.positionengine.lookup;

import com.positionengine.domain.model.SecurityProfile;

/**
 * Authoritative reference-data source for ticker classification.
 *
 * <p>Implementations block until they answer or fail; callers bound the wait. Failures are
 * reported as {@code SecurityLookupException} with the retryable flag set when another
 * attempt could succeed.
 */
public interface SecurityLookupClient {

    SecurityProfile lookup(String ticker);
}
