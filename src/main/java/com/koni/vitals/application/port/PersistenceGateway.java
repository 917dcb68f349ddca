package com.koni.vitals.application.port;

import com.koni.vitals.domain.model.Reading;
import com.koni.vitals.domain.model.Verdict;

/**
 * Port interface for durably committing a classified reading.
 *
 * A commit appends the audit row, updates the device registry and, when the verdict
 * warrants it, raises an alert. Either all of it becomes visible or none of it does.
 */
public interface PersistenceGateway {

    /**
     * @param reading the accepted reading
     * @param verdict the verdict computed for it
     * @return the identifier of the audit row
     * @throws com.koni.vitals.domain.exception.DatabaseUnavailableException if the store cannot commit
     */
    Long commit(Reading reading, Verdict verdict);
}
