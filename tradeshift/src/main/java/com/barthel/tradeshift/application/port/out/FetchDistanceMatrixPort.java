package com.barthel.tradeshift.application.port.out;

import com.barthel.tradeshift.domain.model.DistanceMatrix;

import java.util.Collection;
import java.util.Optional;

/**
 * Port for obtaining geographic distances between countries.
 */
public interface FetchDistanceMatrixPort {
    /**
     * Build the distance matrix over the given countries.
     *
     * @param countries the countries to cover
     * @return the matrix, or empty if any country cannot be located
     */
    Optional<DistanceMatrix> fetchDistanceMatrix(Collection<String> countries);
}
