package com.barthel.tradeshift.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Ordered sequence of disjoint communities. The position of a community is its id.
 *
 * @param communities the communities, each a set of country identifiers
 */
public record CommunityPartition(List<Set<String>> communities) {

    public CommunityPartition {
        if (communities == null) {
            throw new IllegalArgumentException("Communities are required");
        }
        Set<String> seen = new HashSet<>();
        List<Set<String>> copy = new ArrayList<>(communities.size());
        for (Set<String> community : communities) {
            for (String country : community) {
                if (!seen.add(country)) {
                    throw new IllegalArgumentException("Country " + country + " belongs to more than one community");
                }
            }
            copy.add(Collections.unmodifiableSet(new LinkedHashSet<>(community)));
        }
        communities = Collections.unmodifiableList(copy);
    }

    @SafeVarargs
    public static CommunityPartition of(Set<String>... communities) {
        return new CommunityPartition(List.of(communities));
    }

    public int size() {
        return communities.size();
    }

    public Set<String> community(int id) {
        return communities.get(id);
    }

    public OptionalInt indexOf(String country) {
        for (int i = 0; i < communities.size(); i++) {
            if (communities.get(i).contains(country)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public Optional<Set<String>> communityOf(String country) {
        OptionalInt index = indexOf(country);
        return index.isPresent() ? Optional.of(communities.get(index.getAsInt())) : Optional.empty();
    }
}
